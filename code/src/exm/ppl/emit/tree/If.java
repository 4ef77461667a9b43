/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.ppl.emit.tree;

/**
 * If-then-else construct.  An empty else block is omitted.
 */
public class If extends CodeTree
{
  String condition;
  Sequence thenBlock;
  Sequence elseBlock;

  public If(String condition, Sequence thenBlock, Sequence elseBlock)
  {
    this.condition = condition;
    this.thenBlock = thenBlock;
    this.elseBlock = elseBlock;
  }

  /**
   * The caller adds statements to the blocks later
   */
  public If(String condition)
  {
    this(condition, new Sequence(), new Sequence());
  }

  public Sequence thenBlock()
  {
    return thenBlock;
  }

  public Sequence elseBlock()
  {
    return elseBlock;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    indent(sb);
    sb.append("if ").append(condition).append(syntax.blockOpen())
      .append("\n");
    appendBlock(sb, thenBlock);
    if (elseBlock != null && !elseBlock.isEmpty()) {
      indent(sb);
      sb.append("else").append(syntax.blockOpen()).append("\n");
      appendBlock(sb, elseBlock);
    }
    appendBlockClose(sb);
  }
}
