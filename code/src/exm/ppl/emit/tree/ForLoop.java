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
 * Loop of a variable over an iteration space rendered by the caller,
 * e.g. "0:1:(n)-1" in Julia or "range(0, n, 1)" in Python
 */
public class ForLoop extends CodeTree
{
  private final String loopVar;
  private final String iteration;
  private final Sequence loopBody;

  public ForLoop(String loopVar, String iteration)
  {
    this(loopVar, iteration, new Sequence());
  }

  public ForLoop(String loopVar, String iteration, Sequence loopBody)
  {
    this.loopVar = loopVar;
    this.iteration = iteration;
    this.loopBody = loopBody;
  }

  public Sequence loopBody()
  {
    return loopBody;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    indent(sb);
    sb.append("for ").append(loopVar);
    sb.append(syntax == Syntax.PYTHON ? " in " : " = ");
    sb.append(iteration).append(syntax.blockOpen()).append("\n");
    appendBlock(sb, loopBody);
    appendBlockClose(sb);
  }
}
