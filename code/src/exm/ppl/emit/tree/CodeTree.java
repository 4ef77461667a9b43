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

import org.apache.commons.lang3.StringUtils;

/**
 * The CodeTree class hierarchy represents the constructs of generated
 * model code.  Nodes are rendered in a target {@link Syntax}; parents
 * pass their syntax, indentation and indent width down to children
 * before rendering them.
 */
public abstract class CodeTree
{
  int indentation = 0;
  int indentWidth = 4;
  Syntax syntax = Syntax.JULIA;

  public abstract void appendTo(StringBuilder sb);

  /**
   * Render a nested block: the members one level deeper, then the
   * block terminator if the syntax has one.
   */
  public void appendBlock(StringBuilder sb, Sequence block)
  {
    block.inheritFrom(this);
    block.increaseIndent();
    if (block.isEmpty() && syntax.emptyBlock() != null) {
      block.indent(sb);
      sb.append(syntax.emptyBlock()).append("\n");
    } else {
      block.appendTo(sb);
    }
  }

  void appendBlockClose(StringBuilder sb)
  {
    if (syntax.blockClose() != null) {
      indent(sb);
      sb.append(syntax.blockClose()).append("\n");
    }
  }

  void inheritFrom(CodeTree parent)
  {
    this.indentation = parent.indentation;
    this.indentWidth = parent.indentWidth;
    this.syntax = parent.syntax;
  }

  public void indent(StringBuilder sb)
  {
    sb.append(StringUtils.repeat(' ', indentation));
  }

  public void setIndentWidth(int width)
  {
    indentWidth = width;
  }

  public void setSyntax(Syntax syntax)
  {
    this.syntax = syntax;
  }

  public void increaseIndent()
  {
    indentation += indentWidth;
  }

  @Override
  public String toString()
  {
    StringBuilder sb = new StringBuilder(2048);
    appendTo(sb);
    return sb.toString();
  }
}
