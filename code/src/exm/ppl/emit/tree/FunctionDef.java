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

import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Function definition.  The qualifier is a Julia macro such as
 * "@model" written before the function keyword, or a Python decorator
 * written on the line above.
 */
public class FunctionDef extends CodeTree
{
  String qualifier;
  String name;
  List<String> args;
  Sequence body;

  /**
   * @param qualifier macro or decorator, null for none
   */
  public FunctionDef(String qualifier, String name, List<String> args,
                     Sequence body)
  {
    this.qualifier = qualifier;
    this.name = name;
    this.args = args;
    this.body = body;
  }

  public FunctionDef(String qualifier, String name, List<String> args)
  {
    this(qualifier, name, args, new Sequence());
  }

  public String name()
  {
    return name;
  }

  public Sequence getBody()
  {
    return body;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    String signature = name + "(" + StringUtils.join(args, ", ") + ")";
    if (syntax == Syntax.PYTHON) {
      if (qualifier != null) {
        indent(sb);
        sb.append(qualifier).append("\n");
      }
      indent(sb);
      sb.append("def ").append(signature).append(":\n");
    } else {
      indent(sb);
      if (qualifier != null) {
        sb.append(qualifier).append(" ");
      }
      sb.append("function ").append(signature).append("\n");
    }
    appendBlock(sb, body);
    appendBlockClose(sb);
  }
}
