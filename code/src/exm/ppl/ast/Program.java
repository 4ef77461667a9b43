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
package exm.ppl.ast;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * A parsed model: name, inputs and body.
 */
public class Program {
  private final String name;
  private final ImmutableList<String> params;
  private final ImmutableList<Statement> body;
  private final SourcePos pos;

  public Program(SourcePos pos, String name, List<String> params,
                 List<Statement> body) {
    this.pos = pos;
    this.name = name;
    this.params = ImmutableList.copyOf(params);
    this.body = ImmutableList.copyOf(body);
  }

  public String name() {
    return name;
  }

  /**
   * @return model inputs in declaration order
   */
  public ImmutableList<String> params() {
    return params;
  }

  public ImmutableList<Statement> body() {
    return body;
  }

  public SourcePos pos() {
    return pos;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("def ").append(name).append("(");
    sb.append(String.join(", ", params)).append("):\n");
    for (Statement stmt: body) {
      stmt.appendTo(sb, 1);
    }
    return sb.toString();
  }
}
