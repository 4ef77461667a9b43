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
package exm.ppl.ir;

import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import exm.ppl.common.lang.Role;

/**
 * Lowered model, shared read-only by the generators of one translation
 */
public class IRProgram {
  private final String name;
  private final ImmutableList<String> params;
  private final ImmutableList<IRStatement> body;
  private final ImmutableMap<String, Role> paramRoles;

  public IRProgram(String name, List<String> params, List<IRStatement> body,
                   Map<String, Role> paramRoles) {
    this.name = name;
    this.params = ImmutableList.copyOf(params);
    this.body = ImmutableList.copyOf(body);
    this.paramRoles = ImmutableMap.copyOf(paramRoles);
  }

  public String name() {
    return name;
  }

  public ImmutableList<String> params() {
    return params;
  }

  public ImmutableList<IRStatement> body() {
    return body;
  }

  /**
   * @return final role of a model input: observed if it is data for a
   *         random choice, else deterministic
   */
  public Role paramRole(String param) {
    return paramRoles.get(param);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("model ").append(name).append(params).append("\n");
    IRStatement.prettyPrintBlock(sb, body, "");
    return sb.toString();
  }
}
