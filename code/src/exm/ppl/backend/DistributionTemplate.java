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
package exm.ppl.backend;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import exm.ppl.common.exceptions.PPLRuntimeError;

/**
 * Target-language text for one distribution, with placeholders %1, %2,
 * ... for the rendered arguments in source order.  A placeholder may
 * appear more than once, or not at all.
 */
public class DistributionTemplate {
  private static final Pattern PLACEHOLDER = Pattern.compile("%(\\d+)");

  private final String template;
  private final int arity;

  public DistributionTemplate(String template, int arity) {
    this.template = template;
    this.arity = arity;
    Matcher m = PLACEHOLDER.matcher(template);
    while (m.find()) {
      int n = Integer.parseInt(m.group(1));
      if (n < 1 || n > arity) {
        throw new PPLRuntimeError("Placeholder %" + n + " out of range in " +
                                  template);
      }
    }
  }

  public int arity() {
    return arity;
  }

  /**
   * @param param parameter number, from 1
   * @return number of times the argument is substituted
   */
  public int occurrences(int param) {
    int count = 0;
    Matcher m = PLACEHOLDER.matcher(template);
    while (m.find()) {
      if (Integer.parseInt(m.group(1)) == param) {
        count++;
      }
    }
    return count;
  }

  public String render(List<String> args) {
    assert(args.size() == arity) : template + " " + args;
    StringBuffer sb = new StringBuffer();
    Matcher m = PLACEHOLDER.matcher(template);
    while (m.find()) {
      String arg = args.get(Integer.parseInt(m.group(1)) - 1);
      m.appendReplacement(sb, Matcher.quoteReplacement(arg));
    }
    m.appendTail(sb);
    return sb.toString();
  }

  @Override
  public String toString() {
    return template;
  }
}
