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

import java.util.Set;

import com.google.common.collect.ImmutableMap;

import exm.ppl.common.exceptions.PPLRuntimeError;
import exm.ppl.common.lang.DistributionDescriptor;
import exm.ppl.common.lang.Distributions;

/**
 * Templates for the constructs one backend can emit, keyed by catalog
 * name or {@link exm.ppl.common.lang.BackendDescriptor#FACTOR}
 */
public class DistributionTable {
  private final ImmutableMap<String, DistributionTemplate> templates;

  private DistributionTable(ImmutableMap<String, DistributionTemplate> t) {
    this.templates = t;
  }

  /**
   * @return template, or null if the backend cannot emit the construct
   */
  public DistributionTemplate lookup(String construct) {
    return templates.get(construct);
  }

  public Set<String> constructs() {
    return templates.keySet();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private final ImmutableMap.Builder<String, DistributionTemplate> b =
                                                  ImmutableMap.builder();

    /**
     * Add a catalog distribution, taking the arity from the catalog
     */
    public Builder put(String name, String template) {
      DistributionDescriptor d = Distributions.lookup(name);
      if (d == null) {
        throw new PPLRuntimeError("Not in catalog: " + name);
      }
      b.put(name, new DistributionTemplate(template, d.arity()));
      return this;
    }

    /**
     * Add a non-distribution construct with the given arity
     */
    public Builder put(String construct, String template, int arity) {
      b.put(construct, new DistributionTemplate(template, arity));
      return this;
    }

    public DistributionTable build() {
      return new DistributionTable(b.build());
    }
  }
}
