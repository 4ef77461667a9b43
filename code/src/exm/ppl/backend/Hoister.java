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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.LinkedHashMultiset;
import com.google.common.collect.Multiset;

import exm.ppl.ir.AddressTemplate;
import exm.ppl.ir.IRExpr;

/**
 * Finds random sub-expressions that a statement's generated code would
 * evaluate more than once, so they can be computed once into a
 * temporary, so that every use sees the same value.
 *
 * Occurrences are counted over the address components, when the
 * backend renders addresses, and over the distribution arguments,
 * weighted by how many times each template substitutes the argument.
 */
public class Hoister {

  /** Temporary name to hoisted expression, in emission order */
  private final Map<String, IRExpr> hoisted =
                                    new LinkedHashMap<String, IRExpr>();
  /** Hoisted expression to temporary name */
  private final Map<IRExpr, String> substitutions =
                                    new LinkedHashMap<IRExpr, String>();

  private final Multiset<IRExpr> counts = LinkedHashMultiset.create();
  /** Counted roots in order, for selection */
  private final List<IRExpr> roots = new ArrayList<IRExpr>();

  private Hoister() {
  }

  /**
   * @param address null if the backend does not render addresses
   * @param distribution null for statements without one
   * @param extra further expressions rendered once each, e.g. the
   *              value of a factor
   */
  public static Hoister analyze(AddressTemplate address,
          IRExpr.Distribution distribution, List<IRExpr> extra,
          DistributionTable table, GeneratorState state) {
    Hoister h = new Hoister();
    if (address != null) {
      for (IRExpr c: address.components()) {
        h.count(c, 1);
      }
    }
    if (distribution != null) {
      h.countDistribution(distribution, 1, table);
    }
    for (IRExpr e: extra) {
      h.count(e, 1);
    }
    for (IRExpr root: h.roots) {
      h.select(root, state);
    }
    return h;
  }

  private void countDistribution(IRExpr.Distribution d, int weight,
                                 DistributionTable table) {
    DistributionTemplate template = table.lookup(d.name());
    if (template == null) {
      // Reported when the statement is rendered
      return;
    }
    for (int i = 0; i < d.args().size(); i++) {
      IRExpr arg = d.args().get(i);
      int n = weight * template.occurrences(i + 1);
      if (arg.kind() == IRExpr.Kind.DISTRIBUTION) {
        countDistribution((IRExpr.Distribution)arg, n, table);
      } else {
        count(arg, n);
      }
    }
  }

  private void count(IRExpr expr, int weight) {
    if (weight == 0) {
      return;
    }
    roots.add(expr);
    countRec(expr, weight);
  }

  private void countRec(IRExpr expr, int weight) {
    if (expr.isCompound() && expr.isRandom()) {
      counts.add(expr, weight);
    }
    for (IRExpr child: expr.children()) {
      countRec(child, weight);
    }
  }

  /**
   * Take the outermost repeated expressions, parents before children
   */
  private void select(IRExpr expr, GeneratorState state) {
    if (substitutions.containsKey(expr)) {
      return;
    }
    if (counts.count(expr) >= 2) {
      String temp = state.newTemp();
      hoisted.put(temp, expr);
      substitutions.put(expr, temp);
      return;
    }
    for (IRExpr child: expr.children()) {
      select(child, state);
    }
  }

  /**
   * @return temporary name to expression, in the order to assign them
   */
  public Map<String, IRExpr> hoisted() {
    return hoisted;
  }

  public Map<IRExpr, String> substitutions() {
    return substitutions;
  }

  public boolean isEmpty() {
    return hoisted.isEmpty();
  }
}
