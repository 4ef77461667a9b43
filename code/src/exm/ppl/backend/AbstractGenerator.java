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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.ppl.common.Logging;
import exm.ppl.common.Settings;
import exm.ppl.common.exceptions.CodegenError;
import exm.ppl.common.exceptions.InvalidOptionException;
import exm.ppl.common.exceptions.PPLRuntimeError;
import exm.ppl.common.lang.BackendDescriptor;
import exm.ppl.common.lang.BackendDescriptor.AddressingScheme;
import exm.ppl.emit.tree.Assign;
import exm.ppl.emit.tree.Comment;
import exm.ppl.emit.tree.ForLoop;
import exm.ppl.emit.tree.If;
import exm.ppl.emit.tree.Line;
import exm.ppl.emit.tree.Sequence;
import exm.ppl.emit.tree.Syntax;
import exm.ppl.ir.AddressTemplate;
import exm.ppl.ir.IRExpr;
import exm.ppl.ir.IRProgram;
import exm.ppl.ir.IRStatement;

/**
 * Statement lowering shared by all backends.  Subclasses supply the
 * model function and the three random-choice statements; control flow
 * and assignments are emitted here through the backend's renderer.
 */
public abstract class AbstractGenerator implements BackendGenerator {

  protected static final Logger logger = Logging.getPPLLogger();

  protected final BackendDescriptor descriptor;
  protected final ExprRenderer renderer;
  protected final DistributionTable table;
  protected final GeneratorState state = new GeneratorState();

  /** Import lines, emitted once each in insertion order */
  private final Set<String> preamble = new LinkedHashSet<String>();

  /** Top-level code after the preamble */
  protected final Sequence root = new Sequence();

  protected String programName = null;

  /** Generated text, set by finalize */
  private String code = null;

  protected AbstractGenerator(BackendDescriptor descriptor,
                              ExprRenderer renderer,
                              DistributionTable table) {
    this.descriptor = descriptor;
    this.renderer = renderer;
    this.table = table;
  }

  @Override
  public BackendDescriptor descriptor() {
    return descriptor;
  }

  protected abstract Syntax syntax();

  protected void addPreamble(String line) {
    preamble.add(line);
  }

  /**
   * Extra preamble lines depending on what the body used
   */
  protected Set<String> finalPreamble() {
    return Collections.emptySet();
  }

  @Override
  public String emitExpression(IRExpr expr) {
    return renderer.render(expr);
  }

  public void emitBlock(List<IRStatement> block, Sequence out)
                                          throws CodegenError {
    for (IRStatement stmt: block) {
      emitStatement(stmt, out);
    }
  }

  @Override
  public void emitStatement(IRStatement stmt, Sequence out)
                                          throws CodegenError {
    switch (stmt.kind()) {
      case ASSIGN: {
        IRStatement.Assign a = (IRStatement.Assign)stmt;
        out.add(new Assign(renderer.render(a.target()),
                           renderer.render(a.value())));
        break;
      }
      case SAMPLE: {
        IRStatement.Sample s = (IRStatement.Sample)stmt;
        hoist(out, s.address(), s.distribution(),
                          Collections.<IRExpr>emptyList());
        try {
          emitSample(s, out);
        } finally {
          renderer.clearSubstitutions();
        }
        break;
      }
      case OBSERVE: {
        IRStatement.Observe o = (IRStatement.Observe)stmt;
        hoist(out, o.address(), o.distribution(),
                          Collections.<IRExpr>emptyList());
        try {
          emitObserve(o, out);
        } finally {
          renderer.clearSubstitutions();
        }
        break;
      }
      case FACTOR: {
        IRStatement.Factor f = (IRStatement.Factor)stmt;
        if (table.lookup(BackendDescriptor.FACTOR) == null) {
          throw CodegenError.unsupported(stmt.pos(),
                  BackendDescriptor.FACTOR, descriptor.displayName());
        }
        hoist(out, f.address(), null,
                          Collections.singletonList(f.value()));
        try {
          emitFactor(f, out);
        } finally {
          renderer.clearSubstitutions();
        }
        break;
      }
      case IF: {
        IRStatement.If i = (IRStatement.If)stmt;
        If tree = new If(renderer.render(i.condition()));
        emitBlock(i.thenBlock(), tree.thenBlock());
        emitBlock(i.elseBlock(), tree.elseBlock());
        out.add(tree);
        break;
      }
      case FOR:
        emitFor((IRStatement.For)stmt, out);
        break;
      case RETURN: {
        IRStatement.Return r = (IRStatement.Return)stmt;
        if (r.value() == null) {
          out.add(new Line("return"));
        } else {
          out.add(new Line("return " + renderer.render(r.value())));
        }
        break;
      }
      case CONTINUE:
        out.add(new Line("continue"));
        break;
      case BREAK:
        out.add(new Line("break"));
        break;
      default:
        throw new PPLRuntimeError("Unexpected IR statement kind " +
                                  stmt.kind());
    }
  }

  protected void emitFor(IRStatement.For loop, Sequence out)
                                          throws CodegenError {
    ForLoop tree = new ForLoop(loop.loopVar(),
                               renderer.loopIteration(loop.range()));
    emitBlock(loop.body(), tree.loopBody());
    out.add(tree);
  }

  private void hoist(Sequence out, AddressTemplate address,
          IRExpr.Distribution distribution, List<IRExpr> extra) {
    boolean rendersAddress =
        descriptor.addressing() == AddressingScheme.EXPLICIT_STRING;
    Hoister h = Hoister.analyze(rendersAddress ? address : null,
                                distribution, extra, table, state);
    for (Map.Entry<String, IRExpr> e: h.hoisted().entrySet()) {
      out.add(new Assign(e.getKey(), renderer.render(e.getValue())));
      logger.trace("hoisted " + e.getValue() + " into " + e.getKey());
    }
    renderer.setSubstitutions(h.substitutions());
  }

  protected abstract void emitSample(IRStatement.Sample sample,
                           Sequence out) throws CodegenError;

  protected abstract void emitObserve(IRStatement.Observe observe,
                           Sequence out) throws CodegenError;

  protected abstract void emitFactor(IRStatement.Factor factor,
                           Sequence out) throws CodegenError;

  protected String renderDistribution(IRStatement stmt,
              IRExpr.Distribution d) throws CodegenError {
    return renderer.distribution(stmt.pos(), d, table);
  }

  @Override
  public void finalize() {
    if (code != null) {
      return;
    }
    Sequence file = new Sequence();
    file.setSyntax(syntax());
    file.setIndentWidth(indentWidth());
    if (bannerEnabled()) {
      file.add(new Comment("Generated from model " + programName + " for " +
                           descriptor.displayName()));
    }
    Set<String> lines = new LinkedHashSet<String>(preamble);
    lines.addAll(finalPreamble());
    for (String line: lines) {
      file.add(new Line(line));
    }
    file.add(new Line(""));
    file.append(root);
    code = file.toString();
  }

  @Override
  public String code() {
    if (code == null) {
      throw new PPLRuntimeError("Generator for " + descriptor +
                                " not finalized");
    }
    return code;
  }

  private static int indentWidth() {
    try {
      return Settings.getInt(Settings.EMIT_INDENT);
    } catch (InvalidOptionException e) {
      throw new PPLRuntimeError(e.getMessage());
    }
  }

  private static boolean bannerEnabled() {
    return Settings.get(Settings.EMIT_BANNER).equalsIgnoreCase("header");
  }
}
