package exm.ppl.testing;

import static exm.ppl.ast.Ast.assign;
import static exm.ppl.ast.Ast.at;
import static exm.ppl.ast.Ast.binary;
import static exm.ppl.ast.Ast.block;
import static exm.ppl.ast.Ast.call;
import static exm.ppl.ast.Ast.eq;
import static exm.ppl.ast.Ast.forLoop;
import static exm.ppl.ast.Ast.ifElse;
import static exm.ppl.ast.Ast.ifThen;
import static exm.ppl.ast.Ast.index;
import static exm.ppl.ast.Ast.lit;
import static exm.ppl.ast.Ast.minus;
import static exm.ppl.ast.Ast.observe;
import static exm.ppl.ast.Ast.params;
import static exm.ppl.ast.Ast.plus;
import static exm.ppl.ast.Ast.program;
import static exm.ppl.ast.Ast.range;
import static exm.ppl.ast.Ast.sample;
import static exm.ppl.ast.Ast.slice;
import static exm.ppl.ast.Ast.times;
import static exm.ppl.ast.Ast.var;

import exm.ppl.ast.Program;
import exm.ppl.common.lang.Operators.BinaryOperator;

/**
 * Models shared by the tests, written as the parser would build them.
 * Statement lines follow the layout in the comments.
 */
public class Models {

  /**
   * <pre>
   * 1 def cointoss(data, M):
   * 2   p ~ Beta(1.0, 1.0)
   * 3   for i in 0:M:
   * 4     if data[i] == 0 or data[i] == 1:
   * 5       data[i] ~ Bernoulli(p)
   * </pre>
   */
  public static Program coinToss() {
    return program("cointoss", params("data", "M"),
        sample(at(2), "p", call("Beta", lit(1.0), lit(1.0))),
        forLoop(at(3), "i", range(lit(0), var("M")),
          ifThen(at(4), binary(BinaryOperator.OR,
                                eq(index("data", var("i")), lit(0)),
                                eq(index("data", var("i")), lit(1))),
            sample(at(5), index("data", var("i")),
                   call("Bernoulli", var("p"))))));
  }

  /**
   * <pre>
   * 1 def hmm(y, T, pi0, trans, mu):
   * 2   z = Vector(T)
   * 3   z[0] ~ Categorical(pi0)
   * 4   observe y[0] ~ Normal(mu[z[0]], 1.0)
   * 5   for t in 1:T:
   * 6     z[t] ~ Categorical(trans[z[t - 1], :])
   * 7     observe y[t] ~ Normal(mu[z[t]], 1.0)
   * </pre>
   */
  public static Program hmm() {
    return program("hmm", params("y", "T", "pi0", "trans", "mu"),
        assign(at(2), "z", call("Vector", var("T"))),
        sample(at(3), index("z", lit(0)), call("Categorical", var("pi0"))),
        observe(at(4), index("y", lit(0)),
                call("Normal", index("mu", index("z", lit(0))), lit(1.0))),
        forLoop(at(5), "t", range(lit(1), var("T")),
          sample(at(6), index("z", var("t")),
                 call("Categorical", index("trans",
                      index("z", minus(var("t"), lit(1))), slice()))),
          observe(at(7), index("y", var("t")),
                  call("Normal", index("mu", index("z", var("t"))),
                       lit(1.0)))));
  }

  /**
   * <pre>
   * 1 def gmm(x, N, K, w):
   * 2   for k in 0:K:
   * 3     mu[k] ~ Normal(0.0, 10.0)
   * 4   for n in 0:N:
   * 5     c[n] ~ Categorical(w)
   * 6     observe x[n] ~ Normal(mu[c[n]], 1.0)
   * </pre>
   */
  public static Program gaussianMixture() {
    return program("gmm", params("x", "N", "K", "w"),
        forLoop(at(2), "k", range(lit(0), var("K")),
          sample(at(3), index("mu", var("k")),
                 call("Normal", lit(0.0), lit(10.0)))),
        forLoop(at(4), "n", range(lit(0), var("N")),
          sample(at(5), index("c", var("n")), call("Categorical", var("w"))),
          observe(at(6), index("x", var("n")),
                  call("Normal", index("mu", index("c", var("n"))),
                       lit(1.0)))));
  }

  /**
   * <pre>
   * 1 def linreg(x, y, N):
   * 2   alpha ~ Normal(0.0, 10.0)
   * 3   beta ~ Normal(0.0, 10.0)
   * 4   sigma ~ HalfNormal(1.0)
   * 5   for i in 0:N:
   * 6     mean[i] = alpha + beta * x[i]
   * 7   for j in 0:N:
   * 8     observe y[j] ~ Normal(mean[j], sigma)
   * </pre>
   */
  public static Program linearRegression() {
    return program("linreg", params("x", "y", "N"),
        sample(at(2), "alpha", call("Normal", lit(0.0), lit(10.0))),
        sample(at(3), "beta", call("Normal", lit(0.0), lit(10.0))),
        sample(at(4), "sigma", call("HalfNormal", lit(1.0))),
        forLoop(at(5), "i", range(lit(0), var("N")),
          assign(at(6), index("mean", var("i")),
                 plus(var("alpha"),
                      times(var("beta"), index("x", var("i")))))),
        forLoop(at(7), "j", range(lit(0), var("N")),
          observe(at(8), index("y", var("j")),
                  call("Normal", index("mean", var("j")), var("sigma")))));
  }

  /**
   * <pre>
   *  1 def burglary_model(alarm):
   *  2   burglary ~ Bernoulli(0.001)
   *  3   earthquake ~ Bernoulli(0.002)
   *  4   if burglary == 1:
   *  5     p = 0.95
   *  6   else:
   *  7     if earthquake == 1:
   *  8       p = 0.29
   *  9     else:
   * 10       p = 0.001
   * 11   observe alarm ~ Bernoulli(p)
   * </pre>
   */
  public static Program burglary() {
    return program("burglary_model", params("alarm"),
        sample(at(2), "burglary", call("Bernoulli", lit(0.001))),
        sample(at(3), "earthquake", call("Bernoulli", lit(0.002))),
        ifElse(at(4), eq(var("burglary"), lit(1)),
          block(assign(at(5), "p", lit(0.95))),
          block(ifElse(at(7), eq(var("earthquake"), lit(1)),
                  block(assign(at(8), "p", lit(0.29))),
                  block(assign(at(10), "p", lit(0.001)))))),
        observe(at(11), var("alarm"), call("Bernoulli", var("p"))));
  }
}
