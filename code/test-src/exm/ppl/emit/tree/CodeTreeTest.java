package exm.ppl.emit.tree;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;

import org.junit.Test;

public class CodeTreeTest {

  private static Sequence model(String qualifier, Syntax syntax, int width) {
    FunctionDef fn = new FunctionDef(qualifier, "m",
                                     Arrays.asList("x", "n"));
    ForLoop loop = new ForLoop("i", syntax == Syntax.PYTHON ?
                               "range(0, n)" : "0:1:(n)-1");
    If branch = new If("x > 0");
    branch.thenBlock().add(new Assign("y", "1"));
    branch.elseBlock().add(new Comment("negative"));
    branch.elseBlock().add(new Assign("y", "2"));
    loop.loopBody().add(branch);
    fn.getBody().add(loop);

    Sequence top = new Sequence();
    top.setSyntax(syntax);
    top.setIndentWidth(width);
    top.add(new Line("header"));
    top.add(new Line(""));
    top.add(fn);
    return top;
  }

  @Test
  public void testJulia() {
    String expected =
        "header\n" +
        "\n" +
        "@model function m(x, n)\n" +
        "    for i = 0:1:(n)-1\n" +
        "        if x > 0\n" +
        "            y = 1\n" +
        "        else\n" +
        "            # negative\n" +
        "            y = 2\n" +
        "        end\n" +
        "    end\n" +
        "end\n";
    assertEquals(expected, model("@model", Syntax.JULIA, 4).toString());
  }

  @Test
  public void testPython() {
    String expected =
        "header\n" +
        "\n" +
        "def m(x, n):\n" +
        "  for i in range(0, n):\n" +
        "    if x > 0:\n" +
        "      y = 1\n" +
        "    else:\n" +
        "      # negative\n" +
        "      y = 2\n";
    assertEquals(expected, model(null, Syntax.PYTHON, 2).toString());
  }

  @Test
  public void testEmptyBlocks() {
    FunctionDef fn = new FunctionDef(null, "f",
                                     Arrays.<String>asList());
    fn.setSyntax(Syntax.PYTHON);
    assertEquals("def f():\n    pass\n", fn.toString());

    fn.setSyntax(Syntax.JULIA);
    assertEquals("function f()\nend\n", fn.toString());
  }

  @Test
  public void testEmptyElseOmitted() {
    If branch = new If("c");
    branch.thenBlock().add(new Line("go()"));
    assertEquals("if c\n    go()\nend\n", branch.toString());
  }

  @Test
  public void testPythonDecorator() {
    FunctionDef fn = new FunctionDef("@pyro.infer.config_enumerate", "f",
                                     Arrays.asList("a"));
    fn.getBody().add(new Line("return a"));
    fn.setSyntax(Syntax.PYTHON);
    assertEquals("@pyro.infer.config_enumerate\ndef f(a):\n    return a\n",
                 fn.toString());
  }
}
