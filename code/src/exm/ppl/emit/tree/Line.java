package exm.ppl.emit.tree;

/**
 * One line of code, already rendered
 */
public class Line extends CodeTree
{
  String text;

  public Line(String text)
  {
    this.text = text;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    if (text.isEmpty()) {
      sb.append("\n");
      return;
    }
    indent(sb);
    sb.append(text).append("\n");
  }
}
