package exm.ppl.emit.tree;

public class Comment extends CodeTree
{
  String text;

  public Comment(String text)
  {
    this.text = text;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    for (String line: text.split("\n")) {
      indent(sb);
      sb.append(syntax.commentPrefix()).append(line).append("\n");
    }
  }
}
