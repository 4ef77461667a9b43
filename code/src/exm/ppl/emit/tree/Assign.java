package exm.ppl.emit.tree;

public class Assign extends CodeTree
{
  String target;
  String value;

  public Assign(String target, String value)
  {
    this.target = target;
    this.value = value;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    indent(sb);
    sb.append(target).append(" = ").append(value).append("\n");
  }
}
