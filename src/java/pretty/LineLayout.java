package pretty;

import clojure.lang.*;

public class LineLayout extends Layout {
  public static final Keyword KIND = Keyword.intern("line");

  public static Layout create(int indent, Layout rest) {
    return new LineLayout(indent, rest);
  }

  public final int indent;

  private LineLayout(int indent, Layout rest) {
    super(rest);
    this.indent = indent;
  }

  @Override
  public Keyword kind() {
    return KIND;
  }

  @Override
  public ISeq inspectChildren() {
    return PersistentVector.create(indent).seq();
  }

  @Override
  public void print(StringBuilder sb) {
    sb.append('\n');
    sb.append(Util.spaces(indent));
  }
}
