package pretty;

import clojure.lang.*;

public class TextLayout extends Layout {
  public static final Keyword KIND = Keyword.intern("text");

  public static Layout create(String text, Layout rest) {
    return new TextLayout(text, rest);
  }

  public final String text;

  private TextLayout(String text, Layout rest) {
    super(rest);
    this.text = text;
  }

  @Override
  public Keyword kind() {
    return KIND;
  }

  @Override
  public ISeq inspectChildren() {
    return PersistentVector.create(text).seq();
  }

  @Override
  public void print(StringBuilder sb) {
    sb.append(text);
  }
}
