package pretty;

import clojure.lang.*;

import java.util.Objects;

public final class TextDoc extends DocCore {
  public static final Keyword KIND = Keyword.intern("text");
  static final TextDoc SPACE = new TextDoc(" ");

  public static TextDoc create(String text) {
    assert text.indexOf('\n') < 0 : "Text must not contain line breaks";
    return " ".equals(text) ? SPACE : new TextDoc(text);
  }

  public final String text;

  private TextDoc(String text) {
    super(Objects.hash(KIND, text));
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
  public DocCore flatten() {
    return this;
  }
}
