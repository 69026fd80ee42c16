package pretty;

import clojure.lang.*;

/**
 * Break to a new line at the enclosing nesting level, or a single space
 * once flattened.
 */
public final class LineDoc extends DocCore {
  public static final Keyword KIND = Keyword.intern("line");
  public static final LineDoc INSTANCE = new LineDoc();

  private LineDoc() {
    super(KIND.hashCode());
  }

  @Override
  public Keyword kind() {
    return KIND;
  }

  @Override
  public ISeq inspectChildren() {
    return null;
  }

  @Override
  public DocCore flatten() {
    return TextDoc.SPACE;
  }
}
