package pretty;

import clojure.lang.*;

public final class NilDoc extends DocCore {
  public static final Keyword KIND = Keyword.intern("nil");
  public static final NilDoc INSTANCE = new NilDoc();

  private NilDoc() {
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
    return this;
  }
}
