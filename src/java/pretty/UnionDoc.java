package pretty;

import clojure.lang.*;

import java.util.Objects;

/**
 * Choice between two layouts of the same content. Both alternatives must
 * flatten to the same text; this is not checked. {@link #flat} is the more
 * horizontal one and is preferred whenever its first line fits.
 */
public final class UnionDoc extends DocCore {
  public static final Keyword KIND = Keyword.intern("union");

  static UnionDoc create(DocCore flat, DocCore broken) {
    return new UnionDoc(flat, broken);
  }

  public final DocCore flat;
  public final DocCore broken;

  private UnionDoc(DocCore flat, DocCore broken) {
    super(Objects.hash(KIND, flat, broken));
    this.flat = flat;
    this.broken = broken;
  }

  @Override
  public Keyword kind() {
    return KIND;
  }

  @Override
  public ISeq inspectChildren() {
    return PersistentVector.create(flat, broken).seq();
  }

  @Override
  public DocCore flatten() {
    return flat.flatten();
  }
}
