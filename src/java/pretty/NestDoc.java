package pretty;

import clojure.lang.*;

import java.util.Objects;

/**
 * Indents the line breaks of {@link #doc} by {@link #amount} more columns
 * than the enclosing context. Amounts add up across nested instances and
 * may be negative.
 */
public final class NestDoc extends DocCore {
  public static final Keyword KIND = Keyword.intern("nest");

  public static NestDoc create(int amount, DocCore doc) {
    return new NestDoc(amount, doc);
  }

  public final int amount;
  public final DocCore doc;

  private NestDoc(int amount, DocCore doc) {
    super(Objects.hash(KIND, amount, doc));
    this.amount = amount;
    this.doc = doc;
  }

  @Override
  public Keyword kind() {
    return KIND;
  }

  @Override
  public ISeq inspectChildren() {
    return PersistentVector.create(amount, doc).seq();
  }

  @Override
  public DocCore flatten() {
    return create(amount, doc.flatten());
  }
}
