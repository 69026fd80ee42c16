package pretty;

import clojure.lang.*;

import java.util.Objects;

public final class AppendDoc extends DocCore {
  public static final Keyword KIND = Keyword.intern("append");

  public static AppendDoc create(DocCore left, DocCore right) {
    return new AppendDoc(left, right);
  }

  public final DocCore left;
  public final DocCore right;

  private AppendDoc(DocCore left, DocCore right) {
    super(Objects.hash(KIND, left, right));
    this.left = left;
    this.right = right;
  }

  @Override
  public Keyword kind() {
    return KIND;
  }

  @Override
  public ISeq inspectChildren() {
    return PersistentVector.create(left, right).seq();
  }

  @Override
  public DocCore flatten() {
    return create(left.flatten(), right.flatten());
  }
}
