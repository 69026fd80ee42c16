package pretty;

/**
 * Pending document on the resolver's worklist, with the nesting level in
 * effect where it was introduced.
 */
public final class Indented {
  public static Indented create(int indent, DocCore doc) {
    return new Indented(indent, doc);
  }

  public final int indent;
  public final DocCore doc;

  private Indented(int indent, DocCore doc) {
    this.indent = indent;
    this.doc = doc;
  }

  Indented with(DocCore other) {
    return new Indented(indent, other);
  }

  @Override
  public String toString() {
    return "(" + indent + ", " + doc.kind() + ")";
  }
}
