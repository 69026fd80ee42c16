package pretty;

import clojure.lang.*;

/**
 * Resolved document: a chain of text fragments and line breaks with
 * literal indentation. The variants are {@link #NIL}, {@link TextLayout}
 * and {@link LineLayout}.
 */
public abstract class Layout {
  public static final Keyword NIL_KIND = Keyword.intern("nil");

  public static final Layout NIL = new Layout(null) {
    @Override
    public Keyword kind() {
      return NIL_KIND;
    }

    @Override
    public ISeq inspectChildren() {
      return null;
    }

    @Override
    public void print(StringBuilder sb) {
    }
  };

  protected final Layout _rest;

  Layout(Layout rest) {
    _rest = rest;
  }

  public abstract Keyword kind();

  public abstract ISeq inspectChildren();

  /**
   * Appends this fragment, without its tail, to the given buffer.
   */
  public abstract void print(StringBuilder sb);

  /**
   * Next fragment, {@link #NIL} at the end of the chain, null for NIL
   * itself.
   */
  public Layout rest() {
    return _rest;
  }

  /**
   * The whole chain as a vector of fragments, e.g.
   * {@code [[:text "a"] [:line 2] [:text "b"]]}.
   */
  public IPersistentVector inspect() {
    ITransientCollection output = PersistentVector.EMPTY.asTransient();
    for (Layout layout = this; layout != NIL; layout = layout.rest()) {
      ITransientCollection fragment = PersistentVector.EMPTY.asTransient();
      fragment = fragment.conj(layout.kind());
      for (ISeq children = layout.inspectChildren(); children != null; children = children.next()) {
        fragment = fragment.conj(children.first());
      }
      output = output.conj(fragment.persistent());
    }
    return (IPersistentVector) output.persistent();
  }

  @Override
  public String toString() {
    return inspect().toString();
  }
}
