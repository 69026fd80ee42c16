package pretty;

import clojure.lang.*;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Unresolved document. Instances are immutable and may be shared between
 * any number of parents. The set of variants is closed: {@link NilDoc},
 * {@link AppendDoc}, {@link NestDoc}, {@link TextDoc}, {@link LineDoc} and
 * {@link UnionDoc}.
 *
 * <p>Documents built with sharing (see {@link Docs#fill}) are DAGs whose
 * tree expansion is exponential, so {@link #hashCode()} is computed once at
 * construction and {@link #inspect()} and {@link #equals(Object)} visit each
 * shared node once.
 */
public abstract class DocCore {
  private static final Var PRINT_LEVEL = RT.var("clojure.core", "*print-level*");
  private static final Var PRINT_LENGTH = RT.var("clojure.core", "*print-length*");

  private final int _hash;

  DocCore(int hash) {
    _hash = hash;
  }

  public abstract Keyword kind();

  /**
   * Child documents and scalar properties of this node, in
   * declaration order, or null if there are none.
   */
  public abstract ISeq inspectChildren();

  /**
   * Single-line form of this document: every line break becomes a
   * space and every union keeps its flat alternative.
   */
  public abstract DocCore flatten();

  /**
   * This document as nested vectors, e.g. {@code [:append [:text "a"] [:line]]}.
   * A node shared by several parents yields one vector shared the same way.
   */
  public IPersistentVector inspect() {
    Map<DocCore, IPersistentVector> done = new IdentityHashMap<>();
    Deque<DocCore> stack = new ArrayDeque<>();
    stack.push(this);
    while (!stack.isEmpty()) {
      DocCore doc = stack.peek();
      if (done.containsKey(doc)) {
        stack.pop();
        continue;
      }
      boolean ready = true;
      for (ISeq children = doc.inspectChildren(); children != null; children = children.next()) {
        Object child = children.first();
        if (child instanceof DocCore && !done.containsKey(child)) {
          stack.push((DocCore) child);
          ready = false;
        }
      }
      if (ready) {
        stack.pop();
        ITransientCollection output = PersistentVector.EMPTY.asTransient();
        output = output.conj(doc.kind());
        for (ISeq children = doc.inspectChildren(); children != null; children = children.next()) {
          Object child = children.first();
          output = output.conj(child instanceof DocCore ? done.get(child) : child);
        }
        done.put(doc, (IPersistentVector) output.persistent());
      }
    }
    return done.get(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DocCore)) {
      return false;
    }
    Map<DocCore, Set<DocCore>> compared = new IdentityHashMap<>();
    Deque<DocCore> lefts = new ArrayDeque<>();
    Deque<DocCore> rights = new ArrayDeque<>();
    lefts.push(this);
    rights.push((DocCore) o);
    while (!lefts.isEmpty()) {
      DocCore left = lefts.pop();
      DocCore right = rights.pop();
      if (left == right) {
        continue;
      }
      if (left._hash != right._hash || left.kind() != right.kind()) {
        return false;
      }
      if (!compared.computeIfAbsent(left, k -> Collections.newSetFromMap(new IdentityHashMap<>())).add(right)) {
        continue;
      }
      ISeq l = left.inspectChildren();
      ISeq r = right.inspectChildren();
      for (; l != null && r != null; l = l.next(), r = r.next()) {
        Object a = l.first();
        Object b = r.first();
        if (a instanceof DocCore && b instanceof DocCore) {
          lefts.push((DocCore) a);
          rights.push((DocCore) b);
        } else if (!Objects.equals(a, b)) {
          return false;
        }
      }
      if (l != null || r != null) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    return _hash;
  }

  /**
   * Printed form of {@link #inspect()}, cut off below a fixed depth.
   */
  @Override
  public String toString() {
    Var.pushThreadBindings(RT.map(PRINT_LEVEL, 10L, PRINT_LENGTH, 8L));
    try {
      return RT.printString(inspect());
    } finally {
      Var.popThreadBindings();
    }
  }
}
