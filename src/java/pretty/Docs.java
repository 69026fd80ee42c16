package pretty;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.BinaryOperator;

/**
 * Document constructors and the combinators derived from them.
 */
public final class Docs {

  private Docs() {
  }

  public static DocCore nil() {
    return NilDoc.INSTANCE;
  }

  public static DocCore append(DocCore x, DocCore y) {
    return AppendDoc.create(x, y);
  }

  public static DocCore nest(int amount, DocCore x) {
    return NestDoc.create(amount, x);
  }

  public static DocCore text(String s) {
    return TextDoc.create(s);
  }

  public static DocCore line() {
    return LineDoc.INSTANCE;
  }

  /**
   * Renders {@code x} on one line if that fits, else with its own breaks.
   */
  public static DocCore group(DocCore x) {
    return UnionDoc.create(x.flatten(), x);
  }

  public static DocCore flatten(DocCore x) {
    return x.flatten();
  }

  //
  //

  public static DocCore space(DocCore x, DocCore y) {
    return append(x, append(TextDoc.SPACE, y));
  }

  public static DocCore newline(DocCore x, DocCore y) {
    return append(x, append(line(), y));
  }

  /**
   * Space between {@code x} and {@code y} if what follows fits on the
   * line, a line break otherwise.
   */
  public static DocCore spaceNewline(DocCore x, DocCore y) {
    return append(x, append(UnionDoc.create(TextDoc.SPACE, line()), y));
  }

  /**
   * Right fold of {@code joiner} over {@code docs}: {@code d0 + (d1 + (... + dn))}.
   */
  public static DocCore foldDoc(BinaryOperator<DocCore> joiner, List<DocCore> docs) {
    if (docs.isEmpty()) {
      return nil();
    }
    int last = docs.size() - 1;
    DocCore result = docs.get(last);
    for (int i = last - 1; i >= 0; i--) {
      result = joiner.apply(docs.get(i), result);
    }
    return result;
  }

  public static DocCore spread(List<DocCore> docs) {
    return foldDoc(Docs::space, docs);
  }

  public static DocCore spread(DocCore... docs) {
    return spread(Arrays.asList(docs));
  }

  public static DocCore stack(List<DocCore> docs) {
    return foldDoc(Docs::newline, docs);
  }

  public static DocCore stack(DocCore... docs) {
    return stack(Arrays.asList(docs));
  }

  public static DocCore bracket(String open, DocCore x, String close) {
    return bracket(2, open, x, close);
  }

  public static DocCore bracket(int indent, String open, DocCore x, String close) {
    return group(append(
        text(open),
        append(nest(indent, append(line(), x)), append(line(), text(close)))));
  }

  /**
   * Word-wraps {@code s}, breaking only where it has a single space.
   */
  public static DocCore fillWords(String s) {
    String[] words = s.split(" ", -1);
    List<DocCore> docs = new ArrayList<>(words.length);
    for (String word : words) {
      docs.add(text(word));
    }
    return foldDoc(Docs::spaceNewline, docs);
  }

  /**
   * Places as many of {@code docs} as fit on each line, separated by
   * spaces. A document that shares a line with the next one is
   * flattened.
   */
  public static DocCore fill(List<DocCore> docs) {
    int n = docs.size();
    if (n == 0) {
      return nil();
    }
    // Fill of docs[i..] with docs[i] kept as-is, and with docs[i] flattened.
    DocCore plain = docs.get(n - 1);
    DocCore flat = plain.flatten();
    for (int i = n - 2; i >= 0; i--) {
      DocCore x = docs.get(i);
      DocCore flatX = x.flatten();
      DocCore together = space(flatX, flat);
      flat = UnionDoc.create(together, newline(flatX, plain));
      plain = UnionDoc.create(together, newline(x, plain));
    }
    return plain;
  }

  public static DocCore fill(DocCore... docs) {
    return fill(Arrays.asList(docs));
  }
}
