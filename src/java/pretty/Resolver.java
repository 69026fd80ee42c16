package pretty;

import clojure.lang.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Turns a {@link DocCore} into a {@link Layout} for a given line width by
 * resolving every union greedily: the flat alternative wins whenever the
 * text up to its first line break fits on the current line.
 *
 * <p>Nothing here recurses. {@link #be} walks an explicit worklist, and a
 * union is decided by {@link Lookahead}, which scans the pending worklist
 * up to the first line break and settles the unions it meets on the way
 * with a stack of open choices.
 */
public final class Resolver {
  private static final Logger LOG = LoggerFactory.getLogger(Resolver.class);

  private Resolver() {
  }

  public static Layout best(int width, int column, DocCore doc) {
    return be(width, column, new Cons(Indented.create(0, doc), null));
  }

  /**
   * Resolves the worklist {@code pending}, a sequence of {@link Indented}
   * entries, starting at {@code column}.
   */
  public static Layout be(int width, int column, ISeq pending) {
    // Strings are text fragments, Integers line breaks with their indent.
    List<Object> fragments = new ArrayList<>();
    while (pending != null) {
      Indented head = (Indented) pending.first();
      ISeq rest = pending.next();
      DocCore doc = head.doc;
      if (doc instanceof NilDoc) {
        pending = rest;
      } else if (doc instanceof AppendDoc) {
        AppendDoc append = (AppendDoc) doc;
        pending = new Cons(head.with(append.left), new Cons(head.with(append.right), rest));
      } else if (doc instanceof NestDoc) {
        NestDoc nest = (NestDoc) doc;
        pending = new Cons(Indented.create(head.indent + nest.amount, nest.doc), rest);
      } else if (doc instanceof TextDoc) {
        String text = ((TextDoc) doc).text;
        fragments.add(text);
        column += text.length();
        pending = rest;
      } else if (doc instanceof LineDoc) {
        fragments.add(head.indent);
        column = head.indent;
        pending = rest;
      } else if (doc instanceof UnionDoc) {
        UnionDoc union = (UnionDoc) doc;
        Lookahead flat = Lookahead.scan(width, column, new Cons(head.with(union.flat), rest));
        if (LogLevel.isLogLevelEnabled(LogLevel.DECISIONS)) {
          LOG.debug("Column {} of {}: {} alternative", column, width, flat != null ? "flat" : "broken");
        }
        if (flat != null) {
          fragments.addAll(flat.texts);
          column = flat.column;
          pending = flat.pending;
        } else {
          pending = new Cons(head.with(union.broken), rest);
        }
      } else {
        throw new IllegalArgumentException("Invalid document: " + doc.getClass().getName());
      }
    }
    Layout layout = Layout.NIL;
    for (int i = fragments.size() - 1; i >= 0; i--) {
      Object fragment = fragments.get(i);
      layout = fragment instanceof String
          ? TextLayout.create((String) fragment, layout)
          : LineLayout.create((Integer) fragment, layout);
    }
    return layout;
  }

  /**
   * {@code first} if it fits the rest of the line at {@code column},
   * {@code second} otherwise.
   */
  public static Layout better(int width, int column, Layout first, Layout second) {
    return fits(width - column, first) ? first : second;
  }

  /**
   * Whether {@code layout} can be emitted up to its first line break
   * within {@code remaining} columns. A negative budget never fits.
   */
  public static boolean fits(int remaining, Layout layout) {
    while (remaining >= 0) {
      if (layout == Layout.NIL || layout instanceof LineLayout) {
        return true;
      }
      remaining -= ((TextLayout) layout).text.length();
      layout = layout.rest();
    }
    return false;
  }

  /**
   * First line of a worklist, resolved: the texts up to the first line
   * break, the column they end at and the worklist from that break on.
   */
  static final class Lookahead {
    final List<String> texts;
    final int column;
    final ISeq pending;

    private Lookahead(List<String> texts, int column, ISeq pending) {
      this.texts = texts;
      this.column = column;
      this.pending = pending;
    }

    /**
     * Resolves {@code pending} up to its first line break, or returns null
     * if that text does not fit within {@code width}.
     *
     * <p>Each union met is first taken flat. When the line overflows, the
     * most recently opened union is the one whose flat alternative did not
     * fit, so it is reopened with its broken alternative. An overflow with
     * no open union left means the line cannot fit.
     */
    static Lookahead scan(int width, int column, ISeq pending) {
      List<String> texts = new ArrayList<>();
      Deque<Choice> open = new ArrayDeque<>();
      while (true) {
        if (column > width) {
          Choice choice = open.pollFirst();
          if (choice == null) {
            return null;
          }
          pending = choice.broken;
          column = choice.column;
          texts.subList(choice.textCount, texts.size()).clear();
          continue;
        }
        if (pending == null) {
          return new Lookahead(texts, column, null);
        }
        Indented head = (Indented) pending.first();
        ISeq rest = pending.next();
        DocCore doc = head.doc;
        if (doc instanceof NilDoc) {
          pending = rest;
        } else if (doc instanceof AppendDoc) {
          AppendDoc append = (AppendDoc) doc;
          pending = new Cons(head.with(append.left), new Cons(head.with(append.right), rest));
        } else if (doc instanceof NestDoc) {
          NestDoc nest = (NestDoc) doc;
          pending = new Cons(Indented.create(head.indent + nest.amount, nest.doc), rest);
        } else if (doc instanceof TextDoc) {
          String text = ((TextDoc) doc).text;
          texts.add(text);
          column += text.length();
          pending = rest;
        } else if (doc instanceof LineDoc) {
          return new Lookahead(texts, column, pending);
        } else if (doc instanceof UnionDoc) {
          UnionDoc union = (UnionDoc) doc;
          open.push(new Choice(new Cons(head.with(union.broken), rest), column, texts.size()));
          pending = new Cons(head.with(union.flat), rest);
        } else {
          throw new IllegalArgumentException("Invalid document: " + doc.getClass().getName());
        }
      }
    }
  }

  private static final class Choice {
    final ISeq broken;
    final int column;
    final int textCount;

    Choice(ISeq broken, int column, int textCount) {
      this.broken = broken;
      this.column = column;
      this.textCount = textCount;
    }
  }
}
