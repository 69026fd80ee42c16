package pretty;

import clojure.lang.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static pretty.Docs.*;

final class DocsTest {
  static LongStream seeds() {
    return RandomDocs.seeds();
  }

  @Test
  void flattenTurnsLinesIntoSpaces() {
    DocCore doc = append(text("a"), nest(2, append(line(), text("b"))));
    assertThat(flatten(doc)).isEqualTo(append(text("a"), nest(2, append(text(" "), text("b")))));
  }

  @Test
  void flattenKeepsFlatAlternative() {
    DocCore doc = group(append(text("a"), append(line(), text("b"))));
    assertThat(flatten(doc)).isEqualTo(append(text("a"), append(text(" "), text("b"))));
    assertThat(flatten(nil())).isSameAs(nil());
  }

  @Test
  void groupSharesItsArgument() {
    DocCore x = append(text("a"), append(line(), text("b")));
    UnionDoc group = (UnionDoc) group(x);
    assertThat(group.broken).isSameAs(x);
    assertThat(group.flat).isEqualTo(flatten(x));
  }

  @Test
  void inspectShowsStructure() {
    DocCore doc = nest(2, append(text("a"), line()));
    assertThat(doc.inspect()).isEqualTo(PersistentVector.create(
        NestDoc.KIND,
        2,
        PersistentVector.create(
            AppendDoc.KIND,
            PersistentVector.create(TextDoc.KIND, "a"),
            PersistentVector.create(LineDoc.KIND))));
  }

  @ParameterizedTest
  @MethodSource("seeds")
  void flattenIsIdempotent(long seed) {
    DocCore x = RandomDocs.generate(RandomDocs.generator(seed), 5);
    assertThat(flatten(flatten(x))).isEqualTo(flatten(x));
  }

  @ParameterizedTest
  @MethodSource("seeds")
  void groupKeepsFlattenedContent(long seed) {
    DocCore x = RandomDocs.generate(RandomDocs.generator(seed), 5);
    assertThat(flatten(group(x))).isEqualTo(flatten(x));
  }

  @Test
  void foldDocHandlesShortLists() {
    DocCore a = text("a");
    assertThat(foldDoc(Docs::space, Collections.emptyList())).isSameAs(nil());
    assertThat(foldDoc(Docs::space, List.of(a))).isSameAs(a);
  }

  @Test
  void foldDocFoldsRight() {
    DocCore doc = foldDoc(Docs::append, List.of(text("a"), text("b"), text("c")));
    assertThat(doc).isEqualTo(append(text("a"), append(text("b"), text("c"))));
  }

  @Test
  void spreadJoinsWithSpaces() {
    assertThat(Pretty.pretty(0, spread(text("a"), text("b"), text("c")))).isEqualTo("a b c");
    assertThat(Pretty.pretty(0, spread())).isEmpty();
  }

  @Test
  void stackJoinsWithLineBreaks() {
    assertThat(Pretty.pretty(80, stack(text("a"), text("b"), text("c")))).isEqualTo("a\nb\nc");
  }

  @Test
  void bracketWithCustomIndent() {
    assertThat(Pretty.pretty(2, bracket(4, "{", text("x"), "}"))).isEqualTo("{\n    x\n}");
    assertThat(Pretty.pretty(5, bracket(4, "{", text("x"), "}"))).isEqualTo("{ x }");
  }

  @Test
  void fillWordsWrapsAtWidth() {
    assertThat(Pretty.pretty(10, fillWords("the quick brown fox jumps")))
        .isEqualTo("the quick\nbrown fox\njumps");
    assertThat(Pretty.pretty(80, fillWords("the quick brown fox jumps")))
        .isEqualTo("the quick brown fox jumps");
  }

  @Test
  void fillWordsKeepsLongWordsWhole() {
    assertThat(Pretty.pretty(5, fillWords("a extraordinarily b"))).isEqualTo("a\nextraordinarily\nb");
  }

  @Test
  void fillWordsKeepsEmptyTokens() {
    assertThat(Pretty.pretty(80, fillWords("a  b"))).isEqualTo("a  b");
    assertThat(Pretty.pretty(80, fillWords(""))).isEmpty();
  }

  @Test
  void fillPacksDocumentsPerLine() {
    DocCore doc = fill(text("aaa"), text("bbb"), text("ccc"), text("ddd"));
    assertThat(Pretty.pretty(8, doc)).isEqualTo("aaa bbb\nccc ddd");
    assertThat(Pretty.pretty(80, doc)).isEqualTo("aaa bbb ccc ddd");
  }

  @Test
  void fillFlattensDocumentsSharingALine() {
    DocCore doc = fill(text("x"), stack(text("1"), text("2")));
    assertThat(Pretty.pretty(5, doc)).isEqualTo("x 1 2");
    assertThat(Pretty.pretty(3, doc)).isEqualTo("x\n1\n2");
  }

  @Test
  void fillHandlesShortLists() {
    DocCore a = text("a");
    assertThat(fill()).isSameAs(nil());
    assertThat(fill(a)).isSameAs(a);
  }

  @Test
  @Timeout(10)
  void sharedFillNodesAreVisitedOnce() {
    DocCore a = fill(texts(40, "ab"));
    DocCore b = fill(texts(40, "ab"));
    List<DocCore> other = texts(40, "ab");
    other.set(39, text("ac"));
    assertThat(a).isNotSameAs(b);
    assertThat(a.equals(b)).isTrue();
    assertThat(a.hashCode()).isEqualTo(b.hashCode());
    assertThat(a.equals(fill(other))).isFalse();
    assertThat(a.inspect().nth(0)).isEqualTo(UnionDoc.KIND);
    assertThat(a.toString()).startsWith("[:union [:append [:text \"ab\"]");
  }

  private static List<DocCore> texts(int count, String s) {
    List<DocCore> docs = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      docs.add(text(s));
    }
    return docs;
  }

  @Test
  void longFillIsLinear() {
    List<DocCore> docs = new ArrayList<>();
    for (int i = 0; i < 20_000; i++) {
      docs.add(text("ab"));
    }
    String[] lines = Pretty.pretty(10, fill(docs)).split("\n", -1);
    assertThat(lines).hasSize(6_667);
    assertThat(lines[0]).isEqualTo("ab ab ab");
    assertThat(lines[lines.length - 1]).isEqualTo("ab ab");
  }

  @Test
  void longWordWrapDoesNotExhaustStack() {
    String words = String.join(" ", Collections.nCopies(20_000, "ab"));
    String[] lines = Pretty.pretty(10, fillWords(words)).split("\n", -1);
    assertThat(lines).hasSize(6_667);
    assertThat(lines).allSatisfy(line -> assertThat(line.length()).isLessThanOrEqualTo(10));
  }

  @Test
  void longStackDoesNotExhaustStack() {
    List<DocCore> docs = new ArrayList<>(Collections.nCopies(50_000, text("x")));
    String output = Pretty.pretty(80, stack(docs));
    assertThat(output.split("\n", -1)).hasSize(50_000);
  }
}
