package io.kifmt.parser.api;

import static org.assertj.core.api.Assertions.assertThat;

import io.kifmt.parser.Fixtures;
import io.kifmt.sexpr.Node;
import io.kifmt.sexpr.NodeEquivalence;
import io.kifmt.sexpr.SExpressionParser;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

class KiCadFormatRoundTripTest {

  static Stream<String> fixtures() {
    return Fixtures.ALL.stream();
  }

  @SuppressWarnings("unchecked")
  private static <D extends KiCadDocument> KiCadFormat<D> formatFor(Path path) throws Exception {
    return (KiCadFormat<D>) KiCadFormat.detect(path);
  }

  @ParameterizedTest
  @MethodSource("fixtures")
  void writtenDocumentParsesToEquivalentTree(String name) throws Exception {
    Path path = Fixtures.path(name);
    KiCadFormat<KiCadDocument> format = formatFor(path);

    KiCadDocument document = format.read(path);
    String written = format.writeToString(document);

    Node original = SExpressionParser.parse(Fixtures.text(name));
    Node reparsed = SExpressionParser.parse(written);
    assertThat(
            NodeEquivalence.firstDifference(
                original, reparsed, NodeEquivalence.DEFAULT_TOLERANCE))
        .isEmpty();
    assertThat(document.getDiagnostics()).isEmpty();
    assertThat(written).endsWith(")\n");
  }

  @ParameterizedTest
  @MethodSource("fixtures")
  void writingTwiceIsStable(String name) throws Exception {
    Path path = Fixtures.path(name);
    KiCadFormat<KiCadDocument> format = formatFor(path);

    String first = format.writeToString(format.read(path));
    String second = format.writeToString(format.parse(first));

    assertThat(second).isEqualTo(first);
  }

  @ParameterizedTest
  @MethodSource("fixtures")
  void writesToFileAndReadsBack(String name, @TempDir Path dir) throws Exception {
    Path source = Fixtures.path(name);
    KiCadFormat<KiCadDocument> format = formatFor(source);
    Path target = dir.resolve(name);

    format.write(format.read(source), target);
    KiCadDocument copy = format.read(target);

    assertThat(
            NodeEquivalence.equivalent(
                SExpressionParser.parse(Fixtures.text(name)), format.toTree(copy)))
        .isTrue();
  }

  @ParameterizedTest
  @MethodSource("fixtures")
  void retainsSourceTreeWhenAsked(String name) throws Exception {
    Path path = Fixtures.path(name);
    KiCadFormat<? extends KiCadDocument> detected = KiCadFormat.detect(path);
    FormatOptions options = FormatOptions.defaults().withRetainSourceTree(true);
    KiCadFormat<? extends KiCadDocument> format;
    switch (detected.kind()) {
      case BOARD -> format = KiCadFormat.board(options);
      case FOOTPRINT -> format = KiCadFormat.footprint(options);
      case SCHEMATIC -> format = KiCadFormat.schematic(options);
      default -> format = KiCadFormat.symbolLibrary(options);
    }

    KiCadDocument document = format.read(path);

    assertThat(document.getSourceTree()).isEqualTo(SExpressionParser.parse(Fixtures.text(name)));
    assertThat(KiCadFormat.detect(path).read(path).getSourceTree()).isNull();
  }
}
