package io.kifmt.sexpr;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

class RoundTripPropertiesTest {

  @Property(tries = 300)
  void writeThenParseIsIdentity(@ForAll("trees") Node tree) throws Exception {
    String text = SExpressionWriter.canonical().write(tree);
    assertThat(SExpressionParser.parse(text)).isEqualTo(tree);
  }

  @Property(tries = 300)
  void rewritingIsStable(@ForAll("trees") Node tree) throws Exception {
    SExpressionWriter writer = SExpressionWriter.canonical();
    String once = writer.write(tree);
    String twice = writer.write(SExpressionParser.parse(once));
    assertThat(twice).isEqualTo(once);
  }

  @Property
  void formattedNumbersReparseWithinTolerance(
      @ForAll("coordinates") double value) throws Exception {
    Node node = Node.builder("v").number(value).build();
    String text = SExpressionWriter.builder().preserveNumberText(false).build().write(node);
    double back = SExpressionParser.parse(text).number(0).getAsDouble();
    assertThat(NodeEquivalence.numbersMatch(value, back, NodeEquivalence.DEFAULT_TOLERANCE))
        .isTrue();
  }

  @Provide
  Arbitrary<Double> coordinates() {
    return Arbitraries.doubles().between(-10_000, 10_000);
  }

  @Provide
  Arbitrary<Node> trees() {
    return Arbitraries.lazyOf(this::leaf, this::leaf, this::branch);
  }

  private Arbitrary<Node> leaf() {
    return Combinators.combine(tokens(), scalars().list().ofMaxSize(4))
        .as((t, v) -> Node.of(t, v, List.of()));
  }

  private Arbitrary<Node> branch() {
    return Combinators.combine(
            tokens(), scalars().list().ofMaxSize(3), trees().list().ofMinSize(1).ofMaxSize(4))
        .as(Node::of);
  }

  private Arbitrary<String> tokens() {
    return Arbitraries.of("at", "layer", "pad", "fill", "stroke", "effects", "uuid", "xy");
  }

  private Arbitrary<ScalarValue> scalars() {
    Arbitrary<ScalarValue> numbers =
        Arbitraries.doubles()
            .between(-1000, 1000)
            .ofScale(4)
            .map(d -> (ScalarValue) NumberValue.of(d));
    Arbitrary<ScalarValue> strings =
        Arbitraries.strings().withCharRange(' ', '~').withChars('\n', '\t').ofMaxLength(12)
            .map(StringValue::new);
    Arbitrary<ScalarValue> symbols =
        Arbitraries.of("yes", "no", "smd", "rect", "F.Cu", "*.Mask", "hide", "solid")
            .map(SymbolValue::new);
    return Arbitraries.oneOf(numbers, strings, symbols);
  }
}
