package io.kifmt.sexpr;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class NodeEquivalenceTest {

  @Test
  void toleratesSmallNumericDrift() throws Exception {
    Node a = SExpressionParser.parse("(at 1.2700001 0)");
    Node b = SExpressionParser.parse("(at 1.27 0)");
    assertThat(a).isNotEqualTo(b);
    assertThat(NodeEquivalence.equivalent(a, b)).isTrue();
  }

  @Test
  void usesRelativeToleranceForLargeValues() {
    assertThat(NodeEquivalence.numbersMatch(1_000_000, 1_000_001, 5e-6)).isTrue();
    assertThat(NodeEquivalence.numbersMatch(1, 1.001, 5e-6)).isFalse();
  }

  @Test
  void reportsPathOfFirstDifference() throws Exception {
    Node a = SExpressionParser.parse("(a (b 1) (c (d x)))");
    Node b = SExpressionParser.parse("(a (b 1) (c (d y)))");
    assertThat(NodeEquivalence.firstDifference(a, b, 1e-6))
        .hasValueSatisfying(
            d -> {
              assertThat(d).startsWith("a/c[1]/d[0]");
              assertThat(d).contains("x").contains("y");
            });
  }

  @Test
  void detectsStructuralDifferences() throws Exception {
    Node a = SExpressionParser.parse("(a (b) (c))");
    assertThat(NodeEquivalence.equivalent(a, SExpressionParser.parse("(a (c) (b))"))).isFalse();
    assertThat(NodeEquivalence.equivalent(a, SExpressionParser.parse("(a (b))"))).isFalse();
    assertThat(NodeEquivalence.equivalent(a, SExpressionParser.parse("(a x (b) (c))"))).isFalse();
    assertThat(NodeEquivalence.equivalent(a, SExpressionParser.parse("(z (b) (c))"))).isFalse();
  }

  @Test
  void numberAndSymbolNeverMatch() throws Exception {
    Node a = SExpressionParser.parse("(pad 1)");
    Node b = SExpressionParser.parse("(pad \"1\")");
    assertThat(NodeEquivalence.equivalent(a, b)).isFalse();
  }
}
