package io.kifmt.sexpr;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class NodeTest {

  @Test
  void equalityIgnoresNumberSpelling() throws Exception {
    Node a = SExpressionParser.parse("(at 1.0 2)");
    Node b = SExpressionParser.parse("(at 1 2.000)");
    assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
  }

  @Test
  void quotedAndBareAreDifferent() throws Exception {
    Node a = SExpressionParser.parse("(layer \"F.Cu\")");
    Node b = SExpressionParser.parse("(layer F.Cu)");
    assertThat(a).isNotEqualTo(b);
    assertThat(a.string(0)).isEqualTo(b.string(0));
  }

  @Test
  void accessorsAreOptional() throws Exception {
    Node node = SExpressionParser.parse("(x 1 yes maybe \"s\" (y) (y 2) (z))");
    assertThat(node.number(0)).hasValue(1.0);
    assertThat(node.number(1)).isEmpty();
    assertThat(node.number(7)).isEmpty();
    assertThat(node.string(0)).isEmpty();
    assertThat(node.text(0)).contains("1");
    assertThat(node.bool(1)).contains(true);
    assertThat(node.bool(2)).isEmpty();
    assertThat(node.hasSymbol("maybe")).isTrue();
    assertThat(node.hasSymbol("s")).isFalse();
    assertThat(node.children("y")).hasSize(2);
    assertThat(node.child("y").orElseThrow().valueCount()).isZero();
    assertThat(node.child("missing")).isEmpty();
    assertThat(node.scalar(-1)).isEmpty();
  }

  @Test
  void isImmutable() {
    Node node = Node.builder("a").number(1).build();
    assertThatThrownBy(() -> node.values().add(NumberValue.of(2)))
        .isInstanceOf(UnsupportedOperationException.class);
    assertThatThrownBy(() -> node.children().add(node))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void builderRoundTrip() {
    Node node =
        Node.builder("pad")
            .string("1")
            .symbol("smd")
            .bool(true)
            .integer(3)
            .emptyChild("locked")
            .build();
    Node copy = node.toBuilder().build();
    assertThat(copy).isEqualTo(node);
    assertThat(copy.toString()).isEqualTo("(pad \"1\" smd yes 3\n  (locked)\n)");
  }

  @Test
  void drainChildrenEmptiesBuilder() {
    Node.Builder b = Node.builder("a").emptyChild("b").emptyChild("c");
    List<Node> drained = b.drainChildren();
    assertThat(drained).extracting(Node::token).containsExactly("b", "c");
    assertThat(b.currentChildren()).isEmpty();
  }

  @Test
  void rejectsEmptyToken() {
    assertThatThrownBy(() -> Node.builder("")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new SymbolValue("")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rejectsNonFiniteNumbers() {
    assertThatThrownBy(() -> NumberValue.of(Double.NaN))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
