package io.kifmt.parser.internal_api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.kifmt.parser.api.FormatOptions;
import io.kifmt.parser.api.Severity;
import io.kifmt.parser.api.model.Flag;
import io.kifmt.parser.api.model.Property;
import io.kifmt.sexpr.Node;
import io.kifmt.sexpr.SExpressionParser;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NodeCursorTest {
  private ReadContext ctx;

  @BeforeEach
  void setUp() {
    ctx = new ReadContext(FormatOptions.defaults());
  }

  private NodeCursor cursor(String text) throws Exception {
    return NodeCursor.of(SExpressionParser.parse(text), ctx);
  }

  @Test
  void leftoversBecomeRawWithWarnings() throws Exception {
    NodeCursor c = cursor("(property \"A\" \"B\" extra (layer \"F.Cu\") (mystery 1) (quiet 2))");
    Property p = new Property(c.requireText(0, "name"), c.requireText(1, "value"));
    c.childText("layer").ifPresent(p::setLayer);

    c.finish(p, Set.of("quiet"));

    assertThat(p.getLayer()).isEqualTo("F.Cu");
    assertThat(p.getSourceOrder()).containsExactly("layer", "mystery", "quiet");
    assertThat(p.getRawChildren()).extracting(Node::token).containsExactly("mystery", "quiet");
    assertThat(p.getRawValues()).extracting(v -> v.text()).containsExactly("extra");
    assertThat(ctx.diagnostics())
        .singleElement()
        .satisfies(
            d -> {
              assertThat(d.severity()).isEqualTo(Severity.WARNING);
              assertThat(d.message()).contains("Unknown token 'mystery'");
            });
  }

  @Test
  void childOfUnexpectedShapeStaysUnused() throws Exception {
    NodeCursor c = cursor("(property \"A\" \"B\" (layer \"F.Cu\" \"B.Cu\"))");
    Property p = new Property("A", "B");
    c.text(0);
    c.text(1);

    assertThat(c.childText("layer")).isEmpty();
    c.finish(p);

    assertThat(p.getRawChildren()).hasSize(1);
    assertThat(ctx.diagnostics().get(0).message()).startsWith("Unsupported form of 'layer'");
  }

  @Test
  void flagSpellings() throws Exception {
    assertThat(cursor("(x hide)").flag("hide")).isEqualTo(new Flag(true, Flag.Form.SYMBOL));
    assertThat(cursor("(x (hide yes))").flag("hide")).isEqualTo(new Flag(true, Flag.Form.CHILD));
    assertThat(cursor("(x (hide no))").flag("hide")).isEqualTo(new Flag(false, Flag.Form.CHILD));
    assertThat(cursor("(x (hide))").flag("hide")).isEqualTo(new Flag(true, Flag.Form.MARKER));
    assertThat(cursor("(x (hide maybe))").flag("hide")).isNull();
    assertThat(cursor("(x)").flag("hide")).isNull();
  }

  @Test
  void bareTextIsRemembered() throws Exception {
    NodeCursor c = cursor("(fp_text reference REF** (layer F.SilkS))");
    Property p = new Property("x", "y");

    assertThat(c.text(1)).contains("REF**");
    assertThat(c.childText("layer")).contains("F.SilkS");
    c.text(0);
    c.finish(p);

    assertThat(p.isBare("@0")).isTrue();
    assertThat(p.isBare("@1")).isTrue();
    assertThat(p.isBare("layer")).isTrue();
    assertThat(ctx.diagnostics()).isEmpty();
  }

  @Test
  void malformedPositionThrows() throws Exception {
    NodeCursor c = cursor("(pad \"1\" (at 1))");

    assertThatThrownBy(c::position)
        .isInstanceOf(ElementFormatException.class)
        .hasMessageContaining("(at)");
  }

  @Test
  void positionKeepsWhetherAngleWasWritten() throws Exception {
    assertThat(cursor("(t (at 1 2))").position().orElseThrow().hasAngle()).isFalse();
    assertThat(cursor("(t (at 1 2 0))").position().orElseThrow().hasAngle()).isTrue();
    assertThat(cursor("(t (at 1 2 unlocked))").position().orElseThrow().unlocked()).isTrue();
  }

  @Test
  void legacyTimestampIsAUuid() throws Exception {
    NodeCursor c = cursor("(pad (tstamp 5F68FEEF))");

    assertThat(c.uuid())
        .hasValueSatisfying(
            u -> {
              assertThat(u.value()).isEqualTo("5F68FEEF");
              assertThat(u.isLegacy()).isTrue();
              assertThat(u.bare()).isTrue();
            });
  }
}
