package io.kifmt.parser.internal_api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.kifmt.parser.api.FormatOptions;
import io.kifmt.parser.api.model.Color;
import io.kifmt.parser.api.model.Fill;
import io.kifmt.parser.api.model.Flag;
import io.kifmt.parser.api.model.Stroke;
import io.kifmt.parser.api.model.TextEffects;
import io.kifmt.sexpr.Node;
import io.kifmt.sexpr.SExpressionParser;
import org.junit.jupiter.api.Test;

class DecodersTest {
  private final ReadContext ctx = new ReadContext(FormatOptions.defaults());

  @Test
  void strokeWithColor() throws Exception {
    Node source = SExpressionParser.parse("(stroke (width 0.254) (type dash) (color 255 0 0 1))");
    Stroke stroke = Decoders.stroke(source, ctx);

    assertThat(stroke.getWidth().toMm()).isCloseTo(0.254, within(1e-6));
    assertThat(stroke.getType()).isEqualTo("dash");
    assertThat(stroke.getColor()).isEqualTo(Color.rgb(255, 0, 0));
    assertThat(Encoders.stroke(stroke)).isEqualTo(source);
  }

  @Test
  void fillKeepsItsDialect() throws Exception {
    Fill schematic = Decoders.fill(SExpressionParser.parse("(fill (type background))"), ctx);
    Fill pcb = Decoders.fill(SExpressionParser.parse("(fill solid)"), ctx);

    assertThat(schematic.getForm()).isEqualTo(Fill.Form.TYPE_CHILD);
    assertThat(schematic.getType()).isEqualTo("background");
    assertThat(pcb.getForm()).isEqualTo(Fill.Form.VALUE);
    assertThat(pcb.isFilled()).isTrue();
    assertThat(Encoders.fill(pcb)).isEqualTo(SExpressionParser.parse("(fill solid)"));
    assertThat(Encoders.fill(schematic))
        .isEqualTo(SExpressionParser.parse("(fill (type background))"));
  }

  @Test
  void effectsHideForms() throws Exception {
    TextEffects bare =
        Decoders.effects(SExpressionParser.parse("(effects (font (size 1 1)) hide)"), ctx);
    TextEffects child =
        Decoders.effects(SExpressionParser.parse("(effects (font (size 1 1)) (hide yes))"), ctx);

    assertThat(bare.getHide()).isEqualTo(new Flag(true, Flag.Form.SYMBOL));
    assertThat(child.getHide()).isEqualTo(new Flag(true, Flag.Form.CHILD));
    assertThat(bare.isHidden()).isTrue();
    assertThat(child.isHidden()).isTrue();
  }

  @Test
  void fontAndJustify() throws Exception {
    TextEffects effects =
        Decoders.effects(
            SExpressionParser.parse(
                "(effects (font (face \"KiCad Font\") (size 1.5 1.2) (thickness 0.3) bold)"
                    + " (justify left bottom))"),
            ctx);

    assertThat(effects.getFont().getFace()).isEqualTo("KiCad Font");
    assertThat(effects.getFont().getHeight().toMm()).isCloseTo(1.5, within(1e-6));
    assertThat(effects.getFont().getWidth().toMm()).isCloseTo(1.2, within(1e-6));
    assertThat(effects.getFont().getBold()).isEqualTo(new Flag(true, Flag.Form.SYMBOL));
    assertThat(effects.getJustify()).containsExactly("left", "bottom");
    assertThat(ctx.diagnostics()).isEmpty();
  }

  @Test
  void colorChannelsAreCheckedAndClamped() throws Exception {
    assertThat(Decoders.color(SExpressionParser.parse("(color 10 20 30)")))
        .contains(new Color(10, 20, 30, 1));
    assertThat(Decoders.color(SExpressionParser.parse("(color 0 0 0 0.5)")))
        .hasValueSatisfying(c -> assertThat(c.alpha()).isEqualTo(0.5));
    assertThat(Decoders.color(SExpressionParser.parse("(color 300 0 0 1)"))).isEmpty();
    assertThat(Decoders.color(SExpressionParser.parse("(color 1 2)"))).isEmpty();

    Color clamped = new Color(300, -5, 10, 2);
    assertThat(clamped.red()).isEqualTo(255);
    assertThat(clamped.green()).isZero();
    assertThat(clamped.alpha()).isEqualTo(1.0);
    assertThat(Color.UNSET.isUnset()).isTrue();
  }

  @Test
  void pointsRejectMixedLists() throws Exception {
    Node plain = SExpressionParser.parse("(pts (xy 0 0) (xy 1 1))");
    Node mixed = SExpressionParser.parse("(pts (xy 0 0) (arc (start 0 0) (mid 1 1) (end 2 0)))");

    assertThat(Decoders.points(plain)).hasValueSatisfying(p -> assertThat(p).hasSize(2));
    assertThat(Decoders.points(mixed)).isEmpty();
  }
}
