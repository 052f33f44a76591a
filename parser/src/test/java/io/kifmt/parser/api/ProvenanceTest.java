package io.kifmt.parser.api;

import static org.assertj.core.api.Assertions.assertThat;

import io.kifmt.parser.Fixtures;
import io.kifmt.parser.api.model.Color;
import io.kifmt.parser.api.model.Flag;
import io.kifmt.parser.api.pcb.Board;
import io.kifmt.parser.api.pcb.Footprint;
import io.kifmt.parser.api.pcb.Pad;
import io.kifmt.parser.api.pcb.PcbText;
import io.kifmt.parser.api.symbol.SymbolLibrary;
import io.kifmt.sexpr.Node;
import io.kifmt.sexpr.SExpressionParser;
import org.junit.jupiter.api.Test;

/** Checks that the way a value was spelled survives a read and a write. */
class ProvenanceTest {
  private final KiCadFormat<Footprint> footprints = KiCadFormat.footprint();

  @Test
  void legacyModuleKeepsItsSpelling() throws Exception {
    Footprint fp = footprints.read(Fixtures.path(Fixtures.LEGACY_FOOTPRINT));

    assertThat(fp.isLegacy()).isTrue();
    assertThat(fp.getLocked()).isEqualTo(new Flag(true, Flag.Form.SYMBOL));
    assertThat(fp.getLocked().isChildNode()).isFalse();
    Pad pad = fp.getPads().get(0);
    assertThat(pad.getUuid().token()).isEqualTo("tstamp");
    assertThat(pad.getPosition().hasAngle()).isFalse();

    Node written = footprints.toTree(fp);
    assertThat(written.token()).isEqualTo("module");
    assertThat(written.hasSymbol("locked")).isTrue();
    assertThat(written.hasChild("locked")).isFalse();
    Node padNode = written.children("pad").get(0);
    assertThat(padNode.hasChild("tstamp")).isTrue();
    assertThat(padNode.hasChild("uuid")).isFalse();
    assertThat(padNode.child("at").orElseThrow().valueCount()).isEqualTo(2);
    assertThat(padNode.isQuoted(0)).isFalse();
  }

  @Test
  void lockedChildStaysChild() throws Exception {
    Footprint fp =
        footprints.parse("(footprint \"X\" (locked yes) (layer \"F.Cu\") (pad \"1\" smd rect"
            + " (at 0 0) (size 1 1) (layers \"F.Cu\") (locked no)))");

    assertThat(fp.getLocked()).isEqualTo(Flag.of(true));
    assertThat(fp.getPads().get(0).getLocked()).isEqualTo(Flag.of(false));

    Node written = footprints.toTree(fp);
    assertThat(written.hasSymbol("locked")).isFalse();
    assertThat(written.child("locked").flatMap(n -> n.bool(0))).contains(true);
    assertThat(written.child("pad").flatMap(p -> p.child("locked")).flatMap(n -> n.bool(0)))
        .contains(false);
  }

  @Test
  void hideKeepsEachOfItsForms() throws Exception {
    Footprint legacy = footprints.read(Fixtures.path(Fixtures.LEGACY_FOOTPRINT));
    PcbText value = legacy.getTexts().get(1);
    assertThat(value.getHide()).isEqualTo(new Flag(true, Flag.Form.SYMBOL));
    Node valueNode = footprints.toTree(legacy).children("fp_text").get(1);
    assertThat(valueNode.hasSymbol("hide")).isTrue();

    Footprint modern = footprints.read(Fixtures.path(Fixtures.MODERN_FOOTPRINT));
    assertThat(modern.property("Footprint").orElseThrow().getHide()).isEqualTo(Flag.of(true));
    Node property = footprints.toTree(modern).children("property").get(2);
    assertThat(property.hasSymbol("hide")).isFalse();
    assertThat(property.child("hide").flatMap(n -> n.bool(0))).contains(true);
  }

  @Test
  void generatorSymbolStaysBare() throws Exception {
    KiCadFormat<SymbolLibrary> format = KiCadFormat.symbolLibrary();
    SymbolLibrary library = format.read(Fixtures.path(Fixtures.SYMBOL_LIBRARY));

    assertThat(library.getGenerator()).isEqualTo("kicad_symbol_editor");
    assertThat(library.isGeneratorIsSymbol()).isTrue();
    Node generator = format.toTree(library).child("generator").orElseThrow();
    assertThat(generator.isSymbol(0)).isTrue();

    Footprint modern = footprints.read(Fixtures.path(Fixtures.MODERN_FOOTPRINT));
    assertThat(modern.isGeneratorIsSymbol()).isFalse();
    assertThat(footprints.toTree(modern).child("generator").orElseThrow().isQuoted(0)).isTrue();
  }

  @Test
  void missingAngleIsNotInvented() throws Exception {
    Footprint fp =
        footprints.parse(
            "(footprint \"X\" (layer \"F.Cu\") (fp_text reference \"R1\" (at 1 2) (layer"
                + " \"F.SilkS\")) (fp_text value \"10k\" (at 1 3 0) (layer \"F.Fab\")))");

    Node written = footprints.toTree(fp);

    assertThat(written.children("fp_text").get(0).child("at").orElseThrow().valueCount())
        .isEqualTo(2);
    assertThat(written.children("fp_text").get(1).child("at").orElseThrow().valueCount())
        .isEqualTo(3);
  }

  @Test
  void unmodifiedChildOrderIsKept() throws Exception {
    String text =
        "(footprint \"X\" (layer \"F.Cu\") (pad \"1\" smd rect (uuid \"u1\") (layers \"F.Cu\")"
            + " (size 1 1) (at 0 0)))";
    Footprint fp = footprints.parse(text);

    assertThat(footprints.toTree(fp)).isEqualTo(SExpressionParser.parse(text));
  }

  @Test
  void editedValueKeepsSurroundingLayout() throws Exception {
    Footprint fp = footprints.read(Fixtures.path(Fixtures.MODERN_FOOTPRINT));
    fp.property("Reference").orElseThrow().setValue("U7");

    Footprint reread = footprints.parse(footprints.writeToString(fp));

    assertThat(reread.reference()).contains("U7");
    assertThat(reread.getPads()).hasSize(3);
    assertThat(reread.getDiagnostics()).isEmpty();
  }

  @Test
  void emptyLayerListIsWrittenBack() throws Exception {
    String text =
        "(footprint \"X\" (pad \"\" np_thru_hole circle (at 0 0) (size 1 1) (layers)))";
    Footprint fp = footprints.parse(text);

    assertThat(fp.getPads().get(0).getLayers()).isEmpty();
    assertThat(footprints.toTree(fp)).isEqualTo(SExpressionParser.parse(text));

    String board =
        "(kicad_pcb (version 20240108) (via (at 2 2) (size 0.6) (drill 0.3) (layers) (net 0)))";
    KiCadFormat<Board> boards = KiCadFormat.board();
    assertThat(boards.toTree(boards.parse(board))).isEqualTo(SExpressionParser.parse(board));
  }

  @Test
  void quotingIsKeptForEachLayer() throws Exception {
    String text =
        "(footprint \"X\" (pad \"1\" smd rect (at 0 0) (size 1 1) (layers \"F.Cu\" F.Mask)))";
    Footprint fp = footprints.parse(text);

    assertThat(fp.getPads().get(0).getLayers()).containsExactly("F.Cu", "F.Mask");
    Node layers = footprints.toTree(fp).child("pad").flatMap(p -> p.child("layers")).orElseThrow();
    assertThat(layers.isQuoted(0)).isTrue();
    assertThat(layers.isQuoted(1)).isFalse();
  }

  @Test
  void flagWordsKeepTheirOrder() throws Exception {
    String text = "(footprint \"X\" placed locked (layer \"F.Cu\"))";
    Footprint fp = footprints.parse(text);

    assertThat(fp.getPlaced()).isEqualTo(new Flag(true, Flag.Form.SYMBOL));
    assertThat(footprints.toTree(fp)).isEqualTo(SExpressionParser.parse(text));

    String board =
        "(kicad_pcb (version 20240108) (via locked blind (at 1 1) (size 0.6) (drill 0.3)"
            + " (layers \"F.Cu\" \"In1.Cu\") (net 0)))";
    KiCadFormat<Board> boards = KiCadFormat.board();
    Board parsed = boards.parse(board);
    assertThat(parsed.getVias().get(0).getTypeToken()).isEqualTo("blind");
    assertThat(boards.toTree(parsed)).isEqualTo(SExpressionParser.parse(board));
  }

  @Test
  void colorWithoutAlphaIsReadAndKeptShort() throws Exception {
    String text =
        "(footprint \"X\" (fp_line (start 0 0) (end 1 0)"
            + " (stroke (width 0.1) (type solid) (color 255 0 0)) (layer \"F.SilkS\")))";
    Footprint fp = footprints.parse(text);

    assertThat(fp.getDiagnostics()).isEmpty();
    assertThat(fp.getGraphics().get(0).getStroke().getColor()).isEqualTo(Color.rgb(255, 0, 0));
    assertThat(footprints.toTree(fp)).isEqualTo(SExpressionParser.parse(text));

    fp.getGraphics().get(0).getStroke().setColor(new Color(0, 0, 255, 0.5));
    Node color =
        footprints.toTree(fp).child("fp_line").flatMap(n -> n.child("stroke"))
            .flatMap(n -> n.child("color")).orElseThrow();
    assertThat(color.valueCount()).isEqualTo(4);
  }
}
