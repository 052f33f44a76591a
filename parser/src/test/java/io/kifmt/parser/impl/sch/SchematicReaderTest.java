package io.kifmt.parser.impl.sch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.kifmt.parser.Fixtures;
import io.kifmt.parser.api.KiCadFormat;
import io.kifmt.parser.api.model.Property;
import io.kifmt.parser.api.sch.Junction;
import io.kifmt.parser.api.sch.Label;
import io.kifmt.parser.api.sch.PlacedPin;
import io.kifmt.parser.api.sch.PlacedSymbol;
import io.kifmt.parser.api.sch.Schematic;
import io.kifmt.parser.api.sch.Sheet;
import io.kifmt.parser.api.sch.SheetPin;
import io.kifmt.parser.api.sch.Wire;
import io.kifmt.parser.api.symbol.LibSymbol;
import io.kifmt.parser.api.symbol.Pin;
import io.kifmt.sexpr.Node;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SchematicReaderTest {
  private final KiCadFormat<Schematic> format = KiCadFormat.schematic();
  private Schematic sch;

  @BeforeEach
  void setUp() throws Exception {
    sch = format.read(Fixtures.path(Fixtures.SCHEMATIC));
  }

  @Test
  void readsHeader() {
    assertThat(sch.getVersion()).isEqualTo(20231120);
    assertThat(sch.getGenerator()).isEqualTo("eeschema");
    assertThat(sch.isGeneratorIsSymbol()).isFalse();
    assertThat(sch.getUuid().value()).isEqualTo("4a9d2c1e-7b3f-4e5a-8c6d-1f2e3a4b5c6d");
    assertThat(sch.getTitleBlock().getRevision()).isEqualTo("1");
    assertThat(sch.getDiagnostics()).isEmpty();
  }

  @Test
  void readsEmbeddedLibrarySymbols() {
    LibSymbol r = sch.getLibSymbols().get("Device:R").orElseThrow();

    assertThat(sch.getLibSymbols().names()).containsExactly("Device:R");
    assertThat(r.getUnits()).hasSize(2);
    assertThat(r.allPins()).extracting(Pin::getNumber).containsExactly("1", "2");
    assertThat(r.property("Footprint").map(Property::isHidden)).contains(true);
  }

  @Test
  void readsConnectivity() {
    assertThat(sch.getWires()).hasSize(2);
    Wire first = sch.getWires().get(0);
    assertThat(first.isBus()).isFalse();
    assertThat(first.getPoints()).hasSize(2);
    assertThat(first.getPoints().get(1).yMm()).isCloseTo(67.31, within(1e-6));

    Junction junction = sch.getJunctions().get(0);
    assertThat(junction.getPosition().xMm()).isCloseTo(127, within(1e-6));
    assertThat(junction.getDiameter().isZero()).isTrue();
    assertThat(sch.getNoConnects()).hasSize(1);
  }

  @Test
  void readsLabelsAndText() {
    assertThat(sch.getLabels()).extracting(Label::getText).containsExactly("SIG", "VCC");
    Label global = sch.getLabels().get(1);
    assertThat(global.isGlobal()).isTrue();
    assertThat(global.getShape()).isEqualTo("input");
    assertThat(global.getProperties())
        .extracting(Property::getName)
        .containsExactly("Intersheetrefs");
    assertThat(sch.getLabels().get(0).isGlobal()).isFalse();

    assertThat(sch.getTexts())
        .singleElement()
        .satisfies(t -> assertThat(t.getText()).isEqualTo("Pull-down"));
  }

  @Test
  void readsPlacedSymbol() {
    PlacedSymbol r1 = sch.getSymbols().get(0);

    assertThat(r1.getLibId()).isEqualTo("Device:R");
    assertThat(r1.librarySymbolName()).isEqualTo("Device:R");
    assertThat(r1.reference()).contains("R1");
    assertThat(r1.getUnit()).isEqualTo(1);
    assertThat(r1.getInBom()).isTrue();
    assertThat(r1.getDnp()).isFalse();
    assertThat(r1.getPins()).extracting(PlacedPin::getNumber).containsExactly("1", "2");
    assertThat(r1.getRawChildren()).extracting(Node::token).containsExactly("instances");
  }

  @Test
  void readsSheet() {
    Sheet sheet = sch.getSheets().get(0);

    assertThat(sheet.sheetName()).contains("Power");
    assertThat(sheet.sheetFile()).contains("power.kicad_sch");
    assertThat(sheet.getSize().xMm()).isCloseTo(25.4, within(1e-6));
    SheetPin pin = sheet.getPins().get(0);
    assertThat(pin.getName()).isEqualTo("EN");
    assertThat(pin.getShape()).isEqualTo("input");
    assertThat(pin.getPosition().angle()).isEqualTo(180);
  }

  @Test
  void keepsSheetInstancesVerbatim() {
    assertThat(sch.getRawChildren()).extracting(Node::token).containsExactly("sheet_instances");
    assertThat(format.toTree(sch).child("sheet_instances"))
        .contains(sch.getRawChildren().get(0));
  }

  @Test
  void symbolWithoutLibIdIsDropped() throws Exception {
    Schematic s =
        format.parse(
            "(kicad_sch (version 20231120) (symbol (at 0 0 0) (uuid \"a\"))"
                + " (junction (at 1 1) (uuid \"b\")))");

    assertThat(s.getSymbols()).isEmpty();
    assertThat(s.getJunctions()).hasSize(1);
    assertThat(s.getErrors())
        .singleElement()
        .satisfies(d -> assertThat(d.context()).isEqualTo("symbol a"));
  }

  @Test
  void polylineOnSheetLevelIsAWire() throws Exception {
    Schematic s =
        format.parse(
            "(kicad_sch (version 20231120) (polyline (pts (xy 0 0) (xy 1 0) (xy 1 1))"
                + " (stroke (width 0) (type dash)) (uuid \"c\")))");

    assertThat(s.getWires())
        .singleElement()
        .satisfies(
            w -> {
              assertThat(w.getToken()).isEqualTo("polyline");
              assertThat(w.getPoints()).hasSize(3);
            });
    assertThat(s.getGraphics()).isEmpty();
  }
}
