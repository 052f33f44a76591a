package io.kifmt.parser.impl.symbol;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.kifmt.parser.Fixtures;
import io.kifmt.parser.api.KiCadFormat;
import io.kifmt.parser.api.geom.ArcGeometry;
import io.kifmt.parser.api.model.Flag;
import io.kifmt.parser.api.model.GraphicArc;
import io.kifmt.parser.api.model.Property;
import io.kifmt.parser.api.symbol.LibSymbol;
import io.kifmt.parser.api.symbol.Pin;
import io.kifmt.parser.api.symbol.PinAlternate;
import io.kifmt.parser.api.symbol.PinOrientation;
import io.kifmt.parser.api.symbol.SymbolLibrary;
import io.kifmt.sexpr.Node;
import io.kifmt.sexpr.NodeEquivalence;
import io.kifmt.sexpr.SExpressionParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SymbolLibraryTest {
  private final KiCadFormat<SymbolLibrary> format = KiCadFormat.symbolLibrary();
  private SymbolLibrary lib;

  @BeforeEach
  void setUp() throws Exception {
    lib = format.read(Fixtures.path(Fixtures.SYMBOL_LIBRARY));
  }

  @Test
  void listsSymbolsInFileOrder() {
    assertThat(lib.names()).containsExactly("GND", "LED", "LED_Red");
    assertThat(lib.getGenerator()).isEqualTo("kicad_symbol_editor");
    assertThat(lib.isGeneratorIsSymbol()).isTrue();
    assertThat(lib.getDiagnostics()).isEmpty();
  }

  @Test
  void readsPowerSymbol() {
    LibSymbol gnd = lib.get("GND").orElseThrow();

    assertThat(gnd.isPower()).isTrue();
    assertThat(gnd.getPinNumbers().getHide()).isEqualTo(new Flag(true, Flag.Form.SYMBOL));
    assertThat(gnd.getPinNames().isHidden()).isTrue();
    assertThat(gnd.getPinNames().getOffset().isZero()).isTrue();
    assertThat(gnd.unitCount()).isEqualTo(1);

    Pin pin = gnd.allPins().get(0);
    assertThat(pin.getElectricalType()).isEqualTo("power_in");
    assertThat(pin.getHide()).isEqualTo(new Flag(true, Flag.Form.SYMBOL));
    assertThat(pin.orientation()).isEqualTo(PinOrientation.DOWN);
    assertThat(pin.getLength().isZero()).isTrue();
  }

  @Test
  void readsUnitsGraphicsAndAlternates() {
    LibSymbol led = lib.get("LED").orElseThrow();

    assertThat(led.isPower()).isFalse();
    assertThat(led.getUnits())
        .extracting(LibSymbol::getName)
        .containsExactly("LED_0_1", "LED_1_1");
    assertThat(LibSymbol.unitNumber("LED_1_1")).isEqualTo(1);
    LibSymbol body = led.getUnits().get(0);
    assertThat(body.getGraphics()).hasSize(4);
    assertThat(body.getTexts())
        .singleElement()
        .satisfies(t -> assertThat(t.getText()).isEqualTo("A"));

    ArcGeometry arc = ((GraphicArc) body.getGraphics().get(3)).geometry();
    assertThat(arc.center().xMm()).isCloseTo(-1.016, within(1e-5));
    assertThat(arc.center().yMm()).isCloseTo(1.778, within(1e-5));
    assertThat(arc.radius().toMm()).isCloseTo(0.508, within(1e-5));

    Pin cathode = led.allPins().get(0);
    assertThat(cathode.getName()).isEqualTo("K");
    assertThat(cathode.getAlternates())
        .containsExactly(new PinAlternate("CATHODE", "passive", "line"));
    assertThat(cathode.orientation()).isEqualTo(PinOrientation.RIGHT);
    assertThat(led.allPins().get(1).orientation()).isEqualTo(PinOrientation.LEFT);
    assertThat(led.getRawChildren()).extracting(Node::token).containsExactly("embedded_fonts");
  }

  @Test
  void readsDerivedSymbol() {
    LibSymbol red = lib.get("LED_Red").orElseThrow();

    assertThat(red.getExtendsName()).isEqualTo("LED");
    assertThat(red.getUnits()).isEmpty();
    assertThat(red.property("Value").map(Property::getValue)).contains("LED_Red");
  }

  @Test
  void addRejectsDuplicateName() {
    assertThatThrownBy(() -> lib.add(new LibSymbol("LED")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("LED");
    assertThat(lib.names()).hasSize(3);
  }

  @Test
  void addedAndRemovedSymbolsShowInOutput() throws Exception {
    LibSymbol blank = new LibSymbol("BLANK");
    lib.add(blank);
    assertThat(lib.remove("GND")).isTrue();
    assertThat(lib.remove("GND")).isFalse();

    SymbolLibrary reread = format.parse(format.writeToString(lib));

    assertThat(reread.names()).containsExactly("LED", "LED_Red", "BLANK");
    assertThat(reread.get("LED").map(s -> s.allPins().size())).contains(2);
  }

  @Test
  void untouchedSymbolsWriteBackUnchanged() throws Exception {
    Node source = SExpressionParser.parse(Fixtures.text(Fixtures.SYMBOL_LIBRARY));
    lib.get("LED").orElseThrow().getProperties().get(1).setValue("LED_Generic");

    Node written = format.toTree(lib);

    assertThat(written.children("symbol").get(0)).isEqualTo(source.children("symbol").get(0));
    assertThat(written.children("symbol").get(2)).isEqualTo(source.children("symbol").get(2));
    assertThat(NodeEquivalence.firstDifference(written, source, NodeEquivalence.DEFAULT_TOLERANCE))
        .hasValueSatisfying(d -> assertThat(d).contains("LED_Generic"));
  }
}
