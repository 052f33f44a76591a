package io.kifmt.parser.impl.pcb;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.kifmt.parser.Fixtures;
import io.kifmt.parser.api.KiCadFileException;
import io.kifmt.parser.api.KiCadFormat;
import io.kifmt.parser.api.model.Graphic;
import io.kifmt.parser.api.pcb.Board;
import io.kifmt.parser.api.pcb.Footprint;
import io.kifmt.parser.api.pcb.LayerDefinition;
import io.kifmt.parser.api.pcb.Net;
import io.kifmt.parser.api.pcb.Pad;
import io.kifmt.parser.api.pcb.Track;
import io.kifmt.parser.api.pcb.TrackArc;
import io.kifmt.parser.api.pcb.Via;
import io.kifmt.parser.api.pcb.ViaType;
import io.kifmt.parser.api.pcb.Zone;
import io.kifmt.sexpr.Node;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BoardReaderTest {
  private final KiCadFormat<Board> format = KiCadFormat.board();
  private Board board;

  @BeforeEach
  void setUp() throws Exception {
    board = format.read(Fixtures.path(Fixtures.BOARD));
  }

  @Test
  void readsHeaderAndLayers() {
    assertThat(board.getVersion()).isEqualTo(20240108);
    assertThat(board.getPaper().getSize()).isEqualTo("A4");
    assertThat(board.getTitleBlock().getTitle()).isEqualTo("Demo board");
    assertThat(board.getLayers())
        .extracting(LayerDefinition::getName)
        .containsExactly("F.Cu", "B.Cu", "B.SilkS", "F.SilkS", "Edge.Cuts");
    LayerDefinition silk = board.getLayers().get(2);
    assertThat(silk.getOrdinal()).isEqualTo(36);
    assertThat(silk.getType()).isEqualTo("user");
    assertThat(silk.getUserName()).isEqualTo("B.Silkscreen");
    assertThat(board.getLayers().get(0).getUserName()).isNull();
    assertThat(board.getDiagnostics()).isEmpty();
  }

  @Test
  void readsNetsAndPadNets() {
    assertThat(board.getNets()).extracting(Net::getName).containsExactly("", "GND", "VCC");
    assertThat(board.net(1)).map(Net::getName).contains("GND");
    assertThat(board.net(7)).isEmpty();

    Footprint r1 = board.footprintByReference("R1").orElseThrow();
    assertThat(r1.getName()).isEqualTo("Resistor_SMD:R_0805_2012Metric");
    assertThat(r1.value()).contains("10k");
    assertThat(r1.getPosition().angle()).isEqualTo(90);
    assertThat(r1.getSheetFile()).isEqualTo("demo.kicad_sch");
    assertThat(r1.getPads()).extracting(Pad::getNetName).containsExactly("VCC", "GND");
    assertThat(r1.getPads()).extracting(Pad::getNetNumber).containsExactly(2, 1);
    assertThat(board.allPads()).hasSize(2);
    assertThat(board.footprintByReference("R2")).isEmpty();
  }

  @Test
  void readsRouting() {
    Track segment = board.getTracks().get(0);
    assertThat(segment.getWidth().toMm()).isCloseTo(0.25, within(1e-6));
    assertThat(segment.getLayer()).isEqualTo("F.Cu");
    assertThat(segment.getNet()).isEqualTo(2);
    assertThat(segment.getEnd().xMm()).isCloseTo(110, within(1e-6));

    TrackArc arc = board.getArcs().get(0);
    assertThat(arc.geometry().radius().toMm()).isCloseTo(2.5, within(1e-5));
    assertThat(arc.geometry().center().xMm()).isCloseTo(107.5, within(1e-5));
    assertThat(arc.geometry().center().yMm()).isCloseTo(79.0875, within(1e-5));

    Via via = board.getVias().get(0);
    assertThat(via.getType()).isEqualTo(ViaType.THROUGH);
    assertThat(via.getDrill().toMm()).isCloseTo(0.3, within(1e-6));
    assertThat(via.getLayers()).containsExactly("F.Cu", "B.Cu");
  }

  @Test
  void readsZone() {
    Zone zone = board.getZones().get(0);
    assertThat(zone.getNet()).isEqualTo(1);
    assertThat(zone.getNetName()).isEqualTo("GND");
    assertThat(zone.getLayers()).containsExactly("B.Cu");
    assertThat(zone.isMultiLayer()).isFalse();
    assertThat(zone.getHatchStyle()).isEqualTo("edge");
    assertThat(zone.getHatchPitch().toMm()).isCloseTo(0.5, within(1e-6));
    assertThat(zone.getFill().getFilled()).isTrue();
    assertThat(zone.getFill().getThermalGap().toMm()).isCloseTo(0.5, within(1e-6));
    assertThat(zone.getOutlines())
        .singleElement()
        .satisfies(p -> assertThat(p.getPoints()).hasSize(4));
    assertThat(zone.getRawChildren())
        .extracting(Node::token)
        .containsExactly("connect_pads", "filled_areas_thickness");
  }

  @Test
  void readsBoardGraphicsAndText() {
    assertThat(board.getGraphics()).extracting(Graphic::getToken).containsExactly("gr_rect");
    assertThat(board.getTexts())
        .singleElement()
        .satisfies(t -> assertThat(t.getText()).isEqualTo("Demo"));
  }

  @Test
  void badLayerEntryIsDropped() throws Exception {
    Board b =
        format.parse(
            "(kicad_pcb (version 20240108) (layers (0 \"F.Cu\" signal) (x \"Bad\" user)"
                + " (31 \"B.Cu\" signal)))");

    assertThat(b.getLayers()).extracting(LayerDefinition::getOrdinal).containsExactly(0, 31);
    assertThat(b.getErrors())
        .singleElement()
        .satisfies(
            d -> {
              assertThat(d.message()).contains("Layer ordinal is not a number: x");
              assertThat(d.context()).isEqualTo("layers > x");
            });
  }

  @Test
  void footprintFileRootIsRejectedAsBoard() {
    assertThatThrownBy(() -> format.parse("(footprint \"X\" (layer \"F.Cu\"))"))
        .isInstanceOf(KiCadFileException.class)
        .hasMessageContaining("kicad_pcb");
  }
}
