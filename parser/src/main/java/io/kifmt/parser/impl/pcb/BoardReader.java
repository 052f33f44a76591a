package io.kifmt.parser.impl.pcb;

import io.kifmt.parser.api.DocumentKind;
import io.kifmt.parser.api.KiCadFileException;
import io.kifmt.parser.api.pcb.Board;
import io.kifmt.parser.api.pcb.LayerDefinition;
import io.kifmt.parser.api.pcb.Net;
import io.kifmt.parser.api.pcb.NetClass;
import io.kifmt.parser.api.pcb.Track;
import io.kifmt.parser.api.pcb.TrackArc;
import io.kifmt.parser.api.pcb.Via;
import io.kifmt.parser.impl.DocumentReader;
import io.kifmt.parser.impl.GraphicReader;
import io.kifmt.parser.impl.Headers;
import io.kifmt.parser.internal_api.DispatchTable;
import io.kifmt.parser.internal_api.ElementFormatException;
import io.kifmt.parser.internal_api.NodeCursor;
import io.kifmt.parser.internal_api.ReadContext;
import io.kifmt.sexpr.Node;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads {@code .kicad_pcb} files.
 *
 * <p>Board setup, plot parameters, groups, dimensions and generated items are kept verbatim.
 */
public final class BoardReader implements DocumentReader<Board> {
  private static final Logger log = LoggerFactory.getLogger(BoardReader.class);

  /** Newest {@code kicad_pcb} format version this reader was written for. */
  public static final int MAX_VERSION = 20250114;

  private static final List<String> VIA_TYPES = List.of("blind", "buried", "micro");

  private static final Set<String> VIA_RAW =
      Set.of(
          "remove_unused_layers",
          "keep_end_layers",
          "zone_layer_connections",
          "teardrops",
          "tenting",
          "padstack",
          "capping",
          "covering",
          "plugging",
          "filling",
          "backdrill",
          "status");

  private static final Set<String> NET_CLASS_RAW =
      Set.of(
          "clearance",
          "trace_width",
          "via_dia",
          "via_drill",
          "uvia_dia",
          "uvia_drill",
          "diff_pair_width",
          "diff_pair_gap");

  private static final DispatchTable<Board> TABLE = table();

  private static DispatchTable<Board> table() {
    DispatchTable<Board> table =
        new DispatchTable<Board>()
            .on("net", BoardReader::net, (b, n) -> b.getNets().add(n))
            .on("net_class", BoardReader::netClass, (b, nc) -> b.getNetClasses().add(nc))
            .on(
                Set.of("footprint", "module"),
                FootprintReader::readFootprint,
                (b, fp) -> b.getFootprints().add(fp))
            .on("gr_text", PcbTextReader::read, (b, t) -> b.getTexts().add(t))
            .on("segment", BoardReader::track, (b, t) -> b.getTracks().add(t))
            .on("arc", BoardReader::arc, (b, a) -> b.getArcs().add(a))
            .on("via", BoardReader::via, (b, v) -> b.getVias().add(v))
            .on("zone", ZoneReader::read, (b, z) -> b.getZones().add(z))
            .raw(
                "general",
                "setup",
                "property",
                "group",
                "generated",
                "embedded_fonts",
                "embedded_files",
                "dimension",
                "target",
                "image",
                "gr_text_box",
                "table");
    return GraphicReader.registerBoardShapes(table, "gr_", (b, g) -> b.getGraphics().add(g));
  }

  @Override
  public Board read(Node root, ReadContext ctx) throws KiCadFileException {
    Headers.checkRoot(root, DocumentKind.BOARD, ctx);
    NodeCursor c = NodeCursor.of(root, ctx);
    Board board = new Board();
    Headers.read(c, board, MAX_VERSION);
    Headers.paper(c).ifPresent(board::setPaper);
    Headers.titleBlock(c).ifPresent(board::setTitleBlock);
    c.child("layers").ifPresent(n -> readLayers(n, board, ctx));
    TABLE.dispatch(c, board);
    TABLE.finish(c, board);
    return board;
  }

  private static void readLayers(Node layers, Board board, ReadContext ctx) {
    for (Node entry : layers.children()) {
      ctx.enter("layers > " + entry.token());
      try {
        board.getLayers().add(layer(entry, ctx));
      } catch (RuntimeException e) {
        ctx.error("Failed to read layer " + entry.token() + ": " + e.getMessage());
        log.debug("Dropped layer {}", entry.token(), e);
      } finally {
        ctx.exit();
      }
    }
  }

  /** Reads {@code (0 "F.Cu" signal ["Front"])}. */
  static LayerDefinition layer(Node node, ReadContext ctx) {
    int ordinal;
    try {
      ordinal = Integer.parseInt(node.token());
    } catch (NumberFormatException e) {
      throw new ElementFormatException("Layer ordinal is not a number: " + node.token(), e);
    }
    NodeCursor c = NodeCursor.of(node, ctx);
    LayerDefinition layer =
        new LayerDefinition(
            ordinal, c.requireText(0, "layer name"), c.requireText(1, "layer type"));
    c.text(2).ifPresent(layer::setUserName);
    c.finish(layer);
    return layer;
  }

  static Net net(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    int number =
        c.number(0)
            .map(Double::intValue)
            .orElseThrow(() -> new ElementFormatException("Missing net number"));
    Net net = new Net(number, c.text(1).orElse(""));
    c.finish(net);
    return net;
  }

  static NetClass netClass(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    NetClass netClass = new NetClass(c.requireText(0, "net class name"));
    c.text(1).ifPresent(netClass::setDescription);
    Optional<String> net;
    while ((net = c.childText("add_net")).isPresent()) {
      netClass.getNets().add(net.get());
    }
    c.finish(netClass, NET_CLASS_RAW);
    return netClass;
  }

  static Track track(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    Track track = new Track();
    track.setLocked(c.flag("locked"));
    track.setStart(c.requirePoint("start"));
    track.setEnd(c.requirePoint("end"));
    c.childCoord("width").ifPresent(track::setWidth);
    c.childText("layer").ifPresent(track::setLayer);
    c.childInt("net").ifPresent(track::setNet);
    c.uuid().ifPresent(track::setUuid);
    c.finish(track, Set.of("status"));
    return track;
  }

  static TrackArc arc(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    TrackArc arc = new TrackArc();
    arc.setLocked(c.flag("locked"));
    arc.setStart(c.requirePoint("start"));
    arc.setMid(c.requirePoint("mid"));
    arc.setEnd(c.requirePoint("end"));
    c.childCoord("width").ifPresent(arc::setWidth);
    c.childText("layer").ifPresent(arc::setLayer);
    c.childInt("net").ifPresent(arc::setNet);
    c.uuid().ifPresent(arc::setUuid);
    c.finish(arc, Set.of("status"));
    return arc;
  }

  static Via via(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    Via via = new Via();
    for (String type : VIA_TYPES) {
      if (c.takeSymbol(type)) {
        via.setTypeToken(type);
        break;
      }
    }
    via.setLocked(c.flag("locked"));
    c.atPoint().ifPresent(via::setPosition);
    c.childCoord("size").ifPresent(via::setSize);
    c.childCoord("drill").ifPresent(via::setDrill);
    c.childTexts("layers").ifPresent(via.getLayers()::addAll);
    via.setFree(c.flag("free"));
    c.childInt("net").ifPresent(via::setNet);
    c.uuid().ifPresent(via::setUuid);
    c.finish(via, VIA_RAW);
    return via;
  }
}
