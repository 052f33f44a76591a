package io.kifmt.parser.impl.pcb;

import io.kifmt.parser.api.geom.Coord;
import io.kifmt.parser.api.pcb.Drill;
import io.kifmt.parser.api.pcb.Pad;
import io.kifmt.parser.internal_api.NodeCursor;
import io.kifmt.parser.internal_api.ReadContext;
import io.kifmt.sexpr.Node;
import java.util.Set;

/**
 * Reads {@code (pad "1" smd roundrect (at ...) (size ...) ...)}.
 *
 * <p>A pad without number, type or shape, or with a malformed position or size, cannot be read
 * and is dropped by the footprint. Custom pad primitives, chamfers and per-pad teardrops are kept
 * verbatim.
 */
public final class PadReader {
  private static final Set<String> RAW =
      Set.of(
          "primitives",
          "options",
          "chamfer",
          "chamfer_ratio",
          "die_length",
          "die_delay",
          "remove_unused_layers",
          "keep_end_layers",
          "teardrops",
          "tenting",
          "rect_delta",
          "solder_paste_margin_ratio",
          "thermal_width",
          "thermal_bridge_angle",
          "property",
          "zone_layer_connections",
          "padstack");

  private PadReader() {}

  public static Pad read(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    Pad pad =
        new Pad(
            c.requireText(0, "pad number"),
            c.requireText(1, "pad type"),
            c.requireText(2, "pad shape"));
    pad.setLocked(c.flag("locked"));
    c.position().ifPresent(pad::setPosition);
    c.point("size").ifPresent(pad::setSize);
    c.child("drill").map(n -> drill(n, ctx)).ifPresent(pad::setDrill);
    c.childTexts("layers").ifPresent(pad.getLayers()::addAll);
    c.childNumber("roundrect_rratio").ifPresent(pad::setRoundrectRatio);
    c.childIf(
            "net",
            n -> n.childCount() == 0 && n.valueCount() == 2 && n.number(0).isPresent())
        .ifPresent(
            n -> {
              pad.setNetNumber(n.integer(0).getAsInt());
              pad.setNetName(n.text(1).get());
              if (!n.isQuoted(1)) {
                c.markBare("net");
              }
            });
    c.childText("pinfunction").ifPresent(pad::setPinFunction);
    c.childText("pintype").ifPresent(pad::setPinType);
    c.childCoord("solder_mask_margin").ifPresent(pad::setSolderMaskMargin);
    c.childCoord("solder_paste_margin").ifPresent(pad::setSolderPasteMargin);
    c.childCoord("clearance").ifPresent(pad::setClearance);
    c.childInt("zone_connect").ifPresent(pad::setZoneConnectCode);
    c.childCoord("thermal_bridge_width").ifPresent(pad::setThermalBridgeWidth);
    c.childCoord("thermal_gap").ifPresent(pad::setThermalGap);
    c.uuid().ifPresent(pad::setUuid);
    c.finish(pad, RAW);
    return pad;
  }

  /** Reads {@code (drill [oval] d [h] [(offset x y)])}. */
  static Drill drill(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    Drill drill = new Drill();
    drill.setOval(c.takeSymbol("oval"));
    int first = drill.isOval() ? 1 : 0;
    c.number(first).map(Coord::fromMm).ifPresent(drill::setDiameter);
    c.number(first + 1).map(Coord::fromMm).ifPresent(drill::setHeight);
    c.point("offset").ifPresent(drill::setOffset);
    c.finish(drill);
    return drill;
  }
}
