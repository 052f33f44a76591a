package io.kifmt.parser.impl.pcb;

import io.kifmt.parser.api.geom.Coord;
import io.kifmt.parser.api.pcb.Zone;
import io.kifmt.parser.api.pcb.ZoneFill;
import io.kifmt.parser.api.pcb.ZonePolygon;
import io.kifmt.parser.internal_api.Decoders;
import io.kifmt.parser.internal_api.DispatchTable;
import io.kifmt.parser.internal_api.NodeCursor;
import io.kifmt.parser.internal_api.ReadContext;
import io.kifmt.sexpr.Node;
import java.util.Set;

/**
 * Reads copper and keepout zones of boards and footprints. Outlines and filled polygons are read
 * one by one; clearance, keepout and placement settings are kept verbatim.
 */
public final class ZoneReader {
  private static final DispatchTable<Zone> TABLE =
      new DispatchTable<Zone>()
          .on("polygon", ZoneReader::polygon, (z, p) -> z.getOutlines().add(p))
          .on("filled_polygon", ZoneReader::polygon, (z, p) -> z.getFilledPolygons().add(p))
          .raw(
              "connect_pads",
              "keepout",
              "filled_areas_thickness",
              "placement",
              "fill_segments",
              "attr");

  private static final Set<String> FILL_RAW =
      Set.of(
          "smoothing",
          "radius",
          "island_removal_mode",
          "island_area_min",
          "hatch_thickness",
          "hatch_gap",
          "hatch_orientation",
          "hatch_smoothing_level",
          "hatch_smoothing_value",
          "hatch_border_algorithm",
          "hatch_min_hole_area",
          "arc_segments");

  private ZoneReader() {}

  public static Zone read(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    Zone zone = new Zone();
    zone.setLocked(c.flag("locked"));
    c.childInt("net").ifPresent(zone::setNet);
    c.childText("net_name").ifPresent(zone::setNetName);
    c.childText("layer").ifPresent(zone.getLayers()::add);
    if (zone.getLayers().isEmpty()) {
      c.childTexts("layers")
          .ifPresent(
              layers -> {
                zone.getLayers().addAll(layers);
                zone.setMultiLayer(true);
              });
    }
    c.uuid().ifPresent(zone::setUuid);
    c.childText("name").ifPresent(zone::setName);
    c.childIf(
            "hatch",
            n -> n.valueCount() == 2 && n.childCount() == 0 && n.number(1).isPresent())
        .ifPresent(
            n -> {
              zone.setHatchStyle(n.text(0).get());
              zone.setHatchPitch(Coord.fromMm(n.number(1).getAsDouble()));
            });
    c.childInt("priority").ifPresent(zone::setPriority);
    c.childCoord("min_thickness").ifPresent(zone::setMinThickness);
    c.child("fill").map(n -> fill(n, ctx)).ifPresent(zone::setFill);
    TABLE.dispatch(c, zone);
    TABLE.finish(c, zone);
    return zone;
  }

  private static ZoneFill fill(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    ZoneFill fill = new ZoneFill();
    if (node.bool(0).isPresent()) {
      c.value(0);
      fill.setFilled(node.bool(0).get());
    }
    c.childText("mode").ifPresent(fill::setMode);
    c.childCoord("thermal_gap").ifPresent(fill::setThermalGap);
    c.childCoord("thermal_bridge_width").ifPresent(fill::setThermalBridgeWidth);
    c.finish(fill, FILL_RAW);
    return fill;
  }

  static ZonePolygon polygon(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    ZonePolygon polygon = new ZonePolygon(node.token());
    c.childText("layer").ifPresent(polygon::setLayer);
    c.childIf("pts", Decoders::isPlainPoints)
        .flatMap(Decoders::points)
        .ifPresent(polygon.getPoints()::addAll);
    c.finish(polygon, Set.of("island"));
    return polygon;
  }
}
