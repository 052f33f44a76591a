package io.kifmt.parser.impl.pcb;

import io.kifmt.parser.api.pcb.Zone;
import io.kifmt.parser.api.pcb.ZoneFill;
import io.kifmt.parser.api.pcb.ZonePolygon;
import io.kifmt.parser.internal_api.Encoders;
import io.kifmt.sexpr.Node;

public final class ZoneWriter {
  private ZoneWriter() {}

  public static Node write(Zone zone) {
    Node.Builder b = Node.builder("zone");
    Encoders.putFlag(b, "locked", zone.getLocked());
    Encoders.putInt(b, "net", zone.getNet());
    Encoders.putText(b, zone, "net_name", zone.getNetName());
    if (zone.isMultiLayer()) {
      Encoders.putTexts(b, zone, "layers", zone.getLayers());
    } else if (!zone.getLayers().isEmpty()) {
      Encoders.putText(b, zone, "layer", zone.getLayers().get(0));
    }
    Encoders.putUuid(b, zone.getUuid());
    Encoders.putText(b, zone, "name", zone.getName());
    if (zone.getHatchStyle() != null && zone.getHatchPitch() != null) {
      b.child(
          Node.builder("hatch")
              .value(Encoders.word(zone.getHatchStyle()))
              .value(Encoders.mm(zone.getHatchPitch()))
              .build());
    }
    Encoders.putInt(b, "priority", zone.getPriority());
    Encoders.putCoord(b, "min_thickness", zone.getMinThickness());
    if (zone.getFill() != null) {
      b.child(fill(zone.getFill()));
    }
    for (ZonePolygon outline : zone.getOutlines()) {
      b.child(polygon(outline));
    }
    for (ZonePolygon filled : zone.getFilledPolygons()) {
      b.child(polygon(filled));
    }
    return Encoders.finish(b, zone);
  }

  private static Node fill(ZoneFill fill) {
    Node.Builder b = Node.builder("fill");
    if (fill.getFilled() != null) {
      b.bool(fill.getFilled());
    }
    Encoders.putWord(b, "mode", fill.getMode());
    Encoders.putCoord(b, "thermal_gap", fill.getThermalGap());
    Encoders.putCoord(b, "thermal_bridge_width", fill.getThermalBridgeWidth());
    return Encoders.finish(b, fill);
  }

  private static Node polygon(ZonePolygon polygon) {
    Node.Builder b = Node.builder(polygon.getToken());
    Encoders.putText(b, polygon, "layer", polygon.getLayer());
    if (!polygon.getPoints().isEmpty()) {
      b.child(Encoders.points(polygon.getPoints()));
    }
    return Encoders.finish(b, polygon);
  }
}
