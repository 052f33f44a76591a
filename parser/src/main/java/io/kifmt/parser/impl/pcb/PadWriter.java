package io.kifmt.parser.impl.pcb;

import io.kifmt.parser.api.pcb.Drill;
import io.kifmt.parser.api.pcb.Pad;
import io.kifmt.parser.internal_api.Encoders;
import io.kifmt.sexpr.Node;

public final class PadWriter {
  private PadWriter() {}

  public static Node write(Pad pad) {
    Node.Builder b =
        Node.builder("pad")
            .value(Encoders.text(pad, "@0", pad.getNumber()))
            .value(Encoders.word(pad.getTypeToken()))
            .value(Encoders.word(pad.getShapeToken()));
    Encoders.putFlag(b, "locked", pad.getLocked());
    Encoders.putPosition(b, pad.getPosition());
    Encoders.putPoint(b, "size", pad.getSize());
    if (pad.getDrill() != null) {
      b.child(drill(pad.getDrill()));
    }
    if (!pad.getLayers().isEmpty() || pad.hadTypedChild("layers")) {
      Encoders.putTexts(b, pad, "layers", pad.getLayers());
    }
    Encoders.putNumber(b, "roundrect_rratio", pad.getRoundrectRatio());
    if (pad.getNetNumber() != null) {
      b.child(
          Node.builder("net")
              .integer(pad.getNetNumber())
              .value(
                  Encoders.text(pad, "net", pad.getNetName() == null ? "" : pad.getNetName()))
              .build());
    }
    Encoders.putText(b, pad, "pinfunction", pad.getPinFunction());
    Encoders.putText(b, pad, "pintype", pad.getPinType());
    Encoders.putCoord(b, "solder_mask_margin", pad.getSolderMaskMargin());
    Encoders.putCoord(b, "solder_paste_margin", pad.getSolderPasteMargin());
    Encoders.putCoord(b, "clearance", pad.getClearance());
    Encoders.putInt(b, "zone_connect", pad.getZoneConnectCode());
    Encoders.putCoord(b, "thermal_bridge_width", pad.getThermalBridgeWidth());
    Encoders.putCoord(b, "thermal_gap", pad.getThermalGap());
    Encoders.putUuid(b, pad.getUuid());
    return Encoders.finish(b, pad);
  }

  static Node drill(Drill drill) {
    Node.Builder b = Node.builder("drill");
    if (drill.isOval()) {
      b.symbol("oval");
    }
    if (drill.getDiameter() != null) {
      b.value(Encoders.mm(drill.getDiameter()));
    }
    if (drill.getHeight() != null) {
      b.value(Encoders.mm(drill.getHeight()));
    }
    Encoders.putPoint(b, "offset", drill.getOffset());
    return Encoders.finish(b, drill);
  }
}
