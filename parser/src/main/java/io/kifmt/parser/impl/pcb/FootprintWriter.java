package io.kifmt.parser.impl.pcb;

import io.kifmt.parser.api.model.Graphic;
import io.kifmt.parser.api.model.Property;
import io.kifmt.parser.api.pcb.Footprint;
import io.kifmt.parser.api.pcb.Model3D;
import io.kifmt.parser.api.pcb.Pad;
import io.kifmt.parser.api.pcb.PcbText;
import io.kifmt.parser.api.pcb.Zone;
import io.kifmt.parser.impl.DocumentWriter;
import io.kifmt.parser.impl.GraphicWriter;
import io.kifmt.parser.impl.Headers;
import io.kifmt.parser.impl.PropertyWriter;
import io.kifmt.parser.internal_api.Encoders;
import io.kifmt.sexpr.Node;

/** Writes footprints, standalone or as part of a board. */
public final class FootprintWriter implements DocumentWriter<Footprint> {
  @Override
  public Node write(Footprint footprint) {
    return writeFootprint(footprint);
  }

  public static Node writeFootprint(Footprint fp) {
    Node.Builder b = Node.builder(fp.getRootToken()).value(Encoders.text(fp, "@0", fp.getName()));
    Encoders.putFlag(b, "locked", fp.getLocked());
    Encoders.putFlag(b, "placed", fp.getPlaced());
    Headers.write(b, fp);
    Encoders.putText(b, fp, "layer", fp.getLayer());
    Encoders.putWord(b, "tedit", fp.getTedit());
    Encoders.putUuid(b, fp.getUuid());
    Encoders.putPosition(b, fp.getPosition());
    Encoders.putText(b, fp, "descr", fp.getDescription());
    Encoders.putText(b, fp, "tags", fp.getTags());
    for (Property p : fp.getProperties()) {
      b.child(PropertyWriter.write(p));
    }
    Encoders.putText(b, fp, "path", fp.getPath());
    Encoders.putText(b, fp, "sheetname", fp.getSheetName());
    Encoders.putText(b, fp, "sheetfile", fp.getSheetFile());
    Encoders.putWords(b, "attr", fp.getAttributes());
    Encoders.putCoord(b, "solder_mask_margin", fp.getSolderMaskMargin());
    Encoders.putCoord(b, "solder_paste_margin", fp.getSolderPasteMargin());
    Encoders.putNumber(b, "solder_paste_ratio", fp.getSolderPasteRatio());
    Encoders.putCoord(b, "clearance", fp.getClearance());
    Encoders.putInt(b, "zone_connect", fp.getZoneConnectCode());
    for (PcbText text : fp.getTexts()) {
      b.child(PcbTextWriter.write(text));
    }
    for (Graphic g : fp.getGraphics()) {
      b.child(GraphicWriter.write(g));
    }
    for (Pad pad : fp.getPads()) {
      b.child(PadWriter.write(pad));
    }
    for (Zone zone : fp.getZones()) {
      b.child(ZoneWriter.write(zone));
    }
    for (Model3D model : fp.getModels()) {
      b.child(model(model));
    }
    return Encoders.finish(b, fp);
  }

  static Node model(Model3D model) {
    Node.Builder b = Node.builder("model").value(Encoders.text(model, "@0", model.getPath()));
    Encoders.putFlag(b, "hide", model.getHide());
    Encoders.putNumber(b, "opacity", model.getOpacity());
    if (model.getOffset() != null) {
      b.child(Encoders.xyz("offset", model.getOffset()));
    }
    if (model.getScale() != null) {
      b.child(Encoders.xyz("scale", model.getScale()));
    }
    if (model.getRotate() != null) {
      b.child(Encoders.xyz("rotate", model.getRotate()));
    }
    return Encoders.finish(b, model);
  }
}
