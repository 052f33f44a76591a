package io.kifmt.parser.impl.sch;

import io.kifmt.parser.api.DocumentKind;
import io.kifmt.parser.api.model.Graphic;
import io.kifmt.parser.api.model.Property;
import io.kifmt.parser.api.sch.BusEntry;
import io.kifmt.parser.api.sch.Junction;
import io.kifmt.parser.api.sch.Label;
import io.kifmt.parser.api.sch.NoConnect;
import io.kifmt.parser.api.sch.PlacedPin;
import io.kifmt.parser.api.sch.PlacedSymbol;
import io.kifmt.parser.api.sch.SchText;
import io.kifmt.parser.api.sch.Schematic;
import io.kifmt.parser.api.sch.Sheet;
import io.kifmt.parser.api.sch.SheetPin;
import io.kifmt.parser.api.sch.Wire;
import io.kifmt.parser.impl.DocumentWriter;
import io.kifmt.parser.impl.GraphicWriter;
import io.kifmt.parser.impl.Headers;
import io.kifmt.parser.impl.PropertyWriter;
import io.kifmt.parser.impl.symbol.SymbolLibraryWriter;
import io.kifmt.parser.internal_api.Encoders;
import io.kifmt.sexpr.Node;
import java.util.List;

public final class SchematicWriter implements DocumentWriter<Schematic> {
  @Override
  public Node write(Schematic sch) {
    Node.Builder b = Node.builder(DocumentKind.SCHEMATIC.rootToken());
    Headers.write(b, sch);
    Encoders.putUuid(b, sch.getUuid());
    if (sch.getPaper() != null) {
      b.child(Headers.paper(sch.getPaper()));
    }
    if (sch.getTitleBlock() != null) {
      b.child(Headers.titleBlock(sch.getTitleBlock()));
    }
    if (sch.getLibSymbols() != null) {
      b.child(SymbolLibraryWriter.writeEmbedded(sch.getLibSymbols()));
    }
    for (Junction j : sch.getJunctions()) {
      b.child(junction(j));
    }
    for (NoConnect n : sch.getNoConnects()) {
      Node.Builder nc = Node.builder("no_connect");
      Encoders.putPoint(nc, "at", n.getPosition());
      Encoders.putUuid(nc, n.getUuid());
      b.child(Encoders.finish(nc, n));
    }
    for (BusEntry e : sch.getBusEntries()) {
      b.child(busEntry(e));
    }
    for (Wire w : sch.getWires()) {
      b.child(wire(w));
    }
    for (Graphic g : sch.getGraphics()) {
      b.child(GraphicWriter.write(g));
    }
    for (SchText t : sch.getTexts()) {
      b.child(text(t));
    }
    for (Label l : sch.getLabels()) {
      b.child(label(l));
    }
    for (PlacedSymbol s : sch.getSymbols()) {
      b.child(symbol(s));
    }
    for (Sheet s : sch.getSheets()) {
      b.child(sheet(s));
    }
    return Encoders.finish(b, sch);
  }

  private static void properties(Node.Builder b, List<Property> properties) {
    for (Property p : properties) {
      b.child(PropertyWriter.write(p));
    }
  }

  private static Node junction(Junction j) {
    Node.Builder b = Node.builder("junction");
    Encoders.putPoint(b, "at", j.getPosition());
    Encoders.putCoord(b, "diameter", j.getDiameter());
    Encoders.putColor(b, j, j.getColor());
    Encoders.putUuid(b, j.getUuid());
    return Encoders.finish(b, j);
  }

  private static Node busEntry(BusEntry e) {
    Node.Builder b = Node.builder("bus_entry");
    Encoders.putPoint(b, "at", e.getPosition());
    Encoders.putPoint(b, "size", e.getSize());
    if (e.getStroke() != null) {
      b.child(Encoders.stroke(e.getStroke()));
    }
    Encoders.putUuid(b, e.getUuid());
    return Encoders.finish(b, e);
  }

  private static Node wire(Wire w) {
    Node.Builder b = Node.builder(w.getToken());
    if (!w.getPoints().isEmpty()) {
      b.child(Encoders.points(w.getPoints()));
    }
    if (w.getStroke() != null) {
      b.child(Encoders.stroke(w.getStroke()));
    }
    Encoders.putUuid(b, w.getUuid());
    return Encoders.finish(b, w);
  }

  private static Node text(SchText t) {
    Node.Builder b = Node.builder("text").value(Encoders.text(t, "@0", t.getText()));
    Encoders.putPosition(b, t.getPosition());
    if (t.getEffects() != null) {
      b.child(Encoders.effects(t.getEffects()));
    }
    Encoders.putUuid(b, t.getUuid());
    return Encoders.finish(b, t);
  }

  private static Node label(Label l) {
    Node.Builder b = Node.builder(l.getToken()).value(Encoders.text(l, "@0", l.getText()));
    Encoders.putWord(b, "shape", l.getShape());
    Encoders.putPosition(b, l.getPosition());
    Encoders.putFlag(b, "fields_autoplaced", l.getFieldsAutoplaced());
    if (l.getEffects() != null) {
      b.child(Encoders.effects(l.getEffects()));
    }
    Encoders.putUuid(b, l.getUuid());
    properties(b, l.getProperties());
    return Encoders.finish(b, l);
  }

  private static Node symbol(PlacedSymbol s) {
    Node.Builder b = Node.builder("symbol");
    Encoders.putText(b, s, "lib_name", s.getLibName());
    Encoders.putText(b, s, "lib_id", s.getLibId());
    Encoders.putPosition(b, s.getPosition());
    Encoders.putWord(b, "mirror", s.getMirror());
    Encoders.putInt(b, "unit", s.getUnit());
    Encoders.putInt(b, "convert", s.getBodyStyle());
    Encoders.putBool(b, "exclude_from_sim", s.getExcludeFromSim());
    Encoders.putBool(b, "in_bom", s.getInBom());
    Encoders.putBool(b, "on_board", s.getOnBoard());
    Encoders.putBool(b, "dnp", s.getDnp());
    Encoders.putFlag(b, "fields_autoplaced", s.getFieldsAutoplaced());
    Encoders.putUuid(b, s.getUuid());
    properties(b, s.getProperties());
    for (PlacedPin pin : s.getPins()) {
      Node.Builder p = Node.builder("pin").value(Encoders.text(pin, "@0", pin.getNumber()));
      Encoders.putText(p, pin, "alternate", pin.getAlternate());
      Encoders.putUuid(p, pin.getUuid());
      b.child(Encoders.finish(p, pin));
    }
    return Encoders.finish(b, s);
  }

  private static Node sheet(Sheet s) {
    Node.Builder b = Node.builder("sheet");
    Encoders.putPoint(b, "at", s.getPosition());
    Encoders.putPoint(b, "size", s.getSize());
    Encoders.putFlag(b, "fields_autoplaced", s.getFieldsAutoplaced());
    if (s.getStroke() != null) {
      b.child(Encoders.stroke(s.getStroke()));
    }
    if (s.getFill() != null) {
      b.child(Encoders.fill(s.getFill()));
    }
    Encoders.putUuid(b, s.getUuid());
    properties(b, s.getProperties());
    for (SheetPin pin : s.getPins()) {
      Node.Builder p =
          Node.builder("pin")
              .value(Encoders.text(pin, "@0", pin.getName()))
              .value(Encoders.word(pin.getShape()));
      Encoders.putPosition(p, pin.getPosition());
      if (pin.getEffects() != null) {
        p.child(Encoders.effects(pin.getEffects()));
      }
      Encoders.putUuid(p, pin.getUuid());
      b.child(Encoders.finish(p, pin));
    }
    return Encoders.finish(b, s);
  }
}
