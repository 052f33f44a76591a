package io.kifmt.parser.impl.symbol;

import io.kifmt.parser.api.model.Graphic;
import io.kifmt.parser.api.model.Property;
import io.kifmt.parser.api.symbol.LibSymbol;
import io.kifmt.parser.api.symbol.Pin;
import io.kifmt.parser.api.symbol.PinAlternate;
import io.kifmt.parser.api.symbol.PinLabels;
import io.kifmt.parser.api.symbol.SymbolText;
import io.kifmt.parser.impl.GraphicWriter;
import io.kifmt.parser.impl.PropertyWriter;
import io.kifmt.parser.internal_api.Encoders;
import io.kifmt.sexpr.Node;

/** Writes a library symbol and its units. */
public final class LibSymbolWriter {
  private LibSymbolWriter() {}

  public static Node write(LibSymbol symbol) {
    Node.Builder b = Node.builder("symbol").value(Encoders.text(symbol, "@0", symbol.getName()));
    Encoders.putText(b, symbol, "extends", symbol.getExtendsName());
    if (symbol.isPower()) {
      Node.Builder power = Node.builder("power");
      if (symbol.getPowerScope() != null) {
        power.value(Encoders.word(symbol.getPowerScope()));
      }
      b.child(power.build());
    }
    if (symbol.getPinNumbers() != null) {
      b.child(pinLabels("pin_numbers", symbol.getPinNumbers()));
    }
    if (symbol.getPinNames() != null) {
      b.child(pinLabels("pin_names", symbol.getPinNames()));
    }
    Encoders.putBool(b, "exclude_from_sim", symbol.getExcludeFromSim());
    Encoders.putBool(b, "in_bom", symbol.getInBom());
    Encoders.putBool(b, "on_board", symbol.getOnBoard());
    for (Property p : symbol.getProperties()) {
      b.child(PropertyWriter.write(p));
    }
    for (LibSymbol unit : symbol.getUnits()) {
      b.child(write(unit));
    }
    for (Graphic g : symbol.getGraphics()) {
      b.child(GraphicWriter.write(g));
    }
    for (SymbolText text : symbol.getTexts()) {
      b.child(text(text));
    }
    for (Pin pin : symbol.getPins()) {
      b.child(pin(pin));
    }
    Encoders.putText(b, symbol, "unit_name", symbol.getUnitName());
    return Encoders.finish(b, symbol);
  }

  private static Node pinLabels(String token, PinLabels labels) {
    Node.Builder b = Node.builder(token);
    Encoders.putCoord(b, "offset", labels.getOffset());
    Encoders.putFlag(b, "hide", labels.getHide());
    return Encoders.finish(b, labels);
  }

  static Node pin(Pin pin) {
    Node.Builder b =
        Node.builder("pin")
            .value(Encoders.word(pin.getElectricalType()))
            .value(Encoders.word(pin.getGraphicStyle()));
    Encoders.putPosition(b, pin.getPosition());
    Encoders.putCoord(b, "length", pin.getLength());
    Encoders.putFlag(b, "hide", pin.getHide());
    if (pin.getName() != null) {
      Node.Builder name = Node.builder("name").value(Encoders.text(pin, "name", pin.getName()));
      if (pin.getNameEffects() != null) {
        name.child(Encoders.effects(pin.getNameEffects()));
      }
      b.child(name.build());
    }
    if (pin.getNumber() != null) {
      Node.Builder number =
          Node.builder("number").value(Encoders.text(pin, "number", pin.getNumber()));
      if (pin.getNumberEffects() != null) {
        number.child(Encoders.effects(pin.getNumberEffects()));
      }
      b.child(number.build());
    }
    for (PinAlternate alt : pin.getAlternates()) {
      b.child(
          Node.builder("alternate")
              .string(alt.name())
              .value(Encoders.word(alt.electricalType()))
              .value(Encoders.word(alt.graphicStyle()))
              .build());
    }
    return Encoders.finish(b, pin);
  }

  static Node text(SymbolText text) {
    Node.Builder b = Node.builder("text").value(Encoders.text(text, "@0", text.getText()));
    Encoders.putPosition(b, text.getPosition());
    if (text.getEffects() != null) {
      b.child(Encoders.effects(text.getEffects()));
    }
    return Encoders.finish(b, text);
  }
}
