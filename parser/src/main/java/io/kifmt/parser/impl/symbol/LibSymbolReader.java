package io.kifmt.parser.impl.symbol;

import io.kifmt.parser.api.symbol.LibSymbol;
import io.kifmt.parser.api.symbol.Pin;
import io.kifmt.parser.api.symbol.PinAlternate;
import io.kifmt.parser.api.symbol.PinLabels;
import io.kifmt.parser.api.symbol.SymbolText;
import io.kifmt.parser.impl.GraphicReader;
import io.kifmt.parser.impl.PropertyReader;
import io.kifmt.parser.internal_api.Decoders;
import io.kifmt.parser.internal_api.DispatchTable;
import io.kifmt.parser.internal_api.NodeCursor;
import io.kifmt.parser.internal_api.ReadContext;
import io.kifmt.sexpr.Node;
import java.util.Optional;

/**
 * Reads a library symbol. Units are nested {@code symbol} nodes read by the same code, so a
 * failing unit is dropped on its own.
 */
public final class LibSymbolReader {
  private static final DispatchTable<LibSymbol> TABLE = table();

  private LibSymbolReader() {}

  private static DispatchTable<LibSymbol> table() {
    DispatchTable<LibSymbol> table =
        new DispatchTable<LibSymbol>()
            .on("property", PropertyReader::read, (s, p) -> s.getProperties().add(p))
            .on("symbol", LibSymbolReader::read, (s, unit) -> s.getUnits().add(unit))
            .on("pin", LibSymbolReader::pin, (s, pin) -> s.getPins().add(pin))
            .on("text", LibSymbolReader::text, (s, text) -> s.getTexts().add(text))
            .raw("embedded_fonts", "text_box");
    return GraphicReader.registerSchematicShapes(table, (s, g) -> s.getGraphics().add(g));
  }

  public static LibSymbol read(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    LibSymbol symbol = new LibSymbol(c.requireText(0, "symbol name"));
    c.childText("extends").ifPresent(symbol::setExtendsName);
    c.childIf("power", n -> n.childCount() == 0 && n.valueCount() <= 1)
        .ifPresent(
            n -> {
              symbol.setPower(true);
              n.text(0).ifPresent(symbol::setPowerScope);
            });
    c.child("pin_numbers").map(n -> pinLabels(n, ctx)).ifPresent(symbol::setPinNumbers);
    c.child("pin_names").map(n -> pinLabels(n, ctx)).ifPresent(symbol::setPinNames);
    c.childBool("exclude_from_sim").ifPresent(symbol::setExcludeFromSim);
    c.childBool("in_bom").ifPresent(symbol::setInBom);
    c.childBool("on_board").ifPresent(symbol::setOnBoard);
    c.childText("unit_name").ifPresent(symbol::setUnitName);
    TABLE.dispatch(c, symbol);
    TABLE.finish(c, symbol);
    return symbol;
  }

  private static PinLabels pinLabels(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    PinLabels labels = new PinLabels();
    c.childCoord("offset").ifPresent(labels::setOffset);
    labels.setHide(c.flag("hide"));
    c.finish(labels);
    return labels;
  }

  static Pin pin(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    Pin pin = new Pin(c.requireText(0, "pin electrical type"), c.requireText(1, "pin style"));
    pin.setHide(c.flag("hide"));
    c.position().ifPresent(pin::setPosition);
    c.childCoord("length").ifPresent(pin::setLength);
    c.childIf("name", LibSymbolReader::isPinLabel)
        .ifPresent(
            n -> {
              pin.setName(n.text(0).get());
              if (!n.isQuoted(0)) {
                c.markBare("name");
              }
              n.child("effects").map(e -> Decoders.effects(e, ctx)).ifPresent(pin::setNameEffects);
            });
    c.childIf("number", LibSymbolReader::isPinLabel)
        .ifPresent(
            n -> {
              pin.setNumber(n.text(0).get());
              if (!n.isQuoted(0)) {
                c.markBare("number");
              }
              n.child("effects")
                  .map(e -> Decoders.effects(e, ctx))
                  .ifPresent(pin::setNumberEffects);
            });
    Optional<Node> alt;
    while ((alt = c.childIf("alternate", n -> n.valueCount() == 3 && n.childCount() == 0))
        .isPresent()) {
      Node n = alt.get();
      pin.getAlternates()
          .add(new PinAlternate(n.text(0).get(), n.text(1).get(), n.text(2).get()));
    }
    c.finish(pin);
    return pin;
  }

  private static boolean isPinLabel(Node n) {
    return n.valueCount() == 1
        && (n.childCount() == 0
            || (n.childCount() == 1 && "effects".equals(n.children().get(0).token())));
  }

  static SymbolText text(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    SymbolText text = new SymbolText(c.requireText(0, "text"));
    c.position().ifPresent(text::setPosition);
    c.child("effects").map(n -> Decoders.effects(n, ctx)).ifPresent(text::setEffects);
    c.finish(text);
    return text;
  }
}
