package io.kifmt.parser.impl.sch;

import io.kifmt.parser.api.DocumentKind;
import io.kifmt.parser.api.KiCadFileException;
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
import io.kifmt.parser.api.symbol.SymbolLibrary;
import io.kifmt.parser.impl.DocumentReader;
import io.kifmt.parser.impl.GraphicReader;
import io.kifmt.parser.impl.Headers;
import io.kifmt.parser.impl.PropertyReader;
import io.kifmt.parser.impl.symbol.SymbolLibraryReader;
import io.kifmt.parser.internal_api.Decoders;
import io.kifmt.parser.internal_api.DispatchTable;
import io.kifmt.parser.internal_api.ElementFormatException;
import io.kifmt.parser.internal_api.NodeCursor;
import io.kifmt.parser.internal_api.ReadContext;
import io.kifmt.sexpr.Node;
import java.util.Set;

/**
 * Reads {@code .kicad_sch} files.
 *
 * <p>The embedded {@code lib_symbols} section is read with the symbol library reader. Instance
 * data, bus aliases, text boxes, images and tables are kept verbatim.
 */
public final class SchematicReader implements DocumentReader<Schematic> {
  /** Newest {@code kicad_sch} format version this reader was written for. */
  public static final int MAX_VERSION = 20250114;

  private static final DispatchTable<Schematic> TABLE = table();

  private static final DispatchTable<Label> LABEL_TABLE =
      new DispatchTable<Label>()
          .on("property", PropertyReader::read, (l, p) -> l.getProperties().add(p))
          .raw("iref", "exclude_from_sim");

  private static final DispatchTable<PlacedSymbol> SYMBOL_TABLE =
      new DispatchTable<PlacedSymbol>()
          .on("property", PropertyReader::read, (s, p) -> s.getProperties().add(p))
          .on("pin", SchematicReader::placedPin, (s, p) -> s.getPins().add(p))
          .raw("instances", "default_instance", "body_style");

  private static final DispatchTable<Sheet> SHEET_TABLE =
      new DispatchTable<Sheet>()
          .on("property", PropertyReader::read, (s, p) -> s.getProperties().add(p))
          .on("pin", SchematicReader::sheetPin, (s, p) -> s.getPins().add(p))
          .raw("instances", "exclude_from_sim", "in_bom", "on_board", "dnp");

  private static DispatchTable<Schematic> table() {
    DispatchTable<Schematic> table =
        GraphicReader.registerSchematicShapes(
            new DispatchTable<Schematic>(), (s, g) -> s.getGraphics().add(g));
    return table
        .on(Set.of("wire", "bus", "polyline"), SchematicReader::wire, (s, w) -> s.getWires().add(w))
        .on("junction", SchematicReader::junction, (s, j) -> s.getJunctions().add(j))
        .on("no_connect", SchematicReader::noConnect, (s, n) -> s.getNoConnects().add(n))
        .on("bus_entry", SchematicReader::busEntry, (s, e) -> s.getBusEntries().add(e))
        .on(
            Set.of(Label.LOCAL, Label.GLOBAL, Label.HIERARCHICAL),
            SchematicReader::label,
            (s, l) -> s.getLabels().add(l))
        .on("text", SchematicReader::text, (s, t) -> s.getTexts().add(t))
        .on("symbol", SchematicReader::symbol, (s, sym) -> s.getSymbols().add(sym))
        .on("sheet", SchematicReader::sheet, (s, sh) -> s.getSheets().add(sh))
        .raw(
            "sheet_instances",
            "symbol_instances",
            "bus_alias",
            "netclass_flag",
            "directive_label",
            "text_box",
            "image",
            "table",
            "rule_area",
            "group",
            "embedded_fonts",
            "embedded_files");
  }

  @Override
  public Schematic read(Node root, ReadContext ctx) throws KiCadFileException {
    Headers.checkRoot(root, DocumentKind.SCHEMATIC, ctx);
    NodeCursor c = NodeCursor.of(root, ctx);
    Schematic sch = new Schematic();
    Headers.read(c, sch, MAX_VERSION);
    c.uuid().ifPresent(sch::setUuid);
    Headers.paper(c).ifPresent(sch::setPaper);
    Headers.titleBlock(c).ifPresent(sch::setTitleBlock);
    c.child("lib_symbols")
        .ifPresent(
            n -> {
              SymbolLibrary library = new SymbolLibrary();
              ctx.enter(n.token());
              try {
                SymbolLibraryReader.readBody(NodeCursor.of(n, ctx), library);
              } finally {
                ctx.exit();
              }
              sch.setLibSymbols(library);
            });
    TABLE.dispatch(c, sch);
    TABLE.finish(c, sch);
    return sch;
  }

  static Wire wire(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    Wire wire = new Wire(node.token());
    c.childIf("pts", Decoders::isPlainPoints)
        .flatMap(Decoders::points)
        .ifPresent(wire.getPoints()::addAll);
    c.child("stroke").map(n -> Decoders.stroke(n, ctx)).ifPresent(wire::setStroke);
    c.uuid().ifPresent(wire::setUuid);
    c.finish(wire);
    return wire;
  }

  static Junction junction(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    Junction junction = new Junction();
    c.atPoint().ifPresent(junction::setPosition);
    c.childCoord("diameter").ifPresent(junction::setDiameter);
    Decoders.color(c, junction).ifPresent(junction::setColor);
    c.uuid().ifPresent(junction::setUuid);
    c.finish(junction);
    return junction;
  }

  static NoConnect noConnect(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    NoConnect noConnect = new NoConnect();
    c.atPoint().ifPresent(noConnect::setPosition);
    c.uuid().ifPresent(noConnect::setUuid);
    c.finish(noConnect);
    return noConnect;
  }

  static BusEntry busEntry(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    BusEntry entry = new BusEntry();
    c.atPoint().ifPresent(entry::setPosition);
    c.point("size").ifPresent(entry::setSize);
    c.child("stroke").map(n -> Decoders.stroke(n, ctx)).ifPresent(entry::setStroke);
    c.uuid().ifPresent(entry::setUuid);
    c.finish(entry);
    return entry;
  }

  static Label label(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    Label label = new Label(node.token(), c.requireText(0, "label text"));
    c.childText("shape").ifPresent(label::setShape);
    c.position().ifPresent(label::setPosition);
    label.setFieldsAutoplaced(c.flag("fields_autoplaced"));
    c.child("effects").map(n -> Decoders.effects(n, ctx)).ifPresent(label::setEffects);
    c.uuid().ifPresent(label::setUuid);
    LABEL_TABLE.dispatch(c, label);
    LABEL_TABLE.finish(c, label);
    return label;
  }

  static SchText text(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    SchText text = new SchText(c.requireText(0, "text"));
    c.position().ifPresent(text::setPosition);
    c.child("effects").map(n -> Decoders.effects(n, ctx)).ifPresent(text::setEffects);
    c.uuid().ifPresent(text::setUuid);
    c.finish(text, Set.of("exclude_from_sim"));
    return text;
  }

  static PlacedSymbol symbol(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    String libName = c.childText("lib_name").orElse(null);
    PlacedSymbol symbol =
        new PlacedSymbol(
            c.childText("lib_id")
                .orElseThrow(() -> new ElementFormatException("Missing lib_id in symbol")));
    symbol.setLibName(libName);
    c.position().ifPresent(symbol::setPosition);
    c.childText("mirror").ifPresent(symbol::setMirror);
    c.childInt("unit").ifPresent(symbol::setUnit);
    c.childInt("convert").ifPresent(symbol::setBodyStyle);
    c.childBool("exclude_from_sim").ifPresent(symbol::setExcludeFromSim);
    c.childBool("in_bom").ifPresent(symbol::setInBom);
    c.childBool("on_board").ifPresent(symbol::setOnBoard);
    c.childBool("dnp").ifPresent(symbol::setDnp);
    symbol.setFieldsAutoplaced(c.flag("fields_autoplaced"));
    c.uuid().ifPresent(symbol::setUuid);
    SYMBOL_TABLE.dispatch(c, symbol);
    SYMBOL_TABLE.finish(c, symbol);
    return symbol;
  }

  static PlacedPin placedPin(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    PlacedPin pin = new PlacedPin(c.requireText(0, "pin number"));
    c.childText("alternate").ifPresent(pin::setAlternate);
    c.uuid().ifPresent(pin::setUuid);
    c.finish(pin);
    return pin;
  }

  static Sheet sheet(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    Sheet sheet = new Sheet();
    c.atPoint().ifPresent(sheet::setPosition);
    c.point("size").ifPresent(sheet::setSize);
    sheet.setFieldsAutoplaced(c.flag("fields_autoplaced"));
    c.child("stroke").map(n -> Decoders.stroke(n, ctx)).ifPresent(sheet::setStroke);
    c.child("fill").map(n -> Decoders.fill(n, ctx)).ifPresent(sheet::setFill);
    c.uuid().ifPresent(sheet::setUuid);
    SHEET_TABLE.dispatch(c, sheet);
    SHEET_TABLE.finish(c, sheet);
    return sheet;
  }

  static SheetPin sheetPin(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    SheetPin pin = new SheetPin(c.requireText(0, "sheet pin name"), c.requireText(1, "pin shape"));
    c.position().ifPresent(pin::setPosition);
    c.child("effects").map(n -> Decoders.effects(n, ctx)).ifPresent(pin::setEffects);
    c.uuid().ifPresent(pin::setUuid);
    c.finish(pin);
    return pin;
  }
}
