package io.kifmt.parser.api.sch;

import io.kifmt.parser.api.DocumentKind;
import io.kifmt.parser.api.KiCadDocument;
import io.kifmt.parser.api.model.Graphic;
import io.kifmt.parser.api.model.Paper;
import io.kifmt.parser.api.model.TitleBlock;
import io.kifmt.parser.api.model.UuidRef;
import io.kifmt.parser.api.symbol.SymbolLibrary;
import java.util.ArrayList;
import java.util.List;

/**
 * A schematic sheet, {@code .kicad_sch}.
 *
 * <p>The library symbols used on the sheet are embedded as {@link #getLibSymbols()}. Instance
 * tables, bus aliases, images and tables are not modeled and stay in the raw children.
 */
public class Schematic extends KiCadDocument {
  private UuidRef uuid;
  private Paper paper;
  private TitleBlock titleBlock;
  private SymbolLibrary libSymbols;
  private final List<Junction> junctions = new ArrayList<>();
  private final List<NoConnect> noConnects = new ArrayList<>();
  private final List<BusEntry> busEntries = new ArrayList<>();
  private final List<Wire> wires = new ArrayList<>();
  private final List<Label> labels = new ArrayList<>();
  private final List<SchText> texts = new ArrayList<>();
  private final List<PlacedSymbol> symbols = new ArrayList<>();
  private final List<Sheet> sheets = new ArrayList<>();
  private final List<Graphic> graphics = new ArrayList<>();

  public UuidRef getUuid() {
    return uuid;
  }

  public void setUuid(UuidRef uuid) {
    this.uuid = uuid;
  }

  public Paper getPaper() {
    return paper;
  }

  public void setPaper(Paper paper) {
    this.paper = paper;
  }

  public TitleBlock getTitleBlock() {
    return titleBlock;
  }

  public void setTitleBlock(TitleBlock titleBlock) {
    this.titleBlock = titleBlock;
  }

  /** @return the embedded {@code lib_symbols}; null if the file had none */
  public SymbolLibrary getLibSymbols() {
    return libSymbols;
  }

  public void setLibSymbols(SymbolLibrary libSymbols) {
    this.libSymbols = libSymbols;
  }

  public List<Junction> getJunctions() {
    return junctions;
  }

  public List<NoConnect> getNoConnects() {
    return noConnects;
  }

  public List<BusEntry> getBusEntries() {
    return busEntries;
  }

  public List<Wire> getWires() {
    return wires;
  }

  public List<Label> getLabels() {
    return labels;
  }

  public List<SchText> getTexts() {
    return texts;
  }

  public List<PlacedSymbol> getSymbols() {
    return symbols;
  }

  public List<Sheet> getSheets() {
    return sheets;
  }

  public List<Graphic> getGraphics() {
    return graphics;
  }

  @Override
  public DocumentKind kind() {
    return DocumentKind.SCHEMATIC;
  }
}
