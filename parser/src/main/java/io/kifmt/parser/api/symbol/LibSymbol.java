package io.kifmt.parser.api.symbol;

import io.kifmt.parser.api.model.Element;
import io.kifmt.parser.api.model.Graphic;
import io.kifmt.parser.api.model.Property;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A library symbol.
 *
 * <p>Units and body styles are nested symbols named {@code <name>_<unit>_<style>}. Unit 0 holds
 * the drawing shared by all units. {@link #unitCount()} derives the number of units from those
 * names.
 */
public class LibSymbol extends Element {
  private static final Pattern UNIT_NAME = Pattern.compile("^(.*)_(\\d{1,6})_(\\d{1,6})$");

  private String name;
  private String extendsName;
  private boolean power;
  private String powerScope;
  private PinLabels pinNames;
  private PinLabels pinNumbers;
  private Boolean excludeFromSim;
  private Boolean inBom;
  private Boolean onBoard;
  private String unitName;
  private final List<Property> properties = new ArrayList<>();
  private final List<Graphic> graphics = new ArrayList<>();
  private final List<SymbolText> texts = new ArrayList<>();
  private final List<Pin> pins = new ArrayList<>();
  private final List<LibSymbol> units = new ArrayList<>();

  public LibSymbol(String name) {
    this.name = Objects.requireNonNull(name, "name");
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  /** @return the parent symbol name of a derived symbol, {@code (extends "...")} */
  public String getExtendsName() {
    return extendsName;
  }

  public void setExtendsName(String extendsName) {
    this.extendsName = extendsName;
  }

  /** @return whether the symbol carries a {@code (power)} marker */
  public boolean isPower() {
    return power;
  }

  public void setPower(boolean power) {
    this.power = power;
  }

  /** @return the value of {@code (power local|global)}; null for a plain marker */
  public String getPowerScope() {
    return powerScope;
  }

  public void setPowerScope(String powerScope) {
    this.powerScope = powerScope;
  }

  public PinLabels getPinNames() {
    return pinNames;
  }

  public void setPinNames(PinLabels pinNames) {
    this.pinNames = pinNames;
  }

  public PinLabels getPinNumbers() {
    return pinNumbers;
  }

  public void setPinNumbers(PinLabels pinNumbers) {
    this.pinNumbers = pinNumbers;
  }

  public Boolean getExcludeFromSim() {
    return excludeFromSim;
  }

  public void setExcludeFromSim(Boolean excludeFromSim) {
    this.excludeFromSim = excludeFromSim;
  }

  public Boolean getInBom() {
    return inBom;
  }

  public void setInBom(Boolean inBom) {
    this.inBom = inBom;
  }

  public Boolean getOnBoard() {
    return onBoard;
  }

  public void setOnBoard(Boolean onBoard) {
    this.onBoard = onBoard;
  }

  public String getUnitName() {
    return unitName;
  }

  public void setUnitName(String unitName) {
    this.unitName = unitName;
  }

  public List<Property> getProperties() {
    return properties;
  }

  public List<Graphic> getGraphics() {
    return graphics;
  }

  public List<SymbolText> getTexts() {
    return texts;
  }

  public List<Pin> getPins() {
    return pins;
  }

  /** @return the nested unit symbols, mutable */
  public List<LibSymbol> getUnits() {
    return units;
  }

  public Optional<Property> property(String propertyName) {
    return properties.stream().filter(p -> p.getName().equals(propertyName)).findFirst();
  }

  /**
   * Returns the description, from the {@code Description} property or the older {@code
   * ki_description}.
   *
   * @return the description, if any
   */
  public Optional<String> description() {
    Optional<Property> p = property("Description");
    if (p.isEmpty()) {
      p = property("ki_description");
    }
    return p.map(Property::getValue);
  }

  /**
   * Counts the units of this symbol: the highest unit number among nested symbols, at least 1.
   *
   * @return the number of units
   */
  public int unitCount() {
    int max = 1;
    for (LibSymbol unit : units) {
      int n = unitNumber(unit.getName());
      if (n > max) {
        max = n;
      }
    }
    return max;
  }

  /**
   * Parses the unit number from a nested symbol name such as {@code R_1_1}.
   *
   * @param unitSymbolName the nested symbol name
   * @return the unit number, or 0 if the name has no unit suffix
   */
  public static int unitNumber(String unitSymbolName) {
    Matcher m = UNIT_NAME.matcher(unitSymbolName);
    if (!m.matches()) {
      return 0;
    }
    return Integer.parseInt(m.group(2));
  }

  /** @return the pins of this symbol and all its units */
  public List<Pin> allPins() {
    List<Pin> all = new ArrayList<>(pins);
    for (LibSymbol unit : units) {
      all.addAll(unit.allPins());
    }
    return all;
  }

  @Override
  public String toString() {
    return "LibSymbol{" + name + "}";
  }
}
