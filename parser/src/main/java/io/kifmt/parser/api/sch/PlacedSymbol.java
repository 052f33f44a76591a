package io.kifmt.parser.api.sch;

import io.kifmt.parser.api.geom.Position;
import io.kifmt.parser.api.model.Element;
import io.kifmt.parser.api.model.Flag;
import io.kifmt.parser.api.model.Property;
import io.kifmt.parser.api.model.UuidRef;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A symbol instance on a schematic sheet, referring to its library symbol by {@link #getLibId()}
 * (or by {@link #getLibName()} when the embedded copy was renamed).
 *
 * <p>The {@code instances} block with per-project references stays in the raw children.
 */
public class PlacedSymbol extends Element {
  private String libName;
  private String libId;
  private Position position;
  private String mirror;
  private Integer unit;
  private Integer bodyStyle;
  private Boolean excludeFromSim;
  private Boolean inBom;
  private Boolean onBoard;
  private Boolean dnp;
  private Flag fieldsAutoplaced;
  private UuidRef uuid;
  private final List<Property> properties = new ArrayList<>();
  private final List<PlacedPin> pins = new ArrayList<>();

  public PlacedSymbol(String libId) {
    this.libId = Objects.requireNonNull(libId, "libId");
  }

  public String getLibName() {
    return libName;
  }

  public void setLibName(String libName) {
    this.libName = libName;
  }

  public String getLibId() {
    return libId;
  }

  public void setLibId(String libId) {
    this.libId = libId;
  }

  public Position getPosition() {
    return position;
  }

  public void setPosition(Position position) {
    this.position = position;
  }

  /** @return {@code x} or {@code y}; null if not mirrored */
  public String getMirror() {
    return mirror;
  }

  public void setMirror(String mirror) {
    this.mirror = mirror;
  }

  public Integer getUnit() {
    return unit;
  }

  public void setUnit(Integer unit) {
    this.unit = unit;
  }

  /** @return the {@code (convert n)} body style; null if absent */
  public Integer getBodyStyle() {
    return bodyStyle;
  }

  public void setBodyStyle(Integer bodyStyle) {
    this.bodyStyle = bodyStyle;
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

  public Boolean getDnp() {
    return dnp;
  }

  public void setDnp(Boolean dnp) {
    this.dnp = dnp;
  }

  public Flag getFieldsAutoplaced() {
    return fieldsAutoplaced;
  }

  public void setFieldsAutoplaced(Flag fieldsAutoplaced) {
    this.fieldsAutoplaced = fieldsAutoplaced;
  }

  public UuidRef getUuid() {
    return uuid;
  }

  public void setUuid(UuidRef uuid) {
    this.uuid = uuid;
  }

  public List<Property> getProperties() {
    return properties;
  }

  public List<PlacedPin> getPins() {
    return pins;
  }

  public Optional<Property> property(String name) {
    return properties.stream().filter(p -> p.getName().equals(name)).findFirst();
  }

  public Optional<String> reference() {
    return property("Reference").map(Property::getValue);
  }

  /** @return the name of the embedded library symbol this instance uses */
  public String librarySymbolName() {
    return libName != null ? libName : libId;
  }
}
