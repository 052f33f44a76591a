package io.kifmt.parser.api.model;

import io.kifmt.parser.api.geom.Position;
import java.util.Objects;

/**
 * A named field: {@code (property "Reference" "R1" (at ...) (effects ...))}.
 *
 * <p>Used by symbols, placed symbols, sheets, footprints and labels. Not every attribute applies
 * to every owner; absent attributes are null.
 */
public class Property extends Element {
  private String name;
  private String value;
  private Integer id;
  private Position position;
  private String layer;
  private Flag hide;
  private Flag unlocked;
  private Flag showName;
  private Flag doNotAutoplace;
  private TextEffects effects;
  private UuidRef uuid;

  public Property(String name, String value) {
    this.name = Objects.requireNonNull(name, "name");
    this.value = Objects.requireNonNull(value, "value");
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = Objects.requireNonNull(name, "name");
  }

  public String getValue() {
    return value;
  }

  public void setValue(String value) {
    this.value = Objects.requireNonNull(value, "value");
  }

  /** @return the legacy numeric field id, {@code (id n)}; null if absent */
  public Integer getId() {
    return id;
  }

  public void setId(Integer id) {
    this.id = id;
  }

  public Position getPosition() {
    return position;
  }

  public void setPosition(Position position) {
    this.position = position;
  }

  public String getLayer() {
    return layer;
  }

  public void setLayer(String layer) {
    this.layer = layer;
  }

  public Flag getHide() {
    return hide;
  }

  public void setHide(Flag hide) {
    this.hide = hide;
  }

  /** True if either the property or its effects are hidden. */
  public boolean isHidden() {
    return Flag.isSet(hide) || (effects != null && effects.isHidden());
  }

  public Flag getUnlocked() {
    return unlocked;
  }

  public void setUnlocked(Flag unlocked) {
    this.unlocked = unlocked;
  }

  public Flag getShowName() {
    return showName;
  }

  public void setShowName(Flag showName) {
    this.showName = showName;
  }

  public Flag getDoNotAutoplace() {
    return doNotAutoplace;
  }

  public void setDoNotAutoplace(Flag doNotAutoplace) {
    this.doNotAutoplace = doNotAutoplace;
  }

  public TextEffects getEffects() {
    return effects;
  }

  public void setEffects(TextEffects effects) {
    this.effects = effects;
  }

  public UuidRef getUuid() {
    return uuid;
  }

  public void setUuid(UuidRef uuid) {
    this.uuid = uuid;
  }

  @Override
  public String toString() {
    return name + "=" + value;
  }
}
