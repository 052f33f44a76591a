package io.kifmt.parser.api.sch;

import io.kifmt.parser.api.geom.Position;
import io.kifmt.parser.api.model.Element;
import io.kifmt.parser.api.model.TextEffects;
import io.kifmt.parser.api.model.UuidRef;
import java.util.Objects;

/** A hierarchical sheet pin, {@code (pin "name" input (at ...) (effects ...))}. */
public class SheetPin extends Element {
  private String name;
  private String shape;
  private Position position;
  private TextEffects effects;
  private UuidRef uuid;

  public SheetPin(String name, String shape) {
    this.name = Objects.requireNonNull(name, "name");
    this.shape = Objects.requireNonNull(shape, "shape");
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getShape() {
    return shape;
  }

  public void setShape(String shape) {
    this.shape = shape;
  }

  public Position getPosition() {
    return position;
  }

  public void setPosition(Position position) {
    this.position = position;
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
}
