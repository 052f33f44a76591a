package io.kifmt.parser.api.sch;

import io.kifmt.parser.api.geom.Position;
import io.kifmt.parser.api.model.Element;
import io.kifmt.parser.api.model.TextEffects;
import io.kifmt.parser.api.model.UuidRef;
import java.util.Objects;

/** Free text on a schematic sheet. */
public class SchText extends Element {
  private String text;
  private Position position;
  private TextEffects effects;
  private UuidRef uuid;

  public SchText(String text) {
    this.text = Objects.requireNonNull(text, "text");
  }

  public String getText() {
    return text;
  }

  public void setText(String text) {
    this.text = text;
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
