package io.kifmt.parser.api.symbol;

import io.kifmt.parser.api.geom.Position;
import io.kifmt.parser.api.model.Element;
import io.kifmt.parser.api.model.TextEffects;
import java.util.Objects;

/** Free text inside a symbol body, {@code (text "..." (at x y a) (effects ...))}. */
public class SymbolText extends Element {
  private String text;
  private Position position;
  private TextEffects effects;

  public SymbolText(String text) {
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
}
