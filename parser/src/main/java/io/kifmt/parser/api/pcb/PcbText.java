package io.kifmt.parser.api.pcb;

import io.kifmt.parser.api.geom.Position;
import io.kifmt.parser.api.model.Element;
import io.kifmt.parser.api.model.Flag;
import io.kifmt.parser.api.model.TextEffects;
import io.kifmt.parser.api.model.UuidRef;
import java.util.Objects;

/**
 * Free text on a board ({@code gr_text}) or a footprint ({@code fp_text reference|value|user}).
 */
public class PcbText extends Element {
  public static final String FOOTPRINT_TEXT = "fp_text";
  public static final String BOARD_TEXT = "gr_text";

  private String token;
  private String kind;
  private String text;
  private Position position;
  private String layer;
  private boolean knockout;
  private Flag hide;
  private Flag unlocked;
  private Flag locked;
  private TextEffects effects;
  private UuidRef uuid;

  public PcbText(String token, String kind, String text) {
    this.token = Objects.requireNonNull(token, "token");
    this.kind = kind;
    this.text = Objects.requireNonNull(text, "text");
  }

  public String getToken() {
    return token;
  }

  public void setToken(String token) {
    this.token = token;
  }

  /** @return {@code reference}, {@code value} or {@code user} for footprint text; null for board text */
  public String getKind() {
    return kind;
  }

  public void setKind(String kind) {
    this.kind = kind;
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

  public String getLayer() {
    return layer;
  }

  public void setLayer(String layer) {
    this.layer = layer;
  }

  /** @return whether the layer carries the {@code knockout} marker */
  public boolean isKnockout() {
    return knockout;
  }

  public void setKnockout(boolean knockout) {
    this.knockout = knockout;
  }

  public Flag getHide() {
    return hide;
  }

  public void setHide(Flag hide) {
    this.hide = hide;
  }

  public Flag getUnlocked() {
    return unlocked;
  }

  public void setUnlocked(Flag unlocked) {
    this.unlocked = unlocked;
  }

  public Flag getLocked() {
    return locked;
  }

  public void setLocked(Flag locked) {
    this.locked = locked;
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

  /** Hidden either by the text's own flag or by its effects. */
  public boolean isHidden() {
    return Flag.isSet(hide) || (effects != null && effects.isHidden());
  }
}
