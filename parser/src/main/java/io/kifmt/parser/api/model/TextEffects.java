package io.kifmt.parser.api.model;

import java.util.List;

/**
 * Text styling: {@code (effects (font ...) (justify ...) (hide yes))}.
 *
 * <p>{@code hide} is written either as a bare word inside {@code effects} (KiCad 6 and 7) or as a
 * {@code (hide yes)} child (KiCad 8 and later); {@link #getHide()} keeps the spelling.
 */
public class TextEffects extends Element {
  private Font font;
  private List<String> justify;
  private Flag hide;

  public Font getFont() {
    return font;
  }

  public void setFont(Font font) {
    this.font = font;
  }

  /** @return the justification words such as {@code left} or {@code mirror}; null if absent */
  public List<String> getJustify() {
    return justify;
  }

  public void setJustify(List<String> justify) {
    this.justify = justify;
  }

  public Flag getHide() {
    return hide;
  }

  public void setHide(Flag hide) {
    this.hide = hide;
  }

  public boolean isHidden() {
    return Flag.isSet(hide);
  }

  /**
   * Shows or hides the text, keeping the spelling of an existing hide flag. Showing text that has
   * no {@code (hide no)} child removes the flag.
   */
  public void setHidden(boolean hidden) {
    if (!hidden && (hide == null || hide.form() != Flag.Form.CHILD)) {
      hide = null;
    } else {
      hide = Flag.update(hide, hidden);
    }
  }

  public boolean isMirrored() {
    return justify != null && justify.contains("mirror");
  }
}
