package io.kifmt.parser.api.model;

import java.util.Objects;

/**
 * Area fill, in one of two spellings.
 *
 * <ul>
 *   <li>{@link Form#TYPE_CHILD}: {@code (fill (type none|outline|background|color) (color ...))},
 *       used by schematics and symbols.
 *   <li>{@link Form#VALUE}: {@code (fill yes|no|solid)}, used by boards and footprints.
 * </ul>
 */
public class Fill extends Element {
  /** Spelling of a fill. */
  public enum Form {
    TYPE_CHILD,
    VALUE
  }

  private Form form;
  private String type;
  private String value;
  private Color color;

  public Fill(Form form) {
    this.form = Objects.requireNonNull(form, "form");
  }

  /** A schematic fill, {@code (fill (type t))}. */
  public static Fill ofType(String type) {
    Fill fill = new Fill(Form.TYPE_CHILD);
    fill.type = type;
    return fill;
  }

  /** A board fill, {@code (fill yes)} or {@code (fill no)}. */
  public static Fill ofValue(boolean filled) {
    Fill fill = new Fill(Form.VALUE);
    fill.value = filled ? "yes" : "no";
    return fill;
  }

  public Form getForm() {
    return form;
  }

  public void setForm(Form form) {
    this.form = Objects.requireNonNull(form, "form");
  }

  /** @return the fill type of a {@link Form#TYPE_CHILD} fill, or null */
  public String getType() {
    return type;
  }

  public void setType(String type) {
    this.type = type;
  }

  /** @return the value of a {@link Form#VALUE} fill ({@code yes}, {@code no}, {@code solid}) */
  public String getValue() {
    return value;
  }

  public void setValue(String value) {
    this.value = value;
  }

  public Color getColor() {
    return color;
  }

  public void setColor(Color color) {
    this.color = color;
  }

  public boolean isFilled() {
    if (form == Form.VALUE) {
      return "yes".equals(value) || "solid".equals(value);
    }
    return type != null && !"none".equals(type);
  }
}
