package io.kifmt.parser.api.model;

import io.kifmt.parser.api.geom.Coord;

/** Line style: {@code (stroke (width w) (type t) (color r g b a))}. Absent parts are null. */
public class Stroke extends Element {
  private Coord width;
  private String type;
  private Color color;

  public Stroke() {}

  public Stroke(Coord width, String type) {
    this.width = width;
    this.type = type;
  }

  public Coord getWidth() {
    return width;
  }

  public void setWidth(Coord width) {
    this.width = width;
  }

  /** @return the line type token, such as {@code solid}, {@code dash} or {@code default} */
  public String getType() {
    return type;
  }

  public void setType(String type) {
    this.type = type;
  }

  public Color getColor() {
    return color;
  }

  public void setColor(Color color) {
    this.color = color;
  }
}
