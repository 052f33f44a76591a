package io.kifmt.parser.api.model;

import io.kifmt.parser.api.geom.Coord;

/** The {@code (font ...)} part of {@link TextEffects}. */
public class Font extends Element {
  private String face;
  private Coord height;
  private Coord width;
  private Coord thickness;
  private Flag bold;
  private Flag italic;
  private Double lineSpacing;
  private Color color;

  public Font() {}

  public Font(Coord height, Coord width) {
    this.height = height;
    this.width = width;
  }

  public String getFace() {
    return face;
  }

  public void setFace(String face) {
    this.face = face;
  }

  /** Height from {@code (size h w)}; null when the size is absent. */
  public Coord getHeight() {
    return height;
  }

  public void setHeight(Coord height) {
    this.height = height;
  }

  public Coord getWidth() {
    return width;
  }

  public void setWidth(Coord width) {
    this.width = width;
  }

  public Coord getThickness() {
    return thickness;
  }

  public void setThickness(Coord thickness) {
    this.thickness = thickness;
  }

  public Flag getBold() {
    return bold;
  }

  public void setBold(Flag bold) {
    this.bold = bold;
  }

  public boolean isBold() {
    return Flag.isSet(bold);
  }

  public Flag getItalic() {
    return italic;
  }

  public void setItalic(Flag italic) {
    this.italic = italic;
  }

  public boolean isItalic() {
    return Flag.isSet(italic);
  }

  public Double getLineSpacing() {
    return lineSpacing;
  }

  public void setLineSpacing(Double lineSpacing) {
    this.lineSpacing = lineSpacing;
  }

  public Color getColor() {
    return color;
  }

  public void setColor(Color color) {
    this.color = color;
  }
}
