package io.kifmt.parser.api.model;

import io.kifmt.parser.api.geom.Coord;
import java.util.Objects;

/**
 * Sheet size: {@code (paper "A4")}, {@code (paper "A3" portrait)} or {@code (paper "User" w h)}.
 */
public class Paper extends Element {
  public static final String USER = "User";

  private String size;
  private Coord width;
  private Coord height;
  private boolean portrait;

  public Paper(String size) {
    this.size = Objects.requireNonNull(size, "size");
  }

  public static Paper user(Coord width, Coord height) {
    Paper paper = new Paper(USER);
    paper.width = width;
    paper.height = height;
    return paper;
  }

  public String getSize() {
    return size;
  }

  public void setSize(String size) {
    this.size = Objects.requireNonNull(size, "size");
  }

  /** @return the width of a {@code User} sheet, otherwise null */
  public Coord getWidth() {
    return width;
  }

  public void setWidth(Coord width) {
    this.width = width;
  }

  public Coord getHeight() {
    return height;
  }

  public void setHeight(Coord height) {
    this.height = height;
  }

  public boolean isPortrait() {
    return portrait;
  }

  public void setPortrait(boolean portrait) {
    this.portrait = portrait;
  }
}
