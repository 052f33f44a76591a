package io.kifmt.parser.api.pcb;

import io.kifmt.parser.api.geom.Coord;
import io.kifmt.parser.api.geom.Point;
import io.kifmt.parser.api.model.Element;

/**
 * Pad drill: {@code (drill d)}, {@code (drill oval w h)}, optionally with {@code (offset x y)}.
 */
public class Drill extends Element {
  private boolean oval;
  private Coord diameter;
  private Coord height;
  private Point offset;

  public Drill() {}

  public Drill(Coord diameter) {
    this.diameter = diameter;
  }

  public boolean isOval() {
    return oval;
  }

  public void setOval(boolean oval) {
    this.oval = oval;
  }

  /** @return the hole diameter, or the slot width of an oval drill */
  public Coord getDiameter() {
    return diameter;
  }

  public void setDiameter(Coord diameter) {
    this.diameter = diameter;
  }

  /** @return the slot height of an oval drill; null for round holes */
  public Coord getHeight() {
    return height;
  }

  public void setHeight(Coord height) {
    this.height = height;
  }

  public Point getOffset() {
    return offset;
  }

  public void setOffset(Point offset) {
    this.offset = offset;
  }
}
