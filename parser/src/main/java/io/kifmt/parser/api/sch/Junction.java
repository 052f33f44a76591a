package io.kifmt.parser.api.sch;

import io.kifmt.parser.api.geom.Coord;
import io.kifmt.parser.api.geom.Point;
import io.kifmt.parser.api.model.Color;
import io.kifmt.parser.api.model.Element;
import io.kifmt.parser.api.model.UuidRef;

/** A wire junction dot. */
public class Junction extends Element {
  private Point position;
  private Coord diameter;
  private Color color;
  private UuidRef uuid;

  public Point getPosition() {
    return position;
  }

  public void setPosition(Point position) {
    this.position = position;
  }

  public Coord getDiameter() {
    return diameter;
  }

  public void setDiameter(Coord diameter) {
    this.diameter = diameter;
  }

  public Color getColor() {
    return color;
  }

  public void setColor(Color color) {
    this.color = color;
  }

  public UuidRef getUuid() {
    return uuid;
  }

  public void setUuid(UuidRef uuid) {
    this.uuid = uuid;
  }
}
