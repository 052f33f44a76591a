package io.kifmt.parser.api.sch;

import io.kifmt.parser.api.geom.Point;
import io.kifmt.parser.api.model.Element;
import io.kifmt.parser.api.model.UuidRef;

/** A no-connect marker. */
public class NoConnect extends Element {
  private Point position;
  private UuidRef uuid;

  public Point getPosition() {
    return position;
  }

  public void setPosition(Point position) {
    this.position = position;
  }

  public UuidRef getUuid() {
    return uuid;
  }

  public void setUuid(UuidRef uuid) {
    this.uuid = uuid;
  }
}
