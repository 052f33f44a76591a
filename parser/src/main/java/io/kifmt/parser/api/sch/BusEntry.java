package io.kifmt.parser.api.sch;

import io.kifmt.parser.api.geom.Point;
import io.kifmt.parser.api.model.Element;
import io.kifmt.parser.api.model.Stroke;
import io.kifmt.parser.api.model.UuidRef;

/** A bus entry: position and size of the diagonal stub. */
public class BusEntry extends Element {
  private Point position;
  private Point size;
  private Stroke stroke;
  private UuidRef uuid;

  public Point getPosition() {
    return position;
  }

  public void setPosition(Point position) {
    this.position = position;
  }

  public Point getSize() {
    return size;
  }

  public void setSize(Point size) {
    this.size = size;
  }

  public Stroke getStroke() {
    return stroke;
  }

  public void setStroke(Stroke stroke) {
    this.stroke = stroke;
  }

  public UuidRef getUuid() {
    return uuid;
  }

  public void setUuid(UuidRef uuid) {
    this.uuid = uuid;
  }
}
