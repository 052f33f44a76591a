package io.kifmt.parser.api.pcb;

import io.kifmt.parser.api.geom.Coord;
import io.kifmt.parser.api.geom.Point;
import io.kifmt.parser.api.model.Element;
import io.kifmt.parser.api.model.Flag;
import io.kifmt.parser.api.model.UuidRef;

/** A straight copper segment, {@code (segment ...)}. */
public class Track extends Element {
  private Point start;
  private Point end;
  private Coord width;
  private String layer;
  private Integer net;
  private UuidRef uuid;
  private Flag locked;

  public Track() {}

  public Track(Point start, Point end, Coord width, String layer) {
    this.start = start;
    this.end = end;
    this.width = width;
    this.layer = layer;
  }

  public Point getStart() {
    return start;
  }

  public void setStart(Point start) {
    this.start = start;
  }

  public Point getEnd() {
    return end;
  }

  public void setEnd(Point end) {
    this.end = end;
  }

  public Coord getWidth() {
    return width;
  }

  public void setWidth(Coord width) {
    this.width = width;
  }

  public String getLayer() {
    return layer;
  }

  public void setLayer(String layer) {
    this.layer = layer;
  }

  public Integer getNet() {
    return net;
  }

  public void setNet(Integer net) {
    this.net = net;
  }

  public UuidRef getUuid() {
    return uuid;
  }

  public void setUuid(UuidRef uuid) {
    this.uuid = uuid;
  }

  public Flag getLocked() {
    return locked;
  }

  public void setLocked(Flag locked) {
    this.locked = locked;
  }

  public boolean isLocked() {
    return Flag.isSet(locked);
  }
}
