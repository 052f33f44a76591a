package io.kifmt.parser.api.pcb;

import io.kifmt.parser.api.geom.ArcGeometry;
import io.kifmt.parser.api.geom.Coord;
import io.kifmt.parser.api.geom.Point;
import io.kifmt.parser.api.model.Element;
import io.kifmt.parser.api.model.Flag;
import io.kifmt.parser.api.model.UuidRef;

/** A curved copper track, {@code (arc (start) (mid) (end) ...)}. */
public class TrackArc extends Element {
  private Point start;
  private Point mid;
  private Point end;
  private Coord width;
  private String layer;
  private Integer net;
  private UuidRef uuid;
  private Flag locked;

  public Point getStart() {
    return start;
  }

  public void setStart(Point start) {
    this.start = start;
  }

  public Point getMid() {
    return mid;
  }

  public void setMid(Point mid) {
    this.mid = mid;
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

  /** @return center, radius and sweep; null if a point is missing */
  public ArcGeometry geometry() {
    if (start == null || mid == null || end == null) {
      return null;
    }
    return ArcGeometry.fromThreePoints(start, mid, end);
  }
}
