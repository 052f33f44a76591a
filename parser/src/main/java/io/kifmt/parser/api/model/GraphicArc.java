package io.kifmt.parser.api.model;

import io.kifmt.parser.api.geom.ArcGeometry;
import io.kifmt.parser.api.geom.Point;

/** A circular arc through three points. */
public class GraphicArc extends Graphic {
  private Point start;
  private Point mid;
  private Point end;

  public GraphicArc(String token, Point start, Point mid, Point end) {
    super(token);
    this.start = start;
    this.mid = mid;
    this.end = end;
  }

  public Point getStart() {
    return start;
  }

  public void setStart(Point start) {
    this.start = start;
  }

  /** @return the mid point; null for legacy arcs given by center and angle */
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

  /**
   * Reconstructs center, radius and sweep.
   *
   * @return the arc geometry, or null if the arc has no mid point
   */
  public ArcGeometry geometry() {
    if (start == null || mid == null || end == null) {
      return null;
    }
    return ArcGeometry.fromThreePoints(start, mid, end);
  }
}
