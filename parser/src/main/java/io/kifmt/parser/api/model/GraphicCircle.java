package io.kifmt.parser.api.model;

import io.kifmt.parser.api.geom.Coord;
import io.kifmt.parser.api.geom.Point;

/**
 * A circle. Boards and footprints give a point on the circle ({@code (end x y)}); symbols and
 * schematics give the radius ({@code (radius r)}). Exactly one of the two is normally set.
 */
public class GraphicCircle extends Graphic {
  private Point center;
  private Point end;
  private Coord radius;

  public GraphicCircle(String token, Point center) {
    super(token);
    this.center = center;
  }

  public Point getCenter() {
    return center;
  }

  public void setCenter(Point center) {
    this.center = center;
  }

  public Point getEnd() {
    return end;
  }

  public void setEnd(Point end) {
    this.end = end;
  }

  public Coord getRadius() {
    return radius;
  }

  public void setRadius(Coord radius) {
    this.radius = radius;
  }

  /** @return the radius, computed from the end point when no explicit radius is set */
  public Coord effectiveRadius() {
    if (radius != null) {
      return radius;
    }
    if (center == null || end == null) {
      return Coord.ZERO;
    }
    return Coord.fromMm(Math.hypot(end.xMm() - center.xMm(), end.yMm() - center.yMm()));
  }
}
