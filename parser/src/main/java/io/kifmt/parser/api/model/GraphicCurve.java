package io.kifmt.parser.api.model;

import io.kifmt.parser.api.geom.Point;
import java.util.ArrayList;
import java.util.List;

/** A cubic Bezier curve: {@code gr_curve}, {@code fp_curve}, {@code bezier}. Points are start, two controls and end. */
public class GraphicCurve extends Graphic {
  private final List<Point> points = new ArrayList<>();

  public GraphicCurve(String token) {
    super(token);
  }

  public GraphicCurve(String token, List<Point> points) {
    super(token);
    this.points.addAll(points);
  }

  /** @return the points, mutable */
  public List<Point> getPoints() {
    return points;
  }
}
