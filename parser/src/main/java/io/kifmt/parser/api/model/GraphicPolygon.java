package io.kifmt.parser.api.model;

import io.kifmt.parser.api.geom.Point;
import java.util.ArrayList;
import java.util.List;

/** A polygon or open polyline: {@code gr_poly}, {@code fp_poly}, symbol {@code polyline}. */
public class GraphicPolygon extends Graphic {
  private final List<Point> points = new ArrayList<>();

  public GraphicPolygon(String token) {
    super(token);
  }

  public GraphicPolygon(String token, List<Point> points) {
    super(token);
    this.points.addAll(points);
  }

  /** @return the points, mutable */
  public List<Point> getPoints() {
    return points;
  }
}
