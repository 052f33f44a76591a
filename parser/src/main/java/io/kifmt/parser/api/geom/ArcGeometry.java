package io.kifmt.parser.api.geom;

/**
 * Center, radius and angles of a circular arc given by three points.
 *
 * <p>Angles are in degrees, measured with {@code atan2} on document coordinates. {@code sweep} is
 * signed: positive when the arc runs from start to end through increasing angles, negative
 * otherwise. Its magnitude is at most 360.
 *
 * <p>Collinear or coincident points do not define a circle. For those the result is {@linkplain
 * #degenerate() degenerate}: the center is the midpoint of start and end, and radius and sweep are
 * zero.
 *
 * @param center the arc center
 * @param radius the radius
 * @param startAngle angle of the start point around the center
 * @param endAngle angle of the end point around the center
 * @param sweep signed angle swept from start to end through the mid point
 * @param degenerate whether the points are collinear
 */
public record ArcGeometry(
    Point center,
    Coord radius,
    double startAngle,
    double endAngle,
    double sweep,
    boolean degenerate) {
  private static final double EPSILON = 1e-10;

  /**
   * Reconstructs an arc from its start, a point on it and its end.
   *
   * @param start the start point
   * @param mid any point on the arc strictly between start and end
   * @param end the end point
   * @return the arc geometry, never {@code null}
   */
  public static ArcGeometry fromThreePoints(Point start, Point mid, Point end) {
    double ax = start.xMm();
    double ay = start.yMm();
    double bx = mid.xMm();
    double by = mid.yMm();
    double cx = end.xMm();
    double cy = end.yMm();

    double d = 2 * (ax * (by - cy) + bx * (cy - ay) + cx * (ay - by));
    if (Math.abs(d) < EPSILON) {
      Point chordMid = Point.ofMm((ax + cx) / 2, (ay + cy) / 2);
      double angle = Math.toDegrees(Math.atan2(cy - ay, cx - ax));
      return new ArcGeometry(chordMid, Coord.ZERO, angle, angle, 0, true);
    }

    double a2 = ax * ax + ay * ay;
    double b2 = bx * bx + by * by;
    double c2 = cx * cx + cy * cy;
    double ux = (a2 * (by - cy) + b2 * (cy - ay) + c2 * (ay - by)) / d;
    double uy = (a2 * (cx - bx) + b2 * (ax - cx) + c2 * (bx - ax)) / d;
    double radius = Math.hypot(ax - ux, ay - uy);

    double startAngle = Math.toDegrees(Math.atan2(ay - uy, ax - ux));
    double midAngle = Math.toDegrees(Math.atan2(by - uy, bx - ux));
    double endAngle = Math.toDegrees(Math.atan2(cy - uy, cx - ux));

    double forward = normalize(endAngle - startAngle);
    double toMid = normalize(midAngle - startAngle);
    double sweep = toMid <= forward ? forward : forward - 360;

    return new ArcGeometry(
        Point.ofMm(ux, uy), Coord.fromMm(radius), startAngle, endAngle, sweep, false);
  }

  private static double normalize(double degrees) {
    double r = degrees % 360;
    return r < 0 ? r + 360 : r;
  }
}
