package io.kifmt.parser.api.geom;

import java.util.Objects;

/**
 * A point in document coordinates. KiCad's Y axis points down.
 *
 * @param x the horizontal coordinate
 * @param y the vertical coordinate
 */
public record Point(Coord x, Coord y) {
  public static final Point ZERO = new Point(Coord.ZERO, Coord.ZERO);

  public Point {
    Objects.requireNonNull(x, "x");
    Objects.requireNonNull(y, "y");
  }

  public static Point ofMm(double x, double y) {
    return new Point(Coord.fromMm(x), Coord.fromMm(y));
  }

  public double xMm() {
    return x.toMm();
  }

  public double yMm() {
    return y.toMm();
  }

  public Point plus(Point other) {
    return new Point(x.plus(other.x), y.plus(other.y));
  }

  public Point minus(Point other) {
    return new Point(x.minus(other.x), y.minus(other.y));
  }

  @Override
  public String toString() {
    return "(" + xMm() + ", " + yMm() + ")";
  }
}
