package io.kifmt.parser.api.geom;

import java.util.Objects;

/**
 * The content of an {@code (at x y [angle])} node.
 *
 * <p>{@code hasAngle} tells whether the angle was written. It is set for every position read with
 * three numbers, even a zero angle, and writers emit the angle only when it is set. {@code
 * unlocked} records the legacy {@code unlocked} marker some footprint texts carry inside their
 * position.
 *
 * @param point the location
 * @param angle the rotation in degrees, 0 when absent
 * @param hasAngle whether the angle was present
 * @param unlocked whether the legacy {@code unlocked} marker was present
 */
public record Position(Point point, double angle, boolean hasAngle, boolean unlocked) {
  public Position {
    Objects.requireNonNull(point, "point");
    if (!hasAngle && angle != 0) {
      throw new IllegalArgumentException("Angle " + angle + " given without hasAngle");
    }
  }

  /** A position without an angle. */
  public static Position of(Point point) {
    return new Position(point, 0, false, false);
  }

  /** A position with an explicit angle. */
  public static Position of(Point point, double angle) {
    return new Position(point, angle, true, false);
  }

  public static Position ofMm(double x, double y) {
    return of(Point.ofMm(x, y));
  }

  public static Position ofMm(double x, double y, double angle) {
    return of(Point.ofMm(x, y), angle);
  }

  /** Returns a copy with the given angle, which is then always written. */
  public Position withAngle(double newAngle) {
    return new Position(point, newAngle, true, unlocked);
  }

  public Position withPoint(Point newPoint) {
    return new Position(newPoint, angle, hasAngle, unlocked);
  }
}
