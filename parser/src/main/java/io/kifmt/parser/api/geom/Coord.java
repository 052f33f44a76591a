package io.kifmt.parser.api.geom;

/**
 * A fixed-point length.
 *
 * <p>One millimeter is {@value #UNITS_PER_MM_NUMERATOR}/25.4 units, so one unit is 2.54e-6 mm
 * and one mil is exactly 10,000 units. Converting a millimeter value to a coordinate and back loses
 * at most one unit.
 *
 * @param units the length in internal units
 */
public record Coord(long units) implements Comparable<Coord> {
  static final double UNITS_PER_MM_NUMERATOR = 10_000_000.0;

  /** Units per millimeter, about 393,700.8. */
  public static final double UNITS_PER_MM = UNITS_PER_MM_NUMERATOR / 25.4;

  public static final Coord ZERO = new Coord(0);

  public static Coord ofUnits(long units) {
    return units == 0 ? ZERO : new Coord(units);
  }

  /**
   * Converts millimeters to the nearest coordinate.
   *
   * @param mm the length in millimeters
   * @return the coordinate
   */
  public static Coord fromMm(double mm) {
    if (Double.isNaN(mm) || Double.isInfinite(mm)) {
      throw new IllegalArgumentException("Not a finite length: " + mm);
    }
    return ofUnits(Math.round(mm * UNITS_PER_MM));
  }

  public double toMm() {
    return units / UNITS_PER_MM;
  }

  public Coord plus(Coord other) {
    return ofUnits(Math.addExact(units, other.units));
  }

  public Coord minus(Coord other) {
    return ofUnits(Math.subtractExact(units, other.units));
  }

  public Coord negate() {
    return ofUnits(-units);
  }

  public boolean isZero() {
    return units == 0;
  }

  @Override
  public int compareTo(Coord o) {
    return Long.compare(units, o.units);
  }

  @Override
  public String toString() {
    return toMm() + "mm";
  }
}
