package io.kifmt.parser.api.symbol;

/** Direction a pin extends from its connection point. */
public enum PinOrientation {
  RIGHT(0),
  UP(90),
  LEFT(180),
  DOWN(270);

  private final int angle;

  PinOrientation(int angle) {
    this.angle = angle;
  }

  public int angle() {
    return angle;
  }

  /**
   * Maps an angle to the nearest orientation.
   *
   * @param degrees the pin angle in degrees
   * @return the orientation
   */
  public static PinOrientation fromAngle(double degrees) {
    long quadrant = Math.round(degrees / 90.0);
    int index = (int) Math.floorMod(quadrant, 4L);
    return values()[index];
  }
}
