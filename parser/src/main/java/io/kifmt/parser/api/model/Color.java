package io.kifmt.parser.api.model;

/**
 * An RGBA color. Channels are clamped to 0..255 and alpha to 0..1 on construction.
 *
 * @param red red channel
 * @param green green channel
 * @param blue blue channel
 * @param alpha opacity, 0 is transparent
 */
public record Color(int red, int green, int blue, double alpha) {
  /** {@code (color 0 0 0 0)}, which KiCad uses for "no color, use the default". */
  public static final Color UNSET = new Color(0, 0, 0, 0);

  public Color {
    red = clamp(red);
    green = clamp(green);
    blue = clamp(blue);
    alpha = Double.isNaN(alpha) ? 0 : Math.max(0, Math.min(1, alpha));
  }

  private static int clamp(int channel) {
    return Math.max(0, Math.min(255, channel));
  }

  public static Color rgb(int red, int green, int blue) {
    return new Color(red, green, blue, 1);
  }

  public boolean isUnset() {
    return equals(UNSET);
  }
}
