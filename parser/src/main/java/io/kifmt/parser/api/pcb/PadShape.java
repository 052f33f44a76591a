package io.kifmt.parser.api.pcb;

/**
 * Pad outline, a view over the token kept on {@link Pad}. Trapezoid and custom shapes are kept
 * exactly as written; their details stay in the pad's raw children.
 */
public enum PadShape {
  CIRCLE("circle"),
  RECT("rect"),
  OVAL("oval"),
  TRAPEZOID("trapezoid"),
  ROUNDRECT("roundrect"),
  CUSTOM("custom"),
  UNKNOWN(null);

  private final String token;

  PadShape(String token) {
    this.token = token;
  }

  public String token() {
    return token;
  }

  public static PadShape fromToken(String token) {
    for (PadShape s : values()) {
      if (s.token != null && s.token.equals(token)) {
        return s;
      }
    }
    return UNKNOWN;
  }
}
