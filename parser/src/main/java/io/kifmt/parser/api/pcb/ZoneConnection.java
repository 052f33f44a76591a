package io.kifmt.parser.api.pcb;

/**
 * How a pad connects to a surrounding copper zone, from {@code (zone_connect n)}.
 *
 * <p>A missing or unrecognized code reads as {@link #INHERITED}; the code itself is kept on the
 * owner so it is written back unchanged.
 */
public enum ZoneConnection {
  INHERITED(-1),
  NONE(0),
  THERMAL_RELIEF(1),
  SOLID(2),
  THT_THERMAL(3);

  private final int code;

  ZoneConnection(int code) {
    this.code = code;
  }

  /** @return the file code, -1 for {@link #INHERITED} */
  public int code() {
    return code;
  }

  public static ZoneConnection fromCode(Integer code) {
    if (code == null) {
      return INHERITED;
    }
    for (ZoneConnection c : values()) {
      if (c != INHERITED && c.code == code) {
        return c;
      }
    }
    return INHERITED;
  }
}
