package io.kifmt.parser.api.pcb;

/** Pad kind, a view over the token kept on {@link Pad}. */
public enum PadType {
  THRU_HOLE("thru_hole"),
  SMD("smd"),
  CONNECT("connect"),
  NP_THRU_HOLE("np_thru_hole"),
  UNKNOWN(null);

  private final String token;

  PadType(String token) {
    this.token = token;
  }

  /** @return the file token, or null for {@link #UNKNOWN} */
  public String token() {
    return token;
  }

  public static PadType fromToken(String token) {
    for (PadType t : values()) {
      if (t.token != null && t.token.equals(token)) {
        return t;
      }
    }
    return UNKNOWN;
  }
}
