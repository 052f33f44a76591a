package io.kifmt.parser.api.pcb;

/** Via kind. A through via has no type word in the file. */
public enum ViaType {
  THROUGH(null),
  BLIND("blind"),
  BURIED("buried"),
  MICRO("micro"),
  UNKNOWN(null);

  private final String token;

  ViaType(String token) {
    this.token = token;
  }

  public String token() {
    return token;
  }

  /**
   * Maps the type word of a via.
   *
   * @param token the word, or null if the via has none
   * @return the type
   */
  public static ViaType fromToken(String token) {
    if (token == null) {
      return THROUGH;
    }
    for (ViaType t : values()) {
      if (token.equals(t.token)) {
        return t;
      }
    }
    return UNKNOWN;
  }
}
