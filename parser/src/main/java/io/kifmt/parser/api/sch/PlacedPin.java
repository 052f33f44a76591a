package io.kifmt.parser.api.sch;

import io.kifmt.parser.api.model.Element;
import io.kifmt.parser.api.model.UuidRef;
import java.util.Objects;

/** Per-instance data of a pin of a placed symbol, {@code (pin "1" (uuid ...) (alternate "..."))}. */
public class PlacedPin extends Element {
  private String number;
  private UuidRef uuid;
  private String alternate;

  public PlacedPin(String number) {
    this.number = Objects.requireNonNull(number, "number");
  }

  public String getNumber() {
    return number;
  }

  public void setNumber(String number) {
    this.number = number;
  }

  public UuidRef getUuid() {
    return uuid;
  }

  public void setUuid(UuidRef uuid) {
    this.uuid = uuid;
  }

  public String getAlternate() {
    return alternate;
  }

  public void setAlternate(String alternate) {
    this.alternate = alternate;
  }
}
