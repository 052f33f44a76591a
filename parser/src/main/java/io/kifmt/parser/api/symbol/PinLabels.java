package io.kifmt.parser.api.symbol;

import io.kifmt.parser.api.geom.Coord;
import io.kifmt.parser.api.model.Element;
import io.kifmt.parser.api.model.Flag;

/**
 * Pin name or pin number display settings of a symbol: {@code (pin_names (offset 0.5) hide)} or,
 * since KiCad 9, {@code (pin_numbers (hide yes))}.
 */
public class PinLabels extends Element {
  private Coord offset;
  private Flag hide;

  /** @return the pin name offset; null if absent */
  public Coord getOffset() {
    return offset;
  }

  public void setOffset(Coord offset) {
    this.offset = offset;
  }

  public Flag getHide() {
    return hide;
  }

  public void setHide(Flag hide) {
    this.hide = hide;
  }

  public boolean isHidden() {
    return Flag.isSet(hide);
  }
}
