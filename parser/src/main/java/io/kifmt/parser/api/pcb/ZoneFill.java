package io.kifmt.parser.api.pcb;

import io.kifmt.parser.api.geom.Coord;
import io.kifmt.parser.api.model.Element;

/** Zone fill settings, {@code (fill [yes] (thermal_gap g) (thermal_bridge_width w) ...)}. */
public class ZoneFill extends Element {
  private Boolean filled;
  private String mode;
  private Coord thermalGap;
  private Coord thermalBridgeWidth;

  /** @return true for {@code (fill yes ...)}; null when no value was written */
  public Boolean getFilled() {
    return filled;
  }

  public void setFilled(Boolean filled) {
    this.filled = filled;
  }

  public String getMode() {
    return mode;
  }

  public void setMode(String mode) {
    this.mode = mode;
  }

  public Coord getThermalGap() {
    return thermalGap;
  }

  public void setThermalGap(Coord thermalGap) {
    this.thermalGap = thermalGap;
  }

  public Coord getThermalBridgeWidth() {
    return thermalBridgeWidth;
  }

  public void setThermalBridgeWidth(Coord thermalBridgeWidth) {
    this.thermalBridgeWidth = thermalBridgeWidth;
  }
}
