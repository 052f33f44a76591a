package io.kifmt.parser.api.model;

import io.kifmt.parser.api.geom.Coord;
import java.util.Objects;

/**
 * A drawn shape. The same hierarchy serves boards ({@code gr_*}), footprints ({@code fp_*}),
 * symbols and schematics (bare {@code polyline}, {@code rectangle}, ...); each instance keeps the
 * token it is written with.
 */
public abstract class Graphic extends Element {
  private String token;
  private Stroke stroke;
  private Fill fill;
  private String layer;
  private UuidRef uuid;
  private Flag locked;
  private Coord width;

  protected Graphic(String token) {
    this.token = Objects.requireNonNull(token, "token");
  }

  public String getToken() {
    return token;
  }

  public void setToken(String token) {
    this.token = Objects.requireNonNull(token, "token");
  }

  public Stroke getStroke() {
    return stroke;
  }

  public void setStroke(Stroke stroke) {
    this.stroke = stroke;
  }

  public Fill getFill() {
    return fill;
  }

  public void setFill(Fill fill) {
    this.fill = fill;
  }

  /** @return the board layer; null for schematic graphics */
  public String getLayer() {
    return layer;
  }

  public void setLayer(String layer) {
    this.layer = layer;
  }

  public UuidRef getUuid() {
    return uuid;
  }

  public void setUuid(UuidRef uuid) {
    this.uuid = uuid;
  }

  public Flag getLocked() {
    return locked;
  }

  public void setLocked(Flag locked) {
    this.locked = locked;
  }

  public boolean isLocked() {
    return Flag.isSet(locked);
  }

  /** @return the legacy line width, {@code (width w)} written outside a stroke; null if absent */
  public Coord getWidth() {
    return width;
  }

  public void setWidth(Coord width) {
    this.width = width;
  }

  /** @return the stroke width, falling back to the legacy width, or null if neither is set */
  public Coord strokeWidth() {
    if (stroke != null && stroke.getWidth() != null) {
      return stroke.getWidth();
    }
    return width;
  }
}
