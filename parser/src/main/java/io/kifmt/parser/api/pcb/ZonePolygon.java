package io.kifmt.parser.api.pcb;

import io.kifmt.parser.api.geom.Point;
import io.kifmt.parser.api.model.Element;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** A zone outline, {@code (polygon (pts ...))}, or a filled area, {@code (filled_polygon (layer) (pts ...))}. */
public class ZonePolygon extends Element {
  private String token;
  private String layer;
  private final List<Point> points = new ArrayList<>();

  public ZonePolygon(String token) {
    this.token = Objects.requireNonNull(token, "token");
  }

  public String getToken() {
    return token;
  }

  public void setToken(String token) {
    this.token = token;
  }

  public String getLayer() {
    return layer;
  }

  public void setLayer(String layer) {
    this.layer = layer;
  }

  public List<Point> getPoints() {
    return points;
  }
}
