package io.kifmt.parser.api.sch;

import io.kifmt.parser.api.geom.Point;
import io.kifmt.parser.api.model.Element;
import io.kifmt.parser.api.model.Stroke;
import io.kifmt.parser.api.model.UuidRef;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** A wire, bus or graphical line in a schematic: {@code wire}, {@code bus} or {@code polyline}. */
public class Wire extends Element {
  private String token;
  private final List<Point> points = new ArrayList<>();
  private Stroke stroke;
  private UuidRef uuid;

  public Wire(String token) {
    this.token = Objects.requireNonNull(token, "token");
  }

  public String getToken() {
    return token;
  }

  public void setToken(String token) {
    this.token = token;
  }

  public List<Point> getPoints() {
    return points;
  }

  public Stroke getStroke() {
    return stroke;
  }

  public void setStroke(Stroke stroke) {
    this.stroke = stroke;
  }

  public UuidRef getUuid() {
    return uuid;
  }

  public void setUuid(UuidRef uuid) {
    this.uuid = uuid;
  }

  public boolean isBus() {
    return "bus".equals(token);
  }
}
