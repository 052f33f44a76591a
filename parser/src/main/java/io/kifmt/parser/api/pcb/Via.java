package io.kifmt.parser.api.pcb;

import io.kifmt.parser.api.geom.Coord;
import io.kifmt.parser.api.geom.Point;
import io.kifmt.parser.api.model.Element;
import io.kifmt.parser.api.model.Flag;
import io.kifmt.parser.api.model.UuidRef;
import java.util.ArrayList;
import java.util.List;

/** A via. {@link #getTypeToken()} is null for an ordinary through via. */
public class Via extends Element {
  private String typeToken;
  private Point position;
  private Coord size;
  private Coord drill;
  private final List<String> layers = new ArrayList<>();
  private Integer net;
  private Flag locked;
  private Flag free;
  private UuidRef uuid;

  public String getTypeToken() {
    return typeToken;
  }

  public void setTypeToken(String typeToken) {
    this.typeToken = typeToken;
  }

  public Point getPosition() {
    return position;
  }

  public void setPosition(Point position) {
    this.position = position;
  }

  public Coord getSize() {
    return size;
  }

  public void setSize(Coord size) {
    this.size = size;
  }

  public Coord getDrill() {
    return drill;
  }

  public void setDrill(Coord drill) {
    this.drill = drill;
  }

  public List<String> getLayers() {
    return layers;
  }

  public Integer getNet() {
    return net;
  }

  public void setNet(Integer net) {
    this.net = net;
  }

  public Flag getLocked() {
    return locked;
  }

  public void setLocked(Flag locked) {
    this.locked = locked;
  }

  public Flag getFree() {
    return free;
  }

  public void setFree(Flag free) {
    this.free = free;
  }

  public UuidRef getUuid() {
    return uuid;
  }

  public void setUuid(UuidRef uuid) {
    this.uuid = uuid;
  }

  public ViaType getType() {
    return ViaType.fromToken(typeToken);
  }
}
