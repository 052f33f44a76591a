package io.kifmt.parser.api.pcb;

import io.kifmt.parser.api.geom.Coord;
import io.kifmt.parser.api.model.Element;
import io.kifmt.parser.api.model.Flag;
import io.kifmt.parser.api.model.UuidRef;
import java.util.ArrayList;
import java.util.List;

/**
 * A copper zone or rule area.
 *
 * <p>Keepout settings, pad connection settings and other zone options stay in the raw children.
 */
public class Zone extends Element {
  private Integer net;
  private String netName;
  private final List<String> layers = new ArrayList<>();
  private boolean multiLayer;
  private UuidRef uuid;
  private String name;
  private String hatchStyle;
  private Coord hatchPitch;
  private Integer priority;
  private Coord minThickness;
  private ZoneFill fill;
  private final List<ZonePolygon> outlines = new ArrayList<>();
  private final List<ZonePolygon> filledPolygons = new ArrayList<>();
  private Flag locked;

  public Integer getNet() {
    return net;
  }

  public void setNet(Integer net) {
    this.net = net;
  }

  public String getNetName() {
    return netName;
  }

  public void setNetName(String netName) {
    this.netName = netName;
  }

  public List<String> getLayers() {
    return layers;
  }

  /** @return whether layers were written as {@code (layers ...)} rather than {@code (layer ...)} */
  public boolean isMultiLayer() {
    return multiLayer;
  }

  public void setMultiLayer(boolean multiLayer) {
    this.multiLayer = multiLayer;
  }

  public UuidRef getUuid() {
    return uuid;
  }

  public void setUuid(UuidRef uuid) {
    this.uuid = uuid;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getHatchStyle() {
    return hatchStyle;
  }

  public void setHatchStyle(String hatchStyle) {
    this.hatchStyle = hatchStyle;
  }

  public Coord getHatchPitch() {
    return hatchPitch;
  }

  public void setHatchPitch(Coord hatchPitch) {
    this.hatchPitch = hatchPitch;
  }

  public Integer getPriority() {
    return priority;
  }

  public void setPriority(Integer priority) {
    this.priority = priority;
  }

  public Coord getMinThickness() {
    return minThickness;
  }

  public void setMinThickness(Coord minThickness) {
    this.minThickness = minThickness;
  }

  public ZoneFill getFill() {
    return fill;
  }

  public void setFill(ZoneFill fill) {
    this.fill = fill;
  }

  public List<ZonePolygon> getOutlines() {
    return outlines;
  }

  public List<ZonePolygon> getFilledPolygons() {
    return filledPolygons;
  }

  public Flag getLocked() {
    return locked;
  }

  public void setLocked(Flag locked) {
    this.locked = locked;
  }
}
