package io.kifmt.parser.api.pcb;

import io.kifmt.parser.api.geom.Coord;
import io.kifmt.parser.api.geom.Point;
import io.kifmt.parser.api.geom.Position;
import io.kifmt.parser.api.model.Element;
import io.kifmt.parser.api.model.Flag;
import io.kifmt.parser.api.model.UuidRef;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A footprint pad.
 *
 * <p>Type and shape are kept as the tokens read from the file, so spellings this library does not
 * know survive a round trip. {@link #getType()} and {@link #getShape()} are views over them.
 */
public class Pad extends Element {
  private String number;
  private String typeToken;
  private String shapeToken;
  private Position position;
  private Point size;
  private Drill drill;
  private final List<String> layers = new ArrayList<>();
  private Flag locked;
  private Double roundrectRatio;
  private Integer netNumber;
  private String netName;
  private String pinFunction;
  private String pinType;
  private Coord clearance;
  private Coord solderMaskMargin;
  private Coord solderPasteMargin;
  private Integer zoneConnectCode;
  private Coord thermalBridgeWidth;
  private Coord thermalGap;
  private UuidRef uuid;

  public Pad(String number, String typeToken, String shapeToken) {
    this.number = Objects.requireNonNull(number, "number");
    this.typeToken = Objects.requireNonNull(typeToken, "typeToken");
    this.shapeToken = Objects.requireNonNull(shapeToken, "shapeToken");
  }

  public Pad(String number, PadType type, PadShape shape) {
    this(number, type.token(), shape.token());
  }

  /** @return the pad number, possibly empty for mechanical pads */
  public String getNumber() {
    return number;
  }

  public void setNumber(String number) {
    this.number = number;
  }

  public String getTypeToken() {
    return typeToken;
  }

  public void setTypeToken(String typeToken) {
    this.typeToken = typeToken;
  }

  public String getShapeToken() {
    return shapeToken;
  }

  public void setShapeToken(String shapeToken) {
    this.shapeToken = shapeToken;
  }

  public Position getPosition() {
    return position;
  }

  public void setPosition(Position position) {
    this.position = position;
  }

  public Point getSize() {
    return size;
  }

  public void setSize(Point size) {
    this.size = size;
  }

  public Drill getDrill() {
    return drill;
  }

  public void setDrill(Drill drill) {
    this.drill = drill;
  }

  public List<String> getLayers() {
    return layers;
  }

  public Flag getLocked() {
    return locked;
  }

  public void setLocked(Flag locked) {
    this.locked = locked;
  }

  /** @return {@code roundrect_rratio}, corner radius over the smaller size */
  public Double getRoundrectRatio() {
    return roundrectRatio;
  }

  public void setRoundrectRatio(Double roundrectRatio) {
    this.roundrectRatio = roundrectRatio;
  }

  public Integer getNetNumber() {
    return netNumber;
  }

  public void setNetNumber(Integer netNumber) {
    this.netNumber = netNumber;
  }

  public String getNetName() {
    return netName;
  }

  public void setNetName(String netName) {
    this.netName = netName;
  }

  public String getPinFunction() {
    return pinFunction;
  }

  public void setPinFunction(String pinFunction) {
    this.pinFunction = pinFunction;
  }

  public String getPinType() {
    return pinType;
  }

  public void setPinType(String pinType) {
    this.pinType = pinType;
  }

  public Coord getClearance() {
    return clearance;
  }

  public void setClearance(Coord clearance) {
    this.clearance = clearance;
  }

  public Coord getSolderMaskMargin() {
    return solderMaskMargin;
  }

  public void setSolderMaskMargin(Coord solderMaskMargin) {
    this.solderMaskMargin = solderMaskMargin;
  }

  public Coord getSolderPasteMargin() {
    return solderPasteMargin;
  }

  public void setSolderPasteMargin(Coord solderPasteMargin) {
    this.solderPasteMargin = solderPasteMargin;
  }

  /** @return the raw {@code zone_connect} code; null if absent */
  public Integer getZoneConnectCode() {
    return zoneConnectCode;
  }

  public void setZoneConnectCode(Integer zoneConnectCode) {
    this.zoneConnectCode = zoneConnectCode;
  }

  public Coord getThermalBridgeWidth() {
    return thermalBridgeWidth;
  }

  public void setThermalBridgeWidth(Coord thermalBridgeWidth) {
    this.thermalBridgeWidth = thermalBridgeWidth;
  }

  public Coord getThermalGap() {
    return thermalGap;
  }

  public void setThermalGap(Coord thermalGap) {
    this.thermalGap = thermalGap;
  }

  public UuidRef getUuid() {
    return uuid;
  }

  public void setUuid(UuidRef uuid) {
    this.uuid = uuid;
  }

  public PadType getType() {
    return PadType.fromToken(typeToken);
  }

  public PadShape getShape() {
    return PadShape.fromToken(shapeToken);
  }

  public ZoneConnection getZoneConnection() {
    return ZoneConnection.fromCode(zoneConnectCode);
  }

  public boolean isLocked() {
    return Flag.isSet(locked);
  }

  @Override
  public String toString() {
    return "Pad{" + number + " " + typeToken + " " + shapeToken + "}";
  }
}
