package io.kifmt.parser.api.symbol;

import io.kifmt.parser.api.geom.Coord;
import io.kifmt.parser.api.geom.Position;
import io.kifmt.parser.api.model.Element;
import io.kifmt.parser.api.model.Flag;
import io.kifmt.parser.api.model.TextEffects;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A symbol pin: {@code (pin type style (at x y angle) (length l) (name "..." (effects ...)) (number
 * "..." (effects ...)))}.
 *
 * <p>The electrical type and graphic style are kept as written, for example {@code passive} and
 * {@code line}.
 */
public class Pin extends Element {
  private String electricalType;
  private String graphicStyle;
  private Position position;
  private Coord length;
  private Flag hide;
  private String name;
  private TextEffects nameEffects;
  private String number;
  private TextEffects numberEffects;
  private final List<PinAlternate> alternates = new ArrayList<>();

  public Pin(String electricalType, String graphicStyle) {
    this.electricalType = Objects.requireNonNull(electricalType, "electricalType");
    this.graphicStyle = Objects.requireNonNull(graphicStyle, "graphicStyle");
  }

  public String getElectricalType() {
    return electricalType;
  }

  public void setElectricalType(String electricalType) {
    this.electricalType = electricalType;
  }

  public String getGraphicStyle() {
    return graphicStyle;
  }

  public void setGraphicStyle(String graphicStyle) {
    this.graphicStyle = graphicStyle;
  }

  public Position getPosition() {
    return position;
  }

  public void setPosition(Position position) {
    this.position = position;
  }

  public Coord getLength() {
    return length;
  }

  public void setLength(Coord length) {
    this.length = length;
  }

  public Flag getHide() {
    return hide;
  }

  public void setHide(Flag hide) {
    this.hide = hide;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public TextEffects getNameEffects() {
    return nameEffects;
  }

  public void setNameEffects(TextEffects nameEffects) {
    this.nameEffects = nameEffects;
  }

  public String getNumber() {
    return number;
  }

  public void setNumber(String number) {
    this.number = number;
  }

  public TextEffects getNumberEffects() {
    return numberEffects;
  }

  public void setNumberEffects(TextEffects numberEffects) {
    this.numberEffects = numberEffects;
  }

  public List<PinAlternate> getAlternates() {
    return alternates;
  }

  public boolean isHidden() {
    return Flag.isSet(hide);
  }

  /** @return the direction the pin points to, from the angle of its position */
  public PinOrientation orientation() {
    return PinOrientation.fromAngle(position == null ? 0 : position.angle());
  }

  @Override
  public String toString() {
    return "Pin{" + number + " " + name + " " + electricalType + "}";
  }
}
