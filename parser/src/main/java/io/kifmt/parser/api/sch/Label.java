package io.kifmt.parser.api.sch;

import io.kifmt.parser.api.geom.Position;
import io.kifmt.parser.api.model.Element;
import io.kifmt.parser.api.model.Flag;
import io.kifmt.parser.api.model.Property;
import io.kifmt.parser.api.model.TextEffects;
import io.kifmt.parser.api.model.UuidRef;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A net label: local ({@code label}), global ({@code global_label}) or hierarchical ({@code
 * hierarchical_label}). Global and hierarchical labels carry a {@link #getShape() shape}.
 */
public class Label extends Element {
  public static final String LOCAL = "label";
  public static final String GLOBAL = "global_label";
  public static final String HIERARCHICAL = "hierarchical_label";

  private String token;
  private String text;
  private Position position;
  private String shape;
  private Flag fieldsAutoplaced;
  private TextEffects effects;
  private UuidRef uuid;
  private final List<Property> properties = new ArrayList<>();

  public Label(String token, String text) {
    this.token = Objects.requireNonNull(token, "token");
    this.text = Objects.requireNonNull(text, "text");
  }

  public String getToken() {
    return token;
  }

  public void setToken(String token) {
    this.token = token;
  }

  public String getText() {
    return text;
  }

  public void setText(String text) {
    this.text = text;
  }

  public Position getPosition() {
    return position;
  }

  public void setPosition(Position position) {
    this.position = position;
  }

  /** @return the port shape such as {@code input}; null for local labels */
  public String getShape() {
    return shape;
  }

  public void setShape(String shape) {
    this.shape = shape;
  }

  public Flag getFieldsAutoplaced() {
    return fieldsAutoplaced;
  }

  public void setFieldsAutoplaced(Flag fieldsAutoplaced) {
    this.fieldsAutoplaced = fieldsAutoplaced;
  }

  public TextEffects getEffects() {
    return effects;
  }

  public void setEffects(TextEffects effects) {
    this.effects = effects;
  }

  public UuidRef getUuid() {
    return uuid;
  }

  public void setUuid(UuidRef uuid) {
    this.uuid = uuid;
  }

  public List<Property> getProperties() {
    return properties;
  }

  public boolean isGlobal() {
    return GLOBAL.equals(token);
  }

  public boolean isHierarchical() {
    return HIERARCHICAL.equals(token);
  }
}
