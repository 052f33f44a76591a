package io.kifmt.parser.api.sch;

import io.kifmt.parser.api.geom.Point;
import io.kifmt.parser.api.model.Element;
import io.kifmt.parser.api.model.Fill;
import io.kifmt.parser.api.model.Flag;
import io.kifmt.parser.api.model.Property;
import io.kifmt.parser.api.model.Stroke;
import io.kifmt.parser.api.model.UuidRef;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** A hierarchical sheet. Its name and file are the {@code Sheetname} and {@code Sheetfile} properties. */
public class Sheet extends Element {
  private Point position;
  private Point size;
  private Flag fieldsAutoplaced;
  private Stroke stroke;
  private Fill fill;
  private UuidRef uuid;
  private final List<Property> properties = new ArrayList<>();
  private final List<SheetPin> pins = new ArrayList<>();

  public Point getPosition() {
    return position;
  }

  public void setPosition(Point position) {
    this.position = position;
  }

  public Point getSize() {
    return size;
  }

  public void setSize(Point size) {
    this.size = size;
  }

  public Flag getFieldsAutoplaced() {
    return fieldsAutoplaced;
  }

  public void setFieldsAutoplaced(Flag fieldsAutoplaced) {
    this.fieldsAutoplaced = fieldsAutoplaced;
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

  public UuidRef getUuid() {
    return uuid;
  }

  public void setUuid(UuidRef uuid) {
    this.uuid = uuid;
  }

  public List<Property> getProperties() {
    return properties;
  }

  public List<SheetPin> getPins() {
    return pins;
  }

  public Optional<String> sheetName() {
    return propertyValue("Sheetname", "Sheet name");
  }

  public Optional<String> sheetFile() {
    return propertyValue("Sheetfile", "Sheet file");
  }

  private Optional<String> propertyValue(String name, String altName) {
    for (Property p : properties) {
      if (p.getName().equals(name) || p.getName().equals(altName)) {
        return Optional.of(p.getValue());
      }
    }
    return Optional.empty();
  }
}
