package io.kifmt.parser.api.pcb;

import io.kifmt.parser.api.model.Element;
import java.util.Objects;

/** One entry of the board layer table, {@code (0 "F.Cu" signal ["user name"])}. */
public class LayerDefinition extends Element {
  private int ordinal;
  private String name;
  private String type;
  private String userName;

  public LayerDefinition(int ordinal, String name, String type) {
    this.ordinal = ordinal;
    this.name = Objects.requireNonNull(name, "name");
    this.type = Objects.requireNonNull(type, "type");
  }

  public int getOrdinal() {
    return ordinal;
  }

  public void setOrdinal(int ordinal) {
    this.ordinal = ordinal;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getType() {
    return type;
  }

  public void setType(String type) {
    this.type = type;
  }

  public String getUserName() {
    return userName;
  }

  public void setUserName(String userName) {
    this.userName = userName;
  }
}
