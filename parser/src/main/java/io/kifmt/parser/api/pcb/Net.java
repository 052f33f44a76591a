package io.kifmt.parser.api.pcb;

import io.kifmt.parser.api.model.Element;
import java.util.Objects;

/** A board net, {@code (net n "name")}. */
public class Net extends Element {
  private int number;
  private String name;

  public Net(int number, String name) {
    this.number = number;
    this.name = Objects.requireNonNull(name, "name");
  }

  public int getNumber() {
    return number;
  }

  public void setNumber(int number) {
    this.number = number;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  @Override
  public String toString() {
    return number + ":" + name;
  }
}
