package io.kifmt.parser.api.pcb;

import io.kifmt.parser.api.model.Element;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** A legacy net class, {@code (net_class "name" "description" ... (add_net "n"))}. Design rule values stay raw. */
public class NetClass extends Element {
  private String name;
  private String description;
  private final List<String> nets = new ArrayList<>();

  public NetClass(String name) {
    this.name = Objects.requireNonNull(name, "name");
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public List<String> getNets() {
    return nets;
  }
}
