package io.kifmt.parser.impl;

import io.kifmt.parser.api.model.Property;
import io.kifmt.parser.internal_api.Encoders;
import io.kifmt.sexpr.Node;

public final class PropertyWriter {
  private PropertyWriter() {}

  public static Node write(Property p) {
    Node.Builder b =
        Node.builder("property")
            .value(Encoders.text(p, "@0", p.getName()))
            .value(Encoders.text(p, "@1", p.getValue()));
    Encoders.putFlag(b, "unlocked", p.getUnlocked());
    Encoders.putFlag(b, "hide", p.getHide());
    Encoders.putInt(b, "id", p.getId());
    Encoders.putPosition(b, p.getPosition());
    Encoders.putText(b, p, "layer", p.getLayer());
    Encoders.putFlag(b, "show_name", p.getShowName());
    Encoders.putFlag(b, "do_not_autoplace", p.getDoNotAutoplace());
    Encoders.putUuid(b, p.getUuid());
    if (p.getEffects() != null) {
      b.child(Encoders.effects(p.getEffects()));
    }
    return Encoders.finish(b, p);
  }
}
