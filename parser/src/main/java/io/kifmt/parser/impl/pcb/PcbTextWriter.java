package io.kifmt.parser.impl.pcb;

import io.kifmt.parser.api.pcb.PcbText;
import io.kifmt.parser.internal_api.Encoders;
import io.kifmt.sexpr.Node;

public final class PcbTextWriter {
  private PcbTextWriter() {}

  public static Node write(PcbText text) {
    Node.Builder b = Node.builder(text.getToken());
    if (text.getKind() != null) {
      b.value(Encoders.word(text.getKind()));
      b.value(Encoders.text(text, "@1", text.getText()));
    } else {
      b.value(Encoders.text(text, "@0", text.getText()));
    }
    Encoders.putFlag(b, "locked", text.getLocked());
    Encoders.putFlag(b, "hide", text.getHide());
    Encoders.putFlag(b, "unlocked", text.getUnlocked());
    Encoders.putPosition(b, text.getPosition());
    if (text.getLayer() != null) {
      Node.Builder layer =
          Node.builder("layer").value(Encoders.text(text, "layer", text.getLayer()));
      if (text.isKnockout()) {
        layer.symbol("knockout");
      }
      b.child(layer.build());
    }
    Encoders.putUuid(b, text.getUuid());
    if (text.getEffects() != null) {
      b.child(Encoders.effects(text.getEffects()));
    }
    return Encoders.finish(b, text);
  }
}
