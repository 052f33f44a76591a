package io.kifmt.parser.impl.pcb;

import io.kifmt.parser.api.pcb.PcbText;
import io.kifmt.parser.internal_api.Decoders;
import io.kifmt.parser.internal_api.NodeCursor;
import io.kifmt.parser.internal_api.ReadContext;
import io.kifmt.sexpr.Node;
import java.util.Set;

/** Reads {@code (fp_text kind "text" ...)} and {@code (gr_text "text" ...)}. */
public final class PcbTextReader {
  private static final Set<String> RAW = Set.of("render_cache");

  private PcbTextReader() {}

  public static PcbText read(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    boolean hasKind = PcbText.FOOTPRINT_TEXT.equals(node.token());
    String kind = hasKind ? c.requireText(0, "text kind") : null;
    PcbText text = new PcbText(node.token(), kind, c.requireText(hasKind ? 1 : 0, "text"));
    text.setLocked(c.flag("locked"));
    text.setHide(c.flag("hide"));
    text.setUnlocked(c.flag("unlocked"));
    c.position().ifPresent(text::setPosition);
    c.childIf("layer", PcbTextReader::isLayer)
        .ifPresent(
            n -> {
              text.setLayer(n.text(0).get());
              text.setKnockout(n.valueCount() == 2);
              if (!n.isQuoted(0)) {
                c.markBare("layer");
              }
            });
    c.uuid().ifPresent(text::setUuid);
    c.child("effects").map(n -> Decoders.effects(n, ctx)).ifPresent(text::setEffects);
    c.finish(text, RAW);
    return text;
  }

  /** {@code (layer "F.SilkS")} or {@code (layer "F.SilkS" knockout)}. */
  private static boolean isLayer(Node n) {
    if (n.childCount() != 0) {
      return false;
    }
    return n.valueCount() == 1
        || (n.valueCount() == 2 && n.isSymbol(1) && "knockout".equals(n.text(1).get()));
  }
}
