package io.kifmt.parser.impl;

import io.kifmt.parser.api.model.Property;
import io.kifmt.parser.internal_api.Decoders;
import io.kifmt.parser.internal_api.NodeCursor;
import io.kifmt.parser.internal_api.ReadContext;
import io.kifmt.sexpr.Node;

/**
 * Reads {@code (property "Name" "Value" ...)} as found on footprints, symbols, placed symbols,
 * sheets and labels.
 */
public final class PropertyReader {
  private PropertyReader() {}

  public static Property read(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    Property p = new Property(c.requireText(0, "property name"), c.requireText(1, "property value"));
    p.setUnlocked(c.flag("unlocked"));
    p.setHide(c.flag("hide"));
    c.childInt("id").ifPresent(p::setId);
    c.position().ifPresent(p::setPosition);
    c.childText("layer").ifPresent(p::setLayer);
    p.setShowName(c.flag("show_name"));
    p.setDoNotAutoplace(c.flag("do_not_autoplace"));
    c.uuid().ifPresent(p::setUuid);
    c.child("effects").map(n -> Decoders.effects(n, ctx)).ifPresent(p::setEffects);
    c.finish(p);
    return p;
  }
}
