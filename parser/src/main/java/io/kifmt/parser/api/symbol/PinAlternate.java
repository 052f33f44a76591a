package io.kifmt.parser.api.symbol;

import java.util.Objects;

/**
 * An alternate pin function, {@code (alternate "name" type style)}.
 *
 * @param name the alternate name
 * @param electricalType the electrical type token
 * @param graphicStyle the graphic style token
 */
public record PinAlternate(String name, String electricalType, String graphicStyle) {
  public PinAlternate {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(electricalType, "electricalType");
    Objects.requireNonNull(graphicStyle, "graphicStyle");
  }
}
