package io.kifmt.parser.internal_api;

import io.kifmt.parser.api.geom.Coord;
import io.kifmt.parser.api.geom.Point;
import io.kifmt.parser.api.geom.Position;
import io.kifmt.parser.api.model.Color;
import io.kifmt.parser.api.model.Element;
import io.kifmt.parser.api.model.Fill;
import io.kifmt.parser.api.model.Font;
import io.kifmt.parser.api.model.Stroke;
import io.kifmt.parser.api.model.TextEffects;
import io.kifmt.sexpr.Node;
import io.kifmt.sexpr.NumberValue;
import io.kifmt.sexpr.ScalarValue;
import io.kifmt.sexpr.SymbolValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/** Readers for the small nodes shared by all file kinds. */
public final class Decoders {
  private static final Set<String> EFFECTS_RAW = Set.of("href");

  private Decoders() {}

  /**
   * Reads {@code (token x y)}.
   *
   * @throws ElementFormatException unless the node holds exactly two numbers
   */
  public static Point point(Node node) {
    if (node.valueCount() != 2 || node.childCount() != 0) {
      throw new ElementFormatException("Malformed (" + node.token() + "): expected x and y");
    }
    double x = requireNumber(node, 0);
    double y = requireNumber(node, 1);
    return new Point(Coord.fromMm(x), Coord.fromMm(y));
  }

  /**
   * Reads {@code (at x y [angle] [unlocked])}.
   *
   * @throws ElementFormatException if the node is malformed
   */
  public static Position position(Node node) {
    int n = node.valueCount();
    if (n < 2 || node.childCount() != 0) {
      throw new ElementFormatException("Malformed (at): expected x and y");
    }
    Point point =
        new Point(Coord.fromMm(requireNumber(node, 0)), Coord.fromMm(requireNumber(node, 1)));
    double angle = 0;
    boolean hasAngle = false;
    boolean unlocked = false;
    for (int i = 2; i < n; i++) {
      ScalarValue v = node.values().get(i);
      if (i == 2 && v instanceof NumberValue) {
        angle = ((NumberValue) v).value();
        hasAngle = true;
      } else if (v instanceof SymbolValue && "unlocked".equals(((SymbolValue) v).value())) {
        unlocked = true;
      } else {
        throw new ElementFormatException("Malformed (at): unexpected value " + v.text());
      }
    }
    return new Position(point, angle, hasAngle, unlocked);
  }

  private static double requireNumber(Node node, int index) {
    return node.numberValue(index)
        .orElseThrow(
            () ->
                new ElementFormatException(
                    "Malformed (" + node.token() + "): value #" + index + " is not a number"));
  }

  /**
   * Reads {@code (pts (xy x y) ...)}.
   *
   * @return the points, or empty if the list holds anything but plain {@code xy} points
   */
  public static Optional<List<Point>> points(Node pts) {
    if (pts.valueCount() != 0) {
      return Optional.empty();
    }
    List<Point> points = new ArrayList<>(pts.childCount());
    for (Node xy : pts.children()) {
      if (!"xy".equals(xy.token())
          || xy.valueCount() != 2
          || xy.childCount() != 0
          || xy.number(0).isEmpty()
          || xy.number(1).isEmpty()) {
        return Optional.empty();
      }
      points.add(point(xy));
    }
    return Optional.of(points);
  }

  /** Checks the shape accepted by {@link #points(Node)}. */
  public static boolean isPlainPoints(Node pts) {
    return points(pts).isPresent();
  }

  /**
   * Reads {@code (color r g b [a])}.
   *
   * @return the color, or empty if the node does not hold in-range channels
   */
  public static Optional<Color> color(Node node) {
    int n = node.valueCount();
    if ((n != 3 && n != 4) || node.childCount() != 0) {
      return Optional.empty();
    }
    int[] rgb = new int[3];
    for (int i = 0; i < 3; i++) {
      Optional<Double> c = node.numberValue(i);
      if (c.isEmpty() || c.get() % 1 != 0 || c.get() < 0 || c.get() > 255) {
        return Optional.empty();
      }
      rgb[i] = c.get().intValue();
    }
    double alpha = 1;
    if (n == 4) {
      Optional<Double> a = node.numberValue(3);
      if (a.isEmpty() || a.get() < 0 || a.get() > 1) {
        return Optional.empty();
      }
      alpha = a.get();
    }
    return Optional.of(new Color(rgb[0], rgb[1], rgb[2], alpha));
  }

  public static boolean isColor(Node node) {
    return color(node).isPresent();
  }

  /**
   * Takes the {@code color} child of a node. A color written without alpha is remembered as a
   * short form on the target, so it is written back with three channels.
   *
   * @param c the cursor over the owning node
   * @param target the entity read from that node
   * @return the color, if present and in range
   */
  public static Optional<Color> color(NodeCursor c, Element target) {
    Optional<Node> node = c.childIf("color", Decoders::isColor);
    if (node.isPresent() && node.get().valueCount() == 3) {
      target.getShortForms().add("color");
    }
    return node.flatMap(Decoders::color);
  }

  /** Reads {@code (token (xyz a b c))} as used by 3D model offsets. */
  public static Optional<double[]> xyz(Node node) {
    if (node.valueCount() != 0 || node.childCount() != 1) {
      return Optional.empty();
    }
    Node xyz = node.children().get(0);
    if (!"xyz".equals(xyz.token()) || xyz.valueCount() != 3 || xyz.childCount() != 0) {
      return Optional.empty();
    }
    double[] result = new double[3];
    for (int i = 0; i < 3; i++) {
      if (xyz.number(i).isEmpty()) {
        return Optional.empty();
      }
      result[i] = xyz.number(i).getAsDouble();
    }
    return Optional.of(result);
  }

  public static Stroke stroke(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    Stroke stroke = new Stroke();
    c.childCoord("width").ifPresent(stroke::setWidth);
    c.childText("type").ifPresent(stroke::setType);
    color(c, stroke).ifPresent(stroke::setColor);
    c.finish(stroke);
    return stroke;
  }

  public static Fill fill(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    Fill fill;
    if (node.valueCount() > 0) {
      fill = new Fill(Fill.Form.VALUE);
      fill.setValue(c.text(0).get());
    } else {
      fill = new Fill(Fill.Form.TYPE_CHILD);
    }
    c.childText("type").ifPresent(fill::setType);
    color(c, fill).ifPresent(fill::setColor);
    c.finish(fill);
    return fill;
  }

  public static Font font(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    Font font = new Font();
    c.childText("face").ifPresent(font::setFace);
    c.childIf(
            "size",
            n -> n.valueCount() == 2 && n.childCount() == 0 && n.number(0).isPresent()
                && n.number(1).isPresent())
        .ifPresent(
            size -> {
              font.setHeight(Coord.fromMm(size.number(0).getAsDouble()));
              font.setWidth(Coord.fromMm(size.number(1).getAsDouble()));
            });
    c.childCoord("thickness").ifPresent(font::setThickness);
    font.setBold(c.flag("bold"));
    font.setItalic(c.flag("italic"));
    c.childNumber("line_spacing").ifPresent(font::setLineSpacing);
    color(c, font).ifPresent(font::setColor);
    c.finish(font);
    return font;
  }

  public static TextEffects effects(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    TextEffects effects = new TextEffects();
    c.child("font").map(f -> font(f, ctx)).ifPresent(effects::setFont);
    c.childIf("justify", Decoders::isWordList)
        .ifPresent(
            j -> {
              List<String> words = new ArrayList<>();
              j.values().forEach(v -> words.add(v.text()));
              effects.setJustify(words);
            });
    effects.setHide(c.flag("hide"));
    c.finish(effects, EFFECTS_RAW);
    return effects;
  }

  private static boolean isWordList(Node node) {
    if (node.childCount() != 0) {
      return false;
    }
    for (ScalarValue v : node.values()) {
      if (!(v instanceof SymbolValue)) {
        return false;
      }
    }
    return true;
  }
}
