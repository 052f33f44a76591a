package io.kifmt.parser.internal_api;

import io.kifmt.parser.api.geom.Coord;
import io.kifmt.parser.api.geom.Point;
import io.kifmt.parser.api.geom.Position;
import io.kifmt.parser.api.model.Color;
import io.kifmt.parser.api.model.Element;
import io.kifmt.parser.api.model.Fill;
import io.kifmt.parser.api.model.Flag;
import io.kifmt.parser.api.model.Font;
import io.kifmt.parser.api.model.Stroke;
import io.kifmt.parser.api.model.TextEffects;
import io.kifmt.parser.api.model.UuidRef;
import io.kifmt.sexpr.Node;
import io.kifmt.sexpr.NumberValue;
import io.kifmt.sexpr.SExpressionParser;
import io.kifmt.sexpr.ScalarValue;
import io.kifmt.sexpr.StringValue;
import io.kifmt.sexpr.SymbolValue;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Writers for the small nodes shared by all file kinds, and the helpers every entity writer uses
 * to emit values in the spelling they were read with.
 */
public final class Encoders {
  private static final double STEPS_PER_MM = 10_000;

  private Encoders() {}

  /**
   * Converts a coordinate to millimeters for output. Values within half an internal unit of a
   * multiple of 0.0001 mm are written as that multiple, so {@code 0.15} stays {@code 0.15} after
   * the conversion to units and back.
   */
  public static NumberValue mm(Coord coord) {
    double mm = coord.toMm();
    double snapped = Math.rint(mm * STEPS_PER_MM) / STEPS_PER_MM;
    if (Math.abs(snapped - mm) * Coord.UNITS_PER_MM <= 0.5) {
      mm = snapped;
    }
    return NumberValue.of(mm);
  }

  public static NumberValue number(double value) {
    return NumberValue.of(value);
  }

  /** @return whether the text can be written without quotes and read back unchanged */
  public static boolean canBeBare(String text) {
    if (text.isEmpty()) {
      return false;
    }
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (Character.isWhitespace(c) || c == '(' || c == ')' || c == '"' || c == '\\') {
        return false;
      }
    }
    return true;
  }

  /**
   * A bare word. Words that read back as numbers become numbers, so the written tree equals the
   * tree read back.
   */
  public static ScalarValue word(String text) {
    if (!canBeBare(text)) {
      return new StringValue(text);
    }
    if (SExpressionParser.isNumeric(text)) {
      double d = Double.parseDouble(text);
      if (!Double.isInfinite(d)) {
        return new NumberValue(d, text);
      }
    }
    return new SymbolValue(text);
  }

  /**
   * A text field, quoted unless the entity read it bare.
   *
   * @param element the owning entity
   * @param key the bare key, a child token or {@code @index}
   * @param text the text
   */
  public static ScalarValue text(Element element, String key, String text) {
    return element.isBare(key) ? word(text) : new StringValue(text);
  }

  // ---- optional children; a null value writes nothing

  public static void putText(Node.Builder b, Element element, String token, String text) {
    if (text != null) {
      b.child(Node.builder(token).value(text(element, token, text)).build());
    }
  }

  public static void putTexts(
      Node.Builder b, Element element, String token, List<String> texts) {
    if (texts != null) {
      Node.Builder child = Node.builder(token);
      for (int i = 0; i < texts.size(); i++) {
        child.value(text(element, Element.valueKey(token, i), texts.get(i)));
      }
      b.child(child.build());
    }
  }

  /** Adds {@code (token word)} with a bare keyword. */
  public static void putWord(Node.Builder b, String token, String word) {
    if (word != null) {
      b.child(Node.builder(token).value(word(word)).build());
    }
  }

  /** Adds {@code (token w1 w2 ...)} with bare keywords. */
  public static void putWords(Node.Builder b, String token, List<String> words) {
    if (words != null) {
      Node.Builder child = Node.builder(token);
      words.forEach(w -> child.value(word(w)));
      b.child(child.build());
    }
  }

  public static void putCoord(Node.Builder b, String token, Coord value) {
    if (value != null) {
      b.child(Node.builder(token).value(mm(value)).build());
    }
  }

  public static void putNumber(Node.Builder b, String token, Double value) {
    if (value != null) {
      b.child(Node.builder(token).number(value).build());
    }
  }

  public static void putInt(Node.Builder b, String token, Integer value) {
    if (value != null) {
      b.child(Node.builder(token).integer(value).build());
    }
  }

  /** Adds {@code (token yes|no)}. */
  public static void putBool(Node.Builder b, String token, Boolean value) {
    if (value != null) {
      b.child(Node.builder(token).bool(value).build());
    }
  }

  public static void putPoint(Node.Builder b, String token, Point point) {
    if (point != null) {
      b.child(point(token, point));
    }
  }

  public static void putPosition(Node.Builder b, Position position) {
    if (position != null) {
      b.child(position(position));
    }
  }

  public static void putUuid(Node.Builder b, UuidRef uuid) {
    if (uuid != null) {
      b.child(uuid(uuid));
    }
  }

  /** Adds the color, with three channels if the entity read it that way and it is opaque. */
  public static void putColor(Node.Builder b, Element element, Color color) {
    if (color == null) {
      return;
    }
    if (element.isShortForm("color") && color.alpha() == 1) {
      b.child(
          Node.builder("color")
              .integer(color.red())
              .integer(color.green())
              .integer(color.blue())
              .build());
    } else {
      b.child(color(color));
    }
  }

  public static void putNode(Node.Builder b, Node node) {
    if (node != null) {
      b.child(node);
    }
  }

  /**
   * Adds a flag in its recorded spelling: a bare word among the values, {@code (word yes|no)} or
   * {@code (word)}.
   */
  public static void putFlag(Node.Builder b, String word, Flag flag) {
    if (flag == null) {
      return;
    }
    switch (flag.form()) {
      case SYMBOL -> b.symbol(word);
      case CHILD -> b.child(Node.builder(word).bool(flag.value()).build());
      case MARKER -> b.emptyChild(word);
    }
  }

  /**
   * Adds the entity's raw values and arranges all children in source order.
   *
   * @param b a builder holding the entity's typed values and children
   * @param element the entity
   * @return the finished node
   */
  public static Node finish(Node.Builder b, Element element) {
    b.values(orderWords(b.drainValues(), element.getWordOrder()));
    b.values(element.getRawValues());
    List<Node> typed = b.drainChildren();
    b.children(Layouts.arrange(element, typed));
    return b.build();
  }

  /**
   * Puts the flag and type words among the values back into their read order. Other values keep
   * their slots.
   */
  static List<ScalarValue> orderWords(List<ScalarValue> values, List<String> wordOrder) {
    if (wordOrder.size() < 2) {
      return values;
    }
    List<Integer> slots = new ArrayList<>();
    List<ScalarValue> words = new ArrayList<>();
    List<String> pending = new ArrayList<>(wordOrder);
    for (int i = 0; i < values.size(); i++) {
      ScalarValue v = values.get(i);
      if (v instanceof SymbolValue && pending.remove(v.text())) {
        slots.add(i);
        words.add(v);
      }
    }
    words.sort(Comparator.comparingInt(w -> wordOrder.indexOf(w.text())));
    List<ScalarValue> result = new ArrayList<>(values);
    for (int i = 0; i < slots.size(); i++) {
      result.set(slots.get(i), words.get(i));
    }
    return result;
  }

  // ---- shared nodes

  public static Node point(String token, Point point) {
    return Node.builder(token).value(mm(point.x())).value(mm(point.y())).build();
  }

  public static Node position(Position position) {
    Node.Builder b =
        Node.builder("at").value(mm(position.point().x())).value(mm(position.point().y()));
    if (position.hasAngle()) {
      b.number(position.angle());
    }
    if (position.unlocked()) {
      b.symbol("unlocked");
    }
    return b.build();
  }

  public static Node uuid(UuidRef uuid) {
    return Node.builder(uuid.token())
        .value(uuid.bare() ? word(uuid.value()) : new StringValue(uuid.value()))
        .build();
  }

  public static Node color(Color color) {
    return Node.builder("color")
        .integer(color.red())
        .integer(color.green())
        .integer(color.blue())
        .number(color.alpha())
        .build();
  }

  public static Node points(List<Point> points) {
    Node.Builder b = Node.builder("pts");
    for (Point p : points) {
      b.child(point("xy", p));
    }
    return b.build();
  }

  public static Node xyz(String token, double[] xyz) {
    return Node.builder(token)
        .child("xyz", b -> b.number(xyz[0]).number(xyz[1]).number(xyz[2]))
        .build();
  }

  public static Node stroke(Stroke stroke) {
    Node.Builder b = Node.builder("stroke");
    putCoord(b, "width", stroke.getWidth());
    putWord(b, "type", stroke.getType());
    putColor(b, stroke, stroke.getColor());
    return finish(b, stroke);
  }

  public static Node fill(Fill fill) {
    Node.Builder b = Node.builder("fill");
    if (fill.getForm() == Fill.Form.VALUE && fill.getValue() != null) {
      b.value(word(fill.getValue()));
    }
    putWord(b, "type", fill.getType());
    putColor(b, fill, fill.getColor());
    return finish(b, fill);
  }

  public static Node font(Font font) {
    Node.Builder b = Node.builder("font");
    putText(b, font, "face", font.getFace());
    if (font.getHeight() != null && font.getWidth() != null) {
      b.child(Node.builder("size").value(mm(font.getHeight())).value(mm(font.getWidth())).build());
    }
    putCoord(b, "thickness", font.getThickness());
    putFlag(b, "bold", font.getBold());
    putFlag(b, "italic", font.getItalic());
    putNumber(b, "line_spacing", font.getLineSpacing());
    putColor(b, font, font.getColor());
    return finish(b, font);
  }

  public static Node effects(TextEffects effects) {
    Node.Builder b = Node.builder("effects");
    if (effects.getFont() != null) {
      b.child(font(effects.getFont()));
    }
    putWords(b, "justify", effects.getJustify());
    putFlag(b, "hide", effects.getHide());
    return finish(b, effects);
  }
}
