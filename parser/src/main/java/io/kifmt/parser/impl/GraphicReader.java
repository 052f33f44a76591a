package io.kifmt.parser.impl;

import io.kifmt.parser.api.geom.Point;
import io.kifmt.parser.api.model.Graphic;
import io.kifmt.parser.api.model.GraphicArc;
import io.kifmt.parser.api.model.GraphicCircle;
import io.kifmt.parser.api.model.GraphicCurve;
import io.kifmt.parser.api.model.GraphicLine;
import io.kifmt.parser.api.model.GraphicPolygon;
import io.kifmt.parser.api.model.GraphicRect;
import io.kifmt.parser.internal_api.Decoders;
import io.kifmt.parser.internal_api.DispatchTable;
import io.kifmt.parser.internal_api.NodeCursor;
import io.kifmt.parser.internal_api.ReadContext;
import io.kifmt.sexpr.Node;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Reads drawn shapes. Boards and footprints prefix the tokens ({@code gr_line}, {@code fp_arc});
 * symbols and schematics use the bare forms ({@code polyline}, {@code rectangle}, {@code circle},
 * {@code arc}, {@code bezier}).
 */
public final class GraphicReader {
  // legacy arcs given by center and angle, per-shape net and solder mask settings
  private static final Set<String> RAW = Set.of("angle", "radius", "net", "solder_mask_margin");

  private GraphicReader() {}

  /**
   * Routes the prefixed board shapes to the table.
   *
   * @param table the container's table
   * @param prefix {@code gr_} or {@code fp_}
   * @param sink stores a shape on the container
   * @return the table
   */
  public static <P> DispatchTable<P> registerBoardShapes(
      DispatchTable<P> table, String prefix, BiConsumer<P, Graphic> sink) {
    return table
        .on(prefix + "line", GraphicReader::line, sink)
        .on(prefix + "rect", GraphicReader::rect, sink)
        .on(prefix + "circle", GraphicReader::circle, sink)
        .on(prefix + "arc", GraphicReader::arc, sink)
        .on(prefix + "poly", GraphicReader::polygon, sink)
        .on(prefix + "curve", GraphicReader::curve, sink);
  }

  /** Routes the symbol and schematic shapes to the table. */
  public static <P> DispatchTable<P> registerSchematicShapes(
      DispatchTable<P> table, BiConsumer<P, Graphic> sink) {
    return table
        .on("polyline", GraphicReader::polygon, sink)
        .on("rectangle", GraphicReader::rect, sink)
        .on("circle", GraphicReader::circle, sink)
        .on("arc", GraphicReader::arc, sink)
        .on("bezier", GraphicReader::curve, sink);
  }

  public static GraphicLine line(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    GraphicLine g = new GraphicLine(node.token(), c.requirePoint("start"), c.requirePoint("end"));
    return common(c, g);
  }

  public static GraphicRect rect(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    GraphicRect g = new GraphicRect(node.token(), c.requirePoint("start"), c.requirePoint("end"));
    return common(c, g);
  }

  public static GraphicCircle circle(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    GraphicCircle g = new GraphicCircle(node.token(), c.requirePoint("center"));
    c.point("end").ifPresent(g::setEnd);
    c.childCoord("radius").ifPresent(g::setRadius);
    return common(c, g);
  }

  public static GraphicArc arc(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    Point start = c.requirePoint("start");
    Point mid = c.point("mid").orElse(null);
    Point end = c.requirePoint("end");
    return common(c, new GraphicArc(node.token(), start, mid, end));
  }

  public static GraphicPolygon polygon(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    GraphicPolygon g = new GraphicPolygon(node.token());
    points(c).ifPresent(g.getPoints()::addAll);
    return common(c, g);
  }

  public static GraphicCurve curve(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    GraphicCurve g = new GraphicCurve(node.token());
    points(c).ifPresent(g.getPoints()::addAll);
    return common(c, g);
  }

  /** Reads a {@code pts} list of plain points; one holding arcs stays raw. */
  static Optional<List<Point>> points(NodeCursor c) {
    return c.childIf("pts", Decoders::isPlainPoints).flatMap(Decoders::points);
  }

  private static <G extends Graphic> G common(NodeCursor c, G g) {
    ReadContext ctx = c.context();
    g.setLocked(c.flag("locked"));
    c.child("stroke").map(n -> Decoders.stroke(n, ctx)).ifPresent(g::setStroke);
    c.childCoord("width").ifPresent(g::setWidth);
    c.child("fill").map(n -> Decoders.fill(n, ctx)).ifPresent(g::setFill);
    c.childText("layer").ifPresent(g::setLayer);
    c.uuid().ifPresent(g::setUuid);
    c.finish(g, RAW);
    return g;
  }
}
