package io.kifmt.parser.impl;

import io.kifmt.parser.api.model.Graphic;
import io.kifmt.parser.api.model.GraphicArc;
import io.kifmt.parser.api.model.GraphicCircle;
import io.kifmt.parser.api.model.GraphicCurve;
import io.kifmt.parser.api.model.GraphicLine;
import io.kifmt.parser.api.model.GraphicPolygon;
import io.kifmt.parser.api.model.GraphicRect;
import io.kifmt.parser.internal_api.Encoders;
import io.kifmt.sexpr.Node;

/** Writes drawn shapes with the token each one carries. */
public final class GraphicWriter {
  private GraphicWriter() {}

  public static Node write(Graphic g) {
    Node.Builder b = Node.builder(g.getToken());
    if (g instanceof GraphicLine) {
      GraphicLine line = (GraphicLine) g;
      Encoders.putPoint(b, "start", line.getStart());
      Encoders.putPoint(b, "end", line.getEnd());
    } else if (g instanceof GraphicRect) {
      GraphicRect rect = (GraphicRect) g;
      Encoders.putPoint(b, "start", rect.getStart());
      Encoders.putPoint(b, "end", rect.getEnd());
    } else if (g instanceof GraphicCircle) {
      GraphicCircle circle = (GraphicCircle) g;
      Encoders.putPoint(b, "center", circle.getCenter());
      Encoders.putPoint(b, "end", circle.getEnd());
      Encoders.putCoord(b, "radius", circle.getRadius());
    } else if (g instanceof GraphicArc) {
      GraphicArc arc = (GraphicArc) g;
      Encoders.putPoint(b, "start", arc.getStart());
      Encoders.putPoint(b, "mid", arc.getMid());
      Encoders.putPoint(b, "end", arc.getEnd());
    } else if (g instanceof GraphicPolygon) {
      GraphicPolygon poly = (GraphicPolygon) g;
      if (!poly.getPoints().isEmpty()) {
        b.child(Encoders.points(poly.getPoints()));
      }
    } else if (g instanceof GraphicCurve) {
      GraphicCurve curve = (GraphicCurve) g;
      if (!curve.getPoints().isEmpty()) {
        b.child(Encoders.points(curve.getPoints()));
      }
    } else {
      throw new IllegalArgumentException("Unsupported graphic " + g.getClass().getName());
    }
    Encoders.putFlag(b, "locked", g.getLocked());
    if (g.getStroke() != null) {
      b.child(Encoders.stroke(g.getStroke()));
    }
    Encoders.putCoord(b, "width", g.getWidth());
    if (g.getFill() != null) {
      b.child(Encoders.fill(g.getFill()));
    }
    Encoders.putText(b, g, "layer", g.getLayer());
    Encoders.putUuid(b, g.getUuid());
    return Encoders.finish(b, g);
  }
}
