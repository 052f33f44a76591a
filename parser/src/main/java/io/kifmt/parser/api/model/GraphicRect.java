package io.kifmt.parser.api.model;

import io.kifmt.parser.api.geom.Point;

/** An axis-aligned rectangle: {@code gr_rect}, {@code fp_rect}, {@code rectangle}. */
public class GraphicRect extends Graphic {
  private Point start;
  private Point end;

  public GraphicRect(String token, Point start, Point end) {
    super(token);
    this.start = start;
    this.end = end;
  }

  public Point getStart() {
    return start;
  }

  public void setStart(Point start) {
    this.start = start;
  }

  public Point getEnd() {
    return end;
  }

  public void setEnd(Point end) {
    this.end = end;
  }
}
