package io.kifmt.parser.api.model;

import io.kifmt.parser.api.geom.Point;

/** A straight line: {@code gr_line}, {@code fp_line}. */
public class GraphicLine extends Graphic {
  private Point start;
  private Point end;

  public GraphicLine(String token, Point start, Point end) {
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
