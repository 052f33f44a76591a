package io.kifmt.parser.api.geom;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class ArcGeometryTest {

  @Test
  void halfCircleThroughTop() {
    ArcGeometry arc =
        ArcGeometry.fromThreePoints(Point.ofMm(5, 0), Point.ofMm(0, 5), Point.ofMm(-5, 0));

    assertThat(arc.degenerate()).isFalse();
    assertThat(arc.center().xMm()).isCloseTo(0, within(1e-6));
    assertThat(arc.center().yMm()).isCloseTo(0, within(1e-6));
    assertThat(arc.radius().toMm()).isCloseTo(5, within(1e-6));
    assertThat(arc.startAngle()).isCloseTo(0, within(1e-9));
    assertThat(arc.endAngle()).isCloseTo(180, within(1e-9));
    assertThat(arc.sweep()).isCloseTo(180, within(1e-6));
  }

  @Test
  void sweepIsNegativeWhenRunningBackwards() {
    ArcGeometry arc =
        ArcGeometry.fromThreePoints(Point.ofMm(5, 0), Point.ofMm(0, -5), Point.ofMm(-5, 0));

    assertThat(arc.sweep()).isCloseTo(-180, within(1e-6));
  }

  @Test
  void quarterArcAroundOffsetCenter() {
    double h = Math.sqrt(0.5);
    ArcGeometry arc =
        ArcGeometry.fromThreePoints(
            Point.ofMm(11, 20), Point.ofMm(10 + h, 20 + h), Point.ofMm(10, 21));

    assertThat(arc.center().xMm()).isCloseTo(10, within(1e-5));
    assertThat(arc.center().yMm()).isCloseTo(20, within(1e-5));
    assertThat(arc.radius().toMm()).isCloseTo(1, within(1e-5));
    assertThat(arc.sweep()).isCloseTo(90, within(1e-4));
  }

  @Test
  void collinearPointsAreDegenerate() {
    ArcGeometry arc =
        ArcGeometry.fromThreePoints(Point.ofMm(0, 0), Point.ofMm(1, 1), Point.ofMm(2, 2));

    assertThat(arc.degenerate()).isTrue();
    assertThat(arc.radius()).isEqualTo(Coord.ZERO);
    assertThat(arc.sweep()).isZero();
    assertThat(arc.center().xMm()).isCloseTo(1, within(1e-6));
  }

  @Test
  void coincidentPointsAreDegenerate() {
    Point p = Point.ofMm(3, 4);

    assertThat(ArcGeometry.fromThreePoints(p, p, p).degenerate()).isTrue();
  }
}
