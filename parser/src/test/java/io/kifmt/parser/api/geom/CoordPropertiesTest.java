package io.kifmt.parser.api.geom;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.kifmt.parser.internal_api.Encoders;
import net.jqwik.api.Example;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.LongRange;

class CoordPropertiesTest {

  @Property
  void unitsSurviveMillimeterRoundTrip(
      @ForAll @LongRange(min = -4_000_000_000L, max = 4_000_000_000L) long units) {
    Coord c = Coord.ofUnits(units);
    assertThat(Coord.fromMm(c.toMm())).isEqualTo(c);
  }

  @Property
  void fourDecimalValuesAreWrittenExactly(
      @ForAll @IntRange(min = -10_000_000, max = 10_000_000) int tenThousandths) {
    double mm = tenThousandths / 10_000.0;
    double written = Encoders.mm(Coord.fromMm(mm)).value();
    assertThat(written).isEqualTo(mm);
  }

  @Property
  void conversionLosesLessThanOneUnit(
      @ForAll @IntRange(min = -1_000_000, max = 1_000_000) int micrometers) {
    double mm = micrometers / 1000.0;
    assertThat(Math.abs(Coord.fromMm(mm).toMm() - mm))
        .isLessThanOrEqualTo(1 / Coord.UNITS_PER_MM);
  }

  @Example
  void oneMilIsTenThousandUnits() {
    assertThat(Coord.fromMm(0.0254).units()).isEqualTo(10_000);
  }

  @Example
  void rejectsNonFiniteLengths() {
    assertThatThrownBy(() -> Coord.fromMm(Double.NaN))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> Coord.fromMm(Double.POSITIVE_INFINITY))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
