package io.scoreread.parser.score;

import static org.assertj.core.api.Assertions.assertThat;

import io.scoreread.parser.api.Fraction;
import org.junit.jupiter.api.Test;

public class ScoreTest {

  @Test
  void measuresAreLaidOutBackToBack() {
    Score score = new Score();
    score.appendMeasure(Fraction.of(3, 4));
    Measure second = score.appendMeasure(Fraction.of(4, 4));

    assertThat(second.index()).isEqualTo(1);
    assertThat(second.tick()).isEqualTo(Fraction.of(3, 4));
    assertThat(score.endTick()).isEqualTo(Fraction.of(7, 4));
  }

  @Test
  void measureAtUsesHalfOpenRanges() {
    Score score = new Score();
    score.appendMeasure(Fraction.of(3, 4));
    score.appendMeasure(Fraction.of(4, 4));

    assertThat(score.measureAt(Fraction.ZERO)).map(Measure::index).contains(0);
    assertThat(score.measureAt(Fraction.of(3, 4))).map(Measure::index).contains(1);
    assertThat(score.measureAt(Fraction.of(7, 4))).isEmpty();
    assertThat(score.measureAt(Fraction.of(-1, 4))).isEmpty();
  }

  @Test
  void elementOutsideEveryMeasureIsRejected() {
    Score score = new Score();
    score.appendMeasure(Fraction.of(4, 4));
    ChordRest chord = ChordRest.chord();
    chord.setTick(Fraction.of(5, 4));
    chord.setDuration(Fraction.of(1, 4));

    assertThat(score.add(chord)).isFalse();
    assertThat(score.measures().get(0).elements()).isEmpty();
  }

  @Test
  void dottedDurations() {
    assertThat(DurationType.QUARTER.withDots(1)).isEqualTo(Fraction.of(3, 8));
    assertThat(DurationType.HALF.withDots(2)).isEqualTo(Fraction.of(7, 8));
    assertThat(DurationType.isValid(Fraction.of(3, 16))).isTrue();
    assertThat(DurationType.isValid(Fraction.of(1, 12))).isFalse();
    assertThat(DurationType.fromXmlName("16th")).contains(DurationType.V_16TH);
  }

  @Test
  void connectorTypeNamesIgnoreCase() {
    assertThat(ConnectorType.fromXmlName("hairpin")).contains(ConnectorType.HAIRPIN);
    assertThat(ConnectorType.fromXmlName("Glissando")).isEmpty();
    assertThat(TextStyleType.builtIn("tempo")).contains(TextStyleType.TEMPO);
    assertThat(TextStyleType.builtIn("user1")).isEmpty();
  }
}
