package io.scoreread.parser.internal_api;

import static org.assertj.core.api.Assertions.assertThat;

import io.scoreread.parser.api.Fraction;
import io.scoreread.parser.api.Location;
import io.scoreread.parser.api.ReaderOptions;
import io.scoreread.parser.score.Beam;
import io.scoreread.parser.score.ConnectorType;
import io.scoreread.parser.score.Score;
import io.scoreread.parser.score.Spanner;
import io.scoreread.parser.score.Tuplet;
import org.junit.jupiter.api.Test;

public class ReadContextTest {

  private static Location at(int ticks) {
    return Location.at(0, 0, Fraction.fromTicks(ticks));
  }

  @Test
  void forPasteSetsModeAndOffsets() {
    ReadContext context =
        ReadContext.forPaste(
            new Score(), ReaderOptions.DEFAULT, Fraction.of(1, 1), Fraction.of(3, 1), 0, 8);

    ReaderCursor cursor = context.cursor();
    assertThat(cursor.pasteMode()).isTrue();
    assertThat(cursor.tickOffset()).isEqualTo(Fraction.of(-2, 1));
    assertThat(cursor.trackOffset()).isEqualTo(-8);
  }

  @Test
  void finishDocumentRepairsUnlessDisabled() {
    Score score = new Score();
    ReadContext context = new ReadContext(score, ReaderOptions.DEFAULT);
    context.connectors().addConnectorInfo(ConnectorInfo.start(ConnectorType.SLUR, 1, at(0)));
    context.connectors().addConnectorInfo(ConnectorInfo.end(ConnectorType.SLUR, 2, at(480)));

    assertThat(context.finishDocument()).isEqualTo(1);
    assertThat(score.connectors()).singleElement().matches(c -> c.repaired());
  }

  @Test
  void finishDocumentWithoutRepairLeavesChainsOpen() {
    Score score = new Score();
    ReadContext context = new ReadContext(score, ReaderOptions.NO_REPAIR);
    context.connectors().addConnectorInfo(ConnectorInfo.start(ConnectorType.SLUR, 1, at(0)));
    context.connectors().addConnectorInfoLater(ConnectorInfo.end(ConnectorType.SLUR, 2, at(480)));

    assertThat(context.finishDocument()).isZero();
    assertThat(context.connectors().pendingCount()).isZero();
    assertThat(context.connectors().activeCount()).isEqualTo(2);

    TeardownReport report = context.close();
    assertThat(report.discarded()).isEqualTo(2);
    assertThat(score.connectors()).isEmpty();
  }

  @Test
  void closeClearsRegistriesAndIsIdempotent() {
    Score score = new Score();
    ReadContext context = new ReadContext(score, null);
    assertThat(context.options()).isSameAs(ReaderOptions.DEFAULT);
    context.tables().addBeam(new Beam(1));
    context.tables().addTuplet(new Tuplet(1));
    context.spanners().add(1, new Spanner(ConnectorType.SLUR));
    context.textStyles().add("Intro");
    Tuplet open = new Tuplet(2);
    context
        .connectors()
        .addConnectorInfo(
            ConnectorInfo.of(ConnectorType.TUPLET, 2, ConnectorInfo.Role.START, at(0), open));

    TeardownReport report = context.close();

    assertThat(context.isClosed()).isTrue();
    assertThat(report).isEqualTo(new TeardownReport(0, 1));
    assertThat(score.retained()).containsExactly(open);
    assertThat(context.tables().findBeam(1)).isEmpty();
    assertThat(context.tables().tuplets()).isEmpty();
    assertThat(context.spanners().size()).isZero();
    assertThat(context.textStyles().size()).isZero();
    assertThat(context.close()).isSameAs(report);
    assertThat(score.retained()).hasSize(1);
  }
}
