package io.scoreread.parser.internal_api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.scoreread.parser.api.Color;
import io.scoreread.parser.api.ErrorHandler;
import io.scoreread.parser.api.Fraction;
import io.scoreread.parser.api.MissingAttributeException;
import io.scoreread.parser.api.PointF;
import io.scoreread.parser.api.ReaderOptions;
import io.scoreread.parser.api.ScoreParseException;
import io.scoreread.parser.score.ChordRest;
import io.scoreread.parser.score.Connector;
import io.scoreread.parser.score.ConnectorType;
import io.scoreread.parser.score.DurationElement;
import io.scoreread.parser.score.DurationType;
import io.scoreread.parser.score.Measure;
import io.scoreread.parser.score.Score;
import io.scoreread.parser.score.Spanner;
import io.scoreread.parser.score.TextElement;
import io.scoreread.parser.score.TextStyleType;
import io.scoreread.parser.score.Tuplet;
import java.io.InputStream;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

public class StreamingScoreParserTest {
  @Mock private ScoreParserListener listener;
  @Mock private ErrorHandler errorHandler;

  @BeforeEach
  void setup() {
    MockitoAnnotations.openMocks(this);
    when(listener.onMeasureStart(any(), anyInt(), any())).thenReturn(true);
  }

  private static Score parse(String resource, ReaderOptions options) throws Exception {
    Score score = new Score();
    try (InputStream in = StreamingScoreParserTest.class.getResourceAsStream(resource);
        ScoreXmlReader reader = ScoreXmlReader.open(in, options)) {
      new StreamingScoreParser(options).parse(reader, score, ScoreParserListener.NOOP);
    }
    return score;
  }

  private static TeardownReport parseText(
      String xml, Score score, ReaderOptions options, ScoreParserListener listener)
      throws Exception {
    try (ScoreXmlReader reader = ScoreXmlReader.open(new StringReader(xml), options)) {
      return new StreamingScoreParser(options).parse(reader, score, listener);
    }
  }

  private static List<DurationElement> onTrack(Measure measure, int track) {
    return measure.elements().stream()
        .filter(e -> e.track() == track)
        .collect(Collectors.toList());
  }

  @Test
  void readsMeasuresAndTimeline() throws Exception {
    Score score = parse("/scores/basic.mscx", ReaderOptions.DEFAULT);

    assertThat(score.measures()).hasSize(3);
    assertThat(score.measures().get(1).tick()).isEqualTo(Fraction.of(1, 1));
    assertThat(score.endTick()).isEqualTo(Fraction.of(3, 1));

    Measure first = score.measures().get(0);
    List<DurationElement> voice0 = onTrack(first, 0);
    assertThat(voice0).hasSize(3);
    assertThat(voice0.get(0).tick()).isEqualTo(Fraction.ZERO);
    assertThat(voice0.get(1).tick()).isEqualTo(Fraction.of(1, 4));
    assertThat(voice0.get(2).tick()).isEqualTo(Fraction.of(1, 2));
    assertThat(voice0.get(2).duration()).isEqualTo(Fraction.of(1, 2));

    // rest with measure duration spans the whole bar
    assertThat(score.measures().get(1).elements())
        .singleElement()
        .satisfies(e -> assertThat(e.duration()).isEqualTo(Fraction.of(1, 1)));
  }

  @Test
  void beamedChordsShareTheBeam() throws Exception {
    Score score = parse("/scores/basic.mscx", ReaderOptions.DEFAULT);

    List<DurationElement> voice0 = onTrack(score.measures().get(0), 0);
    ChordRest a = (ChordRest) voice0.get(0);
    ChordRest b = (ChordRest) voice0.get(1);
    assertThat(a.beam()).isNotNull().isSameAs(b.beam());
    assertThat(a.beam().elements()).containsExactly(a, b);
    assertThat(((ChordRest) voice0.get(2)).beam()).isNull();
  }

  @Test
  void tupletIsCompletedAndEmptyTupletDropped() throws Exception {
    Score score = parse("/scores/basic.mscx", ReaderOptions.DEFAULT);

    assertThat(score.tuplets()).singleElement().satisfies(t -> assertThat(t.id()).isEqualTo(1));
    Tuplet tuplet = score.tuplets().get(0);
    assertThat(tuplet.ratio()).isEqualTo(Fraction.of(3, 2));
    assertThat(tuplet.elements()).hasSize(3);

    List<DurationElement> voice1 = onTrack(score.measures().get(0), 1);
    assertThat(voice1).hasSize(3);
    assertThat(voice1).allMatch(e -> e.tuplet() == tuplet);
    assertThat(tuplet.elements().get(1).tick()).isEqualTo(Fraction.of(1, 12));
    // filler rest closes the triplet
    assertThat(tuplet.elements().get(2).tick()).isEqualTo(Fraction.of(1, 6));
    assertThat(tuplet.elements().get(2).duration()).isEqualTo(Fraction.of(1, 8));
    assertThat(score.measures().get(0).elements()).hasSize(7);
  }

  @Test
  void connectorsResolveWithinAndAcrossMeasures() throws Exception {
    Score score = parse("/scores/basic.mscx", ReaderOptions.DEFAULT);

    assertThat(score.connectors()).hasSize(2);
    Connector slur = score.connectors().get(0);
    assertThat(slur.type()).isEqualTo(ConnectorType.SLUR);
    assertThat(slur.id()).isEqualTo(1);
    assertThat(slur.tick()).isEqualTo(Fraction.ZERO);
    assertThat(slur.tick2()).isEqualTo(Fraction.of(1, 4));
    assertThat(slur.repaired()).isFalse();
    assertThat(slur.element()).isInstanceOf(Spanner.class);
    assertThat(((Spanner) slur.element()).tick2()).isEqualTo(Fraction.of(1, 4));

    Connector hairpin = score.connectors().get(1);
    assertThat(hairpin.type()).isEqualTo(ConnectorType.HAIRPIN);
    assertThat(hairpin.tick()).isEqualTo(Fraction.of(1, 1));
    assertThat(hairpin.tick2()).isEqualTo(Fraction.of(2, 1));
    assertThat(hairpin.anchors()).hasSize(2);
  }

  @Test
  void staffTextUsesUserStyle() throws Exception {
    Score score = parse("/scores/basic.mscx", ReaderOptions.DEFAULT);

    assertThat(score.texts()).singleElement().isEqualTo(
        new TextElement(
            0, Fraction.of(1, 2), TextStyleType.USER1, "dolce <b>e</b> cantabile"));
  }

  @Test
  void secondStaffReusesMeasures() throws Exception {
    Score score = parse("/scores/basic.mscx", ReaderOptions.DEFAULT);

    assertThat(score.measures()).hasSize(3);
    List<DurationElement> staff2 = onTrack(score.measures().get(0), 4);
    assertThat(staff2).singleElement().isInstanceOf(ChordRest.class);
    ChordRest chord = (ChordRest) staff2.get(0);
    assertThat(chord.durationType()).isEqualTo(DurationType.HALF);
    assertThat(chord.duration()).isEqualTo(Fraction.of(3, 4));
    assertThat(chord.offset()).isEqualTo(new PointF(0.5, -1));
    assertThat(chord.color()).isEqualTo(new Color(255, 0, 0, 255));
    assertThat(chord.isVisible()).isFalse();
  }

  @Test
  void brokenConnectorIsRepairedAtDocumentEnd() throws Exception {
    Score score = parse("/scores/broken-slur.mscx", ReaderOptions.DEFAULT);

    assertThat(score.measures()).singleElement()
        .satisfies(m -> assertThat(m.ticks()).isEqualTo(Fraction.of(3, 4)));
    assertThat(score.connectors()).singleElement().satisfies(c -> {
      assertThat(c.repaired()).isTrue();
      assertThat(c.id()).isEqualTo(7);
      assertThat(c.tick()).isEqualTo(Fraction.ZERO);
      assertThat(c.tick2()).isEqualTo(Fraction.of(1, 4));
    });
  }

  @Test
  void brokenConnectorIsDiscardedWithoutRepair() throws Exception {
    Score score = new Score();
    TeardownReport report;
    try (InputStream in = getClass().getResourceAsStream("/scores/broken-slur.mscx");
        ScoreXmlReader reader = ScoreXmlReader.open(in, ReaderOptions.NO_REPAIR)) {
      report = new StreamingScoreParser(ReaderOptions.NO_REPAIR).parse(reader, score, listener);
    }

    assertThat(score.connectors()).isEmpty();
    assertThat(report).isEqualTo(new TeardownReport(2, 0));
    verify(listener).onDocumentEnd(any(), eq(report));
  }

  @Test
  void listenerSeesEveryMeasureInOrder() throws Exception {
    String xml =
        "<museScore><Score><Staff id=\"1\">"
            + "<Measure><voice><Rest><durationType>measure</durationType></Rest></voice></Measure>"
            + "<Measure><voice><Rest><durationType>measure</durationType></Rest></voice></Measure>"
            + "</Staff></Score></museScore>";
    Score score = new Score();

    parseText(xml, score, ReaderOptions.DEFAULT, listener);

    Measure m0 = score.measures().get(0);
    Measure m1 = score.measures().get(1);
    InOrder order = inOrder(listener);
    order.verify(listener).onDocumentStart(any());
    order.verify(listener).onMeasureStart(any(), eq(0), eq(m0));
    order.verify(listener).onMeasureEnd(any(), eq(0), eq(m0), eq(false));
    order.verify(listener).onMeasureStart(any(), eq(0), eq(m1));
    order.verify(listener).onMeasureEnd(any(), eq(0), eq(m1), eq(false));
    order.verify(listener).onDocumentEnd(any(), eq(TeardownReport.EMPTY));
  }

  @Test
  void listenerCanSkipMeasure() throws Exception {
    String xml =
        "<museScore><Score><Staff id=\"1\">"
            + "<Measure><voice><Chord/><Chord/></voice></Measure>"
            + "<Measure><voice><Chord/></voice></Measure>"
            + "</Staff></Score></museScore>";
    when(listener.onMeasureStart(any(), anyInt(), any()))
        .thenReturn(false)
        .thenReturn(true);
    Score score = new Score();

    parseText(xml, score, ReaderOptions.DEFAULT, listener);

    assertThat(score.measures()).hasSize(2);
    assertThat(score.measures().get(0).elements()).isEmpty();
    assertThat(score.measures().get(1).elements()).hasSize(1);
    verify(listener).onMeasureEnd(any(), eq(0), eq(score.measures().get(0)), eq(true));
    verify(listener).onMeasureEnd(any(), eq(0), eq(score.measures().get(1)), eq(false));
  }

  @Test
  void problemsGoToErrorHandlerAndReadingContinues() throws Exception {
    String xml =
        "<museScore><Score><Staff id=\"1\"><Measure><voice>"
            + "<Foo><Chord/></Foo>"
            + "<Spanner id=\"3\"><next/></Spanner>"
            + "<Chord/>"
            + "</voice></Measure></Staff></Score></museScore>";
    ReaderOptions options = ReaderOptions.builder().errorHandler(errorHandler).build();
    Score score = new Score();

    parseText(xml, score, options, ScoreParserListener.NOOP);

    verify(errorHandler).handleUnknownElement(any(), eq("Foo"));
    ArgumentCaptor<ScoreParseException> error = ArgumentCaptor.forClass(ScoreParseException.class);
    verify(errorHandler).handleRecoverableError(error.capture());
    assertThat(error.getValue()).isInstanceOf(MissingAttributeException.class);
    assertThat(error.getValue().getMessage()).contains("type");

    // the chord inside <Foo> is skipped with it
    assertThat(score.measures().get(0).elements()).singleElement()
        .satisfies(e -> assertThat(e.tick()).isEqualTo(Fraction.ZERO));
  }

  @Test
  void staffWithoutIdTakesNextStaff() throws Exception {
    String xml =
        "<museScore><Score>"
            + "<Staff id=\"1\"><Measure><voice><Chord/></voice></Measure></Staff>"
            + "<Staff><Measure><voice><Chord/></voice></Measure></Staff>"
            + "</Score></museScore>";
    ReaderOptions options = ReaderOptions.builder().errorHandler(errorHandler).build();
    Score score = new Score();

    parseText(xml, score, options, ScoreParserListener.NOOP);

    verify(errorHandler).handleRecoverableError(any(MissingAttributeException.class));
    verify(errorHandler, never()).handleUnknownElement(any(), any());
    assertThat(onTrack(score.measures().get(0), 4)).hasSize(1);
  }

  @Test
  void tickElementRepositionsVoice() throws Exception {
    String xml =
        "<museScore><Score><Staff id=\"1\"><Measure><voice>"
            + "<tick>960</tick><Chord/>"
            + "</voice></Measure></Staff></Score></museScore>";
    Score score = new Score();

    parseText(xml, score, ReaderOptions.DEFAULT, ScoreParserListener.NOOP);

    assertThat(score.measures().get(0).elements()).singleElement()
        .satisfies(e -> assertThat(e.tick()).isEqualTo(Fraction.of(1, 2)));
  }

  @Test
  void locationIntoNextMeasureKeepsHintsInThatMeasure() throws Exception {
    String xml =
        "<museScore><Score>"
            + "<Staff id=\"1\">"
            + "<Measure><voice><Rest><durationType>measure</durationType></Rest></voice></Measure>"
            + "<Measure><voice><Rest><durationType>measure</durationType></Rest></voice></Measure>"
            + "</Staff>"
            + "<Staff id=\"2\">"
            + "<Measure>"
            + "<voice>"
            + "<location><measures>1</measures></location>"
            + "<Spanner type=\"Slur\" id=\"5\">"
            + "<next><location><fractions>1/4</fractions></location></next>"
            + "</Spanner>"
            + "</voice>"
            + "<voice><Chord/></voice>"
            + "</Measure>"
            + "<Measure><voice>"
            + "<Chord/>"
            + "<Spanner type=\"Slur\" id=\"5\">"
            + "<prev><location><fractions>-1/4</fractions></location></prev>"
            + "</Spanner>"
            + "</voice></Measure>"
            + "</Staff>"
            + "</Score></museScore>";
    Score score = new Score();

    TeardownReport report = parseText(xml, score, ReaderOptions.NO_REPAIR, ScoreParserListener.NOOP);

    assertThat(report).isEqualTo(TeardownReport.EMPTY);
    assertThat(score.connectors()).singleElement().satisfies(c -> {
      assertThat(c.repaired()).isFalse();
      assertThat(c.tick()).isEqualTo(Fraction.of(1, 1));
      assertThat(c.tick2()).isEqualTo(Fraction.of(5, 4));
      assertThat(c.track()).isEqualTo(4);
    });
    // the second voice starts over in the measure being read
    assertThat(onTrack(score.measures().get(0), 5)).singleElement()
        .satisfies(e -> assertThat(e.tick()).isEqualTo(Fraction.ZERO));
  }

  @Test
  void endFragmentsRecordSpannerValues() throws Exception {
    List<Optional<SpannerRegistry.SpannerValues>> seen = new ArrayList<>();
    ScoreParserListener recorder =
        new ScoreParserListener() {
          @Override
          public void onMeasureEnd(ReadContext context, int staff, Measure measure, boolean skipped) {
            seen.add(context.spanners().spannerValues(8));
            seen.add(context.spanners().spannerValues(7));
          }
        };
    Score score = new Score();
    try (InputStream in = getClass().getResourceAsStream("/scores/broken-slur.mscx");
        ScoreXmlReader reader = ScoreXmlReader.open(in, ReaderOptions.DEFAULT)) {
      new StreamingScoreParser(ReaderOptions.DEFAULT).parse(reader, score, recorder);
    }

    assertThat(seen).hasSize(2);
    assertThat(seen.get(0)).contains(new SpannerRegistry.SpannerValues(8, Fraction.of(1, 4), 0));
    // start fragments record nothing
    assertThat(seen.get(1)).isEmpty();
  }
}
