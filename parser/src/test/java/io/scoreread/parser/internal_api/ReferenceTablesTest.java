package io.scoreread.parser.internal_api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

import io.scoreread.parser.api.Fraction;
import io.scoreread.parser.score.Beam;
import io.scoreread.parser.score.ChordRest;
import io.scoreread.parser.score.DurationElement;
import io.scoreread.parser.score.DurationType;
import io.scoreread.parser.score.ScoreDocument;
import io.scoreread.parser.score.Tuplet;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

public class ReferenceTablesTest {
  @Mock private ScoreDocument document;

  private AutoCloseable mocks;
  private ReferenceTables tables;

  @BeforeEach
  void setUp() {
    mocks = MockitoAnnotations.openMocks(this);
    tables = new ReferenceTables();
  }

  @AfterEach
  void tearDown() throws Exception {
    mocks.close();
  }

  private static ChordRest eighth(Fraction tick, int track) {
    ChordRest cr = ChordRest.chord();
    cr.setDurationType(DurationType.EIGHTH);
    cr.setDuration(DurationType.EIGHTH.fraction());
    cr.setTick(tick);
    cr.setTrack(track);
    return cr;
  }

  private static Tuplet triplet(int id, int track) {
    Tuplet t = new Tuplet(id);
    t.setTrack(track);
    t.setShape(3, 2, DurationType.EIGHTH.fraction());
    return t;
  }

  @Test
  void lookupsMissReturnEmpty() {
    assertThat(tables.findBeam(1)).isEmpty();
    assertThat(tables.findTuplet(1)).isEmpty();

    Beam beam = new Beam(1);
    tables.addBeam(beam);
    assertThat(tables.findBeam(1)).containsSame(beam);
    assertThat(tables.beamCount()).isEqualTo(1);
  }

  @Test
  void emptyTupletIsDroppedWithoutSortingOrSanitizing() {
    Tuplet empty = spy(triplet(7, 1));
    tables.addTuplet(empty);

    int dropped = tables.checkTuplets(document);

    assertThat(dropped).isEqualTo(1);
    assertThat(tables.findTuplet(7)).isEmpty();
    verify(empty, never()).sortElements();
    verify(empty, never()).sanitizeTuplet();
    verify(document).removeTuplet(empty);
  }

  @Test
  void emptyNestedTupletIsRemovedFromParent() {
    Tuplet parent = triplet(1, 1);
    parent.add(eighth(Fraction.ZERO, 1));
    Tuplet child = triplet(2, 1);
    parent.add(child);
    tables.addTuplet(parent);
    tables.addTuplet(child);

    tables.checkTuplets(document);

    assertThat(parent.elements()).doesNotContain(child);
    assertThat(child.tuplet()).isNull();
  }

  @Test
  void elementsAreSortedBeforeSanitizing() {
    Tuplet tuplet = spy(triplet(1, 0));
    tuplet.add(eighth(Fraction.of(2, 12), 0));
    tuplet.add(eighth(Fraction.ZERO, 0));
    tuplet.add(eighth(Fraction.of(1, 12), 0));
    tables.addTuplet(tuplet);

    tables.checkTuplets(document);

    InOrder order = inOrder(tuplet);
    order.verify(tuplet).sortElements();
    order.verify(tuplet).sanitizeTuplet();
    order.verify(tuplet).addMissingElements(document);
    List<Fraction> ticks =
        tuplet.elements().stream().map(DurationElement::tick).collect(Collectors.toList());
    assertThat(ticks).containsExactly(Fraction.ZERO, Fraction.of(1, 12), Fraction.of(1, 6));
  }

  @Test
  void everyTupletIsSanitizedBeforeAnyIsFilled() {
    Tuplet first = spy(triplet(1, 1));
    first.add(eighth(Fraction.ZERO, 1));
    Tuplet second = spy(triplet(2, 1));
    second.add(eighth(Fraction.of(1, 4), 1));
    tables.addTuplet(first);
    tables.addTuplet(second);

    tables.checkTuplets(document);

    InOrder order = inOrder(first, second);
    order.verify(first).sanitizeTuplet();
    order.verify(second).sanitizeTuplet();
    order.verify(first).addMissingElements(document);
    order.verify(second).addMissingElements(document);
  }

  @Test
  void missingElementsAreFilledWithRests() {
    Tuplet tuplet = triplet(1, 1);
    tuplet.setTick(Fraction.ZERO);
    tuplet.add(eighth(Fraction.ZERO, 1));
    tuplet.add(eighth(Fraction.of(1, 12), 1));
    tables.addTuplet(tuplet);

    tables.checkTuplets(document);

    ArgumentCaptor<DurationElement> added = ArgumentCaptor.forClass(DurationElement.class);
    verify(document).add(added.capture());
    DurationElement rest = added.getValue();
    assertThat(rest).isInstanceOf(ChordRest.class);
    assertThat(((ChordRest) rest).isRest()).isTrue();
    assertThat(rest.tick()).isEqualTo(Fraction.of(1, 6));
    assertThat(rest.duration()).isEqualTo(Fraction.of(1, 8));
    assertThat(rest.track()).isEqualTo(1);
    assertThat(tuplet.elements()).hasSize(3).last().isSameAs(rest);
  }

  @Test
  void firstVoiceTupletsAreNotFilled() {
    Tuplet tuplet = triplet(1, 4);
    tuplet.add(eighth(Fraction.ZERO, 4));
    tables.addTuplet(tuplet);

    tables.checkTuplets(document);

    verify(document, never()).add(any());
    assertThat(tuplet.elements()).hasSize(1);
  }

  @Test
  void reducibleRatioIsSanitized() {
    Tuplet tuplet = new Tuplet(3);
    tuplet.setShape(6, 4, DurationType.EIGHTH.fraction());
    for (int i = 0; i < 6; i++) {
      ChordRest cr = ChordRest.chord();
      cr.setDuration(DurationType.V_16TH.fraction());
      cr.setTick(Fraction.of(i, 24));
      tuplet.add(cr);
    }
    tables.addTuplet(tuplet);

    tables.checkTuplets(document);

    assertThat(tuplet.duration()).isEqualTo(Fraction.of(1, 4));
    assertThat(tuplet.baseLen()).isEqualTo(Fraction.of(1, 16));
  }

  @Test
  void clearEmptiesTables() {
    tables.addBeam(new Beam(1));
    tables.addTuplet(triplet(1, 0));
    tables.clearTuplets();
    assertThat(tables.tuplets()).isEmpty();
    assertThat(tables.beamCount()).isEqualTo(1);
    tables.clear();
    assertThat(tables.beamCount()).isZero();
  }
}
