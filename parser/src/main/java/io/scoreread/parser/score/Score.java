package io.scoreread.parser.score;

import io.scoreread.parser.api.Fraction;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** In-memory score document. Not thread-safe. */
public class Score implements ScoreDocument {
  private static final Logger log = LoggerFactory.getLogger(Score.class);

  private final List<Measure> measures = new ArrayList<>();
  private final List<Tuplet> tuplets = new ArrayList<>();
  private final List<TextElement> texts = new ArrayList<>();
  private final List<Connector> connectors = new ArrayList<>();
  private final List<ConnectorElement> retained = new ArrayList<>();

  @Override
  public Measure appendMeasure(Fraction length) {
    Measure m = new Measure(measures.size(), endTick(), length);
    measures.add(m);
    return m;
  }

  public Fraction endTick() {
    return measures.isEmpty() ? Fraction.ZERO : measures.get(measures.size() - 1).endTick();
  }

  public List<Measure> measures() {
    return Collections.unmodifiableList(measures);
  }

  @Override
  public Optional<Measure> measure(int index) {
    if (index < 0 || index >= measures.size()) {
      return Optional.empty();
    }
    return Optional.of(measures.get(index));
  }

  @Override
  public Optional<Measure> measureAt(Fraction tick) {
    int lo = 0;
    int hi = measures.size() - 1;
    while (lo <= hi) {
      int mid = (lo + hi) >>> 1;
      Measure m = measures.get(mid);
      if (tick.isBefore(m.tick())) {
        hi = mid - 1;
      } else if (!tick.isBefore(m.endTick())) {
        lo = mid + 1;
      } else {
        return Optional.of(m);
      }
    }
    return Optional.empty();
  }

  @Override
  public boolean add(DurationElement element) {
    Optional<Measure> m = measureAt(element.tick());
    if (m.isEmpty()) {
      log.warn("No measure at tick {} for {}", element.tick(), element);
      return false;
    }
    m.get().add(element);
    return true;
  }

  @Override
  public void addTuplet(Tuplet tuplet) {
    tuplets.add(tuplet);
  }

  @Override
  public void removeTuplet(Tuplet tuplet) {
    tuplets.remove(tuplet);
  }

  public List<Tuplet> tuplets() {
    return Collections.unmodifiableList(tuplets);
  }

  @Override
  public void addText(TextElement text) {
    texts.add(text);
  }

  public List<TextElement> texts() {
    return Collections.unmodifiableList(texts);
  }

  @Override
  public void commitConnector(Connector connector, boolean pasteMode) {
    log.debug("{} connector {} committed", pasteMode ? "Pasted" : "Read", connector);
    connectors.add(connector);
  }

  public List<Connector> connectors() {
    return Collections.unmodifiableList(connectors);
  }

  @Override
  public void retainUnfinished(ConnectorElement element) {
    retained.add(element);
  }

  public List<ConnectorElement> retained() {
    return Collections.unmodifiableList(retained);
  }
}
