package io.scoreread.parser.score;

import io.scoreread.parser.api.Fraction;
import java.util.Optional;

/** Written note values. {@link #MEASURE} takes its length from an explicit duration. */
public enum DurationType {
  LONG("long", Fraction.of(4, 1)),
  BREVE("breve", Fraction.of(2, 1)),
  WHOLE("whole", Fraction.of(1, 1)),
  HALF("half", Fraction.of(1, 2)),
  QUARTER("quarter", Fraction.of(1, 4)),
  EIGHTH("eighth", Fraction.of(1, 8)),
  V_16TH("16th", Fraction.of(1, 16)),
  V_32ND("32nd", Fraction.of(1, 32)),
  V_64TH("64th", Fraction.of(1, 64)),
  V_128TH("128th", Fraction.of(1, 128)),
  MEASURE("measure", Fraction.ZERO);

  private static final int MAX_DOTS = 4;

  private final String xmlName;
  private final Fraction fraction;

  DurationType(String xmlName, Fraction fraction) {
    this.xmlName = xmlName;
    this.fraction = fraction;
  }

  public String xmlName() {
    return xmlName;
  }

  public Fraction fraction() {
    return fraction;
  }

  /** Length of this value with the given number of augmentation dots. */
  public Fraction withDots(int dots) {
    Fraction f = fraction;
    Fraction add = fraction;
    for (int i = 0; i < dots; i++) {
      add = add.multiply(Fraction.of(1, 2));
      f = f.plus(add);
    }
    return f.reduced();
  }

  public static Optional<DurationType> fromXmlName(String name) {
    for (DurationType t : values()) {
      if (t.xmlName.equals(name)) {
        return Optional.of(t);
      }
    }
    return Optional.empty();
  }

  /**
   * Whether a length can be written as a single note value with up to four dots.
   *
   * @param f the length to test
   * @return {@code true} if some value and dot count produce exactly {@code f}
   */
  public static boolean isValid(Fraction f) {
    for (DurationType t : values()) {
      if (t == MEASURE) {
        continue;
      }
      for (int dots = 0; dots <= MAX_DOTS; dots++) {
        if (t.withDots(dots).equals(f)) {
          return true;
        }
      }
    }
    return false;
  }
}
