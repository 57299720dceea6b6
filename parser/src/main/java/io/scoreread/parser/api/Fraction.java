package io.scoreread.parser.api;

/**
 * Immutable rational time value.
 *
 * <p>Fractions are kept exactly as constructed (only the sign is normalized to the numerator), so
 * a tuplet ratio of {@code 6/4} stays distinguishable from {@code 3/2}. Equality and ordering are
 * defined on the rational value. Integer ticks use {@link #DIVISION} ticks per quarter note.
 */
public final class Fraction implements Comparable<Fraction> {
  /** Ticks per quarter note. */
  public static final int DIVISION = 480;

  private static final int TICKS_PER_WHOLE = DIVISION * 4;

  public static final Fraction ZERO = new Fraction(0, 1);

  /** Marker for a field that has not been assigned yet. */
  public static final Fraction UNSET = new Fraction(Integer.MIN_VALUE, 1);

  /** The {@code -1} tick marker used by the file format for "no value". */
  public static final Fraction INVALID = new Fraction(-1, 1);

  private final int numerator;
  private final int denominator;

  /**
   * Creates a fraction.
   *
   * @param numerator the numerator
   * @param denominator the denominator, must not be zero
   * @throws ArithmeticException if {@code denominator} is zero
   */
  public Fraction(int numerator, int denominator) {
    if (denominator == 0) {
      throw new ArithmeticException("Zero denominator: " + numerator + "/0");
    }
    if (denominator < 0) {
      numerator = -numerator;
      denominator = -denominator;
    }
    this.numerator = numerator;
    this.denominator = denominator;
  }

  public static Fraction of(int numerator, int denominator) {
    return new Fraction(numerator, denominator);
  }

  /**
   * Converts integer ticks to a reduced fraction of a whole note.
   *
   * @param ticks tick count, {@code -1} maps to {@link #INVALID}
   * @return the fraction
   */
  public static Fraction fromTicks(int ticks) {
    if (ticks == -1) {
      return INVALID;
    }
    return new Fraction(ticks, TICKS_PER_WHOLE).reduced();
  }

  /**
   * Parses the {@code "a/b"} text form. A value without a slash is taken as a plain numerator over
   * one.
   *
   * @param text the text to parse
   * @return the parsed fraction
   * @throws NumberFormatException if either part is not an integer
   */
  public static Fraction parse(String text) {
    String s = text.trim();
    int slash = s.indexOf('/');
    if (slash < 0) {
      return new Fraction(Integer.parseInt(s), 1);
    }
    return new Fraction(
        Integer.parseInt(s.substring(0, slash).trim()),
        Integer.parseInt(s.substring(slash + 1).trim()));
  }

  public int numerator() {
    return numerator;
  }

  public int denominator() {
    return denominator;
  }

  /**
   * Integer ticks for this value, rounded to the nearest tick.
   *
   * @return ticks, or {@code -1} for {@link #INVALID}
   */
  public int ticks() {
    if (numerator == -1 && denominator == 1) {
      return -1;
    }
    long scaled = (long) numerator * TICKS_PER_WHOLE;
    long half = denominator / 2;
    return (int) ((scaled >= 0 ? scaled + half : scaled - half) / denominator);
  }

  public Fraction reduced() {
    int g = gcd(Math.abs(numerator), denominator);
    if (g <= 1) {
      return this;
    }
    return new Fraction(numerator / g, denominator / g);
  }

  public Fraction plus(Fraction other) {
    if (denominator == other.denominator) {
      return new Fraction(numerator + other.numerator, denominator);
    }
    return normalize(
        (long) numerator * other.denominator + (long) other.numerator * denominator,
        (long) denominator * other.denominator);
  }

  public Fraction minus(Fraction other) {
    return plus(other.negate());
  }

  public Fraction multiply(Fraction other) {
    return normalize((long) numerator * other.numerator, (long) denominator * other.denominator);
  }

  public Fraction divide(Fraction other) {
    if (other.numerator == 0) {
      throw new ArithmeticException("Division by zero fraction");
    }
    return normalize((long) numerator * other.denominator, (long) denominator * other.numerator);
  }

  public Fraction negate() {
    return new Fraction(-numerator, denominator);
  }

  public boolean isZero() {
    return numerator == 0;
  }

  public boolean isNegative() {
    return numerator < 0;
  }

  public boolean isValid() {
    return !equals(INVALID) && !equals(UNSET);
  }

  @Override
  public int compareTo(Fraction o) {
    return Long.compare((long) numerator * o.denominator, (long) o.numerator * denominator);
  }

  public boolean isBefore(Fraction o) {
    return compareTo(o) < 0;
  }

  public boolean isAfter(Fraction o) {
    return compareTo(o) > 0;
  }

  public static Fraction max(Fraction a, Fraction b) {
    return a.compareTo(b) >= 0 ? a : b;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Fraction)) return false;
    Fraction that = (Fraction) o;
    return (long) numerator * that.denominator == (long) that.numerator * denominator;
  }

  @Override
  public int hashCode() {
    Fraction r = reduced();
    return 31 * r.numerator + r.denominator;
  }

  @Override
  public String toString() {
    return numerator + "/" + denominator;
  }

  // Reduces before narrowing so intermediate long products stay representable.
  private static Fraction normalize(long n, long d) {
    long g = gcd(Math.abs(n), Math.abs(d));
    if (g > 1) {
      n /= g;
      d /= g;
    }
    return new Fraction(Math.toIntExact(n), Math.toIntExact(d));
  }

  private static int gcd(int a, int b) {
    while (b != 0) {
      int t = a % b;
      a = b;
      b = t;
    }
    return a;
  }

  private static long gcd(long a, long b) {
    while (b != 0) {
      long t = a % b;
      a = b;
      b = t;
    }
    return a;
  }
}
