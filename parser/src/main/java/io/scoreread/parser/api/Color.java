package io.scoreread.parser.api;

/** RGBA colour with 8-bit channels. */
public record Color(int red, int green, int blue, int alpha) {
  public static final Color BLACK = new Color(0, 0, 0, 255);

  public Color {
    red = clamp(red);
    green = clamp(green);
    blue = clamp(blue);
    alpha = clamp(alpha);
  }

  private static int clamp(int channel) {
    return Math.max(0, Math.min(255, channel));
  }
}
