package io.scoreread.parser.score;

import io.scoreread.parser.api.Fraction;

/**
 * Staff text attached to a position.
 *
 * @param track the track the text belongs to
 * @param tick the position in the document
 * @param style the resolved style
 * @param text the text, possibly containing inline markup
 */
public record TextElement(int track, Fraction tick, TextStyleType style, String text) {}
