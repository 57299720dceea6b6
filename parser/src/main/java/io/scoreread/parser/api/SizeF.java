package io.scoreread.parser.api;

/** A width/height pair; also used for scale factors. */
public record SizeF(double width, double height) {}
