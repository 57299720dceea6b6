package io.scoreread.parser.api;

public record RectF(double x, double y, double width, double height) {}
