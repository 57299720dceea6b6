/**
 * Parser utilities shared by the reader.
 *
 * <p>
 * Contains low-level helpers such as {@link io.scoreread.parser.ParsingUtils}.
 * These are generally not needed for typical API consumers.
 * </p>
 */
package io.scoreread.parser;
