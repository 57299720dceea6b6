/**
 * Public API for reading score documents.
 *
 * <p>
 * Entry point is {@link io.scoreread.parser.api.ScoreReader}, configured with
 * {@link io.scoreread.parser.api.ReaderOptions}. Positions in a document are expressed as
 * {@link io.scoreread.parser.api.Location} values over {@link io.scoreread.parser.api.Fraction}
 * time. Recoverable input problems go to an {@link io.scoreread.parser.api.ErrorHandler}.
 * </p>
 */
package io.scoreread.parser.api;
