package io.scoreread.parser.api;

import io.scoreread.parser.internal_api.ScoreParserListener;
import io.scoreread.parser.internal_api.ScoreXmlReader;
import io.scoreread.parser.internal_api.StreamingScoreParser;
import io.scoreread.parser.internal_api.TeardownReport;
import io.scoreread.parser.score.Score;
import io.scoreread.parser.score.ScoreDocument;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Entry points for reading score documents and pasting score fragments.
 *
 * <p>Reading is best-effort: problems in the input are reported through the {@link ErrorHandler}
 * of the {@link ReaderOptions} and the rest of the document is still read. Only an unreadable
 * token stream ends a read with an exception.
 */
public final class ScoreReader {
  private ScoreReader() {}

  /**
   * Reads a score file with {@link ReaderOptions#DEFAULT}.
   *
   * @param path the score file
   * @return the score
   * @throws ScoreIOException if the file cannot be read
   */
  public static Score read(Path path) throws ScoreIOException {
    return read(path, ReaderOptions.DEFAULT);
  }

  /**
   * Reads a score file.
   *
   * @param path the score file
   * @param options reader options
   * @return the score
   * @throws ScoreIOException if the file cannot be read
   */
  public static Score read(Path path, ReaderOptions options) throws ScoreIOException {
    try (InputStream in = Files.newInputStream(path)) {
      return read(in, options, ScoreParserListener.NOOP);
    } catch (IOException e) {
      throw ScoreIOException.fileReadError(path, e);
    }
  }

  /**
   * Reads a score from a stream. The stream is left open.
   *
   * @param in the document bytes
   * @param options reader options
   * @param listener progress callbacks
   * @return the score
   * @throws ScoreIOException if the token stream cannot be read
   */
  public static Score read(InputStream in, ReaderOptions options, ScoreParserListener listener)
      throws ScoreIOException {
    Score score = new Score();
    try (ScoreXmlReader reader = ScoreXmlReader.open(in, options)) {
      new StreamingScoreParser(options).parse(reader, score, listener);
    }
    return score;
  }

  /**
   * Pastes a copied staff list into an existing document.
   *
   * @param in the copied content
   * @param target the document to paste into; it must contain the measures the content covers
   * @param dstTick where the content starts in {@code target}
   * @param dstStaff the staff the first copied staff goes to
   * @param options reader options
   * @return what happened to connectors of the pasted content that never resolved
   * @throws ScoreIOException if the token stream cannot be read
   */
  public static TeardownReport paste(
      InputStream in, ScoreDocument target, Fraction dstTick, int dstStaff, ReaderOptions options)
      throws ScoreIOException {
    try (ScoreXmlReader reader = ScoreXmlReader.open(in, options)) {
      return new StreamingScoreParser(options)
          .paste(reader, target, dstTick, dstStaff, ScoreParserListener.NOOP);
    }
  }
}
