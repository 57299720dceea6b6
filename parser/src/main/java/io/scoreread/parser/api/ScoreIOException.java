package io.scoreread.parser.api;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Exception thrown for I/O and token-stream errors while reading a score document.
 */
public class ScoreIOException extends ScoreParseException {

    private ScoreIOException(String message, Throwable cause, String context) {
        super(message, cause, context, "IO");
    }

    /**
     * Creates a ScoreIOException for a file read error.
     *
     * @param filePath the path of the file that could not be read
     * @param cause the underlying IOException
     * @return a new ScoreIOException instance
     */
    public static ScoreIOException fileReadError(Path filePath, IOException cause) {
        return new ScoreIOException("Failed to read score file", cause, filePath.toString());
    }

    /**
     * Creates a ScoreIOException for a token stream that could not be read any further.
     *
     * @param position the last known position in the document
     * @param cause the underlying exception
     * @return a new ScoreIOException instance
     */
    public static ScoreIOException malformedStream(ElementPosition position, Throwable cause) {
        return new ScoreIOException(
            "Malformed score document", cause, position != null ? position.toString() : null);
    }
}
