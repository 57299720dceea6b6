package io.scoreread.parser.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Interface for handling recoverable problems found while reading a score.
 * Allows for configurable error handling strategies.
 */
public interface ErrorHandler {

    /**
     * Default error handler that logs problems and keeps reading.
     */
    ErrorHandler DEFAULT = new ErrorHandler() {
        private final Logger log = LoggerFactory.getLogger(ErrorHandler.class);

        @Override
        public void handleUnknownElement(ElementPosition position, String name) {
            log.warn("tag in {}: {}", position, name);
        }

        @Override
        public void handleRecoverableError(ScoreParseException e) {
            log.warn("Recoverable read error: {}", e.getMessage());
        }
    };

    /**
     * Handle an element the reader does not recognise. The element is skipped afterwards.
     *
     * @param position where the element starts
     * @param name the element name
     */
    void handleUnknownElement(ElementPosition position, String name);

    /**
     * Handle a malformed but recoverable construct, such as a missing required attribute.
     *
     * @param e the exception describing the problem
     */
    void handleRecoverableError(ScoreParseException e);

    /**
     * Creates a strict error handler that turns every reported problem into an exception.
     *
     * @return a strict error handler
     */
    static ErrorHandler strict() {
        return new ErrorHandler() {
            @Override
            public void handleUnknownElement(ElementPosition position, String name) {
                throw new IllegalStateException("Unknown element <" + name + "> at " + position);
            }

            @Override
            public void handleRecoverableError(ScoreParseException e) {
                throw new RuntimeException("Read error: " + e.getMessage(), e);
            }
        };
    }
}
