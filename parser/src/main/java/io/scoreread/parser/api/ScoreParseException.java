package io.scoreread.parser.api;

/**
 * Base exception for score reading errors. The message carries the context, usually a document
 * position or file name, and a short error code, such as {@code IO} or {@code MISSING_ATTRIBUTE}.
 */
public class ScoreParseException extends Exception {
    private final String context;
    private final String errorCode;

    public ScoreParseException(String message, String context, String errorCode) {
        this(message, null, context, errorCode);
    }

    public ScoreParseException(String message, Throwable cause, String context, String errorCode) {
        super(formatMessage(message, context, errorCode), cause);
        this.context = context;
        this.errorCode = errorCode;
    }

    private static String formatMessage(String message, String context, String errorCode) {
        StringBuilder sb = new StringBuilder(message);
        if (context != null) {
            sb.append(" [Context: ").append(context).append("]");
        }
        if (errorCode != null) {
            sb.append(" [Error Code: ").append(errorCode).append("]");
        }
        return sb.toString();
    }

    public String getContext() {
        return context;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
