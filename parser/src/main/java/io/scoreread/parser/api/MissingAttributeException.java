package io.scoreread.parser.api;

/**
 * Thrown when a required attribute is absent and the caller supplied no default.
 *
 * <p>Only the attribute read fails; callers are expected to report the exception through the
 * {@link ErrorHandler} and carry on with the rest of the document.
 */
public class MissingAttributeException extends ScoreParseException {
    private final String attribute;
    private final ElementPosition position;

    /**
     * @param attribute the missing attribute key
     * @param element the element that was expected to carry it
     * @param position where the element starts
     */
    public MissingAttributeException(String attribute, String element, ElementPosition position) {
        super(
            "Missing required attribute '" + attribute + "' on <" + element + ">",
            position.toString(),
            "MISSING_ATTRIBUTE");
        this.attribute = attribute;
        this.position = position;
    }

    public String getAttribute() {
        return attribute;
    }

    public ElementPosition getPosition() {
        return position;
    }
}
