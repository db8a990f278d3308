package io.github.yok.xmlcsvlink.parser;

/**
 * Thrown when the term sequence does not describe a well-nested tree.
 *
 * @author Yasuharu.Okawauchi
 */
public class TreeException extends ConversionException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with the given message.
     *
     * @param message description of the problem
     */
    public TreeException(String message) {
        super(message);
    }

    /**
     * Creates the exception raised for a closing tag that does not match the open element.
     *
     * @param found name of the closing tag
     * @param expected name of the innermost open element
     * @return new exception
     */
    static TreeException unexpectedClosingTag(String found, String expected) {
        return new TreeException(
                String.format("Unexpected closing tag. Found: %s, Expected: %s", found, expected));
    }
}
