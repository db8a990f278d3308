package io.github.yok.xmlcsvlink.parser;

/**
 * Base class of the errors that abort a conversion because the input text is malformed.
 *
 * @author Yasuharu.Okawauchi
 */
public class ConversionException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with the given message.
     *
     * @param message description of the problem
     */
    public ConversionException(String message) {
        super(message);
    }
}
