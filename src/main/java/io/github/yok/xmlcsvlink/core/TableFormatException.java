package io.github.yok.xmlcsvlink.core;

import io.github.yok.xmlcsvlink.parser.ConversionException;

/**
 * Thrown when tabular text cannot be turned into a tree.
 *
 * @author Yasuharu.Okawauchi
 */
public class TableFormatException extends ConversionException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with the given message.
     *
     * @param message description of the problem
     */
    public TableFormatException(String message) {
        super(message);
    }
}
