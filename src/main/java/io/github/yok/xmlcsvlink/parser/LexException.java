package io.github.yok.xmlcsvlink.parser;

import lombok.Getter;

/**
 * Thrown when the markup text contains a character that is not allowed in the current lexer state.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class LexException extends ConversionException {

    private static final long serialVersionUID = 1L;

    // 1-based line of the offending character
    private final int line;

    // 1-based column of the offending character
    private final int column;

    /**
     * Creates an exception for an unexpected character.
     *
     * @param character offending character
     * @param line 1-based line
     * @param column 1-based column
     */
    public LexException(char character, int line, int column) {
        super(String.format("Unexpected '%s' at line %d, column %d", character, line, column));
        this.line = line;
        this.column = column;
    }
}
