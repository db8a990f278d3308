package io.github.yok.xmlcsvlink.model;

/**
 * Kinds of lexical/formatting units exchanged between the lexer, the parser and the serializer.
 *
 * @author Yasuharu.Okawauchi
 */
public enum TermType {

    // Start of an element, e.g. "<name>".
    OPENING_TAG,

    // End of an element, e.g. "</name>".
    CLOSING_TAG,

    // Run of character data.
    TEXT,

    // No term; used as the idle state of the lexer accumulator.
    NONE
}
