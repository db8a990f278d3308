package io.github.yok.xmlcsvlink.parser;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import io.github.yok.xmlcsvlink.model.Term;
import io.github.yok.xmlcsvlink.model.TermType;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Converts markup text into an ordered list of {@link Term}s.
 *
 * <p>
 * The text is scanned once, character by character, with a single accumulator and one character
 * of lookback:
 * </p>
 * <ul>
 * <li>{@code <} ends a pending text run and starts an opening tag.</li>
 * <li>{@code >} ends the pending opening or closing tag.</li>
 * <li>{@code /} directly after {@code <} turns the opening tag into a closing tag; inside text it
 * is an ordinary character.</li>
 * <li>{@code ?} skips the rest of the line (declarations and processing instructions).</li>
 * </ul>
 *
 * <p>
 * Terms are trimmed of Unicode white space when flushed and dropped when empty. Any character that is not valid in the
 * current state aborts the whole scan; no partial result is returned. A term still being
 * accumulated at end of input is discarded.
 * </p>
 *
 * <p>
 * Instances hold no state between calls.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class MarkupLexer {

    /**
     * Splits the given text into terms.
     *
     * @param text full markup document
     * @return terms in document order
     * @throws LexException if a character is not allowed in the current state
     */
    public List<Term> tokenize(String text) throws LexException {
        Preconditions.checkNotNull(text, "text must not be null");

        List<Term> terms = new ArrayList<>();
        StringBuilder buffer = new StringBuilder();
        TermType current = TermType.NONE;
        char previous = '\0';
        boolean skipToEndOfLine = false;
        int line = 1;
        int column = 0;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (i > 0 && text.charAt(i - 1) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }

            if (c == '\n' && skipToEndOfLine) {
                skipToEndOfLine = false;
                previous = '\0';
                current = TermType.NONE;
                buffer.setLength(0);
            }
            if (skipToEndOfLine) {
                continue;
            }

            switch (c) {
                case '<':
                    if (current == TermType.TEXT) {
                        current = flush(terms, current, buffer);
                    }
                    if (current != TermType.NONE) {
                        throw new LexException(c, line, column);
                    }
                    current = TermType.OPENING_TAG;
                    break;
                case '>':
                    if (current != TermType.OPENING_TAG && current != TermType.CLOSING_TAG) {
                        throw new LexException(c, line, column);
                    }
                    current = flush(terms, current, buffer);
                    break;
                case '/':
                    if (current == TermType.TEXT) {
                        buffer.append(c);
                    } else if (current == TermType.OPENING_TAG && previous == '<') {
                        current = TermType.CLOSING_TAG;
                    } else {
                        throw new LexException(c, line, column);
                    }
                    break;
                case '?':
                    skipToEndOfLine = true;
                    break;
                default:
                    if (current == TermType.NONE) {
                        current = TermType.TEXT;
                    }
                    buffer.append(c);
                    break;
            }
            previous = c;
        }

        if (current != TermType.NONE) {
            log.debug("Discarding unterminated {} at end of input: '{}'", current, buffer);
        }
        log.debug("Tokenized {} characters into {} terms", text.length(), terms.size());
        return terms;
    }

    /**
     * Emits the accumulated term if it is non-empty after trimming and resets the accumulator.
     *
     * @param terms output list
     * @param type type of the accumulated term
     * @param buffer accumulated content (cleared by this method)
     * @return {@link TermType#NONE}, the new accumulator state
     */
    private static TermType flush(List<Term> terms, TermType type, StringBuilder buffer) {
        String content = CharMatcher.whitespace().trimFrom(buffer);
        if (!content.isEmpty()) {
            terms.add(Term.of(type, content));
        }
        buffer.setLength(0);
        return TermType.NONE;
    }
}
