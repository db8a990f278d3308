package io.github.yok.xmlcsvlink.model;

import com.google.common.base.Preconditions;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable lexical/formatting unit: a tag boundary or a run of text.
 *
 * <p>
 * For {@link TermType#OPENING_TAG} and {@link TermType#CLOSING_TAG} the content is the element
 * name; for {@link TermType#TEXT} it is the text itself. {@link #NONE} carries no content.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
public final class Term {

    /**
     * The empty term.
     */
    public static final Term NONE = new Term(TermType.NONE, "");

    private final TermType type;

    private final String content;

    private Term(TermType type, String content) {
        this.type = type;
        this.content = content;
    }

    /**
     * Creates a term of the given type.
     *
     * @param type term type
     * @param content element name or text
     * @return new term, or {@link #NONE} for {@link TermType#NONE}
     */
    public static Term of(TermType type, String content) {
        Preconditions.checkNotNull(type, "type must not be null");
        if (type == TermType.NONE) {
            return NONE;
        }
        return new Term(type, Preconditions.checkNotNull(content, "content must not be null"));
    }

    /**
     * Creates an opening tag term.
     *
     * @param name element name
     * @return opening tag
     */
    public static Term openingTag(String name) {
        return of(TermType.OPENING_TAG, name);
    }

    /**
     * Creates a closing tag term.
     *
     * @param name element name
     * @return closing tag
     */
    public static Term closingTag(String name) {
        return of(TermType.CLOSING_TAG, name);
    }

    /**
     * Creates a text term.
     *
     * @param content text
     * @return text term
     */
    public static Term text(String content) {
        return of(TermType.TEXT, content);
    }
}
