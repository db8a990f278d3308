package io.github.yok.xmlcsvlink.core;

import com.google.common.base.Preconditions;
import io.github.yok.xmlcsvlink.config.MarkupConfig;
import io.github.yok.xmlcsvlink.model.Node;
import io.github.yok.xmlcsvlink.model.Term;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Writes a {@link Node} tree back to markup text.
 *
 * <p>
 * Serialization happens in two steps: {@link #serialize(Node)} produces the terms of an indented
 * document and {@link #render(List)} turns terms into text behind the declaration line. Text is
 * written verbatim; markup-significant characters are not escaped.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class TreeSerializer {

    private static final String NEWLINE = "\n";

    private final MarkupConfig markupConfig;

    /**
     * Creates a serializer.
     *
     * @param markupConfig declaration and indentation settings
     */
    public TreeSerializer(MarkupConfig markupConfig) {
        this.markupConfig = Preconditions.checkNotNull(markupConfig, "markupConfig");
    }

    /**
     * Serializes the first top-level element below the synthetic root.
     *
     * <p>
     * Further top-level elements are ignored.
     * </p>
     *
     * @param root synthetic root
     * @return terms describing the indented document
     * @throws IllegalStateException if the root has no children
     */
    public List<Term> serialize(Node root) {
        Preconditions.checkNotNull(root, "root must not be null");
        List<Node> topLevel = root.getChildren();
        if (topLevel.isEmpty()) {
            throw new IllegalStateException("Invalid XML tree");
        }
        if (topLevel.size() > 1) {
            log.debug("Ignoring {} additional top-level element(s)", topLevel.size() - 1);
        }

        List<Term> terms = new ArrayList<>();
        emit(topLevel.get(0), terms, 0);
        return terms;
    }

    private void emit(Node node, List<Term> terms, int depth) {
        String indentation = StringUtils.repeat(markupConfig.getIndent(), depth);

        terms.add(Term.text(indentation));
        terms.add(Term.openingTag(node.getName()));
        if (!node.getData().isEmpty()) {
            terms.add(Term.text(node.getData()));
        }
        if (!node.isLeaf()) {
            terms.add(Term.text(NEWLINE));
            for (Node child : node.getChildren()) {
                emit(child, terms, depth + 1);
            }
            terms.add(Term.text(indentation));
        }
        terms.add(Term.closingTag(node.getName()));
        terms.add(Term.text(NEWLINE));
    }

    /**
     * Renders terms as markup text, starting with the declaration line.
     *
     * @param terms terms to render
     * @return markup document
     */
    public String render(List<Term> terms) {
        Preconditions.checkNotNull(terms, "terms must not be null");

        StringBuilder out = new StringBuilder(markupConfig.getDeclaration()).append(NEWLINE);
        for (Term term : terms) {
            switch (term.getType()) {
                case OPENING_TAG:
                    out.append('<').append(term.getContent()).append('>');
                    break;
                case CLOSING_TAG:
                    out.append("</").append(term.getContent()).append('>');
                    break;
                case TEXT:
                    out.append(term.getContent());
                    break;
                case NONE:
                    break;
                default:
                    throw new IllegalStateException("Unknown term type: " + term.getType());
            }
        }
        return out.toString();
    }

    /**
     * Serializes and renders the tree in one step.
     *
     * @param root synthetic root
     * @return markup document
     */
    public String toMarkup(Node root) {
        return render(serialize(root));
    }
}
