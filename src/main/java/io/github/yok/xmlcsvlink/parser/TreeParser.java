package io.github.yok.xmlcsvlink.parser;

import com.google.common.base.Preconditions;
import io.github.yok.xmlcsvlink.config.MarkupConfig;
import io.github.yok.xmlcsvlink.model.Node;
import io.github.yok.xmlcsvlink.model.Term;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds a {@link Node} tree from a list of {@link Term}s using an explicit stack.
 *
 * <p>
 * The stack is seeded with a synthetic root node. An opening tag creates a child of the element on
 * top of the stack and pushes it; a closing tag must name the element on top of the stack and pops
 * it; text is appended to the data of the element on top of the stack. Mismatched closing tags are
 * never repaired.
 * </p>
 *
 * <p>
 * Elements left open at end of input are accepted with a warning unless
 * {@link MarkupConfig#isFailOnUnclosedTags()} is set.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class TreeParser {

    private final MarkupConfig markupConfig;

    /**
     * Creates a parser.
     *
     * @param markupConfig markup settings (root name, unclosed-tag policy)
     */
    public TreeParser(MarkupConfig markupConfig) {
        this.markupConfig = Preconditions.checkNotNull(markupConfig, "markupConfig");
    }

    /**
     * Parses the given terms.
     *
     * @param terms terms in document order
     * @return synthetic root whose children are the top-level elements
     * @throws TreeException on a mismatched closing tag, or on unclosed elements in strict mode
     */
    public Node parse(List<Term> terms) throws TreeException {
        Preconditions.checkNotNull(terms, "terms must not be null");

        Node root = Node.syntheticRoot(markupConfig.getRootName());
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(root);

        for (Term term : terms) {
            Node top = stack.peek();
            switch (term.getType()) {
                case OPENING_TAG:
                    stack.push(top.addChild(new Node(term.getContent())));
                    break;
                case CLOSING_TAG:
                    if (top == root) {
                        throw TreeException.unexpectedClosingTag(term.getContent(),
                                "no open element");
                    }
                    if (!top.getName().equals(term.getContent())) {
                        throw TreeException.unexpectedClosingTag(term.getContent(),
                                top.getName());
                    }
                    stack.pop();
                    break;
                case TEXT:
                    top.appendData(term.getContent());
                    break;
                case NONE:
                    break;
                default:
                    throw new IllegalStateException("Unknown term type: " + term.getType());
            }
        }

        if (stack.size() > 1) {
            List<String> open = openElementNames(stack);
            if (markupConfig.isFailOnUnclosedTags()) {
                throw new TreeException(
                        "Unclosed tag(s) at end of input: " + String.join(", ", open));
            }
            log.warn("Accepting unclosed tag(s) at end of input: {}", open);
        }
        return root;
    }

    /**
     * Lists the names of the open elements, outermost first, without the synthetic root.
     */
    private static List<String> openElementNames(Deque<Node> stack) {
        List<String> names = new ArrayList<>();
        Iterator<Node> it = stack.descendingIterator();
        it.next();
        while (it.hasNext()) {
            names.add(it.next().getName());
        }
        return names;
    }
}
