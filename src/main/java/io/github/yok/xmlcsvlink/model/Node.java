package io.github.yok.xmlcsvlink.model;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import lombok.Getter;

/**
 * One element of a hierarchical document tree.
 *
 * <p>
 * A node carries a name, a text payload ({@code data}) and an ordered list of children in document
 * order. The parent reference is used only to compute ancestor paths; it is never traversed
 * downward.
 * </p>
 *
 * <p>
 * A <em>synthetic</em> node is a wrapper that does not correspond to any element of the document
 * (for example the root created by the tree parser). Synthetic nodes are excluded from paths.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class Node {

    private final String name;

    private final boolean synthetic;

    private String data = "";

    private Node parent;

    private final List<Node> children = new ArrayList<>();

    /**
     * Creates a document node without text.
     *
     * @param name element name
     */
    public Node(String name) {
        this(name, false);
    }

    /**
     * Creates a document leaf carrying the given text.
     *
     * @param name element name
     * @param data text payload
     */
    public Node(String name, String data) {
        this(name, false);
        setData(data);
    }

    private Node(String name, boolean synthetic) {
        this.name = Preconditions.checkNotNull(name, "name must not be null");
        this.synthetic = synthetic;
    }

    /**
     * Creates a synthetic wrapper node.
     *
     * @param name wrapper name
     * @return new synthetic node without parent
     */
    public static Node syntheticRoot(String name) {
        return new Node(name, true);
    }

    /**
     * Replaces the text payload.
     *
     * @param data new text (must not be {@code null})
     */
    public void setData(String data) {
        this.data = Preconditions.checkNotNull(data, "data must not be null");
    }

    /**
     * Appends text to the current payload.
     *
     * @param text text to append
     */
    public void appendData(String text) {
        this.data = this.data + Preconditions.checkNotNull(text, "text must not be null");
    }

    /**
     * Attaches {@code child} as the last child of this node.
     *
     * @param child node to attach; must not already have a parent
     * @return the attached child
     * @throws IllegalArgumentException if the child already belongs to another node, or is this
     *         node or one of its ancestors
     */
    public Node addChild(Node child) {
        Preconditions.checkNotNull(child, "child must not be null");
        Preconditions.checkArgument(child.parent == null, "Node '%s' already has a parent",
                child.name);
        for (Node cursor = this; cursor != null; cursor = cursor.parent) {
            Preconditions.checkArgument(cursor != child,
                    "Node '%s' cannot contain itself or its ancestor '%s'", name, child.name);
        }
        child.parent = this;
        children.add(child);
        return child;
    }

    /**
     * Returns the children in document order.
     *
     * @return unmodifiable view of the children
     */
    public List<Node> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Returns whether this node has no children.
     *
     * @return {@code true} for leaf nodes
     */
    public boolean isLeaf() {
        return children.isEmpty();
    }

    /**
     * Returns the names from the outermost non-synthetic ancestor down to this node.
     *
     * @return path segments, root first; empty for a synthetic node
     */
    public List<String> getPath() {
        LinkedList<String> path = new LinkedList<>();
        for (Node cursor = this; cursor != null && !cursor.synthetic; cursor = cursor.parent) {
            path.addFirst(cursor.name);
        }
        return path;
    }

    @Override
    public String toString() {
        return "Node[name=" + name + ", data=" + data + ", children=" + children.size() + "]";
    }
}
