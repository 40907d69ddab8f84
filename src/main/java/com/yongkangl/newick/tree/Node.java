package com.yongkangl.newick.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.OptionalDouble;

public class Node {
    private String label = "";
    private String comment = "";
    private OptionalDouble length = OptionalDouble.empty();
    private Node parent;
    private final List<Node> children;

    public Node(Node parent) {
        this.parent = parent;
        this.children = new ArrayList<>();
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    public void appendLabel(CharSequence text) {
        this.label = label + text;
    }

    public String getComment() {
        return comment;
    }

    public void appendComment(CharSequence text) {
        this.comment = comment + text;
    }

    /**
     * Distance to the parent. Empty when the input gave no length, which is not the same as 0.0.
     */
    public OptionalDouble getLength() {
        return length;
    }

    public void setLength(double length) {
        this.length = OptionalDouble.of(length);
    }

    public Node getParent() {
        return parent;
    }

    public void setParent(Node parent) {
        this.parent = parent;
    }

    public void addChild(Node child) {
        children.add(child);
    }

    public List<Node> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public int getChildCount() {
        return children.size();
    }

    public Node getChild(int i) {
        return children.get(i);
    }

    public boolean isTip() {
        return children.isEmpty();
    }

    public boolean isRoot() {
        return parent == null;
    }

    public Iterable<Node> breadthFirst() {
        return () -> new BreadthFirstIterator(this);
    }

    /**
     * Pre-order walk that visits siblings from the last child to the first.
     */
    public Iterable<Node> depthFirst() {
        return () -> new DepthFirstIterator(this);
    }

    /**
     * Renders this subtree in Newick notation, without the trailing ';'.
     */
    public String toNewick() {
        StringBuilder sb = new StringBuilder();
        Deque<RenderFrame> pending = new ArrayDeque<>();
        pending.push(new RenderFrame(this));
        while (!pending.isEmpty()) {
            RenderFrame frame = pending.peek();
            Node node = frame.node;
            if (node.isTip()) {
                sb.append(node.labelAndLength());
                pending.pop();
            } else if (frame.nextChild < node.children.size()) {
                sb.append(frame.nextChild == 0 ? "(" : ",");
                pending.push(new RenderFrame(node.children.get(frame.nextChild++)));
            } else {
                sb.append(")").append(node.labelAndLength());
                pending.pop();
            }
        }
        return sb.toString();
    }

    private String labelAndLength() {
        if (length.isPresent()) {
            return label + ":" + length.getAsDouble();
        }
        return label;
    }

    @Override
    public String toString() {
        return toNewick();
    }

    private static final class RenderFrame {
        private final Node node;
        private int nextChild;

        private RenderFrame(Node node) {
            this.node = node;
        }
    }
}
