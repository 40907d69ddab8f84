package com.yongkangl.newick.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Every node of a parsed tree, in the order their subtrees were closed.
 * Leaves and internal nodes are both present; the root comes last.
 */
public class Tree {
    private final List<Node> nodes;

    public Tree() {
        this.nodes = new ArrayList<>();
    }

    public void addNode(Node node) {
        nodes.add(node);
    }

    public List<Node> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public Node getRoot() {
        return nodes.isEmpty() ? null : nodes.get(nodes.size() - 1);
    }

    /**
     * First node carrying the label, scanning in closure order.
     *
     * @throws NoSuchElementException if no node has that label
     */
    public Node get(String label) {
        for (Node node : nodes) {
            if (node.getLabel().equals(label)) {
                return node;
            }
        }
        throw new NoSuchElementException("No node labelled '" + label + "'");
    }

    public boolean contains(String label) {
        for (Node node : nodes) {
            if (node.getLabel().equals(label)) {
                return true;
            }
        }
        return false;
    }

    public List<Node> leaves() {
        List<Node> leaves = new ArrayList<>();
        for (Node node : nodes) {
            if (node.isTip()) leaves.add(node);
        }
        return leaves;
    }

    public String toNewick() {
        if (nodes.isEmpty()) {
            return "";
        }
        return getRoot().toNewick() + ";";
    }

    @Override
    public String toString() {
        return toNewick();
    }
}
