package com.yongkangl.newick.tree;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Children are pushed to the front in their stored order, so the last child is visited first.
 * For ((A1,A2)B,(C,D)E)F this yields F, E, D, C, B, A2, A1.
 */
public class DepthFirstIterator implements Iterator<Node> {
    private final Deque<Node> stack = new ArrayDeque<>();

    public DepthFirstIterator(Node start) {
        stack.addFirst(start);
    }

    @Override
    public boolean hasNext() {
        return !stack.isEmpty();
    }

    @Override
    public Node next() {
        Node node = stack.pollFirst();
        if (node == null) {
            throw new NoSuchElementException();
        }
        for (Node child : node.getChildren()) {
            stack.addFirst(child);
        }
        return node;
    }
}
