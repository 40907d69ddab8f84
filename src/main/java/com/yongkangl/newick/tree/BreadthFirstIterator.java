package com.yongkangl.newick.tree;

import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Queue;

public class BreadthFirstIterator implements Iterator<Node> {
    private final Queue<Node> queue = new ArrayDeque<>();

    public BreadthFirstIterator(Node start) {
        queue.add(start);
    }

    @Override
    public boolean hasNext() {
        return !queue.isEmpty();
    }

    @Override
    public Node next() {
        Node node = queue.poll();
        if (node == null) {
            throw new NoSuchElementException();
        }
        queue.addAll(node.getChildren());
        return node;
    }
}
