package com.yongkangl.newick.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.yongkangl.newick.tree.Node;
import com.yongkangl.newick.tree.Tree;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Writes a tree as nested JSON objects, starting at the root:
 * {@code {"label":"F","children":[{"label":"A","length":0.1}, ...]}}.
 * Absent lengths, empty comments and empty child lists are omitted.
 */
public class TreeJsonWriter {
    private final ObjectMapper mapper;

    public TreeJsonWriter() {
        this(new ObjectMapper());
    }

    public TreeJsonWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public JsonNode toJson(Tree tree) {
        if (tree.isEmpty()) {
            return NullNode.getInstance();
        }
        return toJson(tree.getRoot());
    }

    public ObjectNode toJson(Node start) {
        Map<Node, ObjectNode> objects = new IdentityHashMap<>();
        // Breadth-first order creates every parent before its children, in child order
        for (Node node : start.breadthFirst()) {
            ObjectNode object = mapper.createObjectNode();
            object.put("label", node.getLabel());
            node.getLength().ifPresent(length -> object.put("length", length));
            if (!node.getComment().isEmpty()) {
                object.put("comment", node.getComment());
            }
            ObjectNode parent = node == start ? null : objects.get(node.getParent());
            if (parent != null) {
                ArrayNode children = parent.has("children")
                        ? (ArrayNode) parent.get("children")
                        : parent.putArray("children");
                children.add(object);
            }
            objects.put(node, object);
        }
        return objects.get(start);
    }

    public String write(Tree tree, boolean pretty) throws JsonProcessingException {
        JsonNode json = toJson(tree);
        if (pretty) {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(json);
        }
        return mapper.writeValueAsString(json);
    }
}
