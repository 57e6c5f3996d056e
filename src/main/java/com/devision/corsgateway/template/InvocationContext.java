package com.devision.corsgateway.template;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Caller-supplied values used to fill template placeholders.
 *
 * Expressions are dotted paths walked from the root: object members by name, array elements by
 * numeric index. The root is also reachable as {@code context}, so {@code context.apiKey} and
 * {@code apiKey} both resolve against {@code {"apiKey": "k1"}} unless the caller supplies its own
 * {@code context} member.
 */
public final class InvocationContext {

    static final String ROOT_ALIAS = "context";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final InvocationContext EMPTY = new InvocationContext(JsonNodeFactory.instance.objectNode());

    private final JsonNode root;

    private InvocationContext(JsonNode root) {
        this.root = root;
    }

    public static InvocationContext empty() {
        return EMPTY;
    }

    public static InvocationContext of(JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return EMPTY;
        }
        return new InvocationContext(root.deepCopy());
    }

    public static InvocationContext of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return new InvocationContext(MAPPER.valueToTree(values));
    }

    public JsonNode root() {
        return root.deepCopy();
    }

    /**
     * Resolves a dotted path to text. Empty when any step is missing or not indexable.
     */
    public Optional<String> resolve(List<String> path) {
        if (path == null || path.isEmpty()) {
            return Optional.empty();
        }
        JsonNode node = walk(root, path, 0);
        if (node.isMissingNode() && ROOT_ALIAS.equals(path.get(0)) && !root.has(ROOT_ALIAS)) {
            node = walk(root, path, 1);
        }
        if (node.isMissingNode()) {
            return Optional.empty();
        }
        return Optional.of(node.isValueNode() ? node.asText() : node.toString());
    }

    private static JsonNode walk(JsonNode start, List<String> path, int from) {
        if (from >= path.size()) {
            return MissingNode.getInstance();
        }
        JsonNode node = start;
        for (int i = from; i < path.size(); i++) {
            String key = path.get(i);
            if (node.isObject() && node.has(key)) {
                node = node.get(key);
            } else if (node.isArray() && isIndex(key) && Integer.parseInt(key) < node.size()) {
                node = node.get(Integer.parseInt(key));
            } else {
                return MissingNode.getInstance();
            }
        }
        return node;
    }

    private static boolean isIndex(String key) {
        if (key.isEmpty() || key.length() > 9) {
            return false;
        }
        for (int i = 0; i < key.length(); i++) {
            if (!Character.isDigit(key.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "InvocationContext" + root;
    }
}
