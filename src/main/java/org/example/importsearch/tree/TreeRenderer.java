package org.example.importsearch.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders a summary map as an indented import tree.
 *
 * <p>Each node is printed on its own line as {@code |-name}, indented by two spaces
 * per level. A node that was already printed earlier in the same rendering is printed
 * again to show the edge, but its children are not expanded a second time, so cycles
 * render in finite output.</p>
 *
 * <pre>
 * |-main.py
 *   |-utils.py
 *     |-json
 *   |-config.py
 * </pre>
 */
public final class TreeRenderer {

    /** Marker printed in front of every node. */
    public static final String NODE_MARKER = "|-";

    /** Indentation added per depth level. */
    public static final String INDENT = "  ";

    private TreeRenderer() {
    }

    /**
     * Renders the tree rooted at {@code root}.
     *
     * @param summary file name to dependency names, normalized before rendering
     * @param root    the node to start from
     * @return the rendered lines, never empty
     */
    public static List<String> render(Map<String, List<String>> summary, String root) {
        Map<String, List<String>> tree = SummaryNormalizer.normalize(summary);
        List<String> lines = new ArrayList<>();
        Set<String> printed = new HashSet<>();
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(new Node(root, 0));

        while (!stack.isEmpty()) {
            Node node = stack.pop();
            lines.add(INDENT.repeat(node.depth) + NODE_MARKER + node.name);
            if (!printed.add(node.name)) {
                continue;
            }

            List<String> children = tree.getOrDefault(node.name, List.of());
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(new Node(children.get(i), node.depth + 1));
            }
        }
        return lines;
    }

    /**
     * Renders the tree as a single newline-separated string.
     */
    public static String renderToString(Map<String, List<String>> summary, String root) {
        return String.join("\n", render(summary, root));
    }

    private static final class Node {
        private final String name;
        private final int depth;

        private Node(String name, int depth) {
            this.name = name;
            this.depth = depth;
        }
    }
}
