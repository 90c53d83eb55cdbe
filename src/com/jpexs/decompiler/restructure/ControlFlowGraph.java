package com.jpexs.decompiler.restructure;

import java.util.*;

/**
 * Control Flow Graph (CFG): nodes in declaration order plus a single entry node.
 * The graph is validated on construction and never modified by restructuring.
 *
 * @author JPEXS
 */
public class ControlFlowGraph {

    private static final String ROLE_ATTRIBUTE = "role";
    private static final String CASE_ATTRIBUTE = "case";

    private final List<Node> nodes;
    private final Map<String, Node> nodesByLabel = new LinkedHashMap<>();
    private final Node entryNode;
    private Map<Node, List<Node>> predecessors;

    /**
     * Creates a graph whose entry is the only node without predecessors.
     *
     * @param nodes the nodes in declaration order
     * @throws MalformedGraphException if the graph is malformed or the entry is ambiguous
     */
    public ControlFlowGraph(List<Node> nodes) {
        this(nodes, null);
    }

    /**
     * Creates a graph with an explicitly designated entry.
     *
     * @param nodes the nodes in declaration order
     * @param entryNode the entry node, or null to pick the only node without predecessors
     * @throws MalformedGraphException if the graph is malformed or the entry is ambiguous
     */
    public ControlFlowGraph(List<Node> nodes, Node entryNode) {
        if (nodes == null || nodes.isEmpty()) {
            throw new MalformedGraphException("Graph has no nodes");
        }
        this.nodes = new ArrayList<>(nodes);
        for (Node node : this.nodes) {
            if (nodesByLabel.containsKey(node.getLabel())) {
                throw new MalformedGraphException("Duplicate node label: " + node.getLabel());
            }
            nodesByLabel.put(node.getLabel(), node);
        }
        for (Node node : this.nodes) {
            for (Edge edge : node.getSuccessors()) {
                if (nodesByLabel.get(edge.getTarget().getLabel()) != edge.getTarget()) {
                    throw new MalformedGraphException("Edge " + node + " -> " + edge.getTarget()
                            + " references a node that is not part of the graph");
                }
            }
        }
        if (entryNode != null) {
            if (nodesByLabel.get(entryNode.getLabel()) != entryNode) {
                throw new MalformedGraphException("Entry node " + entryNode + " is not part of the graph");
            }
            this.entryNode = entryNode;
        } else {
            this.entryNode = findImplicitEntry();
        }
    }

    private Node findImplicitEntry() {
        List<Node> candidates = new ArrayList<>();
        for (Node node : nodes) {
            if (getPredecessors(node).isEmpty()) {
                candidates.add(node);
            }
        }
        if (candidates.size() != 1) {
            throw new MalformedGraphException("Cannot determine entry node, nodes without predecessors: " + candidates);
        }
        return candidates.get(0);
    }

    /**
     * Parses a Graphviz/DOT format string and builds a CFG.
     * The first node encountered becomes the entry node.
     * Supports chained edges like: a->b->c
     * Node attribute "role" marks synthetic nodes, edge attribute "case" sets the case value.
     * Other node attributes are kept in a map stored as the node payload.
     *
     * @param dot the DOT format string
     * @return the parsed graph
     */
    public static ControlFlowGraph fromGraphviz(String dot) {
        Map<String, Map<String, String>> nodeAttributes = new LinkedHashMap<>();
        List<String[]> edges = new ArrayList<>();
        List<Integer> edgeCases = new ArrayList<>();

        // Remove "digraph {" and "}" wrapper
        String content = dot.trim();
        if (content.startsWith("digraph")) {
            int start = content.indexOf('{');
            int end = content.lastIndexOf('}');
            if (start != -1 && end != -1) {
                content = content.substring(start + 1, end);
            }
        }

        // Parse each line/statement
        String[] statements = content.split("[;\\n]");
        for (String statement : statements) {
            statement = statement.trim();
            if (statement.isEmpty() || statement.startsWith("//")) {
                continue;
            }

            Map<String, String> attributes = new LinkedHashMap<>();
            int bracketStart = statement.indexOf('[');
            int bracketEnd = statement.lastIndexOf(']');
            if (bracketStart != -1 && bracketEnd > bracketStart) {
                parseAttributes(statement.substring(bracketStart + 1, bracketEnd).trim(), attributes);
                statement = statement.substring(0, bracketStart).trim();
            }

            if (statement.contains("->")) {
                // Edge definitions (may be chained: a->b->c)
                String[] parts = statement.split("->");
                int caseValue = Edge.NO_CASE;
                if (attributes.containsKey(CASE_ATTRIBUTE)) {
                    try {
                        caseValue = Integer.parseInt(attributes.get(CASE_ATTRIBUTE));
                    } catch (NumberFormatException ex) {
                        throw new MalformedGraphException("Invalid case value in statement: " + statement);
                    }
                }
                for (int i = 0; i < parts.length - 1; i++) {
                    String fromLabel = unquote(parts[i].trim());
                    String toLabel = unquote(parts[i + 1].trim());
                    if (fromLabel.isEmpty() || toLabel.isEmpty()) {
                        throw new MalformedGraphException("Invalid edge statement: " + statement);
                    }
                    nodeAttributes.computeIfAbsent(fromLabel, k -> new LinkedHashMap<>());
                    nodeAttributes.computeIfAbsent(toLabel, k -> new LinkedHashMap<>());
                    edges.add(new String[]{fromLabel, toLabel});
                    edgeCases.add(caseValue);
                }
            } else {
                // Standalone node, optionally with attributes: nodeName [key1=value1 key2="value2" ...]
                if (statement.contains("=")) {
                    // graph attribute such as rankdir=LR
                    continue;
                }
                String nodeLabel = unquote(statement);
                if (nodeLabel.isEmpty() || "node".equals(nodeLabel) || "edge".equals(nodeLabel) || "graph".equals(nodeLabel)) {
                    continue;
                }
                nodeAttributes.computeIfAbsent(nodeLabel, k -> new LinkedHashMap<>()).putAll(attributes);
            }
        }

        if (nodeAttributes.isEmpty()) {
            throw new MalformedGraphException("No nodes found in DOT string");
        }

        Map<String, Node> nodes = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, String>> entry : nodeAttributes.entrySet()) {
            Map<String, String> attributes = new LinkedHashMap<>(entry.getValue());
            NodeRole role = NodeRole.ORIGINAL;
            String roleValue = attributes.remove(ROLE_ATTRIBUTE);
            if (roleValue != null) {
                role = NodeRole.fromAttributeValue(roleValue);
                if (role == null) {
                    throw new MalformedGraphException("Unknown role of node " + entry.getKey() + ": " + roleValue);
                }
            }
            nodes.put(entry.getKey(), new Node(entry.getKey(), role, attributes.isEmpty() ? null : attributes));
        }
        for (int i = 0; i < edges.size(); i++) {
            String[] edge = edges.get(i);
            nodes.get(edge[0]).addSuccessor(nodes.get(edge[1]), edgeCases.get(i));
        }

        List<Node> nodeList = new ArrayList<>(nodes.values());
        return new ControlFlowGraph(nodeList, nodeList.get(0));
    }

    /**
     * Parses DOT attribute string.
     * Handles both quoted and unquoted keys and values.
     * Format: key1=value1 "key2"=value2 key3="value3", "key4"="value 4"
     */
    private static void parseAttributes(String attributesStr, Map<String, String> attributes) {
        int pos = 0;
        int len = attributesStr.length();

        while (pos < len) {
            // Skip whitespace and separators
            while (pos < len && (Character.isWhitespace(attributesStr.charAt(pos)) || attributesStr.charAt(pos) == ',')) {
                pos++;
            }
            if (pos >= len) break;

            String key;
            if (attributesStr.charAt(pos) == '"') {
                int endQuote = attributesStr.indexOf('"', pos + 1);
                if (endQuote == -1) break;
                key = attributesStr.substring(pos + 1, endQuote);
                pos = endQuote + 1;
            } else {
                int start = pos;
                while (pos < len && isIdentifierChar(attributesStr.charAt(pos))) {
                    pos++;
                }
                if (pos == start) break;
                key = attributesStr.substring(start, pos);
            }

            while (pos < len && Character.isWhitespace(attributesStr.charAt(pos))) {
                pos++;
            }
            if (pos >= len || attributesStr.charAt(pos) != '=') {
                break;
            }
            pos++;
            while (pos < len && Character.isWhitespace(attributesStr.charAt(pos))) {
                pos++;
            }
            if (pos >= len) break;

            String value;
            if (attributesStr.charAt(pos) == '"') {
                int endQuote = attributesStr.indexOf('"', pos + 1);
                if (endQuote == -1) break;
                value = attributesStr.substring(pos + 1, endQuote);
                pos = endQuote + 1;
            } else {
                int start = pos;
                while (pos < len && isIdentifierChar(attributesStr.charAt(pos))) {
                    pos++;
                }
                if (pos == start) break;
                value = attributesStr.substring(start, pos);
            }

            attributes.put(key, value);
        }
    }

    /**
     * Checks if a character is valid in an unquoted DOT identifier.
     */
    private static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.';
    }

    private static String unquote(String s) {
        if (s.length() >= 2 && s.startsWith("\"") && s.endsWith("\"")) {
            return s.substring(1, s.length() - 1);
        }
        return s;
    }

    static String quoteIfNeeded(String label) {
        for (int i = 0; i < label.length(); i++) {
            char c = label.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '_') {
                return "\"" + label.replace("\"", "'") + "\"";
            }
        }
        return label;
    }

    public Node getEntryNode() {
        return entryNode;
    }

    /**
     * Gets all nodes in declaration order.
     *
     * @return the nodes
     */
    public List<Node> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    /**
     * Finds a node by its label.
     *
     * @param label the label
     * @return the node, or null if not found
     */
    public Node getNode(String label) {
        return nodesByLabel.get(label);
    }

    public boolean contains(Node node) {
        return node != null && nodesByLabel.get(node.getLabel()) == node;
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Gets the distinct predecessors of a node, in declaration order.
     *
     * @param node the node
     * @return the predecessors
     */
    public List<Node> getPredecessors(Node node) {
        if (predecessors == null) {
            predecessors = new HashMap<>();
            for (Node n : nodes) {
                predecessors.put(n, new ArrayList<>());
            }
            for (Node n : nodes) {
                for (Edge edge : n.getSuccessors()) {
                    List<Node> preds = predecessors.get(edge.getTarget());
                    if (!preds.contains(n)) {
                        preds.add(n);
                    }
                }
            }
        }
        List<Node> ret = predecessors.get(node);
        if (ret == null) {
            throw new IllegalArgumentException("Node " + node + " is not part of the graph");
        }
        return Collections.unmodifiableList(ret);
    }

    /**
     * Collects all nodes reachable from the entry node, in declaration order.
     *
     * @return the reachable nodes
     */
    public List<Node> getReachableNodes() {
        return getReachableNodes(entryNode);
    }

    /**
     * Collects all nodes reachable from the given node, in declaration order.
     *
     * @param from the start node
     * @return the reachable nodes, the start node included
     */
    public List<Node> getReachableNodes(Node from) {
        if (!contains(from)) {
            throw new IllegalArgumentException("Node " + from + " is not part of the graph");
        }
        Set<Node> visited = new HashSet<>();
        Queue<Node> queue = new LinkedList<>();
        queue.add(from);
        visited.add(from);

        while (!queue.isEmpty()) {
            Node current = queue.poll();
            for (Node succ : current.getSuccessorNodes()) {
                if (!visited.contains(succ)) {
                    visited.add(succ);
                    queue.add(succ);
                }
            }
        }
        List<Node> result = new ArrayList<>();
        for (Node node : nodes) {
            if (visited.contains(node)) {
                result.add(node);
            }
        }
        return result;
    }

    /**
     * Builds the induced subgraph of the given nodes.
     * Only edges whose both ends are in the set are kept. The nodes are copies.
     *
     * @param labels labels of the nodes to keep
     * @param entryLabel label of the subgraph entry
     * @return the subgraph
     */
    public ControlFlowGraph subgraph(Collection<String> labels, String entryLabel) {
        Set<String> keep = new HashSet<>(labels);
        for (String label : keep) {
            if (!nodesByLabel.containsKey(label)) {
                throw new MalformedGraphException("Node not found: " + label);
            }
        }
        if (!keep.contains(entryLabel)) {
            throw new MalformedGraphException("Subgraph entry " + entryLabel + " is not in the subgraph");
        }
        Map<Node, Node> copies = new LinkedHashMap<>();
        for (Node node : nodes) {
            if (keep.contains(node.getLabel())) {
                copies.put(node, new Node(node.getLabel(), node.getRole(), node.getPayload()));
            }
        }
        for (Map.Entry<Node, Node> entry : copies.entrySet()) {
            for (Edge edge : entry.getKey().getSuccessors()) {
                Node target = copies.get(edge.getTarget());
                if (target != null) {
                    entry.getValue().addSuccessor(target, edge.getCaseValue());
                }
            }
        }
        Node entry = null;
        for (Node copy : copies.values()) {
            if (copy.getLabel().equals(entryLabel)) {
                entry = copy;
            }
        }
        return new ControlFlowGraph(new ArrayList<>(copies.values()), entry);
    }

    /**
     * Generates a Graphviz/DOT representation of the CFG.
     * The entry node is listed first, so fromGraphviz restores the same entry.
     *
     * @return DOT format string representing the CFG
     */
    public String toGraphviz() {
        List<Node> ordered = new ArrayList<>();
        ordered.add(entryNode);
        for (Node node : nodes) {
            if (node != entryNode) {
                ordered.add(node);
            }
        }

        StringBuilder sb = new StringBuilder();
        sb.append("digraph {\n");
        for (Node node : ordered) {
            sb.append("  ").append(quoteIfNeeded(node.getLabel()));
            if (node.isSynthetic()) {
                sb.append(" [").append(ROLE_ATTRIBUTE).append("=").append(node.getRole().getAttributeValue()).append("]");
            }
            sb.append(";\n");
        }
        for (Node node : ordered) {
            for (Edge edge : node.getSuccessors()) {
                sb.append("  ").append(quoteIfNeeded(node.getLabel())).append("->").append(quoteIfNeeded(edge.getTarget().getLabel()));
                if (edge.hasCaseValue()) {
                    sb.append(" [").append(CASE_ATTRIBUTE).append("=").append(edge.getCaseValue()).append("]");
                }
                sb.append(";\n");
            }
        }
        sb.append("}");
        return sb.toString();
    }

    @Override
    public String toString() {
        return "ControlFlowGraph{entry=" + entryNode + ", nodes=" + nodes + "}";
    }
}
