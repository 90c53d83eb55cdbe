package com.jpexs.decompiler.restructure;

import java.util.*;

/**
 * Finds loops of a graph view as strongly connected components (Tarjan's algorithm).
 * Nodes are visited in arena index order and successors in edge order,
 * so the result is the same for the same input.
 * The depth-first search keeps its own stack, long chains do not exhaust the thread stack.
 *
 * @author JPEXS
 */
final class SccFinder {

    private final GraphView view;
    private final Map<Node, Integer> index = new HashMap<>();
    private final Map<Node, Integer> lowlink = new HashMap<>();
    private final Deque<Node> stack = new ArrayDeque<>();
    private final Set<Node> onStack = new HashSet<>();
    private final List<TreeSet<Node>> components = new ArrayList<>();
    private int idx = 0;

    private SccFinder(GraphView view) {
        this.view = view;
    }

    /**
     * Finds the loops of the view: components with more than one node,
     * or a single node with an edge to itself.
     *
     * @param view the view
     * @return the loops ordered by their first node, each ordered by arena index
     */
    static List<TreeSet<Node>> findLoops(GraphView view) {
        SccFinder finder = new SccFinder(view);
        for (Node node : view.getNodes()) {
            if (!finder.index.containsKey(node)) {
                finder.strongConnect(node);
            }
        }
        List<TreeSet<Node>> loops = new ArrayList<>();
        for (TreeSet<Node> component : finder.components) {
            if (component.size() > 1) {
                loops.add(component);
            } else {
                Node single = component.first();
                if (view.getInternalSuccessors(single).contains(single)) {
                    loops.add(component);
                }
            }
        }
        loops.sort((a, b) -> Node.INDEX_ORDER.compare(a.first(), b.first()));
        return loops;
    }

    /**
     * Node being visited and the successors not yet looked at.
     */
    private static final class Frame {

        final Node node;
        final Iterator<Node> successors;

        Frame(Node node, Iterator<Node> successors) {
            this.node = node;
            this.successors = successors;
        }
    }

    private Frame open(Node v) {
        index.put(v, idx);
        lowlink.put(v, idx);
        idx++;
        stack.push(v);
        onStack.add(v);
        return new Frame(v, view.getInternalSuccessors(v).iterator());
    }

    private void strongConnect(Node root) {
        Deque<Frame> frames = new ArrayDeque<>();
        frames.push(open(root));
        while (!frames.isEmpty()) {
            Frame frame = frames.peek();
            Node v = frame.node;
            if (frame.successors.hasNext()) {
                Node w = frame.successors.next();
                if (!index.containsKey(w)) {
                    frames.push(open(w));
                } else if (onStack.contains(w)) {
                    lowlink.put(v, Math.min(lowlink.get(v), index.get(w)));
                }
                continue;
            }

            frames.pop();
            if (lowlink.get(v).equals(index.get(v))) {
                TreeSet<Node> component = new TreeSet<>(Node.INDEX_ORDER);
                Node w;
                do {
                    w = stack.pop();
                    onStack.remove(w);
                    component.add(w);
                } while (w != v);
                components.add(component);
            }
            if (!frames.isEmpty()) {
                Node parent = frames.peek().node;
                lowlink.put(parent, Math.min(lowlink.get(parent), lowlink.get(v)));
            }
        }
    }
}
