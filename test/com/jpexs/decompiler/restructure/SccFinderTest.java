package com.jpexs.decompiler.restructure;

import static com.google.common.truth.Truth.assertThat;
import static com.jpexs.decompiler.restructure.ControlFlowGraphTest.labels;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SccFinderTest {

    /**
     * Numbers the nodes in declaration order, the way the arena of a restructuring run does.
     */
    static GraphView view(String dot) {
        ControlFlowGraph graph = ControlFlowGraph.fromGraphviz(dot);
        List<Node> nodes = graph.getNodes();
        for (int i = 0; i < nodes.size(); i++) {
            nodes.get(i).setIndex(i);
        }
        return new GraphView(nodes, graph.getEntryNode());
    }

    private static List<List<String>> loops(GraphView view) {
        List<List<String>> ret = new ArrayList<>();
        for (Set<Node> loop : SccFinder.findLoops(view)) {
            ret.add(labels(new ArrayList<>(loop)));
        }
        return ret;
    }

    @Test
    public void acyclicGraphHasNoLoops() {
        assertThat(loops(view("digraph { A -> B; A -> C; B -> D; C -> D; }"))).isEmpty();
    }

    @Test
    public void findsLoopsOrderedByFirstNode() {
        GraphView view = view("digraph { A -> D; D -> E; E -> D; A -> B; B -> C; C -> B; E -> F; }");

        assertThat(loops(view)).containsExactly(List.of("D", "E"), List.of("B", "C")).inOrder();
    }

    @Test
    public void selfLoopIsALoop() {
        GraphView view = view("digraph { A -> B; B -> B; B -> C; }");

        assertThat(loops(view)).containsExactly(List.of("B"));
    }

    @Test
    public void nestedCyclesFormOneComponent() {
        GraphView view = view("digraph { A -> B; B -> C; C -> B; C -> D; D -> A; D -> E; }");

        assertThat(loops(view)).containsExactly(List.of("A", "B", "C", "D"));
    }

    @Test
    public void backEdgesAreIgnored() {
        GraphView view = view("digraph { A -> B; B -> A; B -> C; }");
        Node b = view.getNodes().get(1);
        b.setEdge(0, b.getSuccessors().get(0).asBackEdge());

        assertThat(loops(view)).isEmpty();
    }

    @Test
    public void edgesLeavingTheViewAreIgnored() {
        GraphView full = view("digraph { A -> B; B -> C; C -> A; }");
        List<Node> nodes = full.getNodes();
        GraphView partial = new GraphView(nodes.subList(0, 2), nodes.get(0));

        assertThat(loops(partial)).isEmpty();
    }

    @Test
    public void longCycleIsOneLoop() {
        int size = 50000;
        List<Node> nodes = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            Node node = new Node("n" + i);
            node.setIndex(i);
            nodes.add(node);
        }
        for (int i = 0; i < size; i++) {
            nodes.get(i).addSuccessor(nodes.get((i + 1) % size));
        }

        List<TreeSet<Node>> loops = SccFinder.findLoops(new GraphView(nodes, nodes.get(0)));

        assertThat(loops).hasSize(1);
        assertThat(loops.get(0)).hasSize(size);
        assertThat(loops.get(0).first()).isSameInstanceAs(nodes.get(0));
    }

    @Test
    public void loopsAreOrderedByArenaIndex() {
        GraphView view = view("digraph { A -> C; C -> B; B -> C; C -> D; }");

        assertThat(labels(new ArrayList<>(SccFinder.findLoops(view).get(0)))).containsExactly("C", "B").inOrder();
    }
}
