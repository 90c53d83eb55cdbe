package com.jpexs.decompiler.restructure;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ControlFlowGraphTest {

    static List<String> labels(List<Node> nodes) {
        List<String> ret = new ArrayList<>();
        for (Node node : nodes) {
            ret.add(node.getLabel());
        }
        return ret;
    }

    @Test
    public void fromGraphviz_chainedEdgesKeepDeclarationOrder() {
        ControlFlowGraph graph = ControlFlowGraph.fromGraphviz("digraph {\n"
                + "  rankdir=LR;\n"
                + "  // comment\n"
                + "  A -> B -> C;\n"
                + "  A -> D;\n"
                + "}");

        assertThat(labels(graph.getNodes())).containsExactly("A", "B", "C", "D").inOrder();
        assertThat(graph.getEntryNode().getLabel()).isEqualTo("A");
        assertThat(labels(graph.getNode("A").getSuccessorNodes())).containsExactly("B", "D").inOrder();
        assertThat(graph.getNode("C").isTerminal()).isTrue();
        assertThat(graph.getNode("A").isBranch()).isTrue();
    }

    @Test
    public void fromGraphviz_readsRolesCasesAndPayload() {
        ControlFlowGraph graph = ControlFlowGraph.fromGraphviz("digraph {\n"
                + "  A -> X [case=1];\n"
                + "  B -> X [case=0];\n"
                + "  X [role=exit_latch, color=red];\n"
                + "  X -> B;\n"
                + "  X -> C;\n"
                + "}");

        Node x = graph.getNode("X");
        assertThat(x.getRole()).isEqualTo(NodeRole.EXIT_LATCH);
        assertThat(x.isSynthetic()).isTrue();
        assertThat(x.getPayload()).isInstanceOf(Map.class);
        assertThat(((Map<?, ?>) x.getPayload()).get("color")).isEqualTo("red");
        assertThat(graph.getNode("A").getSuccessors().get(0).getCaseValue()).isEqualTo(1);
        assertThat(graph.getNode("B").getSuccessors().get(0).getCaseValue()).isEqualTo(0);
        assertThat(x.getCaseEdge(1).getTarget().getLabel()).isEqualTo("C");
        assertThat(graph.getNode("A").getPayload()).isNull();
    }

    @Test
    public void fromGraphviz_unknownRoleIsRejected() {
        assertThrows(MalformedGraphException.class,
                () -> ControlFlowGraph.fromGraphviz("digraph { A -> B; B [role=teleport]; }"));
    }

    @Test
    public void fromGraphviz_invalidCaseIsRejected() {
        assertThrows(MalformedGraphException.class,
                () -> ControlFlowGraph.fromGraphviz("digraph { A -> B [case=x]; }"));
    }

    @Test
    public void toGraphviz_roundTrips() {
        String dot = "digraph {\n"
                + "  A;\n"
                + "  B;\n"
                + "  \"exit block\";\n"
                + "  J [role=branch_join];\n"
                + "  A->B;\n"
                + "  A->J [case=1];\n"
                + "  B->J [case=0];\n"
                + "  J->B;\n"
                + "  J->\"exit block\";\n"
                + "}";
        ControlFlowGraph graph = ControlFlowGraph.fromGraphviz(dot);

        assertThat(graph.getNode("exit block")).isNotNull();
        assertThat(graph.toGraphviz()).isEqualTo(dot);
        assertThat(ControlFlowGraph.fromGraphviz(graph.toGraphviz()).toGraphviz()).isEqualTo(dot);
    }

    @Test
    public void toGraphviz_listsEntryFirst() {
        Node a = new Node("A");
        Node b = new Node("B");
        b.addSuccessor(a);
        ControlFlowGraph graph = new ControlFlowGraph(Arrays.asList(a, b));

        assertThat(graph.getEntryNode()).isSameInstanceAs(b);
        assertThat(ControlFlowGraph.fromGraphviz(graph.toGraphviz()).getEntryNode().getLabel()).isEqualTo("B");
    }

    @Test
    public void constructor_rejectsDanglingEdge() {
        Node a = new Node("A");
        Node b = new Node("B");
        a.addSuccessor(b);

        assertThrows(MalformedGraphException.class, () -> new ControlFlowGraph(Arrays.asList(a)));
    }

    @Test
    public void constructor_rejectsDuplicateLabel() {
        Node a = new Node("A");
        Node other = new Node("A");
        a.addSuccessor(other);

        assertThrows(MalformedGraphException.class, () -> new ControlFlowGraph(Arrays.asList(a, other)));
    }

    @Test
    public void constructor_rejectsAmbiguousEntry() {
        Node a = new Node("A");
        Node b = new Node("B");
        Node c = new Node("C");
        a.addSuccessor(c);
        b.addSuccessor(c);

        assertThrows(MalformedGraphException.class, () -> new ControlFlowGraph(Arrays.asList(a, b, c)));
    }

    @Test
    public void constructor_rejectsEntryOutsideOfGraph() {
        Node a = new Node("A");

        assertThrows(MalformedGraphException.class, () -> new ControlFlowGraph(Arrays.asList(a), new Node("A")));
    }

    @Test
    public void constructor_rejectsEmptyGraph() {
        assertThrows(MalformedGraphException.class, () -> new ControlFlowGraph(new ArrayList<>()));
    }

    @Test
    public void getPredecessors_areDistinct() {
        ControlFlowGraph graph = ControlFlowGraph.fromGraphviz("digraph { A -> B; A -> B; A -> C; B -> D; C -> D; }");

        assertThat(labels(graph.getPredecessors(graph.getNode("B")))).containsExactly("A");
        assertThat(labels(graph.getPredecessors(graph.getNode("D")))).containsExactly("B", "C").inOrder();
        assertThat(graph.getPredecessors(graph.getNode("A"))).isEmpty();
    }

    @Test
    public void getReachableNodes_skipsUnreachable() {
        ControlFlowGraph graph = ControlFlowGraph.fromGraphviz("digraph { A -> B; C -> B; C -> D; }");

        assertThat(labels(graph.getReachableNodes())).containsExactly("A", "B").inOrder();
        assertThat(labels(graph.getReachableNodes(graph.getNode("C")))).containsExactly("B", "C", "D").inOrder();
    }

    @Test
    public void subgraph_keepsInternalEdgesOnly() {
        ControlFlowGraph graph = ControlFlowGraph.fromGraphviz("digraph { A -> B; B -> C; C -> B; C -> D; }");

        ControlFlowGraph loop = graph.subgraph(Arrays.asList("B", "C"), "B");

        assertThat(labels(loop.getNodes())).containsExactly("B", "C").inOrder();
        assertThat(loop.getEntryNode().getLabel()).isEqualTo("B");
        assertThat(labels(loop.getNode("C").getSuccessorNodes())).containsExactly("B");
        assertThat(loop.getNode("B")).isNotSameInstanceAs(graph.getNode("B"));
    }

    @Test
    public void subgraph_rejectsUnknownLabel() {
        ControlFlowGraph graph = ControlFlowGraph.fromGraphviz("digraph { A -> B; }");

        assertThrows(MalformedGraphException.class, () -> graph.subgraph(Arrays.asList("A", "Z"), "A"));
    }
}
