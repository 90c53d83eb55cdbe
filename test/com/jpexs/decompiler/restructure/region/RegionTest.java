package com.jpexs.decompiler.restructure.region;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.jpexs.decompiler.restructure.Node;
import com.jpexs.decompiler.restructure.NodeRole;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class RegionTest {

    @Test
    public void block() {
        Node a = new Node("a");
        BlockRegion block = new BlockRegion(a);

        assertThat(block.getKind()).isEqualTo(RegionKind.BLOCK);
        assertThat(block.getEntryNode()).isSameInstanceAs(a);
        assertThat(block.getChildren()).isEmpty();
        assertThat(block.getNodes()).containsExactly(a);
        assertThat(block.toString()).isEqualTo("a;\n");
    }

    @Test
    public void syntheticBlockShowsRole() {
        BlockRegion block = new BlockRegion(new Node("j", NodeRole.BRANCH_JOIN, null));

        assertThat(block.toString("  ")).isEqualTo("  j; // branch_join\n");
    }

    @Test
    public void blockNeedsNode() {
        assertThrows(IllegalArgumentException.class, () -> new BlockRegion(null));
    }

    @Test
    public void emptySequence() {
        SequenceRegion empty = SequenceRegion.empty();

        assertThat(empty.isEmpty()).isTrue();
        assertThat(empty.getEntryNode()).isNull();
        assertThat(empty.getNodes()).isEmpty();
        assertThat(empty.toString()).isEmpty();
    }

    @Test
    public void sequenceEntryIsFirstNonEmptyChild() {
        Node b = new Node("b");
        Node c = new Node("c");
        SequenceRegion sequence = new SequenceRegion(Arrays.asList(SequenceRegion.empty(), new BlockRegion(b), new BlockRegion(c)));

        assertThat(sequence.getEntryNode()).isSameInstanceAs(b);
        assertThat(sequence.getNodes()).containsExactly(b, c).inOrder();
    }

    @Test
    public void branchPrintsArmsInEdgeOrder() {
        Node a = new Node("a");
        Node b = new Node("b");
        Node c = new Node("c");
        a.addSuccessor(b).addSuccessor(c);
        BranchRegion branch = new BranchRegion(new BlockRegion(a), Arrays.asList(new BlockRegion(b), SequenceRegion.empty()));

        assertThat(branch.getKind()).isEqualTo(RegionKind.BRANCH);
        assertThat(branch.getEntryNode()).isSameInstanceAs(a);
        assertThat(branch.getChildren()).hasSize(3);
        assertThat(branch.getNodes()).containsExactly(a, b).inOrder();
        assertThat(branch.toString()).isEqualTo(
                "a;\n"
                + "switch (a) {\n"
                + "    case 0 {\n"
                + "        b;\n"
                + "    }\n"
                + "    case 1 {\n"
                + "    }\n"
                + "}\n");
    }

    @Test
    public void branchShowsSelectorOfSyntheticTarget() {
        Node a = new Node("a");
        Node b = new Node("b");
        Node join = new Node("join", NodeRole.BRANCH_JOIN, null);
        a.addSuccessor(b).addSuccessor(join, 1);
        BranchRegion branch = new BranchRegion(new BlockRegion(a), Arrays.asList(new BlockRegion(b), SequenceRegion.empty()));

        assertThat(branch.toString()).contains("    case 1 [join=1] {\n");
    }

    @Test
    public void loop() {
        Node h = new Node("h");
        Node l = new Node("l");
        Node x = new Node("x");
        h.addSuccessor(l);
        l.addSuccessor(x);
        LoopRegion loop = new LoopRegion(new SequenceRegion(Arrays.asList(new BlockRegion(h), new BlockRegion(l))), h, l);

        assertThat(loop.getKind()).isEqualTo(RegionKind.LOOP);
        assertThat(loop.getEntryNode()).isSameInstanceAs(h);
        assertThat(loop.getChildren()).containsExactly(loop.getBody());
        assertThat(loop.getNodes()).containsExactly(h, l).inOrder();
        assertThat(loop.getExitTarget()).isSameInstanceAs(x);
        assertThat(loop.toString()).isEqualTo("loop {\n    h;\n    l;\n}\n");
    }

    @Test
    public void loopWithoutExit() {
        Node h = new Node("h");
        LoopRegion loop = new LoopRegion(new BlockRegion(h), h, h);

        assertThat(loop.getExitTarget()).isNull();
    }

    @Test
    public void edgesSharingAnArmArePrintedTogether() {
        Node a = new Node("a");
        Node head = new Node("head", NodeRole.DISPATCH_HEAD, null);
        Node join = new Node("join", NodeRole.BRANCH_JOIN, null);
        a.addSuccessor(head, 0).addSuccessor(join, 1).addSuccessor(head, 1);
        BranchRegion branch = new BranchRegion(new BlockRegion(a),
                Arrays.asList(new BlockRegion(head), SequenceRegion.empty()), Arrays.asList(0, 1, 0));

        assertThat(branch.getEdgeArms()).containsExactly(0, 1, 0).inOrder();
        assertThat(branch.getArmOfEdge(2)).isSameInstanceAs(branch.getArmOfEdge(0));
        assertThat(branch.getNodes()).containsExactly(a, head).inOrder();
        assertThat(branch.toString()).isEqualTo(
                "a;\n"
                + "switch (a) {\n"
                + "    case 0 [head=0], case 2 [head=1] {\n"
                + "        head; // dispatch_head\n"
                + "    }\n"
                + "    case 1 [join=1] {\n"
                + "    }\n"
                + "}\n");
    }

    @Test
    public void edgeSelectingUnknownArmIsRejected() {
        BlockRegion a = new BlockRegion(new Node("a"));

        assertThrows(IllegalArgumentException.class,
                () -> new BranchRegion(a, Arrays.asList(SequenceRegion.empty()), Arrays.asList(0, 1)));
    }

    @Test
    public void deepTreeListsNodesInPreOrder() {
        Node first = new Node("n0");
        Region region = new BlockRegion(first);
        for (int i = 1; i < 100000; i++) {
            region = new SequenceRegion(Arrays.asList(region, new BlockRegion(new Node("n" + i))));
        }

        List<Node> nodes = region.getNodes();

        assertThat(nodes).hasSize(100000);
        assertThat(nodes.get(0)).isSameInstanceAs(first);
        assertThat(nodes.get(99999).getLabel()).isEqualTo("n99999");
    }
}
