package com.jpexs.decompiler.restructure;

import static com.google.common.truth.Truth.assertThat;

import com.jpexs.decompiler.restructure.region.BranchRegion;
import com.jpexs.decompiler.restructure.region.LoopRegion;
import com.jpexs.decompiler.restructure.region.Region;
import com.jpexs.decompiler.restructure.region.RegionKind;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/**
 * Graphs far larger and deeper than hand written ones. Restructuring must neither exhaust
 * the thread stack nor take more than a few seconds.
 */
@RunWith(JUnit4.class)
public final class LargeGraphTest {

    private static List<Node> nodes(String prefix, int count) {
        List<Node> ret = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            ret.add(new Node(prefix + i));
        }
        return ret;
    }

    @Test(timeout = 20000)
    public void longLoop() {
        int size = 20000;
        List<Node> body = nodes("n", size);
        Node exit = new Node("exit");
        for (int i = 0; i + 1 < size; i++) {
            body.get(i).addSuccessor(body.get(i + 1));
        }
        body.get(size - 1).addSuccessor(body.get(0)).addSuccessor(exit);
        List<Node> all = new ArrayList<>(body);
        all.add(exit);

        Restructurer restructurer = new Restructurer(new ControlFlowGraph(all, body.get(0)));
        Region root = restructurer.analyze();

        assertThat(root.getKind()).isEqualTo(RegionKind.SEQUENCE);
        LoopRegion loop = (LoopRegion) root.getChildren().get(0);
        assertThat(loop.getLatch().getLabel()).isEqualTo("n" + (size - 1));
        assertThat(loop.getBody().getChildren()).hasSize(size);
        assertThat(root.getNodes()).hasSize(size + 1);
        assertThat(restructurer.getSyntheticNodes()).isEmpty();
    }

    @Test(timeout = 20000)
    public void manyDiamondsInSequence() {
        int count = 2000;
        List<Node> all = new ArrayList<>();
        Node previous = new Node("d0");
        all.add(previous);
        for (int i = 0; i < count; i++) {
            Node left = new Node("l" + i);
            Node right = new Node("r" + i);
            Node merge = new Node("d" + (i + 1));
            previous.addSuccessor(left).addSuccessor(right);
            left.addSuccessor(merge);
            right.addSuccessor(merge);
            all.add(left);
            all.add(right);
            all.add(merge);
            previous = merge;
        }

        Restructurer restructurer = new Restructurer(new ControlFlowGraph(all, all.get(0)));
        Region root = restructurer.analyze();

        assertThat(root.getChildren()).hasSize(count + 1);
        assertThat(root.getChildren().get(0).getKind()).isEqualTo(RegionKind.BRANCH);
        assertThat(root.getChildren().get(count).getEntryNode().getLabel()).isEqualTo("d" + count);
        assertThat(restructurer.getBranches()).hasSize(count);
        assertThat(restructurer.getSyntheticNodes()).isEmpty();
    }

    @Test(timeout = 20000)
    public void deeplyNestedBranches() {
        int depth = 2000;
        List<Node> all = nodes("n", depth + 1);
        Node end = new Node("end");
        for (int i = 0; i < depth; i++) {
            all.get(i).addSuccessor(all.get(i + 1)).addSuccessor(end);
        }
        all.get(depth).addSuccessor(end);
        all.add(end);

        Restructurer restructurer = new Restructurer(new ControlFlowGraph(all, all.get(0)));
        Region root = restructurer.analyze();

        int branches = 0;
        Region region = root.getChildren().get(0);
        while (region.getKind() == RegionKind.BRANCH) {
            BranchRegion branch = (BranchRegion) region;
            assertThat(branch.getArmOfEdge(1).isEmpty()).isTrue();
            region = branch.getArmOfEdge(0);
            branches++;
        }
        assertThat(branches).isEqualTo(depth);
        assertThat(region.getEntryNode().getLabel()).isEqualTo("n" + depth);
        assertThat(root.getChildren().get(1).getEntryNode()).isSameInstanceAs(restructurer.getNodes().get(depth + 1));
        assertThat(root.getNodes()).hasSize(depth + 2);
    }

    @Test(timeout = 20000)
    public void deeplyNestedLoops() {
        int depth = 1000;
        List<Node> heads = nodes("h", depth);
        List<Node> tails = nodes("t", depth);
        Node exit = new Node("exit");
        for (int i = 0; i < depth; i++) {
            heads.get(i).addSuccessor(i + 1 < depth ? heads.get(i + 1) : tails.get(i));
            tails.get(i).addSuccessor(heads.get(i)).addSuccessor(i > 0 ? tails.get(i - 1) : exit);
        }
        List<Node> all = new ArrayList<>(heads);
        all.addAll(tails);
        all.add(exit);

        Restructurer restructurer = new Restructurer(new ControlFlowGraph(all, heads.get(0)));
        Region root = restructurer.analyze();

        assertThat(restructurer.getLoops()).hasSize(depth);
        assertThat(restructurer.getLoops().get(0).header.getLabel()).isEqualTo("h0");
        assertThat(restructurer.getLoops().get(depth - 1).header.getLabel()).isEqualTo("h" + (depth - 1));
        assertThat(restructurer.getSyntheticNodes()).isEmpty();
        assertThat(root.getNodes()).hasSize(2 * depth + 1);
    }
}
