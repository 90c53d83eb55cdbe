package com.jpexs.decompiler.restructure.region;

import com.jpexs.decompiler.restructure.Edge;
import com.jpexs.decompiler.restructure.Node;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Multi-way branch: a discriminating block followed by mutually exclusive arms.
 * Every forward edge of the discriminator selects one arm. Several edges may share an arm
 * when they lead to the same node with different case values; all arms continue at the same node.
 *
 * @author JPEXS
 */
public final class BranchRegion extends Region {

    private final BlockRegion discriminator;
    private final List<Region> arms;
    private final List<Integer> edgeArms;

    /**
     * Creates a branch whose arm i belongs to the i-th forward edge.
     *
     * @param discriminator the discriminating block
     * @param arms the arms
     */
    public BranchRegion(BlockRegion discriminator, List<Region> arms) {
        this(discriminator, arms, null);
    }

    /**
     * Creates a branch.
     *
     * @param discriminator the discriminating block
     * @param arms the distinct arms
     * @param edgeArms arm index for each forward edge of the discriminator, null for one arm per edge
     */
    public BranchRegion(BlockRegion discriminator, List<Region> arms, List<Integer> edgeArms) {
        this.discriminator = discriminator;
        this.arms = arms != null ? new ArrayList<>(arms) : new ArrayList<>();
        this.edgeArms = new ArrayList<>();
        if (edgeArms == null) {
            for (int i = 0; i < this.arms.size(); i++) {
                this.edgeArms.add(i);
            }
        } else {
            for (Integer arm : edgeArms) {
                if (arm == null || arm < 0 || arm >= this.arms.size()) {
                    throw new IllegalArgumentException("Edge of " + discriminator.getNode() + " selects unknown arm " + arm);
                }
                this.edgeArms.add(arm);
            }
        }
    }

    public BlockRegion getDiscriminator() {
        return discriminator;
    }

    public List<Region> getArms() {
        return Collections.unmodifiableList(arms);
    }

    /**
     * Gets the arm index of each forward edge of the discriminator.
     *
     * @return the arm indices, in edge order
     */
    public List<Integer> getEdgeArms() {
        return Collections.unmodifiableList(edgeArms);
    }

    /**
     * Gets the arm selected by a forward edge of the discriminator.
     *
     * @param edge position of the edge among the forward edges
     * @return the arm
     */
    public Region getArmOfEdge(int edge) {
        return arms.get(edgeArms.get(edge));
    }

    @Override
    public RegionKind getKind() {
        return RegionKind.BRANCH;
    }

    @Override
    public Node getEntryNode() {
        return discriminator.getNode();
    }

    @Override
    public List<Region> getChildren() {
        List<Region> ret = new ArrayList<>();
        ret.add(discriminator);
        ret.addAll(arms);
        return ret;
    }

    @Override
    public String toString(String indent) {
        StringBuilder sb = new StringBuilder();
        Node node = discriminator.getNode();
        sb.append(discriminator.toString(indent));
        sb.append(indent).append("switch (").append(node.getLabel()).append(") {\n");
        List<Edge> edges = node.getForwardEdges();
        String innerIndent = indent + "    ";
        for (int a = 0; a < arms.size(); a++) {
            sb.append(innerIndent);
            boolean first = true;
            for (int i = 0; i < edgeArms.size(); i++) {
                if (edgeArms.get(i) != a) {
                    continue;
                }
                if (!first) {
                    sb.append(", ");
                }
                first = false;
                sb.append("case ").append(i);
                if (i < edges.size() && edges.get(i).hasCaseValue()) {
                    // selector assignment for the synthetic target
                    sb.append(" [").append(edges.get(i).getTarget().getLabel()).append("=").append(edges.get(i).getCaseValue()).append("]");
                }
            }
            sb.append(" {\n");
            sb.append(arms.get(a).toString(innerIndent + "    "));
            sb.append(innerIndent).append("}\n");
        }
        sb.append(indent).append("}\n");
        return sb.toString();
    }
}
