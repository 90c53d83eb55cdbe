package com.jpexs.decompiler.restructure;

import com.jpexs.decompiler.restructure.region.BlockRegion;
import com.jpexs.decompiler.restructure.region.Region;
import com.jpexs.decompiler.restructure.region.RegionKind;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Renders a region tree as Graphviz/DOT.
 * Every sequence, branch and loop becomes a cluster, synthetic nodes are drawn as diamonds,
 * case values label the edges and back edges are dashed.
 *
 * @author JPEXS
 */
public final class RegionRenderer {

    private RegionRenderer() {
    }

    public static String render(Region root) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph {\n");
        renderRegions(root, sb, "  ");
        for (Node node : root.getNodes()) {
            for (Edge edge : node.getSuccessors()) {
                sb.append("  ").append(ControlFlowGraph.quoteIfNeeded(node.getLabel())).append("->")
                        .append(ControlFlowGraph.quoteIfNeeded(edge.getTarget().getLabel()));
                if (edge.hasCaseValue() && edge.isBackEdge()) {
                    sb.append(" [label=").append(edge.getCaseValue()).append(", style=dashed]");
                } else if (edge.hasCaseValue()) {
                    sb.append(" [label=").append(edge.getCaseValue()).append("]");
                } else if (edge.isBackEdge()) {
                    sb.append(" [style=dashed]");
                }
                sb.append(";\n");
            }
        }
        sb.append("}");
        return sb.toString();
    }

    /**
     * Region still to open, or the cluster to close when region is null.
     */
    private static final class Item {

        final Region region;
        final String indent;

        Item(Region region, String indent) {
            this.region = region;
            this.indent = indent;
        }
    }

    private static void renderRegions(Region root, StringBuilder sb, String rootIndent) {
        int clusterCounter = 0;
        Deque<Item> todo = new ArrayDeque<>();
        todo.push(new Item(root, rootIndent));
        while (!todo.isEmpty()) {
            Item item = todo.pop();
            Region region = item.region;
            String indent = item.indent;
            if (region == null) {
                sb.append(indent).append("}\n");
                continue;
            }
            if (region.getKind() == RegionKind.BLOCK) {
                Node node = ((BlockRegion) region).getNode();
                sb.append(indent).append(ControlFlowGraph.quoteIfNeeded(node.getLabel()));
                if (node.isSynthetic()) {
                    sb.append(" [shape=diamond, role=").append(node.getRole().getAttributeValue()).append("]");
                }
                sb.append(";\n");
                continue;
            }
            if (region.isEmpty()) {
                continue;
            }
            sb.append(indent).append("subgraph cluster_").append(clusterCounter++).append(" {\n");
            sb.append(indent).append("  label=\"").append(region.getKind().name().toLowerCase()).append("\";\n");
            todo.push(new Item(null, indent));
            List<Region> children = region.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                todo.push(new Item(children.get(i), indent + "  "));
            }
        }
    }
}
