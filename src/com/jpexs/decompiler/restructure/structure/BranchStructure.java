package com.jpexs.decompiler.restructure.structure;

import com.jpexs.decompiler.restructure.Node;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Represents a branch point and the place where its arms merge.
 */
public class BranchStructure {
    public final Node discriminator;
    public final List<Node> armEntries; // first node of the arm of each edge, null for an empty arm
    public final Node mergeNode;        // may be null if every arm returns
    public final Node branchJoin;       // synthetic merge node, null if the arms already merged

    public BranchStructure(Node discriminator, List<Node> armEntries, Node mergeNode, Node branchJoin) {
        this.discriminator = discriminator;
        this.armEntries = Collections.unmodifiableList(new ArrayList<>(armEntries));
        this.mergeNode = mergeNode;
        this.branchJoin = branchJoin;
    }

    @Override
    public String toString() {
        return "Branch{discriminator=" + discriminator +
               ", arms=" + armEntries +
               ", merge=" + mergeNode +
               ", join=" + branchJoin + "}";
    }
}
