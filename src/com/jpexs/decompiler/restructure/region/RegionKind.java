package com.jpexs.decompiler.restructure.region;

/**
 * Kind of a Region. The set of kinds is closed, consumers switch over it.
 *
 * @author JPEXS
 */
public enum RegionKind {
    BLOCK,
    SEQUENCE,
    BRANCH,
    LOOP
}
