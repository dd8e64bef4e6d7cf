package com.spreadsheet.fgraph.api;

/** The three kinds of graph node. */
public enum NodeKind {
    /** Literal value or frozen result, no precedents. */
    CONSTANT,
    /** Compiled formula over other cells. */
    FORMULA,
    /** Aggregate of the cells of a range. */
    RANGE
}
