package org.multicode.graph;

import com.google.gson.annotations.SerializedName;

/**
 * Kind of a link between two ports.
 */
public enum EdgeKind {
    /** Control flow; determines statement order. */
    @SerializedName("execution") EXECUTION,
    /** Feeds a computed or literal value into an input port. */
    @SerializedName("data") DATA
}
