package org.multicode.graph;

import com.google.gson.annotations.SerializedName;

/**
 * Direction of a port or function parameter.
 */
public enum PortDirection {
    @SerializedName("input") INPUT,
    @SerializedName("output") OUTPUT
}
