package org.multicode.graph;

import com.google.gson.annotations.SerializedName;

import java.util.EnumSet;
import java.util.Set;

/**
 * The data types a port can carry. {@link #EXECUTION} is special: it denotes control flow
 * rather than a value.
 */
public enum PortDataType {
    @SerializedName("execution") EXECUTION("execution"),
    @SerializedName("bool") BOOL("bool"),
    @SerializedName("int32") INT32("int32"),
    @SerializedName("int64") INT64("int64"),
    @SerializedName("float") FLOAT("float"),
    @SerializedName("double") DOUBLE("double"),
    @SerializedName("string") STRING("string"),
    @SerializedName("vector") VECTOR("vector"),
    @SerializedName("object") OBJECT("object"),
    @SerializedName("array") ARRAY("array"),
    @SerializedName("any") ANY("any");

    private static final Set<PortDataType> NUMERIC = EnumSet.of(INT32, INT64, FLOAT, DOUBLE);

    private final String wireName;

    PortDataType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * @return The lowercase name used in graph documents (e.g. {@code "int32"}).
     */
    public String wireName() {
        return wireName;
    }

    /**
     * @return {@code true} for the integer and floating point types.
     */
    public boolean isNumeric() {
        return NUMERIC.contains(this);
    }

    /**
     * Best-effort check whether a value of this type may flow into a port of the target type.
     * This is a hint for the author, not a type system: numeric types convert into each other,
     * {@code bool} converts to numbers, everything converts to {@code string}, and {@code any}
     * matches every data type. Execution only connects to execution.
     *
     * @param target The type of the receiving port.
     * @return {@code true} if the connection is plausible.
     */
    public boolean isCompatibleWith(PortDataType target) {
        if (this == target) return true;
        if (this == EXECUTION || target == EXECUTION) return false;
        if (this == ANY || target == ANY) return true;
        if (isNumeric() && target.isNumeric()) return true;
        if (this == BOOL && target.isNumeric()) return true;
        return target == STRING;
    }

    /**
     * Resolves a wire name such as {@code "int32"}.
     *
     * @param wireName The lowercase name.
     * @return The matching type, or {@link #ANY} for unknown names.
     */
    public static PortDataType fromWireName(String wireName) {
        for (PortDataType type : values()) {
            if (type.wireName.equals(wireName)) return type;
        }
        return ANY;
    }
}
