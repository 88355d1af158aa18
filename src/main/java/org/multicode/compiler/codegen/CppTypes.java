package org.multicode.compiler.codegen;

import org.multicode.graph.PortDataType;

/**
 * C++ spellings of port data types and their zero values.
 */
public final class CppTypes {

	private CppTypes() {}

	/**
	 * @param type A port data type.
	 * @return The C++ type used for declarations and signatures.
	 */
	public static String cppType(PortDataType type) {
		return switch (type) {
			case EXECUTION -> "void";
			case BOOL -> "bool";
			case INT32 -> "int";
			case INT64 -> "long long";
			case FLOAT -> "float";
			case DOUBLE -> "double";
			case STRING -> "std::string";
			case VECTOR -> "std::vector<float>";
			case OBJECT -> "void*";
			case ARRAY -> "std::vector<int>";
			case ANY -> "auto";
		};
	}

	/**
	 * @param type A port data type.
	 * @return A literal holding the zero value of the type.
	 */
	public static String zeroValue(PortDataType type) {
		return switch (type) {
			case EXECUTION -> "";
			case BOOL -> "false";
			case INT32 -> "0";
			case INT64 -> "0LL";
			case FLOAT -> "0.0f";
			case DOUBLE -> "0.0";
			case STRING -> "\"\"";
			case OBJECT -> "nullptr";
			case VECTOR, ARRAY, ANY -> "{}";
		};
	}
}
