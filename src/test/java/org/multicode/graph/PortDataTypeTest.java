package org.multicode.graph;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
class PortDataTypeTest {

    @ParameterizedTest
    @CsvSource({
            "INT32, DOUBLE, true",
            "FLOAT, INT64, true",
            "BOOL, INT32, true",
            "INT32, BOOL, false",
            "STRING, BOOL, false",
            "VECTOR, STRING, true",
            "OBJECT, ANY, true",
            "ANY, ARRAY, true",
            "EXECUTION, ANY, false",
            "EXECUTION, EXECUTION, true",
            "ARRAY, VECTOR, false"
    })
    void isCompatibleWith(PortDataType source, PortDataType target, boolean expected) {
        assertEquals(expected, source.isCompatibleWith(target));
    }

    @ParameterizedTest
    @CsvSource({"int32, INT32", "execution, EXECUTION", "quaternion, ANY"})
    void fromWireName(String wireName, PortDataType expected) {
        assertEquals(expected, PortDataType.fromWireName(wireName));
    }
}
