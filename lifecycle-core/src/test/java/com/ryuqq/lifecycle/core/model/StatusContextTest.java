package com.ryuqq.lifecycle.core.model;

import com.ryuqq.lifecycle.core.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StatusContext 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class StatusContextTest {

    @Test
    void parse_NullOrBlank_ReturnsEmpty() {
        assertTrue(StatusContext.parse(null).isEmpty());
        assertTrue(StatusContext.parse("  ").isEmpty());
        assertNull(StatusContext.empty().toJson());
    }

    @Test
    void parse_JsonNull_ReturnsEmpty() {
        assertTrue(StatusContext.parse("null").isEmpty());
    }

    @Test
    void parse_Object_KeepsStructure() {
        // When
        StatusContext context = StatusContext.parse("{\"reason\":\"schedule conflict\",\"by\":\"teacher-1\"}");

        // Then
        assertFalse(context.isEmpty());
        assertTrue(context.getValue().isObject());
        assertEquals(StatusContext.fromValue(Map.of("reason", "schedule conflict", "by", "teacher-1")), context);
    }

    @Test
    void parse_ArrayAndScalar_Accepted() {
        assertTrue(StatusContext.parse("[1,2,3]").getValue().isArray());
        assertTrue(StatusContext.parse("42").getValue().isNumber());
    }

    @Test
    void parse_InvalidJson_ThrowsValidationException() {
        assertThrows(ValidationException.class, () -> StatusContext.parse("{not json"));
    }

    @Test
    void parseLenient_InvalidJson_KeepsRawTextAsString() {
        // When
        StatusContext context = StatusContext.parseLenient("{not json");

        // Then
        assertFalse(context.isEmpty());
        assertEquals(StatusContext.fromValue("{not json"), context);
        assertEquals("\"{not json\"", context.toJson());
    }

    @Test
    void toJson_ThenParse_ReproducesContext() {
        // Given
        StatusContext original = StatusContext.fromValue(Map.of("notes", List.of("a", "b"), "hours", 2));

        // When
        StatusContext restored = StatusContext.parse(original.toJson());

        // Then
        assertEquals(original, restored);
        assertEquals(original.hashCode(), restored.hashCode());
    }

    @Test
    void getValue_ReturnsDefensiveCopy() {
        // Given
        StatusContext context = StatusContext.parse("{\"a\":1}");

        // When
        ((tools.jackson.databind.node.ObjectNode) context.getValue()).put("b", 2);

        // Then
        assertEquals("{\"a\":1}", context.toJson());
    }

    @Test
    void fromValue_Null_ReturnsEmpty() {
        assertSame(StatusContext.empty(), StatusContext.fromValue(null));
    }
}
