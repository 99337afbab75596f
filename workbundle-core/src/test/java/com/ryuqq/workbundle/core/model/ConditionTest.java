package com.ryuqq.workbundle.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Condition 테스트.
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
class ConditionTest {

    @Test
    void of_KnownType_UsesWireName() {
        // When
        Condition condition = Condition.of(ConditionType.AVAILABLE, ConditionStatus.TRUE);

        // Then
        assertEquals("Available", condition.type());
        assertTrue(condition.isTrue(ConditionType.AVAILABLE));
        assertFalse(condition.isTrue(ConditionType.APPLIED));
    }

    @Test
    void isTrue_FalseStatus_ReturnsFalse() {
        assertFalse(Condition.of(ConditionType.APPLIED, ConditionStatus.FALSE).isTrue(ConditionType.APPLIED));
    }

    @Test
    void fromWire_KnownAndUnknownValues() {
        assertEquals(ConditionStatus.TRUE, ConditionStatus.fromWire("True"));
        assertEquals(ConditionStatus.FALSE, ConditionStatus.fromWire("False"));
        assertEquals(ConditionStatus.UNKNOWN, ConditionStatus.fromWire("true"));
        assertEquals(ConditionStatus.UNKNOWN, ConditionStatus.fromWire(null));
    }

    @Test
    void constructor_NullStatus_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new Condition("Applied", null));
    }
}
