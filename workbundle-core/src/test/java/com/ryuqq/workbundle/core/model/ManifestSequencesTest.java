package com.ryuqq.workbundle.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ManifestSequences 동등성 판정 테스트.
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
class ManifestSequencesTest {

    private static final Manifest A = Manifest.of("v1", "Namespace", "{\"metadata\":{\"name\":\"a\"}}");
    private static final Manifest B = Manifest.of("v1", "Namespace", "{\"metadata\":{\"name\":\"b\"}}");

    @Test
    void sameContent_IdenticalSequences_ReturnsTrue() {
        assertTrue(ManifestSequences.sameContent(List.of(A, B), List.of(
            Manifest.of("v1", "Namespace", "{\"metadata\":{\"name\":\"a\"}}"),
            Manifest.of("v1", "Namespace", "{\"metadata\":{\"name\":\"b\"}}")
        )));
    }

    @Test
    void sameContent_DifferentOrder_ReturnsFalse() {
        assertFalse(ManifestSequences.sameContent(List.of(A, B), List.of(B, A)));
    }

    @Test
    void sameContent_DifferentLength_ReturnsFalse() {
        assertFalse(ManifestSequences.sameContent(List.of(A), List.of(A, B)));
    }

    @Test
    void sameContent_OnePayloadDiffers_ReturnsFalse() {
        // Given
        Manifest whitespaceVariant = Manifest.of("v1", "Namespace", "{\"metadata\": {\"name\":\"a\"}}");

        // When & Then
        assertFalse(ManifestSequences.sameContent(List.of(A), List.of(whitespaceVariant)));
    }

    @Test
    void sameContent_BothEmpty_ReturnsTrue() {
        assertTrue(ManifestSequences.sameContent(List.of(), List.of()));
    }

    @Test
    void sameContent_BundlesWithDifferentLabels_ComparesManifestsOnly() {
        // Given
        WorkBundle current = new WorkBundle("n", "loc", java.util.Map.of("app", "VRG"), null, List.of(A), "7", null);
        WorkBundle desired = new WorkBundle("n", "loc", null, null, List.of(A), null, null);

        // When & Then
        assertTrue(ManifestSequences.sameContent(current, desired));
    }

    @Test
    void sameContent_NullSequence_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> ManifestSequences.sameContent((List<Manifest>) null, List.of()));
    }
}
