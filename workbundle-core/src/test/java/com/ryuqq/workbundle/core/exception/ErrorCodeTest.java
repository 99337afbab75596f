package com.ryuqq.workbundle.core.exception;

import com.ryuqq.workbundle.core.model.BundleKey;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ErrorCode 및 예외 계층 테스트.
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
class ErrorCodeTest {

    private static final BundleKey KEY = BundleKey.of("app1-ns1-vrg-mw", "cluster-a");

    @Test
    void codes_AreUnique() {
        // Given
        Set<String> seen = new HashSet<>();

        // When & Then
        for (ErrorCode code : ErrorCode.values()) {
            assertTrue(seen.add(code.getCode()), "duplicate code " + code.getCode());
            assertTrue(code.getCode().startsWith("WB-"));
        }
    }

    @Test
    void retryable_OnlyTransientRemoteFailures() {
        assertTrue(ErrorCode.BUNDLE_CONFLICT.isRetryable());
        assertTrue(ErrorCode.REMOTE_STORE_ERROR.isRetryable());
        assertTrue(ErrorCode.BUNDLE_FETCH_FAILED.isRetryable());
        assertTrue(ErrorCode.BUNDLE_WRITE_FAILED.isRetryable());

        assertFalse(ErrorCode.MANIFEST_ENCODE_FAILED.isRetryable());
        assertFalse(ErrorCode.INVALID_TARGET.isRetryable());
        assertFalse(ErrorCode.UNCONDITIONAL_WRITE.isRetryable());
        assertFalse(ErrorCode.OPERATION_CANCELLED.isRetryable());
        assertFalse(ErrorCode.DEADLINE_EXCEEDED.isRetryable());
    }

    @Test
    void fetchException_MessageContainsOperationNameAndLocation() {
        // Given
        RuntimeException cause = new RuntimeException("connection reset");

        // When
        WorkBundleFetchException exception = new WorkBundleFetchException("converge", KEY, cause);

        // Then
        assertTrue(exception.getMessage().contains("converge"));
        assertTrue(exception.getMessage().contains("app1-ns1-vrg-mw"));
        assertTrue(exception.getMessage().contains("cluster-a"));
        assertSame(cause, exception.getCause());
        assertEquals("WB-401", exception.getErrorCode().getCode());
        assertTrue(exception.isRetryable());
    }

    @Test
    void writeException_PreservesCause() {
        // Given
        RemoteStoreException cause = new RemoteStoreException("503");

        // When
        WorkBundleWriteException exception = new WorkBundleWriteException("delete", KEY, cause);

        // Then
        assertSame(cause, exception.getCause());
        assertEquals("delete", exception.getOperation());
        assertEquals(KEY, exception.getKey());
    }

    @Test
    void conflictException_CarriesVersions() {
        // When
        BundleConflictException exception = new BundleConflictException(KEY, "3", "4");

        // Then
        assertEquals("3", exception.getExpectedVersion());
        assertEquals("4", exception.getActualVersion());
        assertEquals(ErrorCode.BUNDLE_CONFLICT, exception.getErrorCode());
    }

    @Test
    void deadlineException_CarriesDeadline() {
        // Given
        Instant deadline = Instant.parse("2024-01-01T00:00:00Z");

        // When
        DeadlineExceededException exception = new DeadlineExceededException("delete", deadline);

        // Then
        assertEquals(deadline, exception.getDeadline());
        assertFalse(exception.isRetryable());
    }
}
