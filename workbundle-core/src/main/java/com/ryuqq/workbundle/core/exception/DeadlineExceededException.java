package com.ryuqq.workbundle.core.exception;

import java.time.Instant;

/**
 * 작업 기한이 지난 경우.
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public class DeadlineExceededException extends WorkBundleException {

    private final String operation;
    private final Instant deadline;

    public DeadlineExceededException(String operation, Instant deadline) {
        super(ErrorCode.DEADLINE_EXCEEDED, operation + ": deadline " + deadline + " exceeded");
        this.operation = operation;
        this.deadline = deadline;
    }

    public String getOperation() {
        return operation;
    }

    public Instant getDeadline() {
        return deadline;
    }
}
