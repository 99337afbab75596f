package com.ryuqq.workbundle.core.exception;

/**
 * 호출자가 작업을 취소한 경우.
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public class OperationCancelledException extends WorkBundleException {

    private final String operation;

    public OperationCancelledException(String operation) {
        super(ErrorCode.OPERATION_CANCELLED, operation + ": operation cancelled");
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
