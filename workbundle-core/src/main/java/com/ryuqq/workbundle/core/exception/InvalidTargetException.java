package com.ryuqq.workbundle.core.exception;

/**
 * 대상 위치(targetLocation)가 비어 있는 경우.
 *
 * <p>원격 호출 전에 발생하며, 원격 저장소에는 아무런 요청도 전달되지 않습니다.</p>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public class InvalidTargetException extends WorkBundleException {

    private final String bundleName;

    public InvalidTargetException(String bundleName) {
        super(ErrorCode.INVALID_TARGET,
            "Target location cannot be empty for WorkBundle " + bundleName);
        this.bundleName = bundleName;
    }

    public String getBundleName() {
        return bundleName;
    }
}
