package com.ryuqq.workbundle.core.outcome;

import com.ryuqq.workbundle.core.model.BundleKey;

/**
 * WorkBundle convergence 결과.
 *
 * <p>SyncOutcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Created}: 원격에 존재하지 않아 새로 생성됨</li>
 *   <li>{@link Updated}: 원격 Manifest 목록이 달라 갱신됨</li>
 *   <li>{@link Unchanged}: 원격 Manifest 목록이 이미 동일하여 쓰기 없음</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 결과 종류가 컴파일 타임에 고정됩니다.</p>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public sealed interface SyncOutcome permits Created, Updated, Unchanged {

    /**
     * 대상 WorkBundle 키.
     *
     * @return BundleKey
     */
    BundleKey key();

    /**
     * 생성 결과인지 확인.
     *
     * @return 생성 여부
     */
    default boolean isCreated() {
        return this instanceof Created;
    }

    /**
     * 갱신 결과인지 확인.
     *
     * @return 갱신 여부
     */
    default boolean isUpdated() {
        return this instanceof Updated;
    }

    /**
     * 변경 없음 결과인지 확인.
     *
     * @return 변경 없음 여부
     */
    default boolean isUnchanged() {
        return this instanceof Unchanged;
    }

    /**
     * 원격 쓰기가 발생했는지 확인.
     *
     * @return Created 또는 Updated이면 true
     */
    default boolean isWritten() {
        return !isUnchanged();
    }
}
