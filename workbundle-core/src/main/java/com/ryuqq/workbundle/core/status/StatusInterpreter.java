package com.ryuqq.workbundle.core.status;

import com.ryuqq.workbundle.core.model.Condition;
import com.ryuqq.workbundle.core.model.ConditionType;
import com.ryuqq.workbundle.core.model.WorkBundle;

import java.util.Collection;

/**
 * 원격 상태 보고를 완료 여부로 해석.
 *
 * <p>판정 규칙: {@code Applied=True ∧ Available=True ∧ Degraded≠True}</p>
 * <ul>
 *   <li>Applied 또는 Available이 없거나 True가 아니면 미완료</li>
 *   <li>Degraded가 없으면 저하되지 않은 것으로 간주</li>
 *   <li>알 수 없는 종류의 Condition은 무시</li>
 * </ul>
 *
 * <p>순수 함수이며 I/O가 없습니다. Convergence 연산은 이 판정을 사용하지 않으며,
 * 호출자가 나중에 조회한 상태 스냅샷에 적용합니다.</p>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public final class StatusInterpreter {

    private StatusInterpreter() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Condition 집합의 완료 여부 판정.
     *
     * @param conditions 상태 보고 (null이면 빈 집합으로 간주)
     * @return 적용 완료 여부
     */
    public static boolean isApplied(Collection<Condition> conditions) {
        if (conditions == null) {
            return false;
        }

        boolean applied = false;
        boolean available = false;
        boolean degraded = false;

        for (Condition condition : conditions) {
            if (condition.isTrue(ConditionType.APPLIED)) {
                applied = true;
            } else if (condition.isTrue(ConditionType.AVAILABLE)) {
                available = true;
            } else if (condition.isTrue(ConditionType.DEGRADED)) {
                degraded = true;
            }
        }

        return applied && available && !degraded;
    }

    /**
     * WorkBundle에 보고된 상태의 완료 여부 판정.
     *
     * @param bundle 원격에서 조회한 WorkBundle
     * @return 적용 완료 여부
     * @throws IllegalArgumentException bundle이 null인 경우
     */
    public static boolean isApplied(WorkBundle bundle) {
        if (bundle == null) {
            throw new IllegalArgumentException("bundle cannot be null");
        }
        return isApplied(bundle.conditions());
    }
}
