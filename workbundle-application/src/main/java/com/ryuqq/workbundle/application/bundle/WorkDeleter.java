package com.ryuqq.workbundle.application.bundle;

import com.ryuqq.workbundle.core.context.OperationContext;
import com.ryuqq.workbundle.core.exception.BundleNotFoundException;
import com.ryuqq.workbundle.core.exception.DeadlineExceededException;
import com.ryuqq.workbundle.core.exception.InvalidTargetException;
import com.ryuqq.workbundle.core.exception.OperationCancelledException;
import com.ryuqq.workbundle.core.exception.WorkBundleFetchException;
import com.ryuqq.workbundle.core.exception.WorkBundleWriteException;
import com.ryuqq.workbundle.core.model.BundleKey;
import com.ryuqq.workbundle.core.model.OwnerRef;
import com.ryuqq.workbundle.core.naming.NameFormatter;
import com.ryuqq.workbundle.core.outcome.Deleted;
import com.ryuqq.workbundle.core.spi.RemoteStoreGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * WorkBundle 멱등 삭제.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. get(name, location)
 *    - NotFound → Deleted(existed=false), 삭제 요청 없음
 *    - 기타 실패 → WorkBundleFetchException
 * 2. delete(name, location)
 *    - NotFound (조회와 삭제 사이에 다른 작성자가 삭제) → 성공
 *    - 기타 실패 → WorkBundleWriteException
 * </pre>
 *
 * <p>네임스페이스 종류 WorkBundle은 {@link #deleteWorkloadBundle}의 대상이 아닙니다.
 * 원격 네임스페이스 생성은 되돌리지 않습니다.</p>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public final class WorkDeleter {

    private static final Logger log = LoggerFactory.getLogger(WorkDeleter.class);
    static final String OPERATION = "delete";

    private final RemoteStoreGateway gateway;

    /**
     * 생성자.
     *
     * @param gateway 원격 저장소 게이트웨이
     * @throws IllegalArgumentException gateway가 null인 경우
     */
    public WorkDeleter(RemoteStoreGateway gateway) {
        if (gateway == null) {
            throw new IllegalArgumentException("gateway cannot be null");
        }
        this.gateway = gateway;
    }

    /**
     * 이름과 위치로 WorkBundle 삭제.
     *
     * @param ctx 취소/기한 컨텍스트
     * @param name WorkBundle 이름
     * @param targetLocation 대상 위치
     * @return 삭제 결과
     * @throws InvalidTargetException targetLocation이 비어 있는 경우 (원격 호출 없음)
     */
    public Deleted delete(OperationContext ctx, String name, String targetLocation) {
        return delete(ctx, BundleKey.of(name, targetLocation));
    }

    /**
     * 키로 WorkBundle 삭제.
     *
     * @param ctx 취소/기한 컨텍스트
     * @param key WorkBundle 키
     * @return 삭제 결과
     * @throws WorkBundleFetchException 조회 실패 시
     * @throws WorkBundleWriteException 삭제 실패 시
     */
    public Deleted delete(OperationContext ctx, BundleKey key) {
        if (ctx == null) {
            throw new IllegalArgumentException("ctx cannot be null");
        }
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }

        log.info("Deleting WorkBundle {}", key);

        ctx.checkActive(OPERATION);
        try {
            gateway.get(ctx, key);
        } catch (BundleNotFoundException e) {
            log.debug("WorkBundle {} does not exist, nothing to delete", key);
            return new Deleted(key, false);
        } catch (OperationCancelledException | DeadlineExceededException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new WorkBundleFetchException(OPERATION, key, e);
        }

        ctx.checkActive(OPERATION);
        try {
            gateway.delete(ctx, key);
        } catch (BundleNotFoundException e) {
            log.info("WorkBundle {} was deleted concurrently", key);
        } catch (OperationCancelledException | DeadlineExceededException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new WorkBundleWriteException(OPERATION, key, e);
        }

        return new Deleted(key, true);
    }

    /**
     * 소유자의 워크로드 WorkBundle만 삭제.
     *
     * <p>같은 위치의 네임스페이스 WorkBundle은 삭제하지 않습니다.</p>
     *
     * @param ctx 취소/기한 컨텍스트
     * @param owner 소유자
     * @param targetLocation 대상 위치
     * @return 삭제 결과
     */
    public Deleted deleteWorkloadBundle(OperationContext ctx, OwnerRef owner, String targetLocation) {
        return delete(ctx, NameFormatter.format(owner, NameFormatter.WORKLOAD_KIND), targetLocation);
    }
}
