/**
 * Exception hierarchy of the WorkBundle engine.
 *
 * <p>Every exception extends {@link com.ryuqq.workbundle.core.exception.WorkBundleException}
 * and carries an {@link com.ryuqq.workbundle.core.exception.ErrorCode}.</p>
 *
 * <h2>Benign inside the engine</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workbundle.core.exception.BundleNotFoundException} - drives the create branch and delete no-op</li>
 *   <li>{@link com.ryuqq.workbundle.core.exception.BundleAlreadyExistsException} - concurrent create, resolved by re-fetch</li>
 * </ul>
 *
 * <h2>Propagated unwrapped</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workbundle.core.exception.BundleConflictException}</li>
 *   <li>{@link com.ryuqq.workbundle.core.exception.OperationCancelledException}</li>
 *   <li>{@link com.ryuqq.workbundle.core.exception.DeadlineExceededException}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author WorkBundle Team
 */
package com.ryuqq.workbundle.core.exception;
