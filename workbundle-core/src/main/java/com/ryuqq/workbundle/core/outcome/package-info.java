/**
 * Engine operation outcomes.
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workbundle.core.outcome.SyncOutcome} - convergence result (permits Created, Updated, Unchanged)</li>
 * </ul>
 *
 * <h2>Other Outcomes</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workbundle.core.outcome.Deleted} - idempotent delete result</li>
 * </ul>
 *
 * @since 1.0.0
 * @author WorkBundle Team
 */
package com.ryuqq.workbundle.core.outcome;
