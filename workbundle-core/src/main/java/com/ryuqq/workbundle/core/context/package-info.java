/**
 * Cancellation and deadline propagation.
 *
 * <p>{@link com.ryuqq.workbundle.core.context.OperationContext} is passed to every engine
 * operation and forwarded unchanged to every {@link com.ryuqq.workbundle.core.spi.RemoteStoreGateway} call.</p>
 *
 * @since 1.0.0
 * @author WorkBundle Team
 */
package com.ryuqq.workbundle.core.context;
