package com.ryuqq.workbundle.core.spi;

import com.ryuqq.workbundle.core.context.OperationContext;
import com.ryuqq.workbundle.core.exception.BundleAlreadyExistsException;
import com.ryuqq.workbundle.core.exception.BundleConflictException;
import com.ryuqq.workbundle.core.exception.BundleNotFoundException;
import com.ryuqq.workbundle.core.exception.RemoteStoreException;
import com.ryuqq.workbundle.core.model.BundleKey;
import com.ryuqq.workbundle.core.model.WorkBundle;

/**
 * Remote store SPI for WorkBundle resources keyed by {@code (name, location)}.
 *
 * <p>The engine never talks to a target cluster directly. It only reads and writes the
 * broker-side WorkBundle object through this gateway.</p>
 *
 * <p><strong>Optimistic Concurrency Contract:</strong></p>
 * <ul>
 *   <li>{@link #create(OperationContext, WorkBundle)} assigns a {@code resourceVersion}</li>
 *   <li>{@link #update(OperationContext, WorkBundle)} MUST be conditioned on the submitted
 *       {@code resourceVersion} and reject a stale one with {@link BundleConflictException}</li>
 *   <li>Every successful write assigns a new {@code resourceVersion}</li>
 * </ul>
 *
 * <p><strong>Context:</strong> the engine forwards its {@link OperationContext} unchanged.
 * Implementations that block on I/O should honour its deadline.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods may be called concurrently</li>
 *   <li>Failures other than the ones listed are reported as {@link RemoteStoreException}
 *       (or another unchecked exception, which the engine wraps)</li>
 * </ul>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public interface RemoteStoreGateway {

    /**
     * Fetches the WorkBundle stored under the given key.
     *
     * @param ctx operation context
     * @param key name and location
     * @return the stored bundle including its resourceVersion and reported conditions
     * @throws BundleNotFoundException if no bundle exists under the key
     * @throws RemoteStoreException on any other remote failure
     */
    WorkBundle get(OperationContext ctx, BundleKey key);

    /**
     * Creates a new WorkBundle.
     *
     * @param ctx operation context
     * @param bundle bundle to create (its resourceVersion is ignored)
     * @return the stored bundle with its assigned resourceVersion
     * @throws BundleAlreadyExistsException if a bundle already exists under the same key
     * @throws RemoteStoreException on any other remote failure
     */
    WorkBundle create(OperationContext ctx, WorkBundle bundle);

    /**
     * Replaces an existing WorkBundle, conditioned on its resourceVersion.
     *
     * @param ctx operation context
     * @param bundle bundle carrying the resourceVersion it was read with
     * @return the stored bundle with its new resourceVersion
     * @throws BundleConflictException if the stored resourceVersion differs
     * @throws BundleNotFoundException if the bundle no longer exists
     * @throws RemoteStoreException on any other remote failure
     */
    WorkBundle update(OperationContext ctx, WorkBundle bundle);

    /**
     * Deletes the WorkBundle stored under the given key.
     *
     * @param ctx operation context
     * @param key name and location
     * @throws BundleNotFoundException if no bundle exists under the key
     * @throws RemoteStoreException on any other remote failure
     */
    void delete(OperationContext ctx, BundleKey key);
}
