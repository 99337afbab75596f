package com.ryuqq.workbundle.adapter.inmemory.store;

import com.ryuqq.workbundle.core.context.OperationContext;
import com.ryuqq.workbundle.core.exception.BundleAlreadyExistsException;
import com.ryuqq.workbundle.core.exception.BundleConflictException;
import com.ryuqq.workbundle.core.exception.BundleNotFoundException;
import com.ryuqq.workbundle.core.model.BundleKey;
import com.ryuqq.workbundle.core.model.Condition;
import com.ryuqq.workbundle.core.model.WorkBundle;
import com.ryuqq.workbundle.core.spi.RemoteStoreGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link RemoteStoreGateway} for testing and reference purposes.
 *
 * <p>Bundles are kept in a {@link ConcurrentHashMap} keyed by {@link BundleKey}. Every write
 * takes a fresh {@code resourceVersion} from a single monotonically increasing counter, so
 * versions never repeat across keys or after a delete and re-create.</p>
 *
 * <p><strong>Optimistic Concurrency:</strong></p>
 * <ul>
 *   <li>{@link #update(OperationContext, WorkBundle)} compares the submitted resourceVersion with
 *       the stored one inside {@link ConcurrentHashMap#compute}; a mismatch raises
 *       {@link BundleConflictException} and leaves the stored bundle untouched</li>
 *   <li>Conditions are owned by the store: writes keep the stored conditions and only
 *       {@link #reportStatus(BundleKey, List)} changes them</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>The {@link OperationContext} is accepted but never blocks, so deadlines are not consulted</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryRemoteStoreGateway gateway = new InMemoryRemoteStoreGateway();
 * WorkSynchronizer synchronizer = new WorkSynchronizer(gateway);
 *
 * synchronizer.converge(ctx, bundle);
 *
 * // simulate the remote agent reporting progress
 * gateway.reportStatus(bundle.key(), List.of(
 *     Condition.of(ConditionType.APPLIED, ConditionStatus.TRUE),
 *     Condition.of(ConditionType.AVAILABLE, ConditionStatus.TRUE)));
 * </pre>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public class InMemoryRemoteStoreGateway implements RemoteStoreGateway {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRemoteStoreGateway.class);

    /**
     * Stored bundles.
     * Key: BundleKey, Value: WorkBundle carrying its current resourceVersion
     */
    private final ConcurrentHashMap<BundleKey, WorkBundle> bundles;

    private final AtomicLong versionSequence;
    private final AtomicInteger createCount;
    private final AtomicInteger updateCount;
    private final AtomicInteger deleteCount;

    /**
     * Creates a new gateway with empty storage.
     */
    public InMemoryRemoteStoreGateway() {
        this.bundles = new ConcurrentHashMap<>();
        this.versionSequence = new AtomicLong();
        this.createCount = new AtomicInteger();
        this.updateCount = new AtomicInteger();
        this.deleteCount = new AtomicInteger();
    }

    @Override
    public WorkBundle get(OperationContext ctx, BundleKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }

        WorkBundle stored = bundles.get(key);
        if (stored == null) {
            throw new BundleNotFoundException(key);
        }
        return stored;
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>The submitted resourceVersion and conditions are discarded</li>
     *   <li>Atomic via {@link ConcurrentHashMap#putIfAbsent}</li>
     * </ul>
     */
    @Override
    public WorkBundle create(OperationContext ctx, WorkBundle bundle) {
        if (bundle == null) {
            throw new IllegalArgumentException("bundle cannot be null");
        }

        WorkBundle stored = bundle.withConditions(List.of()).withResourceVersion(nextVersion());
        WorkBundle existing = bundles.putIfAbsent(bundle.key(), stored);
        if (existing != null) {
            throw new BundleAlreadyExistsException(bundle.key());
        }

        createCount.incrementAndGet();
        log.debug("Created {} at version {}", bundle.key(), stored.resourceVersion());
        return stored;
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>The version check and replacement happen in one {@link ConcurrentHashMap#compute} call</li>
     *   <li>Stored conditions are carried over to the new version</li>
     * </ul>
     */
    @Override
    public WorkBundle update(OperationContext ctx, WorkBundle bundle) {
        if (bundle == null) {
            throw new IllegalArgumentException("bundle cannot be null");
        }

        BundleKey key = bundle.key();
        WorkBundle stored = bundles.compute(key, (k, current) -> {
            if (current == null) {
                throw new BundleNotFoundException(k);
            }
            if (!Objects.equals(current.resourceVersion(), bundle.resourceVersion())) {
                throw new BundleConflictException(k, bundle.resourceVersion(), current.resourceVersion());
            }
            return bundle.withConditions(current.conditions()).withResourceVersion(nextVersion());
        });

        updateCount.incrementAndGet();
        log.debug("Updated {} to version {}", key, stored.resourceVersion());
        return stored;
    }

    @Override
    public void delete(OperationContext ctx, BundleKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }

        if (bundles.remove(key) == null) {
            throw new BundleNotFoundException(key);
        }
        deleteCount.incrementAndGet();
        log.debug("Deleted {}", key);
    }

    /**
     * Replaces the conditions of a stored bundle, as the remote agent would.
     *
     * <p>Assigns a new resourceVersion, so an engine holding the previous version
     * gets a conflict on its next update.</p>
     *
     * @param key bundle key
     * @param conditions reported conditions
     * @return the stored bundle after the report
     * @throws BundleNotFoundException if no bundle exists under the key
     */
    public WorkBundle reportStatus(BundleKey key, List<Condition> conditions) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }

        WorkBundle stored = bundles.computeIfPresent(key,
            (k, current) -> current.withConditions(conditions).withResourceVersion(nextVersion()));
        if (stored == null) {
            throw new BundleNotFoundException(key);
        }
        return stored;
    }

    /**
     * Checks whether a bundle is stored under the key.
     *
     * @param key bundle key
     * @return true if present
     */
    public boolean contains(BundleKey key) {
        return bundles.containsKey(key);
    }

    /**
     * Number of stored bundles.
     *
     * @return bundle count
     */
    public int size() {
        return bundles.size();
    }

    /**
     * Number of successful creates since construction or the last {@link #clear()}.
     *
     * @return create count
     */
    public int createCount() {
        return createCount.get();
    }

    /**
     * Number of successful updates since construction or the last {@link #clear()}.
     *
     * @return update count
     */
    public int updateCount() {
        return updateCount.get();
    }

    /**
     * Number of successful deletes since construction or the last {@link #clear()}.
     *
     * @return delete count
     */
    public int deleteCount() {
        return deleteCount.get();
    }

    /**
     * Clears all stored bundles and write counters (for testing).
     *
     * <p>The version sequence keeps counting, so versions handed out before the
     * clear are never reused.</p>
     */
    public void clear() {
        bundles.clear();
        createCount.set(0);
        updateCount.set(0);
        deleteCount.set(0);
    }

    private String nextVersion() {
        return String.valueOf(versionSequence.incrementAndGet());
    }
}
