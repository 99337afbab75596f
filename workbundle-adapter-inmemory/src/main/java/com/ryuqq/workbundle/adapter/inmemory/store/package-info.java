/**
 * In-memory RemoteStoreGateway adapter package.
 *
 * <p>This package provides a reference implementation of the
 * {@link com.ryuqq.workbundle.core.spi.RemoteStoreGateway} SPI for tests and local runs.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.workbundle.adapter.inmemory.store.InMemoryRemoteStoreGateway}:
 *       Thread-safe keyed store with resourceVersion based optimistic concurrency</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 *   <li>Suitable for Contract Tests and reference implementation</li>
 * </ul>
 *
 * @see com.ryuqq.workbundle.core.spi.RemoteStoreGateway
 * @author WorkBundle Team
 * @since 1.0.0
 */
package com.ryuqq.workbundle.adapter.inmemory.store;
