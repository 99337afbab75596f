package com.ryuqq.workbundle.adapter.inmemory.store;

import com.ryuqq.workbundle.core.spi.RemoteStoreGateway;
import com.ryuqq.workbundle.testkit.contract.AbstractConvergenceContractTest;

/**
 * End-to-end convergence tests running the engine on top of {@link InMemoryRemoteStoreGateway}.
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
class InMemoryConvergenceContractTest extends AbstractConvergenceContractTest {

    @Override
    protected RemoteStoreGateway createGateway() {
        return new InMemoryRemoteStoreGateway();
    }
}
