package com.ryuqq.workbundle.adapter.inmemory.store;

import com.ryuqq.workbundle.core.spi.RemoteStoreGateway;
import com.ryuqq.workbundle.testkit.contract.AbstractGatewayContractTest;

/**
 * Gateway contract tests for {@link InMemoryRemoteStoreGateway}.
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
class InMemoryGatewayContractTest extends AbstractGatewayContractTest {

    @Override
    protected RemoteStoreGateway createGateway() {
        return new InMemoryRemoteStoreGateway();
    }
}
