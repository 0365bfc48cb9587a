package com.cognite.sdk;

import com.cognite.sdk.config.ClientConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CogniteClientTest {

    @Test
    void clientCopiesShareTheWorkerPool() {
        CogniteClient client = CogniteClient.ofKey("test-key")
                .withClientConfig(ClientConfig.create().withNoWorkers(3));
        CogniteClient copy = client
                .withProject("test-project")
                .withBaseUrl("https://westeurope-1.cognitedata.com");

        assertSame(client.getExecutorService(), copy.getExecutorService());
        assertEquals(3, copy.getExecutorService().getParallelism());
    }

    @Test
    void workerCountSelectsThePool() {
        CogniteClient client = CogniteClient.ofKey("test-key")
                .withClientConfig(ClientConfig.create().withNoWorkers(3));
        CogniteClient other = client.withClientConfig(ClientConfig.create().withNoWorkers(5));

        assertNotSame(client.getExecutorService(), other.getExecutorService());
        assertEquals(5, other.getExecutorService().getParallelism());
    }

    @Test
    void projectIsRequired() {
        CogniteClient client = CogniteClient.ofKey("test-key");

        assertThrows(Exception.class, client::buildProjectConfig);
    }
}
