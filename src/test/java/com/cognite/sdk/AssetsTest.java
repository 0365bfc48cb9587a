package com.cognite.sdk;

import com.cognite.sdk.config.ClientConfig;
import com.cognite.sdk.dto.Asset;
import com.cognite.sdk.hierarchy.AssetHierarchyInsertException;
import com.cognite.sdk.hierarchy.InvalidAssetHierarchyException;
import com.cognite.sdk.hierarchy.ValidationReport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableSet;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

import static com.cognite.sdk.TestUtils.asset;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AssetsTest {
    final Logger LOG = LoggerFactory.getLogger(this.getClass());
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private MockWebServer server;
    private CogniteClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        client = CogniteClient.ofKey("test-key")
                .withProject("test-project")
                .withBaseUrl(server.url("/").toString())
                .withClientConfig(ClientConfig.create()
                        .withMaxRetries(1)
                        .withNoWorkers(4));
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void cycleIsRejectedBeforeAnyRequest() {
        InvalidAssetHierarchyException exception = assertThrows(InvalidAssetHierarchyException.class,
                () -> client.assets().createHierarchy(List.of(asset("a", "b"), asset("b", "a"))));

        assertEquals(ImmutableSet.of("a", "b"), exception.getReport().getCycles());
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void emptyInputIsNoop() throws Exception {
        assertTrue(client.assets().createHierarchy(List.of()).isEmpty());
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void createHierarchy() throws Exception {
        String loggingPrefix = "UnitTest - createHierarchy() -";
        Instant startInstant = Instant.now();
        server.setDispatcher(new EchoDispatcher(ImmutableSet.of()));
        List<Asset> assets = TestUtils.generateAssetHierarchy(250);

        List<Asset> created = client
                .withClientConfig(client.getClientConfig().withMaxHierarchyBatchSize(20))
                .assets()
                .createHierarchy(assets);
        LOG.info(loggingPrefix + "Finished writing {} assets. Duration: {}",
                created.size(),
                Duration.between(startInstant, Instant.now()));

        assertEquals(250, created.size());
        assertTrue(created.stream().allMatch(Asset::hasId));
        assertEquals(externalIds(assets), externalIds(created));
    }

    @Test
    void orphanParentIsLookedUp() throws Exception {
        server.setDispatcher(new EchoDispatcher(ImmutableSet.of("existing")));

        List<Asset> created = client.assets().createHierarchy(List.of(asset("x", "existing")));

        assertEquals(1, created.size());
        assertEquals("/api/v1/projects/test-project/assets/byids", server.takeRequest().getPath());
        assertEquals("/api/v1/projects/test-project/assets", server.takeRequest().getPath());
    }

    @Test
    void unknownParentIsInvalid() throws Exception {
        server.setDispatcher(new EchoDispatcher(ImmutableSet.of()));
        Asset orphan = asset("x", "missing");

        ValidationReport report = client.assets().validateHierarchy(List.of(asset("root"), orphan));
        assertEquals(List.of(orphan), report.getOrphans());

        InvalidAssetHierarchyException exception = assertThrows(InvalidAssetHierarchyException.class,
                () -> client.assets().createHierarchy(List.of(asset("root"), orphan)));
        assertEquals(List.of(orphan), exception.getReport().getOrphans());

        // Two lookups, no writes.
        assertEquals(2, server.getRequestCount());
    }

    @Test
    void existingParentIsConfirmedAlongsideOtherProblems() throws Exception {
        server.setDispatcher(new EchoDispatcher(ImmutableSet.of("existing")));
        List<Asset> assets = List.of(
                asset("root"),
                asset("root"),
                asset("x", "existing"),
                asset("y", "missing"));

        ValidationReport report = client.assets().validateHierarchy(assets);

        assertEquals(ImmutableSet.of("root"), report.getDuplicates());
        assertEquals(List.of(assets.get(3)), report.getOrphans());
        assertEquals(1, server.getRequestCount());

        // Writing the same input fails on the duplicate before any lookup.
        assertThrows(InvalidAssetHierarchyException.class, () -> client.assets().createHierarchy(assets));
        assertEquals(1, server.getRequestCount());
    }

    @Test
    void partialFailureIsReported() throws Exception {
        server.setDispatcher(new EchoDispatcher(ImmutableSet.of(), "bad"));
        List<Asset> assets = List.of(
                asset("root"),
                asset("bad", "root"),
                asset("good", "root"),
                asset("badChild", "bad"),
                asset("goodChild", "good"));

        // One asset per batch, so the rejected request only holds "bad".
        AssetHierarchyInsertException exception = assertThrows(AssetHierarchyInsertException.class,
                () -> client.withClientConfig(client.getClientConfig().withMaxHierarchyBatchSize(1))
                        .assets()
                        .createHierarchy(assets));

        assertEquals(Set.of("root", "good", "goodChild"), externalIds(exception.getCreated()));
        assertEquals(Set.of("bad", "badChild"), externalIds(exception.getFailed()));
        assertTrue(exception.getUnknown().isEmpty());
    }

    @Test
    @Tag("remoteCDP")
    void validateHierarchyRemote() throws Exception {
        String loggingPrefix = "UnitTest - validateHierarchyRemote() -";
        CogniteClient remoteClient = CogniteClient.create();
        List<Asset> assets = TestUtils.generateAssetHierarchy(50);

        ValidationReport report = remoteClient.assets().validateHierarchy(assets);
        LOG.info(loggingPrefix + report.describe());

        assertTrue(report.isValid());
    }

    private static Set<String> externalIds(List<Asset> assets) {
        return assets.stream()
                .map(Asset::getExternalId)
                .collect(Collectors.toSet());
    }

    /*
    Mimics the assets endpoints: writes echo the items with a new id, lookups return the known externalIds.
    A write containing a rejected externalId fails with a 400.
     */
    private static class EchoDispatcher extends Dispatcher {
        private final AtomicLong idSequence = new AtomicLong(1L);
        private final Set<String> existing;
        private final Set<String> rejected;

        EchoDispatcher(Set<String> existing, String... rejected) {
            this.existing = existing;
            this.rejected = ImmutableSet.copyOf(rejected);
        }

        @Override
        public MockResponse dispatch(RecordedRequest request) {
            try {
                JsonNode items = objectMapper.readTree(request.getBody().readUtf8()).path("items");
                ArrayNode results = objectMapper.createArrayNode();
                boolean isLookup = request.getPath().endsWith("/assets/byids");
                for (JsonNode item : items) {
                    String externalId = item.path("externalId").asText();
                    if (rejected.contains(externalId)) {
                        return new MockResponse()
                                .setResponseCode(400)
                                .setBody("{\"error\":{\"code\":400,\"message\":\"Rejected " + externalId + "\"}}");
                    }
                    if (isLookup && !existing.contains(externalId)) {
                        continue;
                    }
                    ObjectNode result = objectMapper.createObjectNode();
                    if (isLookup) {
                        result.put("name", externalId);
                    } else {
                        result.setAll((ObjectNode) item);
                    }
                    result.put("id", idSequence.getAndIncrement());
                    result.put("externalId", externalId);
                    results.add(result);
                }
                ObjectNode body = objectMapper.createObjectNode();
                body.set("items", results);
                return new MockResponse()
                        .setResponseCode(200)
                        .setHeader("Content-Type", "application/json")
                        .setBody(objectMapper.writeValueAsString(body));
            } catch (Exception e) {
                return new MockResponse().setResponseCode(500).setBody(e.toString());
            }
        }
    }
}
