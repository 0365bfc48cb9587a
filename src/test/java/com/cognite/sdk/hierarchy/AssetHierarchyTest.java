package com.cognite.sdk.hierarchy;

import com.cognite.sdk.TestUtils;
import com.cognite.sdk.dto.Asset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static com.cognite.sdk.TestUtils.asset;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AssetHierarchyTest {
    final Logger LOG = LoggerFactory.getLogger(this.getClass());

    @Test
    void validHierarchy() {
        List<Asset> assets = TestUtils.generateAssetHierarchy(500);
        ValidationReport report = AssetHierarchy.of(assets).validate();

        LOG.info("UnitTest - validHierarchy() - {}", report.describe());
        assertTrue(report.isValid());
        assertFalse(report.hasStructuralErrors());
    }

    @Test
    void validateIsIdempotent() {
        AssetHierarchy hierarchy = AssetHierarchy.of(List.of(
                asset("a", "b"),
                asset("b", "a"),
                asset("orphan", "missing"),
                asset("dup"),
                asset("dup")));

        assertEquals(hierarchy.validate(), hierarchy.validate());
    }

    @Test
    void duplicateExternalIds() {
        ValidationReport report = AssetHierarchy.of(List.of(asset("A"), asset("A"))).validate();

        assertEquals(ImmutableSet.of("A"), report.getDuplicates());
        assertTrue(report.getUnsureParents().isEmpty());
        assertFalse(report.isValid());
    }

    @Test
    void missingNameOrExternalIdIsInvalid() {
        Asset noName = Asset.newBuilder().setExternalId("noName").build();
        Asset emptyName = asset("emptyName").toBuilder().setName("").build();
        Asset noExternalId = Asset.newBuilder().setName("noExternalId").build();
        ValidationReport report = AssetHierarchy.of(List.of(asset("ok"), noName, emptyName, noExternalId))
                .validate();

        assertEquals(ImmutableList.of(noName, emptyName, noExternalId), report.getInvalid());
        assertTrue(report.hasStructuralErrors());
    }

    @Test
    void selfParentIsCycle() {
        ValidationReport report = AssetHierarchy.of(List.of(asset("root"), asset("self", "self"))).validate();

        assertEquals(ImmutableSet.of("self"), report.getCycles());
        assertTrue(report.getOrphans().isEmpty());
        assertFalse(report.isValid());
    }

    @Test
    void twoNodeCycle() {
        ValidationReport report = AssetHierarchy.of(List.of(asset("a", "b"), asset("b", "a"))).validate();

        assertEquals(ImmutableSet.of("a", "b"), report.getCycles());
        assertTrue(report.getInvalid().isEmpty());
        assertTrue(report.getOrphans().isEmpty());
    }

    @Test
    void cyclesAndOrphansAreReportedTogether() {
        Asset orphan = asset("orphan", "missing");
        ValidationReport report = AssetHierarchy.of(List.of(asset("a", "b"), asset("b", "a"), orphan)).validate();

        assertEquals(ImmutableSet.of("a", "b"), report.getCycles());
        assertEquals(ImmutableList.of(orphan), report.getOrphans());
    }

    @Test
    void orphanConfirmedOrIgnored() {
        Asset orphan = asset("x", "existing");
        AssetHierarchy hierarchy = AssetHierarchy.of(List.of(asset("root"), orphan));

        ValidationReport report = hierarchy.validate();
        assertEquals(ImmutableList.of(orphan), report.getOrphans());
        assertFalse(report.hasStructuralErrors());
        assertEquals(ImmutableSet.of("existing"), hierarchy.getExternalParentReferences());

        assertTrue(hierarchy.withExistingParents(List.of("existing")).validate().isValid());
        assertTrue(hierarchy.ignoreOrphans(true).validate().isValid());
        assertFalse(hierarchy.withExistingParents(List.of("other")).validate().isValid());
    }

    @Test
    void conflictingDuplicateParentIsUnsure() {
        Asset first = asset("p", "r1");
        Asset second = asset("p", "r2");
        Asset child = asset("c", "p");
        Asset unrelated = asset("u", "r1");
        ValidationReport report = AssetHierarchy.of(List.of(asset("r1"), asset("r2"), first, second, child, unrelated))
                .validate();

        assertEquals(ImmutableSet.of("p"), report.getDuplicates());
        assertEquals(ImmutableList.of(first, second, child), report.getUnsureParents());
    }

    @Test
    void agreeingDuplicatesAreNotUnsure() {
        ValidationReport report = AssetHierarchy.of(List.of(
                asset("r"),
                asset("p", "r"),
                asset("p", "r"),
                asset("c", "p"))).validate();

        assertEquals(ImmutableSet.of("p"), report.getDuplicates());
        assertTrue(report.getUnsureParents().isEmpty());
    }

    @Test
    void duplicateCanAlsoBeOrphan() {
        Asset first = asset("d", "missing");
        Asset second = asset("d", "missing");
        ValidationReport report = AssetHierarchy.of(List.of(first, second)).validate();

        assertEquals(ImmutableSet.of("d"), report.getDuplicates());
        assertEquals(ImmutableList.of(first, second), report.getOrphans());
    }

    @Test
    void cycleSuppressesOrphanAndUnsureParent() {
        // The last "b" closes the cycle; the first "b" references a parent outside the input.
        ValidationReport report = AssetHierarchy.of(List.of(
                asset("b", "x"),
                asset("a", "b"),
                asset("b", "a"))).validate();

        assertEquals(ImmutableSet.of("a", "b"), report.getCycles());
        assertEquals(ImmutableSet.of("b"), report.getDuplicates());
        assertTrue(report.getOrphans().isEmpty());
        assertTrue(report.getUnsureParents().isEmpty());
    }

    @Test
    void validateAndRaise() {
        AssetHierarchy hierarchy = AssetHierarchy.of(List.of(asset("a", "b"), asset("b", "a")));

        InvalidAssetHierarchyException exception =
                assertThrows(InvalidAssetHierarchyException.class, hierarchy::validateAndRaise);
        assertEquals(ImmutableSet.of("a", "b"), exception.getReport().getCycles());
    }

    @Test
    void countSubtreeAndGroupByParent() {
        Asset c1 = asset("c1", "root");
        Asset c2 = asset("c2", "root");
        Asset gc = asset("gc", "c1");
        Asset external = asset("e", "existing");
        AssetHierarchy hierarchy = AssetHierarchy.of(List.of(asset("root"), c1, c2, gc, external));

        assertEquals(3, hierarchy.countSubtree("root"));
        assertEquals(1, hierarchy.countSubtree("c1"));
        assertEquals(0, hierarchy.countSubtree("gc"));

        assertEquals(ImmutableList.of(c1, c2), hierarchy.groupByParentExternalId().get("root"));
        assertEquals(ImmutableList.of(external), hierarchy.groupByParentExternalId().get("existing"));
        assertFalse(hierarchy.groupByParentExternalId().containsKey("gc"));
    }

    @Test
    void graphIsMemoized() {
        AssetHierarchy hierarchy = AssetHierarchy.of(List.of(asset("root")));

        assertSame(hierarchy.getGraph(), hierarchy.getGraph());
    }

    @Test
    void batchingRefusesCycles() {
        AssetHierarchy hierarchy = AssetHierarchy.of(List.of(asset("root"), asset("a", "b"), asset("b", "a")));

        assertThrows(IllegalStateException.class, () -> hierarchy.toBatches(1000));
    }

    @Test
    void describeListsProblems() {
        ValidationReport report = AssetHierarchy.of(List.of(asset("a", "b"), asset("b", "a"))).validate();

        String description = report.describe();
        assertTrue(description.contains("ExternalIds in cycles"));
        assertTrue(description.contains("[a]"));
    }
}
