package com.cognite.sdk.hierarchy;

import com.cognite.sdk.dto.Asset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.cognite.sdk.TestUtils.asset;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HierarchyGraphTest {

    @Test
    void buildChildrenAndRootsInInputOrder() {
        HierarchyGraph graph = HierarchyGraph.of(List.of(
                asset("c2", "root"),
                asset("root"),
                asset("c1", "root"),
                asset("gc", "c1")));

        assertEquals(ImmutableList.of("root"), graph.getRoots());
        assertEquals(ImmutableList.of("c2", "c1"), graph.getChildren("root"));
        assertEquals(ImmutableList.of("gc"), graph.getChildren("c1"));
        assertTrue(graph.getChildren("gc").isEmpty());
        assertEquals(4, graph.size());
    }

    @Test
    void parentOutsideInputOrByIdIsRoot() {
        Asset byId = asset("b").toBuilder().setParentId(42L).build();
        HierarchyGraph graph = HierarchyGraph.of(List.of(asset("a", "existing"), byId));

        assertEquals(ImmutableList.of("a", "b"), graph.getRoots());
        assertNull(graph.getParentExternalId(graph.getAsset("a")));
    }

    @Test
    void lastDuplicateWinsForEdges() {
        Asset first = asset("x", "p1");
        Asset last = asset("x", "p2");
        HierarchyGraph graph = HierarchyGraph.of(List.of(asset("p1"), asset("p2"), first, last));

        assertEquals(ImmutableSet.of("x"), graph.getDuplicateExternalIds());
        assertEquals(ImmutableList.of(first, last), graph.getOccurrences("x"));
        assertEquals(last, graph.getAsset("x"));
        assertEquals(3, graph.getPosition("x"));
        assertTrue(graph.getChildren("p1").isEmpty());
        assertEquals(ImmutableList.of("x"), graph.getChildren("p2"));
    }

    @Test
    void assetsWithoutExternalIdAreLeftOut() {
        Asset noExternalId = Asset.newBuilder().setName("anonymous").build();
        HierarchyGraph graph = HierarchyGraph.of(List.of(asset("a"), noExternalId));

        assertEquals(1, graph.size());
        assertEquals(2, graph.getInputAssets().size());
        assertFalse(graph.contains(""));
    }

    @Test
    void findCycleMembers() {
        HierarchyGraph graph = HierarchyGraph.of(List.of(
                asset("self", "self"),
                asset("a", "b"),
                asset("b", "a"),
                asset("below", "a"),
                asset("root"),
                asset("child", "root")));

        assertEquals(ImmutableSet.of("self", "a", "b"), graph.findCycleMembers());
    }

    @Test
    void countDescendants() {
        HierarchyGraph graph = HierarchyGraph.of(List.of(
                asset("root"),
                asset("c1", "root"),
                asset("c2", "root"),
                asset("gc1", "c1"),
                asset("gc2", "c1")));

        assertEquals(4, graph.countDescendants("root"));
        assertEquals(2, graph.countDescendants("c1"));
        assertEquals(0, graph.countDescendants("c2"));
    }

    @Test
    void countDescendantsTerminatesOnCycles() {
        HierarchyGraph graph = HierarchyGraph.of(List.of(
                asset("a", "b"),
                asset("b", "a"),
                asset("c", "a")));

        assertEquals(2, graph.countDescendants("a"));
    }

    @Test
    void unknownExternalIdIsRejected() {
        HierarchyGraph graph = HierarchyGraph.of(List.of(asset("a")));

        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                () -> graph.getPosition("missing"));
        assertEquals("Unknown externalId: missing", exception.getMessage());
        assertThrows(IllegalArgumentException.class, () -> graph.countDescendants("missing"));
        assertEquals(0, graph.getPosition("a"));
    }
}
