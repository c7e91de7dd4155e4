package com.spatialflow.service;

import com.spatialflow.config.AutomationProperties;
import com.spatialflow.dto.MembershipChange;
import com.spatialflow.dto.RegionUpdate;
import com.spatialflow.model.Bounds;
import com.spatialflow.model.SpatialRegion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SpatialRegionService: region CRUD, membership tracking and
 * auto-grow.
 */
class SpatialRegionServiceTest {

    private SpatialRegionService service;

    @BeforeEach
    void setUp() {
        service = new SpatialRegionService(new AutomationProperties());
    }

    private String addRegion(String name, double x, double y, double w, double h) {
        return service.addRegion(SpatialRegion.builder().name(name).bounds(Bounds.of(x, y, w, h)).build());
    }

    private Bounds boundsOf(String regionId) {
        return service.getRegion(regionId).orElseThrow().getBounds();
    }

    // --- CRUD ---

    @Nested
    @DisplayName("Region CRUD")
    class CrudTests {

        @Test
        @DisplayName("addRegion assigns a fresh id")
        void addRegion_assignsId() {
            String a = addRegion("A", 0, 0, 10, 10);
            String b = addRegion("B", 0, 0, 10, 10);
            assertNotNull(a);
            assertNotEquals(a, b);
            assertEquals(2, service.getRegions().size());
        }

        @Test
        @DisplayName("updateRegion applies only the given fields")
        void updateRegion_partial() {
            String id = addRegion("Backlog", 0, 0, 10, 10);
            RegionUpdate update = new RegionUpdate();
            update.setName("Doing");

            assertTrue(service.updateRegion(id, update));

            SpatialRegion region = service.getRegion(id).orElseThrow();
            assertEquals("Doing", region.getName());
            assertEquals(Bounds.of(0, 0, 10, 10), region.getBounds());
        }

        @Test
        @DisplayName("updateRegion on an unknown id returns false")
        void updateRegion_unknown() {
            assertFalse(service.updateRegion("nope", new RegionUpdate()));
        }

        @Test
        @DisplayName("deleteRegion purges the id from every membership set")
        void deleteRegion_purgesMembership() {
            String id = addRegion("A", 0, 0, 500, 500);
            service.checkNodePosition("n1", Bounds.of(10, 10, 50, 50));
            service.checkNodePosition("n2", Bounds.of(100, 100, 50, 50));
            assertEquals(2, service.getMemberCount(id));

            assertTrue(service.deleteRegion(id));

            assertEquals(0, service.getMemberCount(id));
            assertTrue(service.getMembership("n1").isEmpty());
            assertFalse(service.deleteRegion(id));
        }

        @Test
        @DisplayName("returned regions are copies")
        void getRegions_returnsCopies() {
            String id = addRegion("A", 0, 0, 10, 10);
            service.getRegions().get(0).setName("mutated");
            assertEquals("A", service.getRegion(id).orElseThrow().getName());
        }

        @Test
        @DisplayName("getRegionsForRule finds regions linking the rule")
        void regionsForRule() {
            service.addRegion(SpatialRegion.builder().name("Linked").bounds(Bounds.of(0, 0, 1, 1))
                    .linkedActionIds(new java.util.ArrayList<>(List.of("rule-1"))).build());
            addRegion("Other", 0, 0, 1, 1);

            List<SpatialRegion> linked = service.getRegionsForRule("rule-1");
            assertEquals(1, linked.size());
            assertEquals("Linked", linked.get(0).getName());
        }
    }

    // --- Membership ---

    @Nested
    @DisplayName("checkNodePosition")
    class MembershipTests {

        @Test
        @DisplayName("reports entered then exited regions")
        void enteredThenExited() {
            String id = addRegion("A", 100, 100, 400, 300);

            MembershipChange in = service.checkNodePosition("n1", Bounds.of(150, 150, 50, 50));
            assertEquals(List.of(id), in.getEntered());
            assertTrue(in.getExited().isEmpty());

            MembershipChange out = service.checkNodePosition("n1", Bounds.of(900, 900, 50, 50));
            assertTrue(out.getEntered().isEmpty());
            assertEquals(List.of(id), out.getExited());
            assertTrue(service.getMembership("n1").isEmpty());
        }

        @Test
        @DisplayName("second identical call reports nothing")
        void idempotent() {
            String id = addRegion("A", 0, 0, 100, 100);
            service.checkNodePosition("n1", Bounds.of(10, 10, 10, 10));

            MembershipChange again = service.checkNodePosition("n1", Bounds.of(10, 10, 10, 10));

            assertTrue(again.isEmpty());
            assertEquals(Set.of(id), service.getMembership("n1"));
        }

        @Test
        @DisplayName("touching edges do not count as overlap")
        void touchingEdges() {
            addRegion("A", 0, 0, 100, 100);
            MembershipChange change = service.checkNodePosition("n1", Bounds.of(100, 0, 50, 50));
            assertTrue(change.getEntered().isEmpty());
        }

        @Test
        @DisplayName("moving between overlapping regions enters one and exits the other")
        void moveBetweenRegions() {
            String left = addRegion("Left", 0, 0, 100, 100);
            String right = addRegion("Right", 200, 0, 100, 100);
            service.checkNodePosition("n1", Bounds.of(10, 10, 20, 20));

            MembershipChange change = service.checkNodePosition("n1", Bounds.of(210, 10, 20, 20));

            assertEquals(List.of(right), change.getEntered());
            assertEquals(List.of(left), change.getExited());
        }

        @Test
        @DisplayName("loadRegions replaces regions and resets membership")
        void loadRegions_resets() {
            String id = addRegion("A", 0, 0, 100, 100);
            service.checkNodePosition("n1", Bounds.of(10, 10, 10, 10));

            service.loadRegions(List.of(SpatialRegion.builder().id("saved").name("Saved")
                    .bounds(Bounds.of(0, 0, 100, 100)).district(true).build()));

            assertTrue(service.getRegion(id).isEmpty());
            assertTrue(service.getMembership("n1").isEmpty());
            MembershipChange change = service.checkNodePosition("n1", Bounds.of(10, 10, 10, 10));
            assertEquals(List.of("saved"), change.getEntered());
        }

        @Test
        @DisplayName("loadRegions skips regions without id or bounds")
        void loadRegions_skipsIncomplete() {
            service.loadRegions(List.of(
                    SpatialRegion.builder().id("no-bounds").name("Broken").build(),
                    SpatialRegion.builder().name("No id").bounds(Bounds.of(0, 0, 100, 100)).build(),
                    SpatialRegion.builder().id("ok").name("Ok").bounds(Bounds.of(0, 0, 100, 100)).build()));

            assertEquals(1, service.getRegions().size());
            MembershipChange change = service.checkNodePosition("n1", Bounds.of(0, 0, 10, 10));
            assertEquals(List.of("ok"), change.getEntered());
        }

        @Test
        @DisplayName("a region without bounds is ignored by position checks and auto-grow")
        void regionWithoutBounds_ignored() {
            String broken = service.addRegion(SpatialRegion.builder().name("Broken").build());
            String ok = addRegion("Ok", 0, 0, 100, 100);

            MembershipChange change = service.checkNodePosition("n1", Bounds.of(0, 0, 10, 10));

            assertEquals(List.of(ok), change.getEntered());
            assertDoesNotThrow(() -> service.autoGrowRegion(broken, Bounds.of(0, 0, 10, 10)));
            assertNull(service.getRegion(broken).orElseThrow().getBounds());
        }

        @Test
        @DisplayName("forgetNode drops the node from member counts")
        void forgetNode() {
            String id = addRegion("A", 0, 0, 100, 100);
            service.checkNodePosition("n1", Bounds.of(10, 10, 10, 10));
            service.forgetNode("n1");
            assertEquals(0, service.getMemberCount(id));
        }
    }

    // --- Auto-grow ---

    @Nested
    @DisplayName("autoGrowRegion")
    class AutoGrowTests {

        @Test
        @DisplayName("grows the right edge to the padded node edge, keeping left and top")
        void growsRight() {
            String id = addRegion("A", 100, 100, 400, 300);

            service.autoGrowRegion(id, Bounds.of(400, 200, 150, 100));

            Bounds grown = boundsOf(id);
            assertEquals(100, grown.getX());
            assertEquals(100, grown.getY());
            assertEquals(570, grown.right());
            assertEquals(400, grown.bottom());
        }

        @Test
        @DisplayName("padded box exactly on the edge does not grow")
        void exactFit_noGrowth() {
            String id = addRegion("A", 100, 100, 400, 300);
            Bounds before = boundsOf(id);

            // right edge 510 + 20 padding = 530 > 500, so this one grows
            service.autoGrowRegion(id, Bounds.of(400, 200, 110, 100));
            assertEquals(530, boundsOf(id).right());

            // now the padded box meets the edge exactly
            Bounds atEdge = boundsOf(id);
            service.autoGrowRegion(id, Bounds.of(400, 200, 110, 100));
            assertEquals(atEdge, boundsOf(id));
            assertNotEquals(before, atEdge);
        }

        @Test
        @DisplayName("node well inside keeps the same bounds instance")
        void inside_keepsInstance() {
            SpatialRegion region = SpatialRegion.builder().name("A").bounds(Bounds.of(0, 0, 1000, 1000)).build();
            String id = service.addRegion(region);
            Bounds before = service.getRegion(id).orElseThrow().getBounds();

            service.autoGrowRegion(id, Bounds.of(100, 100, 100, 100));

            assertSame(before, service.getRegion(id).orElseThrow().getBounds());
        }

        @Test
        @DisplayName("growing left or up keeps the opposite edge fixed")
        void growsLeftAndUp() {
            String id = addRegion("A", 100, 100, 400, 300);

            service.autoGrowRegion(id, Bounds.of(50, 60, 100, 100));

            Bounds grown = boundsOf(id);
            assertEquals(30, grown.getX());
            assertEquals(40, grown.getY());
            assertEquals(500, grown.right());
            assertEquals(400, grown.bottom());
        }

        @Test
        @DisplayName("never shrinks")
        void neverShrinks() {
            String id = addRegion("A", 0, 0, 1000, 1000);
            service.autoGrowRegion(id, Bounds.of(10, 10, 5, 5));
            assertEquals(Bounds.of(0, 0, 1000, 1000), boundsOf(id));
        }

        @Test
        @DisplayName("unknown region is a no-op")
        void unknownRegion() {
            assertDoesNotThrow(() -> service.autoGrowRegion("nope", Bounds.of(0, 0, 10, 10)));
        }
    }
}
