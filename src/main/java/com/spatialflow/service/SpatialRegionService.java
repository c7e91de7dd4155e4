package com.spatialflow.service;

import com.spatialflow.config.AutomationProperties;
import com.spatialflow.dto.MembershipChange;
import com.spatialflow.dto.RegionUpdate;
import com.spatialflow.model.Bounds;
import com.spatialflow.model.SpatialRegion;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Owns the spatial regions and which nodes currently overlap them.
 *
 * Membership is derived state: for every node it must equal the set of
 * regions whose bounds overlap the node's last reported box. It is only
 * updated through {@link #checkNodePosition}, which the graph-change layer
 * calls before it hands the resulting enter/exit events to the engine.
 *
 * Regions themselves are user-authored; the only write the engine makes to
 * them is {@link #autoGrowRegion}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SpatialRegionService {

    private final AutomationProperties properties;

    private final List<SpatialRegion> regions = new ArrayList<>();
    private final Map<String, Set<String>> membership = new HashMap<>();

    public synchronized String addRegion(SpatialRegion spec) {
        SpatialRegion region = spec.copy();
        region.setId(UUID.randomUUID().toString());
        regions.add(region);
        log.info("Region added: id={}, name='{}'", region.getId(), region.getName());
        return region.getId();
    }

    /**
     * Applies the non-null fields of the update. Returns false for an unknown region.
     */
    public synchronized boolean updateRegion(String regionId, RegionUpdate update) {
        Optional<SpatialRegion> found = find(regionId);
        if (found.isEmpty()) {
            return false;
        }
        SpatialRegion region = found.get();
        if (update.getName() != null) region.setName(update.getName());
        if (update.getBounds() != null) region.setBounds(update.getBounds());
        if (update.getColor() != null) region.setColor(update.getColor());
        if (update.getDistrict() != null) region.setDistrict(update.getDistrict());
        if (update.getLinkedActionIds() != null) region.setLinkedActionIds(new ArrayList<>(update.getLinkedActionIds()));
        if (update.getPresentationOrder() != null) region.setPresentationOrder(update.getPresentationOrder());
        return true;
    }

    /**
     * Removes the region and purges it from every node's membership.
     */
    public synchronized boolean deleteRegion(String regionId) {
        boolean removed = regions.removeIf(r -> regionId.equals(r.getId()));
        if (removed) {
            for (Set<String> memberOf : membership.values()) {
                memberOf.remove(regionId);
            }
            log.info("Region deleted: id={}", regionId);
        }
        return removed;
    }

    /**
     * Recomputes which regions the node's box overlaps and diffs that against
     * the stored membership. The stored set is only replaced when something
     * changed, so a repeated call with the same box returns empty lists and
     * writes nothing.
     */
    public synchronized MembershipChange checkNodePosition(String nodeId, Bounds nodeBox) {
        Set<String> current = membership.getOrDefault(nodeId, Collections.emptySet());
        Set<String> updated = new LinkedHashSet<>();
        List<String> entered = new ArrayList<>();
        List<String> exited = new ArrayList<>();

        for (SpatialRegion region : regions) {
            if (region.getBounds() == null) {
                continue;
            }
            if (Geometry.rectsOverlap(nodeBox, region.getBounds())) {
                updated.add(region.getId());
                if (!current.contains(region.getId())) {
                    entered.add(region.getId());
                }
            } else if (current.contains(region.getId())) {
                exited.add(region.getId());
            }
        }

        if (!entered.isEmpty() || !exited.isEmpty()) {
            membership.put(nodeId, updated);
            log.debug("Membership changed: node={}, entered={}, exited={}", nodeId, entered, exited);
        }
        return new MembershipChange(entered, exited);
    }

    /**
     * Grows the region, never shrinks it, until it contains the node's box plus
     * padding on every side. Each edge moves independently; moving the left or
     * top edge widens or heightens the region by the same amount so the opposite
     * edge stays put. If nothing needs to move the region keeps its exact Bounds
     * instance.
     */
    public synchronized void autoGrowRegion(String regionId, Bounds nodeBox) {
        Optional<SpatialRegion> found = find(regionId);
        if (found.isEmpty()) {
            log.debug("Auto-grow skipped, unknown region: {}", regionId);
            return;
        }
        SpatialRegion region = found.get();
        Bounds b = region.getBounds();
        if (b == null) {
            log.debug("Auto-grow skipped, region has no bounds: {}", regionId);
            return;
        }
        double pad = properties.getRegions().getAutoGrowPadding();

        double left = nodeBox.getX() - pad;
        double top = nodeBox.getY() - pad;
        double right = nodeBox.right() + pad;
        double bottom = nodeBox.bottom() + pad;

        double x = b.getX();
        double y = b.getY();
        double width = b.getWidth();
        double height = b.getHeight();
        boolean grown = false;

        if (left < x) {
            width += x - left;
            x = left;
            grown = true;
        }
        if (top < y) {
            height += y - top;
            y = top;
            grown = true;
        }
        if (right > x + width) {
            width = right - x;
            grown = true;
        }
        if (bottom > y + height) {
            height = bottom - y;
            grown = true;
        }

        if (grown) {
            region.setBounds(Bounds.of(x, y, width, height));
            log.debug("Region grown: id={}, bounds={}", regionId, region.getBounds());
        }
    }

    /**
     * Replaces every region and resets membership; the next position check of
     * each node rebuilds it.
     */
    public synchronized void loadRegions(List<SpatialRegion> loaded) {
        regions.clear();
        for (SpatialRegion region : loaded) {
            if (!isLoadable(region)) {
                log.warn("Region skipped on load, id or bounds missing: id={}, name='{}'",
                        region == null ? null : region.getId(), region == null ? null : region.getName());
                continue;
            }
            regions.add(region.copy());
        }
        membership.clear();
        log.info("Regions loaded: count={}", regions.size());
    }

    /**
     * A saved region needs its id and bounds; anything else is optional.
     */
    public static boolean isLoadable(SpatialRegion region) {
        return region != null
                && region.getId() != null && !region.getId().isBlank()
                && region.getBounds() != null;
    }

    public synchronized List<SpatialRegion> getRegions() {
        List<SpatialRegion> copies = new ArrayList<>(regions.size());
        for (SpatialRegion region : regions) {
            copies.add(region.copy());
        }
        return copies;
    }

    public synchronized Optional<SpatialRegion> getRegion(String regionId) {
        return find(regionId).map(SpatialRegion::copy);
    }

    public synchronized boolean hasRegions() {
        return !regions.isEmpty();
    }

    public synchronized List<SpatialRegion> getRegionsForRule(String ruleId) {
        List<SpatialRegion> linked = new ArrayList<>();
        for (SpatialRegion region : regions) {
            if (region.getLinkedActionIds() != null && region.getLinkedActionIds().contains(ruleId)) {
                linked.add(region.copy());
            }
        }
        return linked;
    }

    public synchronized int getMemberCount(String regionId) {
        int count = 0;
        for (Set<String> memberOf : membership.values()) {
            if (memberOf.contains(regionId)) {
                count++;
            }
        }
        return count;
    }

    public synchronized Set<String> getMembership(String nodeId) {
        return Set.copyOf(membership.getOrDefault(nodeId, Collections.emptySet()));
    }

    /**
     * Drops a deleted node from the membership table.
     */
    public synchronized void forgetNode(String nodeId) {
        membership.remove(nodeId);
    }

    private Optional<SpatialRegion> find(String regionId) {
        return regions.stream()
                .filter(r -> regionId.equals(r.getId()))
                .findFirst();
    }
}
