package com.spatialflow.controller;

import com.spatialflow.dto.RegionRequest;
import com.spatialflow.dto.RegionUpdate;
import com.spatialflow.model.Bounds;
import com.spatialflow.model.SpatialRegion;
import com.spatialflow.service.SpatialRegionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/api/regions")
@RequiredArgsConstructor
public class RegionController {

    private final SpatialRegionService regionService;

    @GetMapping
    public ResponseEntity<List<SpatialRegion>> listAll() {
        return ResponseEntity.ok(regionService.getRegions());
    }

    /**
     * Replaces the whole region set (load side of save/load). Every region
     * must carry an id and bounds, otherwise nothing is replaced.
     */
    @PutMapping
    public ResponseEntity<List<SpatialRegion>> load(@RequestBody List<SpatialRegion> regions) {
        if (!regions.stream().allMatch(SpatialRegionService::isLoadable)) {
            return ResponseEntity.badRequest().build();
        }
        regionService.loadRegions(regions);
        return ResponseEntity.ok(regionService.getRegions());
    }

    @PostMapping
    public ResponseEntity<SpatialRegion> create(@Valid @RequestBody RegionRequest request) {
        SpatialRegion spec = SpatialRegion.builder()
                .name(request.getName())
                .bounds(request.getBounds())
                .color(request.getColor())
                .district(request.isDistrict())
                .linkedActionIds(request.getLinkedActionIds() == null
                        ? new ArrayList<>() : new ArrayList<>(request.getLinkedActionIds()))
                .presentationOrder(request.getPresentationOrder())
                .build();
        String id = regionService.addRegion(spec);
        return regionService.getRegion(id)
                .map(region -> ResponseEntity.status(HttpStatus.CREATED).body(region))
                .orElseGet(() -> ResponseEntity.internalServerError().build());
    }

    @GetMapping("/{id}")
    public ResponseEntity<SpatialRegion> getById(@PathVariable String id) {
        return ResponseEntity.of(regionService.getRegion(id));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<SpatialRegion> update(@PathVariable String id, @RequestBody RegionUpdate update) {
        if (!regionService.updateRegion(id, update)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.of(regionService.getRegion(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        if (!regionService.deleteRegion(id)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    /**
     * Grows the region to contain the given node box plus padding.
     */
    @PostMapping("/{id}/grow")
    public ResponseEntity<SpatialRegion> grow(@PathVariable String id, @RequestBody Bounds nodeBox) {
        if (regionService.getRegion(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        regionService.autoGrowRegion(id, nodeBox);
        return ResponseEntity.of(regionService.getRegion(id));
    }
}
