package com.spatialflow.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

/**
 * A named rectangle on the canvas. Nodes overlapping it are its members,
 * and region-enter / region-exit / cluster-size triggers watch it.
 *
 * Districts are the same rectangles drawn as a background tint; the
 * engine treats them like any other region.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder(toBuilder = true)
public class SpatialRegion {

    private String id;

    private String name;

    private Bounds bounds;

    private String color;

    @JsonProperty("isDistrict")
    private boolean district;

    @Builder.Default
    private List<String> linkedActionIds = new ArrayList<>();

    private Integer presentationOrder;

    public SpatialRegion copy() {
        return toBuilder()
                .linkedActionIds(linkedActionIds == null ? new ArrayList<>() : new ArrayList<>(linkedActionIds))
                .build();
    }
}
