package com.spatialflow.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.spatialflow.model.Bounds;
import lombok.*;

import java.util.List;

/**
 * Partial region update: only non-null fields are applied.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class RegionUpdate {

    private String name;
    private Bounds bounds;
    private String color;

    @JsonProperty("isDistrict")
    private Boolean district;

    private List<String> linkedActionIds;
    private Integer presentationOrder;
}
