package com.spatialflow.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.spatialflow.model.Bounds;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.util.List;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class RegionRequest {

    @NotBlank(message = "name is required")
    private String name;

    @NotNull(message = "bounds are required")
    private Bounds bounds;

    private String color;

    @JsonProperty("isDistrict")
    private boolean district;

    private List<String> linkedActionIds;

    private Integer presentationOrder;
}
