package com.spatialflow.model;

import lombok.*;

import java.util.HashMap;
import java.util.Map;

/**
 * A canvas node as seen by the automation engine.
 *
 * data  = the node's free-form properties (status, title, priority...)
 * rule  = present only on action nodes; the automation rule they carry
 * width / height = measured size, null until the canvas has measured it
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder(toBuilder = true)
public class GraphNode {

    private String id;

    private String type;

    @Builder.Default
    private Map<String, Object> data = new HashMap<>();

    private double x;

    private double y;

    private Double width;

    private Double height;

    private AutomationRule rule;

    /**
     * The node's box, substituting the given size for unmeasured dimensions.
     */
    public Bounds toBounds(double defaultWidth, double defaultHeight) {
        double w = width != null && width > 0 ? width : defaultWidth;
        double h = height != null && height > 0 ? height : defaultHeight;
        return Bounds.of(x, y, w, h);
    }

    public GraphNode copy() {
        return toBuilder()
                .data(data == null ? new HashMap<>() : new HashMap<>(data))
                .build();
    }
}
