package com.spatialflow.model;

import lombok.*;

/**
 * Directed edge between two canvas nodes. "Children" of a node are the
 * targets of its outgoing edges.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class GraphEdge {

    private String id;
    private String source;
    private String target;
}
