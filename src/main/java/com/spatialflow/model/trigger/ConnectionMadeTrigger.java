package com.spatialflow.model.trigger;

import com.spatialflow.model.ConnectionDirection;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ConnectionMadeTrigger extends Trigger {

    /** Null behaves like ANY. */
    private ConnectionDirection direction;

    /** Type of the node on the other end of the new edge. */
    private String nodeTypeFilter;

    @Override
    public TriggerType getType() {
        return TriggerType.CONNECTION_MADE;
    }
}
