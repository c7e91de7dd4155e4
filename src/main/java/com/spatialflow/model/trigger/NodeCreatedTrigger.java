package com.spatialflow.model.trigger;

import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class NodeCreatedTrigger extends Trigger {

    private String nodeTypeFilter;

    @Override
    public TriggerType getType() {
        return TriggerType.NODE_CREATED;
    }
}
