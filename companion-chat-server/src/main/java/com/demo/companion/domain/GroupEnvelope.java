package com.demo.companion.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A group emission mirrored across instances on the broadcast backbone.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GroupEnvelope {
    private String originNodeId;
    private String userId;
    private String event;
    private Object data;
    private Instant timestamp;

    public static GroupEnvelope of(String userId, RealtimeEvent event) {
        return GroupEnvelope.builder()
                .userId(userId)
                .event(event.getEvent())
                .data(event.getData())
                .timestamp(Instant.now())
                .build();
    }

    public RealtimeEvent toEvent() {
        return new RealtimeEvent(event, data);
    }
}
