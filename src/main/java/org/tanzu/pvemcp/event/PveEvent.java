package org.tanzu.pvemcp.event;

import java.time.Instant;

/**
 * A change notification.
 *
 * Events are created unsequenced by publishers; the {@link Broadcaster} stamps each with
 * the next value of its single global sequence when it is published.
 */
public final class PveEvent {

    private final long sequence;
    private final EventType type;
    private final String endpointId;
    private final Instant timestamp;
    private final Object payload;

    private PveEvent(long sequence, EventType type, String endpointId, Instant timestamp, Object payload) {
        this.sequence = sequence;
        this.type = type;
        this.endpointId = endpointId;
        this.timestamp = timestamp;
        this.payload = payload;
    }

    /**
     * @param type Event type
     * @param endpointId Endpoint the event concerns, or null for global events
     * @param payload Snapshot, connection state, batch result or alert record
     */
    public static PveEvent of(EventType type, String endpointId, Object payload) {
        return new PveEvent(0, type, endpointId, Instant.now(), payload);
    }

    PveEvent withSequence(long sequence) {
        return new PveEvent(sequence, type, endpointId, timestamp, payload);
    }

    public long getSequence() { return sequence; }
    public EventType getType() { return type; }
    public String getEndpointId() { return endpointId; }
    public Instant getTimestamp() { return timestamp; }
    public Object getPayload() { return payload; }

    @Override
    public String toString() {
        return "PveEvent{sequence=" + sequence + ", type=" + type + ", endpointId='" + endpointId + "'}";
    }
}
