package com.example.runbookops.queue;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A claimed message. {@code version} identifies the claim; a lease extension or redelivery bumps it.
 */
@Data
@AllArgsConstructor
public class ReceivedMessage {
    private String id;
    private String queueName;
    private String body;
    private int dequeueCount;
    private long version;

    public ReceivedMessage(String id, String queueName, String body, int dequeueCount) {
        this(id, queueName, body, dequeueCount, 0L);
    }
}
