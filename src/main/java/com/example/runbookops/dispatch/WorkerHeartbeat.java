package com.example.runbookops.dispatch;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /workers/register}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkerHeartbeat {

    private String capability;

    @JsonProperty("worker_id")
    private String workerId;

    private String queue;

    private String region;

    private Integer load;
}
