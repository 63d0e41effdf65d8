package com.clawcron.gateway.cron;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Record of one cron job execution.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CronRunLogEntry {
    private String jobId;
    private String jobName;
    private long startedAtMs;
    private Long finishedAtMs;
    private Long durationMs;
    private CronTypes.RunStatus status;
    private String summary;
    private String error;
    private CronTypes.TriggerReason triggerReason;
    /** Next due instant decided after this run. */
    private Long nextRunAtMs;
}
