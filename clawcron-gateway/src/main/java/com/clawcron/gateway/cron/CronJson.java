package com.clawcron.gateway.cron;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Shared Jackson mapper for the cron store, run logs and job snapshots.
 */
public final class CronJson {

    private CronJson() {
    }

    public static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * Deep copy of a job. Mutations are applied to copies and only committed
     * after a successful save.
     */
    public static CronTypes.CronJob copy(CronTypes.CronJob job) {
        if (job == null)
            return null;
        CronTypes.CronJob copy = MAPPER.convertValue(job, CronTypes.CronJob.class);
        if (job.getState() != null && copy.getState() != null) {
            copy.getState().setRunningAtMs(job.getState().getRunningAtMs());
        }
        return copy;
    }
}
