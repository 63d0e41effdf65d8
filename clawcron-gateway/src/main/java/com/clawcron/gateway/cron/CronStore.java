package com.clawcron.gateway.cron;

import com.clawcron.common.infra.JsonFile;
import com.clawcron.gateway.cron.CronTypes.CronJob;
import com.clawcron.gateway.cron.CronTypes.CronStoreFile;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Durable job list: {@code {"version":1,"jobs":[...]}} at a single path,
 * rewritten atomically on every save.
 */
@Slf4j
public class CronStore {

    static final int STORE_VERSION = 1;

    private final Path storePath;

    public CronStore(Path storePath) {
        this.storePath = storePath;
    }

    /**
     * Load the ordered job list. A missing file is an empty store; a bare JSON
     * array of jobs is accepted as a legacy layout.
     *
     * @throws CronErrors.StoreCorrupt if the file is not a well-formed job list
     * @throws CronErrors.StoreIOError if the file cannot be read
     */
    public List<CronJob> load() {
        if (!Files.exists(storePath)) {
            log.debug("Cron store file not found: {}", storePath);
            return new ArrayList<>();
        }

        String content;
        try {
            content = Files.readString(storePath);
        } catch (CharacterCodingException e) {
            throw new CronErrors.StoreCorrupt("cron store " + storePath + " is not valid UTF-8", e);
        } catch (IOException e) {
            throw new CronErrors.StoreIOError("failed to read cron store " + storePath + ": " + e.getMessage(), e);
        }
        if (content.isBlank()) {
            throw new CronErrors.StoreCorrupt("cron store " + storePath + " is empty", null);
        }

        JsonNode root;
        try {
            root = CronJson.MAPPER.readTree(content);
        } catch (JsonProcessingException e) {
            throw new CronErrors.StoreCorrupt("cron store " + storePath + " is not valid JSON: "
                    + e.getOriginalMessage(), e);
        }

        JsonNode jobsNode;
        if (root.isArray()) {
            jobsNode = root;
        } else if (root.isObject() && root.path("jobs").isArray()) {
            jobsNode = root.get("jobs");
        } else {
            throw new CronErrors.StoreCorrupt("cron store " + storePath + " has no jobs list", null);
        }

        List<CronJob> jobs = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int index = 0;
        for (JsonNode node : jobsNode) {
            CronJob job;
            try {
                job = CronJson.MAPPER.treeToValue(node, CronJob.class);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                throw new CronErrors.StoreCorrupt("cron store " + storePath + ": malformed job at index "
                        + index + ": " + e.getMessage(), e);
            }
            if (job == null || job.getId() == null || job.getId().isBlank()) {
                throw new CronErrors.StoreCorrupt("cron store " + storePath + ": job at index " + index
                        + " has no id", null);
            }
            if (!seen.add(job.getId())) {
                throw new CronErrors.StoreCorrupt("cron store " + storePath + ": duplicate job id " + job.getId(),
                        null);
            }
            if (job.getState() == null) {
                job.setState(new CronTypes.CronJobState());
            }
            if (job.getSessionTarget() == null) {
                job.setSessionTarget(CronValidate.defaultTarget(job.getPayload()));
            }
            if (job.getWakeMode() == null) {
                job.setWakeMode(CronTypes.WakeMode.NEXT_HEARTBEAT);
            }
            try {
                CronValidate.checkSchedule(job.getSchedule());
                CronValidate.checkPayload(job.getPayload());
                CronValidate.checkTarget(job.getSessionTarget(), job.getPayload());
            } catch (CronErrors.ValidationError e) {
                throw new CronErrors.StoreCorrupt("cron store " + storePath + ": job at index " + index
                        + " (" + job.getId() + ") is malformed: " + e.getMessage(), e);
            }
            jobs.add(job);
            index++;
        }
        log.debug("Loaded {} cron jobs from {}", jobs.size(), storePath);
        return jobs;
    }

    /**
     * Replace the store content with {@code jobs}.
     *
     * @throws CronErrors.StoreIOError on any write or rename failure
     */
    public void save(List<CronJob> jobs) {
        CronStoreFile file = CronStoreFile.builder()
                .version(STORE_VERSION)
                .jobs(jobs)
                .build();
        try {
            JsonFile.save(storePath, file, CronJson.MAPPER);
            log.debug("Saved cron store to {} ({} jobs)", storePath, jobs.size());
        } catch (IOException e) {
            throw new CronErrors.StoreIOError("failed to save cron store " + storePath + ": " + e.getMessage(), e);
        }
    }

    public Path getStorePath() {
        return storePath;
    }
}
