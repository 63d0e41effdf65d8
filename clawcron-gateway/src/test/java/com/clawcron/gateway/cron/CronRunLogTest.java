package com.clawcron.gateway.cron;

import com.clawcron.gateway.cron.CronTypes.RunStatus;
import com.clawcron.gateway.cron.CronTypes.TriggerReason;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CronRunLogTest {

    @TempDir
    Path tempDir;

    @Test
    void read_newestFirst_limited() {
        CronRunLog log = new CronRunLog(null, 10);
        for (int i = 1; i <= 5; i++) {
            log.append(entry("j", i));
        }

        List<CronRunLogEntry> recent = log.read("j", 2);

        assertEquals(List.of(5L, 4L), recent.stream().map(CronRunLogEntry::getStartedAtMs).toList());
        assertEquals(1, log.read("j", 0).size());
        assertTrue(log.read("other", 10).isEmpty());
    }

    @Test
    void read_unknownJob_isNotCached() {
        CronRunLog log = new CronRunLog(tempDir, 10);
        log.append(entry("j", 1));

        for (int i = 0; i < 20; i++) {
            assertTrue(log.read("junk-" + i, 10).isEmpty());
        }

        assertEquals(1, log.cachedRingCount());
        assertEquals(1, log.read("j", 10).size());
    }

    @Test
    void append_evictsOldestPastCap() {
        CronRunLog log = new CronRunLog(null, 3);
        for (int i = 1; i <= 5; i++) {
            log.append(entry("j", i));
        }

        assertEquals(List.of(5L, 4L, 3L),
                log.read("j", 100).stream().map(CronRunLogEntry::getStartedAtMs).toList());
    }

    @Test
    void mirrorsToJsonl_andReloads() throws IOException {
        CronRunLog log = new CronRunLog(tempDir, 3);
        log.append(entry("job-1", 1));
        log.append(entry("job-1", 2));

        Path file = tempDir.resolve("job-1.jsonl");
        assertEquals(2, Files.readAllLines(file).size());

        CronRunLog reopened = new CronRunLog(tempDir, 3);
        List<CronRunLogEntry> entries = reopened.read("job-1", 10);
        assertEquals(List.of(2L, 1L), entries.stream().map(CronRunLogEntry::getStartedAtMs).toList());
        assertEquals(RunStatus.RAN, entries.get(0).getStatus());
        assertEquals(TriggerReason.DUE, entries.get(0).getTriggerReason());
    }

    @Test
    void mirrorFile_compactedToCap() throws IOException {
        CronRunLog log = new CronRunLog(tempDir, 2);
        for (int i = 1; i <= 4; i++) {
            log.append(entry("j", i));
        }

        assertEquals(2, Files.readAllLines(tempDir.resolve("j.jsonl")).size());
        CronRunLog reopened = new CronRunLog(tempDir, 2);
        assertEquals(List.of(4L, 3L),
                reopened.read("j", 10).stream().map(CronRunLogEntry::getStartedAtMs).toList());
    }

    @Test
    void reload_skipsMalformedLines() throws IOException {
        Files.writeString(tempDir.resolve("j.jsonl"), "{\"jobId\":\"j\",\"startedAtMs\":7}\nnot json\n");

        List<CronRunLogEntry> entries = new CronRunLog(tempDir, 5).read("j", 5);

        assertEquals(1, entries.size());
        assertEquals(7L, entries.get(0).getStartedAtMs());
    }

    @Test
    void discard_removesMemoryAndFile() {
        CronRunLog log = new CronRunLog(tempDir, 5);
        log.append(entry("j", 1));

        log.discard("j");

        assertTrue(log.read("j", 5).isEmpty());
        assertFalse(Files.exists(tempDir.resolve("j.jsonl")));
    }

    @Test
    void fileFor_sanitizesIds() {
        CronRunLog log = new CronRunLog(tempDir, 5);
        assertEquals(tempDir.resolve("a_b_c.jsonl"), log.fileFor("a/b c"));
    }

    private static CronRunLogEntry entry(String jobId, long startedAtMs) {
        return CronRunLogEntry.builder()
                .jobId(jobId)
                .startedAtMs(startedAtMs)
                .finishedAtMs(startedAtMs + 1)
                .durationMs(1L)
                .status(RunStatus.RAN)
                .triggerReason(TriggerReason.DUE)
                .build();
    }
}
