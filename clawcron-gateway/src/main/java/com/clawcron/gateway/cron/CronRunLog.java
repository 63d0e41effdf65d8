package com.clawcron.gateway.cron;

import com.clawcron.common.infra.JsonFile;
import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded per-job run history. Each job keeps a ring of the most recent
 * entries (oldest evicted past the cap), mirrored to
 * {@code <dir>/<jobId>.jsonl} when a directory is configured.
 */
@Slf4j
public class CronRunLog {

    public static final int DEFAULT_MAX_ENTRIES = 200;

    private final Path dir;
    private final int maxEntries;
    private final Map<String, Ring> rings = new ConcurrentHashMap<>();

    private static final class Ring {
        final Deque<CronRunLogEntry> entries = new ArrayDeque<>();
        int fileLines;
    }

    /**
     * @param dir        directory for the JSONL mirrors, or null for memory only
     * @param maxEntries ring capacity per job
     */
    public CronRunLog(Path dir, int maxEntries) {
        this.dir = dir;
        this.maxEntries = maxEntries > 0 ? maxEntries : DEFAULT_MAX_ENTRIES;
    }

    /**
     * Append an entry to its job's ring. A failed file write is logged; the
     * in-memory ring still records the entry.
     */
    public void append(CronRunLogEntry entry) {
        Ring ring = ring(entry.getJobId());
        synchronized (ring) {
            ring.entries.addLast(entry);
            while (ring.entries.size() > maxEntries) {
                ring.entries.removeFirst();
            }
            if (dir == null)
                return;
            Path file = fileFor(entry.getJobId());
            try {
                JsonFile.appendLine(file, CronJson.MAPPER.writeValueAsString(entry));
                ring.fileLines++;
                if (ring.fileLines >= maxEntries * 2) {
                    rewrite(file, ring);
                }
            } catch (IOException e) {
                log.warn("Failed to append cron run log {}: {}", file, e.getMessage());
            }
        }
    }

    /**
     * Most recent entries first, at most {@code limit} (clamped to the cap).
     */
    public List<CronRunLogEntry> read(String jobId, int limit) {
        if (jobId == null) {
            return new ArrayList<>();
        }
        int bounded = Math.max(1, Math.min(limit, maxEntries));
        Ring ring = rings.get(jobId);
        if (ring == null) {
            // rings without history are not cached
            Ring loaded = loadRing(jobId);
            if (loaded.entries.isEmpty()) {
                return new ArrayList<>();
            }
            ring = rings.computeIfAbsent(jobId, k -> loaded);
        }
        synchronized (ring) {
            List<CronRunLogEntry> out = new ArrayList<>(Math.min(bounded, ring.entries.size()));
            Iterator<CronRunLogEntry> it = ring.entries.descendingIterator();
            while (it.hasNext() && out.size() < bounded) {
                out.add(it.next());
            }
            return out;
        }
    }

    /**
     * Drop a job's history, in memory and on disk.
     */
    public void discard(String jobId) {
        Ring ring = rings.remove(jobId);
        if (ring != null) {
            synchronized (ring) {
                ring.entries.clear();
            }
        }
        if (dir == null)
            return;
        Path file = fileFor(jobId);
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete cron run log {}: {}", file, e.getMessage());
        }
    }

    int cachedRingCount() {
        return rings.size();
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    private Ring ring(String jobId) {
        return rings.computeIfAbsent(jobId, this::loadRing);
    }

    private Ring loadRing(String jobId) {
        Ring ring = new Ring();
        if (dir == null)
            return ring;
        Path file = fileFor(jobId);
        if (!Files.exists(file))
            return ring;
        try {
            List<String> lines = Files.readAllLines(file);
            for (String line : lines) {
                if (line.isBlank())
                    continue;
                ring.fileLines++;
                try {
                    ring.entries.addLast(CronJson.MAPPER.readValue(line, CronRunLogEntry.class));
                } catch (JsonProcessingException e) {
                    log.warn("Skipping malformed cron run log line in {}", file);
                    continue;
                }
                if (ring.entries.size() > maxEntries) {
                    ring.entries.removeFirst();
                }
            }
        } catch (IOException e) {
            log.warn("Failed to read cron run log {}: {}", file, e.getMessage());
        }
        return ring;
    }

    private void rewrite(Path file, Ring ring) throws IOException {
        StringBuilder sb = new StringBuilder();
        for (CronRunLogEntry e : ring.entries) {
            sb.append(CronJson.MAPPER.writeValueAsString(e)).append('\n');
        }
        JsonFile.writeAtomic(file, sb.toString());
        ring.fileLines = ring.entries.size();
    }

    Path fileFor(String jobId) {
        return dir.resolve(jobId.replaceAll("[^A-Za-z0-9._-]", "_") + ".jsonl");
    }
}
