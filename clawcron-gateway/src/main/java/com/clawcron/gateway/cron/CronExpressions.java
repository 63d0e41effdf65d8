package com.clawcron.gateway.cron;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Calendar-expression evaluation: {@code nextOccurrence(expr, tz, after)}.
 */
@FunctionalInterface
public interface CronExpressions {

    /**
     * First occurrence strictly after {@code afterMs}.
     *
     * @return epoch ms, or null if the expression never fires again
     * @throws IllegalArgumentException for a malformed expression or zone
     */
    Long nextOccurrence(String expr, String tz, long afterMs);

    /**
     * Throws {@link IllegalArgumentException} if the expression cannot be
     * evaluated.
     */
    default void validate(String expr, String tz) {
        nextOccurrence(expr, tz, 0L);
    }

    /**
     * Five-field Unix expressions evaluated with cron-utils.
     */
    static CronExpressions unix() {
        return new UnixCronExpressions();
    }

    final class UnixCronExpressions implements CronExpressions {

        private final CronParser parser = new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));
        private final Map<String, ExecutionTime> parsed = new ConcurrentHashMap<>();

        @Override
        public Long nextOccurrence(String expr, String tz, long afterMs) {
            if (expr == null || expr.isBlank()) {
                throw new IllegalArgumentException("cron expression is required");
            }
            ZoneId zone = CronParse.resolveZone(tz);
            ExecutionTime executionTime = parsed.computeIfAbsent(expr.trim(), this::parse);
            ZonedDateTime after = Instant.ofEpochMilli(afterMs).atZone(zone);
            Optional<ZonedDateTime> next = executionTime.nextExecution(after);
            // cron-utils works in whole seconds; unix expressions are minute-granular
            while (next.isPresent() && next.get().toInstant().toEpochMilli() <= afterMs) {
                next = executionTime.nextExecution(next.get().plusSeconds(1));
            }
            return next.map(t -> t.toInstant().toEpochMilli()).orElse(null);
        }

        private ExecutionTime parse(String expr) {
            Cron cron = parser.parse(expr);
            cron.validate();
            return ExecutionTime.forCron(cron);
        }
    }
}
