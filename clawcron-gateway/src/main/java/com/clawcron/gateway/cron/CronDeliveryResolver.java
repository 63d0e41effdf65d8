package com.clawcron.gateway.cron;

import com.clawcron.gateway.cron.CronTypes.CronDelivery;
import com.clawcron.gateway.cron.CronTypes.CronJob;
import com.clawcron.gateway.cron.CronTypes.CronPayload;
import com.clawcron.gateway.cron.CronTypes.DeliveryMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Resolves where an isolated agent turn's reply should go. The scheduler only
 * computes the plan; the isolated runner acts on it.
 */
public final class CronDeliveryResolver {

    private CronDeliveryResolver() {
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DeliveryPlan {
        private DeliveryMode mode;
        private String channel;
        private String to;
        /** Where the delivery config came from: "delivery" or "payload". */
        private String source;
        private boolean requested;
    }

    /**
     * Job-level {@code delivery} wins; otherwise the agentTurn payload's
     * {@code deliver/provider/to} hints are used. Channel defaults to
     * {@code last} (the most recently used channel).
     */
    public static DeliveryPlan resolve(CronJob job) {
        CronPayload payload = job.getPayload();
        CronDelivery delivery = job.getDelivery();

        String payloadChannel = payload != null ? normalizeChannel(payload.getProvider()) : null;
        String payloadTo = payload != null ? normalizeTo(payload.getTo()) : null;

        if (delivery != null) {
            DeliveryMode mode = delivery.getMode() != null ? delivery.getMode() : DeliveryMode.NONE;
            String channel = normalizeChannel(delivery.getChannel());
            String to = normalizeTo(delivery.getTo());
            return DeliveryPlan.builder()
                    .mode(mode)
                    .channel(channel != null ? channel : payloadChannel != null ? payloadChannel : "last")
                    .to(to != null ? to : payloadTo)
                    .source("delivery")
                    .requested(mode == DeliveryMode.ANNOUNCE)
                    .build();
        }

        boolean requested = payload != null && (Boolean.TRUE.equals(payload.getDeliver())
                || (payload.getDeliver() == null && payloadTo != null));
        return DeliveryPlan.builder()
                .mode(requested ? DeliveryMode.ANNOUNCE : DeliveryMode.NONE)
                .channel(payloadChannel != null ? payloadChannel : "last")
                .to(payloadTo)
                .source("payload")
                .requested(requested)
                .build();
    }

    private static String normalizeChannel(String value) {
        if (value == null)
            return null;
        String trimmed = value.trim().toLowerCase();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String normalizeTo(String value) {
        if (value == null)
            return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
