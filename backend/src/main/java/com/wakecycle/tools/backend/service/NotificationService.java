package com.wakecycle.tools.backend.service;

import com.wakecycle.tools.backend.dto.WebhookPayload;
import com.wakecycle.tools.backend.model.Priority;
import com.wakecycle.tools.backend.model.StateMetric;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Locale;

/**
 * Records notifications to the principal and escalates high and urgent ones to the webhook
 * when one is configured.
 */
@Service
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private final StateService stateService;
    private final WebhookForwarder webhookForwarder;
    private final Clock clock;
    private final String webhookUrl;

    public NotificationService(StateService stateService,
            WebhookForwarder webhookForwarder,
            Clock clock,
            @Value("${wake-tools.notification.webhook-url:}") String webhookUrl) {
        this.stateService = stateService;
        this.webhookForwarder = webhookForwarder;
        this.clock = clock;
        this.webhookUrl = webhookUrl;
    }

    /**
     * @return whether the notification was handed to the webhook successfully; the notification
     *         counts as sent either way
     */
    public boolean send(String message, Priority priority, String channel) {
        log.info("Sending notification ({}): {}", priority.value(),
                message.length() > 50 ? message.substring(0, 50) + "..." : message);

        stateService.bumpMetric(StateMetric.NOTIFICATIONS_SENT);

        if (priority.isElevated()) {
            log.warn("NOTIFICATION [{}]: {}", priority.value().toUpperCase(Locale.ROOT), message);
        } else {
            log.info("NOTIFICATION [{}]: {}", priority.value(), message);
        }

        if (!isWebhookConfigured() || !priority.isElevated()) {
            return false;
        }

        log.debug("Forwarding notification on channel {} to webhook", channel);
        return webhookForwarder.forward(webhookUrl, WebhookPayload.builder()
                .message(message)
                .priority(priority.value())
                .timestamp(OffsetDateTime.now(clock))
                .build());
    }

    public boolean isWebhookConfigured() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }
}
