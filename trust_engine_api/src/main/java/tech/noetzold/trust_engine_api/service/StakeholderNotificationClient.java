package tech.noetzold.trust_engine_api.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import tech.noetzold.trust_engine_api.exception.NotificationFailedException;
import tech.noetzold.trust_engine_api.model.RoutingDecision;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@Component
public class StakeholderNotificationClient {

    private static final Logger logger = LoggerFactory.getLogger(StakeholderNotificationClient.class);

    private final WebClient webClient;
    private final int maxAttempts;
    private final Duration retryDelay;
    private final Duration timeout;

    public StakeholderNotificationClient(@Qualifier("notificationWebClient") WebClient notificationWebClient,
                                         @Value("${trust-engine.notification.max-attempts:3}") int maxAttempts,
                                         @Value("${trust-engine.notification.retry-delay-ms:2000}") long retryDelayMs,
                                         @Value("${trust-engine.notification.timeout-ms:1500}") long timeoutMs) {
        this.webClient = notificationWebClient;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.retryDelay = Duration.ofMillis(retryDelayMs);
        this.timeout = Duration.ofMillis(timeoutMs);
    }

    /**
     * Delivers the decision to the stakeholder gateway, retrying with linear backoff.
     *
     * @throws NotificationFailedException once every attempt failed
     */
    public void notifyStakeholders(RoutingDecision decision) {
        Map<String, Object> payload = buildPayload(decision);
        String lastError = null;
        int attempts = 0;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            attempts = attempt;
            SendOutcome outcome = doSend(payload);
            if (outcome.delivered()) {
                logger.info("Decision {} delivered to {} (attempt {})", decision.decisionId(), decision.route(), attempt);
                return;
            }
            lastError = outcome.error();
            logger.warn("Delivery of decision {} failed on attempt {}/{}: {}",
                    decision.decisionId(), attempt, maxAttempts, lastError);
            if (attempt < maxAttempts) {
                sleepQuietly(retryDelay.multipliedBy(attempt)); // backoff linear
                if (Thread.currentThread().isInterrupted()) {
                    logger.warn("Delivery of decision {} interrupted, giving up after attempt {}", decision.decisionId(), attempt);
                    break;
                }
            }
        }
        throw new NotificationFailedException("Stakeholder delivery for " + decision.decisionId()
                + " failed after " + attempts + " attempts: " + lastError, attempts, null);
    }

    private Map<String, Object> buildPayload(RoutingDecision d) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("decision_id", d.decisionId());
        payload.put("org_id", d.orgId());
        payload.put("incident_id", d.incidentId());
        payload.put("category", d.category());
        payload.put("route", d.route());
        payload.put("sla_minutes", d.slaMinutes());
        payload.put("estimated_impact", d.estimatedImpact());
        payload.put("exception_applied", d.exceptionApplied());
        if (d.slaDeadline() != null) payload.put("sla_deadline", d.slaDeadline().toString());
        return payload;
    }

    private SendOutcome doSend(Map<String, Object> payload) {
        try {
            return webClient.post()
                    .uri("/notifications/route")
                    .bodyValue(payload)
                    .exchangeToMono(resp -> {
                        HttpStatusCode status = resp.statusCode();
                        if (status.is2xxSuccessful()) {
                            return Mono.just(new SendOutcome(true, null));
                        }
                        return resp.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .map(body -> new SendOutcome(false, "HTTP " + status.value() + " " + body));
                    })
                    .timeout(timeout)
                    .onErrorResume(e -> Mono.just(new SendOutcome(false, e.getClass().getSimpleName() + ": " + e.getMessage())))
                    .blockOptional()
                    .orElse(new SendOutcome(false, "empty response"));
        } catch (Exception e) {
            return new SendOutcome(false, e.getMessage());
        }
    }

    private void sleepQuietly(Duration d) {
        try {
            Thread.sleep(Math.max(1, d.toMillis()));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    private record SendOutcome(boolean delivered, String error) {}
}
