package com.relaydesk.support.webhook.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.relaydesk.support.webhook.repo.WebhookRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Service
public class WebhookTransferEventDispatcher implements TransferEventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(WebhookTransferEventDispatcher.class);

    private final WebhookRepository webhookRepository;
    private final RestTemplate restTemplate;
    private final TaskExecutor executor;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public WebhookTransferEventDispatcher(
            WebhookRepository webhookRepository,
            @Qualifier("webhookRestTemplate") RestTemplate restTemplate,
            @Qualifier("webhookExecutor") TaskExecutor executor,
            ObjectMapper objectMapper,
            Clock clock
    ) {
        this.webhookRepository = webhookRepository;
        this.restTemplate = restTemplate;
        this.executor = executor;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public void dispatch(String tenantId, String event, ObjectNode data) {
        if (tenantId == null || tenantId.isBlank() || event == null || event.isBlank()) return;

        var targets = webhookRepository.listActive(tenantId).stream()
                .filter(w -> w.subscribes(event))
                .toList();
        if (targets.isEmpty()) return;

        var body = objectMapper.createObjectNode();
        body.put("event", event);
        body.put("tenant_id", tenantId);
        body.put("timestamp", clock.instant().toString());
        body.set("data", data == null ? objectMapper.createObjectNode() : data.deepCopy());

        for (var target : targets) {
            try {
                executor.execute(() -> post(target, event, body));
            } catch (TaskRejectedException e) {
                log.warn("webhook_rejected tenant={} webhookId={} event={}", tenantId, target.id(), event, e);
            }
        }
    }

    private void post(WebhookRepository.WebhookRow target, String event, ObjectNode body) {
        var headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("X-RelayDesk-Event", event);
        try {
            var resp = restTemplate.postForEntity(target.url(), new HttpEntity<>(body, headers), String.class);
            log.debug("webhook_delivered webhookId={} event={} status={}", target.id(), event, resp.getStatusCode().value());
        } catch (RestClientException e) {
            log.warn("webhook_delivery_failed webhookId={} event={} url={} cause={}", target.id(), event, target.url(), e.toString());
        }
    }
}
