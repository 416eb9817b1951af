package com.xmer.qbittorrent.bridge.events;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.reactive.messaging.rabbitmq.OutgoingRabbitMQMetadata;
import io.vertx.core.json.JsonObject;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Channel;
import org.eclipse.microprofile.reactive.messaging.Emitter;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.eclipse.microprofile.reactive.messaging.Metadata;
import org.jboss.logging.Logger;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes lifecycle events to the {@code download-events} channel and alerts to the
 * {@code notifications} channel. The RabbitMQ routing key is set per message.
 * <p>
 * Sending is asynchronous. A broker-side failure is logged and does not interrupt the poll cycle.
 */
@ApplicationScoped
public class RabbitMqEventPublisher implements EventPublisher {

    private static final Logger LOG = Logger.getLogger(RabbitMqEventPublisher.class);
    private static final TypeReference<Map<String, Object>> JSON_MAP = new TypeReference<>() {
    };

    @Inject
    @Channel("download-events")
    Emitter<JsonObject> eventEmitter;

    @Inject
    @Channel("notifications")
    Emitter<JsonObject> notificationEmitter;

    @Inject
    ObjectMapper objectMapper;

    @Override
    public void publish(DownloadEventType type, DownloadEvent event) {
        LOG.debugf("Publishing %s: hash=%s, id=%s", type.routingKey(), event.hash(), event.id());
        send(eventEmitter, type.routingKey(), event);
    }

    @Override
    public void publishAlert(PollingFailureAlert alert) {
        LOG.debugf("Publishing %s for service %s", PollingFailureAlert.ROUTING_KEY, alert.service());
        send(notificationEmitter, PollingFailureAlert.ROUTING_KEY, alert);
    }

    private void send(Emitter<JsonObject> emitter, String routingKey, Object payload) {
        JsonObject body = new JsonObject(objectMapper.convertValue(payload, JSON_MAP));
        OutgoingRabbitMQMetadata metadata = OutgoingRabbitMQMetadata.builder()
                .withRoutingKey(routingKey)
                .withContentType("application/json")
                .build();

        Message<JsonObject> message = Message.of(body, Metadata.of(metadata))
                .withNack(error -> {
                    LOG.errorf(error, "Error publishing %s: %s", routingKey, body.encode());
                    return CompletableFuture.completedFuture(null);
                });
        emitter.send(message);
    }
}
