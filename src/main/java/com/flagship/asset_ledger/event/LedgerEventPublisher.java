package com.flagship.asset_ledger.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.asset_ledger.config.LedgerProperties;
import com.flagship.asset_ledger.observability.CorrelationContext;
import com.flagship.asset_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Publishes ledger events to Kafka once the transaction that raised them commits.
 *
 * Events from a rolled-back transaction are never sent. Publishing runs on the
 * async task executor and never waits on the broker, so a slow or unreachable
 * Kafka does not hold up the request that committed. A publish failure is
 * logged and counted; the committed ledger state stands regardless.
 *
 * Uses the aggregate ID as the Kafka key so events of one record stay ordered.
 */
@Component
@EnableAsync
@ConditionalOnProperty(name = "ledger.events.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class LedgerEventPublisher {

    static final String EVENT_TYPE_HEADER = "event-type";
    private static final long SEND_TIMEOUT_SECONDS = 10;

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final LedgerProperties properties;
    private final LedgerMetrics metrics;

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onLedgerEvent(LedgerEvent event) {
        String topic = properties.getEvents().getTopic();
        ProducerRecord<String, String> record;
        try {
            record = new ProducerRecord<>(
                topic, event.getAggregateId().toString(), objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize event: eventId={}, eventType={}", event.getEventId(), event.getEventType(), e);
            metrics.recordEventPublished(event.getEventType(), false);
            return;
        }
        record.headers().add(EVENT_TYPE_HEADER, event.getEventType().getBytes(StandardCharsets.UTF_8));
        record.headers().add(CorrelationContext.CORRELATION_ID_HEADER,
            CorrelationContext.getCorrelationId().getBytes(StandardCharsets.UTF_8));

        CompletableFuture<SendResult<String, String>> sent;
        try {
            sent = kafkaTemplate.send(record);
        } catch (Exception e) {
            // Metadata wait exceeded max.block.ms, or the producer is closed
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                    event.getEventId(), event.getEventType(), e.getMessage());
            metrics.recordEventPublished(event.getEventType(), false);
            return;
        }

        sent.orTimeout(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS)
            .whenComplete((result, throwable) -> {
                if (throwable == null) {
                    log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                            event.getEventId(),
                            result.getRecordMetadata().topic(),
                            result.getRecordMetadata().partition(),
                            result.getRecordMetadata().offset(),
                            event.getEventType());
                    metrics.recordEventPublished(event.getEventType(), true);
                } else {
                    log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                            event.getEventId(), event.getEventType(), throwable.getMessage());
                    metrics.recordEventPublished(event.getEventType(), false);
                }
            });
    }
}
