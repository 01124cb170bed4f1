package com.cadence.kafka;

import com.cadence.domain.DecisionEvent;
import com.cadence.engine.DecisionListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes decision events to Kafka, keyed by session id so a session's
 * decisions stay ordered within one partition.
 */
public class KafkaDecisionPublisher implements DecisionListener {

    private static final Logger log = LoggerFactory.getLogger(KafkaDecisionPublisher.class);

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final String topic;
    private final boolean transitionsOnly;
    private final Counter sendSuccessCounter;
    private final Counter sendFailureCounter;
    private final Timer sendLatencyTimer;

    public KafkaDecisionPublisher(KafkaTemplate<String, Object> kafkaTemplate, String topic, boolean transitionsOnly,
                                  MeterRegistry meterRegistry) {
        this.kafkaTemplate = kafkaTemplate;
        this.topic = topic;
        this.transitionsOnly = transitionsOnly;

        this.sendSuccessCounter = Counter.builder("cadence.kafka.decisions.sent")
            .description("Decision events published")
            .register(meterRegistry);

        this.sendFailureCounter = Counter.builder("cadence.kafka.decisions.failed")
            .description("Decision events that failed to publish")
            .register(meterRegistry);

        this.sendLatencyTimer = Timer.builder("cadence.kafka.decisions.latency")
            .description("Latency of decision publication")
            .register(meterRegistry);
    }

    @Override
    public void onDecision(DecisionEvent event) {
        if (transitionsOnly && !event.isTransition()) {
            return;
        }
        publish(event);
    }

    /**
     * Sends one decision event
     *
     * @param event the decision to publish
     * @return CompletableFuture with the send result
     */
    public CompletableFuture<SendResult<String, Object>> publish(DecisionEvent event) {
        Timer.Sample sample = Timer.start();

        CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, event.getSessionId(), event);

        future.whenComplete((result, ex) -> {
            sample.stop(sendLatencyTimer);

            if (ex != null) {
                sendFailureCounter.increment();
                log.error("Failed to publish decision for session {} to topic {}: {}",
                    event.getSessionId(), topic, ex.getMessage(), ex);
            } else {
                sendSuccessCounter.increment();
                log.debug("Published decision for session {} to topic {} partition {} offset {}",
                    event.getSessionId(),
                    topic,
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset());
            }
        });

        return future;
    }
}
