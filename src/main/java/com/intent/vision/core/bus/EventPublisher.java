package com.intent.vision.core.bus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * Fire-and-forget publisher of domain events. Publishing never fails the
 * operation that produced the event: serialization and broker errors are logged.
 * Without a Kafka producer bean (intentvision.kafka.enabled=false) it only logs.
 */
@Service
@Slf4j
public class EventPublisher {

    private final Producer<String, String> producer;
    private final ObjectMapper mapper;

    public EventPublisher(ObjectProvider<Producer<String, String>> producer, ObjectMapper mapper) {
        this.producer = producer.getIfAvailable();
        this.mapper = mapper;
        if (this.producer == null) {
            log.info("Kafka publishing disabled; domain events are logged only");
        }
    }

    public void publish(String topic, String key, Object payload) {
        final String json;
        try {
            json = payload == null ? "{}" : mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.warn("event serialization failed topic={} key={} cause={}", topic, key, e.toString());
            return;
        }
        if (producer == null) {
            log.debug("event topic={} key={} payload={}", topic, key, json);
            return;
        }
        try {
            producer.send(new ProducerRecord<>(topic, key, json), (m, e) -> {
                if (e == null) {
                    log.debug("kafka sent topic={} partition={} offset={}", m.topic(), m.partition(), m.offset());
                } else {
                    log.warn("kafka send failed topic={} key={} cause={}", topic, key, e.toString());
                }
            });
        } catch (RuntimeException e) {
            log.warn("kafka send rejected topic={} key={} cause={}", topic, key, e.toString());
        }
    }
}
