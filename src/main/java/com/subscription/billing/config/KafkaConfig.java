package com.subscription.billing.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.subscription.billing.messaging.SubscriptionEvent;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.util.HashMap;
import java.util.Map;

/**
 * Producer side of the subscription-events topic. Records are keyed by subscription id, so the
 * transitions of one subscription stay ordered within a partition.
 */
@Configuration
public class KafkaConfig {

    @Bean
    public NewTopic subscriptionEventsTopic(@Value("${billing.kafka.topic.subscription-events:subscription-events}") String topic,
                                           @Value("${billing.kafka.topic.partitions:3}") int partitions) {
        return TopicBuilder.name(topic).partitions(partitions).replicas(1).build();
    }

    @Bean
    public ProducerFactory<String, SubscriptionEvent> subscriptionEventProducerFactory(
            @Value("${spring.kafka.bootstrap-servers:localhost:9092}") String bootstrapServers) {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.put(ProducerConfig.CLIENT_ID_CONFIG, "subscription-billing-events");

        // The web layer keeps Boot's ObjectMapper; downstream consumers get ISO-8601 instants.
        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        JsonSerializer<SubscriptionEvent> valueSerializer = new JsonSerializer<SubscriptionEvent>(mapper).noTypeInfo();
        return new DefaultKafkaProducerFactory<>(props, new StringSerializer(), valueSerializer);
    }

    @Bean
    public KafkaTemplate<String, SubscriptionEvent> subscriptionEventKafkaTemplate(
            ProducerFactory<String, SubscriptionEvent> subscriptionEventProducerFactory) {
        return new KafkaTemplate<>(subscriptionEventProducerFactory);
    }
}
