package com.meisai.ingest.config;

import com.meisai.common.error.MeisaiException;
import com.meisai.common.model.ImportChunk;
import com.meisai.common.model.MappingActivatedEvent;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.*;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.support.serializer.ErrorHandlingDeserializer;
import org.springframework.kafka.support.serializer.JsonDeserializer;
import org.springframework.kafka.support.serializer.JsonSerializer;
import org.springframework.util.backoff.ExponentialBackOff;

import java.util.Map;

/**
 * Consumers for streamed chunks and mapping activations. Failed records are retried with
 * exponential back-off and then published to {@code <topic>.DLT}.
 */
@EnableKafka
@Configuration
public class IngestKafkaDLTConfig {

    @Value("${spring.kafka.bootstrap-servers}")
    private String bootstrap;

    @Value("${meisai.kafka.listeners.auto-startup:true}")
    private boolean autoStartup;

    @Bean
    public ConsumerFactory<String, ImportChunk> chunkConsumerFactory() {
        return new DefaultKafkaConsumerFactory<>(consumerProps("ingest-service-chunk-group", ImportChunk.class));
    }

    @Bean
    public ConsumerFactory<String, MappingActivatedEvent> mappingActivatedConsumerFactory() {
        return new DefaultKafkaConsumerFactory<>(
                consumerProps("ingest-service-mapping-group", MappingActivatedEvent.class));
    }

    // Producer for publishing failed messages
    @Bean
    public ProducerFactory<Object, Object> dltProducerFactory() {
        return new DefaultKafkaProducerFactory<>(Map.of(
                ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrap,
                ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class,
                ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, JsonSerializer.class
        ));
    }

    @Bean
    public KafkaTemplate<Object, Object> dltKafkaTemplate() {
        return new KafkaTemplate<>(dltProducerFactory());
    }

    @Bean
    public DeadLetterPublishingRecoverer recoverer() {
        return new DeadLetterPublishingRecoverer(
                dltKafkaTemplate(),
                (record, ex) -> new TopicPartition(record.topic() + ".DLT", record.partition())
        );
    }

    @Bean
    public DefaultErrorHandler ingestErrorHandler() {
        ExponentialBackOff backOff = new ExponentialBackOff(1000, 2.0); // 1s → 2s → 4s → 8s
        backOff.setMaxInterval(8000);
        backOff.setMaxElapsedTime(30000);

        DefaultErrorHandler handler = new DefaultErrorHandler(recoverer(), backOff);
        // a rejected chunk stays rejected, straight to the DLT
        handler.addNotRetryableExceptions(MeisaiException.class);
        return handler;
    }

    @Bean(name = "chunkListenerFactory")
    public ConcurrentKafkaListenerContainerFactory<String, ImportChunk> chunkListenerFactory(
            ConsumerFactory<String, ImportChunk> chunkConsumerFactory,
            DefaultErrorHandler ingestErrorHandler) {

        ConcurrentKafkaListenerContainerFactory<String, ImportChunk> factory =
                new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(chunkConsumerFactory);
        factory.setCommonErrorHandler(ingestErrorHandler);
        factory.setAutoStartup(autoStartup);
        return factory;
    }

    @Bean(name = "mappingActivatedListenerFactory")
    public ConcurrentKafkaListenerContainerFactory<String, MappingActivatedEvent> mappingActivatedListenerFactory(
            ConsumerFactory<String, MappingActivatedEvent> mappingActivatedConsumerFactory,
            DefaultErrorHandler ingestErrorHandler) {

        ConcurrentKafkaListenerContainerFactory<String, MappingActivatedEvent> factory =
                new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(mappingActivatedConsumerFactory);
        factory.setCommonErrorHandler(ingestErrorHandler);
        factory.setAutoStartup(autoStartup);
        return factory;
    }

    private Map<String, Object> consumerProps(String groupId, Class<?> valueType) {
        return Map.of(
                ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrap,
                ConsumerConfig.GROUP_ID_CONFIG, groupId,
                ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class,
                ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ErrorHandlingDeserializer.class,
                ErrorHandlingDeserializer.VALUE_DESERIALIZER_CLASS, JsonDeserializer.class,
                JsonDeserializer.TRUSTED_PACKAGES, "com.meisai.common.model",
                JsonDeserializer.VALUE_DEFAULT_TYPE, valueType.getName(),
                JsonDeserializer.USE_TYPE_INFO_HEADERS, false
        );
    }
}
