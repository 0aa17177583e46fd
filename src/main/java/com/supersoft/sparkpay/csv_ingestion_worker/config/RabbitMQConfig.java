package com.supersoft.sparkpay.csv_ingestion_worker.config;

import org.springframework.amqp.core.*;
import org.springframework.amqp.rabbit.config.SimpleRabbitListenerContainerFactory;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Upload notifications. Messages only wake the poll loop, so rejected ones go to the dead-letter
 * queue instead of being redelivered.
 */
@Configuration
public class RabbitMQConfig {

    public static final String INGESTION_EXCHANGE = "ingestion.exchange";
    public static final String BATCH_UPLOADED_ROUTING_KEY = "batch.uploaded";
    public static final String DLQ_ROUTING_KEY = "dlq";

    @Value("${ingestion.amqp.queue:ingestion.batch.uploaded}")
    private String batchUploadedQueue;

    @Bean
    public MessageConverter jsonMessageConverter() {
        return new Jackson2JsonMessageConverter();
    }

    @Bean
    public SimpleRabbitListenerContainerFactory rabbitListenerContainerFactory(ConnectionFactory connectionFactory) {
        SimpleRabbitListenerContainerFactory factory = new SimpleRabbitListenerContainerFactory();
        factory.setConnectionFactory(connectionFactory);
        factory.setMessageConverter(jsonMessageConverter());
        factory.setAcknowledgeMode(AcknowledgeMode.AUTO);
        factory.setDefaultRequeueRejected(false);
        factory.setConcurrentConsumers(1);
        return factory;
    }

    @Bean
    public Queue batchUploadedQueue() {
        return QueueBuilder.durable(batchUploadedQueue)
                .withArgument("x-dead-letter-exchange", INGESTION_EXCHANGE)
                .withArgument("x-dead-letter-routing-key", DLQ_ROUTING_KEY)
                .build();
    }

    @Bean
    public Queue batchUploadedDlq() {
        return QueueBuilder.durable(batchUploadedQueue + ".dlq").build();
    }

    @Bean
    public DirectExchange ingestionExchange() {
        return new DirectExchange(INGESTION_EXCHANGE);
    }

    @Bean
    public Binding batchUploadedBinding() {
        return BindingBuilder.bind(batchUploadedQueue()).to(ingestionExchange()).with(BATCH_UPLOADED_ROUTING_KEY);
    }

    @Bean
    public Binding batchUploadedDlqBinding() {
        return BindingBuilder.bind(batchUploadedDlq()).to(ingestionExchange()).with(DLQ_ROUTING_KEY);
    }
}
