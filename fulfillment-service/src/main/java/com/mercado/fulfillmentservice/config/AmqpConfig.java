package com.mercado.fulfillmentservice.config;

import org.springframework.amqp.core.*;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AmqpConfig {

    public static final String DLX_NAME = "dlx";
    public static final String DLQ_NAME = "q.dlq";
    public static final String DLQ_ROUTING_KEY = "dlq";

    public static final String FULFILLMENT_EXCHANGE = "fulfillment_events_exchange";

    // inbox of the notification dispatcher; it consumes everything we publish
    public static final String Q_NOTIFICATIONS = "q.notification.fulfillment.events";

    public static final String ROUTING_KEY_ORDER_ALL = "order.#";
    public static final String ROUTING_KEY_RESERVATION_ALL = "reservation.#";

    @Bean
    public TopicExchange deadLetterExchange() {
        return new TopicExchange(DLX_NAME);
    }

    @Bean
    public Queue deadLetterQueue() {
        return new Queue(DLQ_NAME);
    }

    @Bean
    public Binding deadLetterBinding() {
        return BindingBuilder.bind(deadLetterQueue()).to(deadLetterExchange()).with("#");
    }

    @Bean
    public TopicExchange fulfillmentEventsExchange() {
        return new TopicExchange(FULFILLMENT_EXCHANGE);
    }

    @Bean
    public MessageConverter jsonMessageConverter() {
        return new Jackson2JsonMessageConverter();
    }

    @Bean
    public Queue notificationQueue() {
        return createDurableQueue(Q_NOTIFICATIONS);
    }

    @Bean
    public Binding orderNotificationBinding(Queue notificationQueue, TopicExchange fulfillmentEventsExchange) {
        return BindingBuilder.bind(notificationQueue).to(fulfillmentEventsExchange).with(ROUTING_KEY_ORDER_ALL);
    }

    @Bean
    public Binding reservationNotificationBinding(Queue notificationQueue, TopicExchange fulfillmentEventsExchange) {
        return BindingBuilder.bind(notificationQueue).to(fulfillmentEventsExchange).with(ROUTING_KEY_RESERVATION_ALL);
    }

    private Queue createDurableQueue(String queueName) {
        return QueueBuilder.durable(queueName)
                .withArgument("x-dead-letter-exchange", DLX_NAME)
                .withArgument("x-dead-letter-routing-key", DLQ_ROUTING_KEY)
                .build();
    }
}
