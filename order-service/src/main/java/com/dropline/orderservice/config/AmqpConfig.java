package com.dropline.orderservice.config;

import com.fasterxml.jackson.databind.ObjectMapper;
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

    // outbound: durable event log relay
    public static final String ORDER_EXCHANGE = "order_events_exchange";
    public static final String ROUTING_KEY_ORDER_CREATED = "order.created";
    public static final String ROUTING_KEY_STATUS_CHANGED = "order.status_changed";
    public static final String ROUTING_KEY_AGENT_ASSIGNED = "order.agent_assigned";
    public static final String ROUTING_KEY_CHAT_MESSAGE = "order.chat_message";

    // inbound: dispatcher decisions
    public static final String DISPATCH_EXCHANGE = "dispatch_events_exchange";
    public static final String Q_AGENT_ASSIGNED = "q.order.agent.assigned";
    public static final String ROUTING_KEY_DISPATCH_AGENT_ASSIGNED = "dispatch.agent_assigned";

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
    public TopicExchange orderEventsExchange() {
        return new TopicExchange(ORDER_EXCHANGE);
    }

    @Bean
    public TopicExchange dispatchEventsExchange() {
        return new TopicExchange(DISPATCH_EXCHANGE);
    }

    @Bean
    public MessageConverter jsonMessageConverter(ObjectMapper objectMapper) {
        return new Jackson2JsonMessageConverter(objectMapper);
    }

    @Bean
    public Queue agentAssignedQueue() {
        return createDurableQueue(Q_AGENT_ASSIGNED);
    }

    @Bean
    public Binding agentAssignedBinding(Queue agentAssignedQueue, TopicExchange dispatchEventsExchange) {
        return BindingBuilder.bind(agentAssignedQueue).to(dispatchEventsExchange)
                .with(ROUTING_KEY_DISPATCH_AGENT_ASSIGNED);
    }

    private Queue createDurableQueue(String queueName) {
        return QueueBuilder.durable(queueName)
                .withArgument("x-dead-letter-exchange", DLX_NAME)
                .withArgument("x-dead-letter-routing-key", DLQ_ROUTING_KEY)
                .build();
    }
}
