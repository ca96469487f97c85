package com.dropline.orderservice.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "dropline.outbox")
public class OutboxProperties {

    private boolean enabled = true;

    private String exchange = AmqpConfig.ORDER_EXCHANGE;

    // processed rows older than this are purged by the nightly cleanup
    private Duration retention = Duration.ofDays(1);
}
