package com.dropline.orderservice.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the order event stream endpoint.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "dropline.realtime")
public class RealtimeProperties {

    private String endpointPath = "/ws";

    private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

    // a session that cannot take a frame within this time is closed
    private Duration sendTimeLimit = Duration.ofSeconds(10);

    private int sendBufferSizeLimit = 512 * 1024;
}
