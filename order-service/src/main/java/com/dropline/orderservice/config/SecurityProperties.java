package com.dropline.orderservice.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "dropline.security")
public class SecurityProperties {

    // key under resource_access holding this application's roles
    private String clientId = "dropline-backend";

    private String vendorIdClaim = "vendor_id";
}
