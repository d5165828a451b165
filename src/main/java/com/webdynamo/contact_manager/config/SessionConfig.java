package com.webdynamo.contact_manager.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "app.session")
@Data
public class SessionConfig {

    /**
     * How long a login token stays valid
     */
    private Duration ttl = Duration.ofDays(30);
}
