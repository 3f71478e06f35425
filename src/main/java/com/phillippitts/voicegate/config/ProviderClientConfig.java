package com.phillippitts.voicegate.config;

import com.phillippitts.voicegate.config.properties.ProviderProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Process-wide clients shared by the session pipeline: the provider HTTP client and the clock.
 * One instance each, injected through constructors so tests can substitute fakes.
 */
@Configuration
public class ProviderClientConfig {

    @Bean
    @Qualifier("providerRestTemplate")
    public RestTemplate providerRestTemplate(RestTemplateBuilder builder, ProviderProperties props) {
        return builder
                .rootUri(props.getBaseUrl())
                .setConnectTimeout(Duration.ofMillis(props.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(props.getReadTimeoutMs()))
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
