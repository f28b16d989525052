package com.github.passthrough.backend.config;

import com.github.passthrough.backend.config.properties.PassthroughProperties;
import com.github.passthrough.backend.config.properties.ProviderProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.http.impl.client.DefaultRedirectStrategy;
import org.apache.http.impl.client.HttpClientBuilder;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.util.Optional;

@Slf4j
@Configuration
public class RestConfig {
    static final String DEFAULT_USER_AGENT = "debrid-passthrough";

    @Bean
    @Qualifier("catalogRestTemplate")
    public RestTemplate catalogRestTemplate(RestTemplateBuilder builder, PassthroughProperties properties) {
        return providerTemplate(builder, properties.getCatalog())
                .build();
    }

    @Bean
    @Qualifier("aggregatorRestTemplate")
    public RestTemplate aggregatorRestTemplate(RestTemplateBuilder builder, PassthroughProperties properties) {
        return providerTemplate(builder, properties.getAggregator())
                .build();
    }

    @Bean
    @Qualifier("debridRestTemplate")
    public RestTemplate debridRestTemplate(RestTemplateBuilder builder, PassthroughProperties properties) {
        var debrid = properties.getDebrid();

        if (!debrid.isTokenConfigured()) {
            log.warn("No debrid API token has been configured, stream resolution will fail");
        }

        return builder
                .requestFactory(() -> requestFactory(DEFAULT_USER_AGENT))
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + StringUtils.defaultString(debrid.getToken()))
                .build();
    }

    private static RestTemplateBuilder providerTemplate(RestTemplateBuilder builder, ProviderProperties provider) {
        var userAgent = StringUtils.defaultIfBlank(provider.getUserAgent(), DEFAULT_USER_AGENT);
        var result = builder
                .requestFactory(() -> requestFactory(userAgent))
                .defaultHeader(HttpHeaders.USER_AGENT, userAgent);

        return Optional.ofNullable(provider.getTimeout())
                .map(e -> result
                        .setConnectTimeout(e)
                        .setReadTimeout(e))
                .orElse(result);
    }

    private static HttpComponentsClientHttpRequestFactory requestFactory(String userAgent) {
        return new HttpComponentsClientHttpRequestFactory(HttpClientBuilder.create()
                .setRedirectStrategy(new DefaultRedirectStrategy())
                .setUserAgent(userAgent)
                .build());
    }
}
