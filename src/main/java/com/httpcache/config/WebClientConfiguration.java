package com.httpcache.config;

import com.httpcache.service.HttpCacheFilter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * WebClient configuration: every request made through this client passes the cache.
 */
@Configuration
public class WebClientConfiguration {

    private final HttpCacheProperties properties;

    public WebClientConfiguration(HttpCacheProperties properties) {
        this.properties = properties;
    }

    @Bean
    public WebClient cachingWebClient(HttpCacheFilter httpCacheFilter) {
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(properties.getClient().getResponseTimeout());

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .filter(httpCacheFilter)
                .build();
    }
}
