package com.stockalert.monitor.application.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/** One RestClient per upstream, each with bounded connect and read timeouts. */
@Configuration
public class ProviderConfig {

    @Bean
    public RestClient moexRestClient(RestClient.Builder builder, MonitorProperties properties) {
        return builder.clone()
                .baseUrl(properties.providers().moex().baseUrl())
                .requestFactory(requestFactory(properties))
                .build();
    }

    @Bean
    public RestClient yahooRestClient(RestClient.Builder builder, MonitorProperties properties) {
        var yahoo = properties.providers().yahoo();
        return builder.clone()
                .baseUrl(yahoo.baseUrl())
                .defaultHeader(HttpHeaders.USER_AGENT, yahoo.userAgent())
                .requestFactory(requestFactory(properties))
                .build();
    }

    @Bean
    public RestClient twelveDataRestClient(RestClient.Builder builder, MonitorProperties properties) {
        return builder.clone()
                .baseUrl(properties.providers().twelveData().baseUrl())
                .requestFactory(requestFactory(properties))
                .build();
    }

    private SimpleClientHttpRequestFactory requestFactory(MonitorProperties properties) {
        var factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(properties.providers().connectTimeout());
        factory.setReadTimeout(properties.providers().readTimeout());
        return factory;
    }
}
