package com.libraryindex.agent.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * One pooled Apache HttpClient behind every outbound RestClient
 * (LLM providers, arXiv metadata, PDF downloads).
 *
 * Pool size must cover maxWorkers analyses plus the orchestrator's own calls,
 * otherwise workers queue on connection lease instead of on the worker pool.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Bean
    public RestClient.Builder restClientBuilder(ResearchProperties properties) {
        ResearchProperties.Http http = properties.getHttp();

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(
                        PoolingHttpClientConnectionManagerBuilder.create()
                                .setMaxConnTotal(http.getMaxConnections())
                                .setMaxConnPerRoute(http.getMaxConnections())
                                .setDefaultConnectionConfig(ConnectionConfig.custom()
                                        .setConnectTimeout(Timeout.ofMilliseconds(http.getConnectTimeout().toMillis()))
                                        .setSocketTimeout(Timeout.ofMilliseconds(http.getResponseTimeout().toMillis()))
                                        .build())
                                .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.ofMilliseconds(http.getResponseTimeout().toMillis()))
                        .build())
                .build();

        log.info("HttpClient configured [maxConnections={}, connectTimeout={}, responseTimeout={}]",
                http.getMaxConnections(), http.getConnectTimeout(), http.getResponseTimeout());
        return RestClient.builder().requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
    }
}
