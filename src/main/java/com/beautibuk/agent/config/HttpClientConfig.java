package com.beautibuk.agent.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * One pooled Apache HttpClient shared by every outbound adapter
 * (completion provider, embedding provider, tool server).
 *
 * Consumers must {@code clone()} the builder before customizing it.
 * Connect and response timeouts here are the per-call timeouts that feed the retry policy;
 * the orchestrator's turn budget sits on top of them.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Bean("pooledRestClientBuilder")
    public RestClient.Builder pooledRestClientBuilder(AgentProperties agentProperties) {
        AgentProperties.Http http = agentProperties.getHttp();

        PoolingHttpClientConnectionManager connectionManager =
                PoolingHttpClientConnectionManagerBuilder.create()
                        .setMaxConnTotal(http.getMaxConnections())
                        .setMaxConnPerRoute(http.getMaxConnectionsPerRoute())
                        .setDefaultConnectionConfig(ConnectionConfig.custom()
                                .setConnectTimeout(Timeout.ofMilliseconds(http.getConnectTimeout().toMillis()))
                                .build())
                        .build();

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.ofMilliseconds(http.getResponseTimeout().toMillis()))
                        .build())
                .build();

        log.info("HttpClient pool configured [maxConnections={}, connectTimeout={}, responseTimeout={}]",
                http.getMaxConnections(), http.getConnectTimeout(), http.getResponseTimeout());

        return RestClient.builder()
                .requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
    }
}
