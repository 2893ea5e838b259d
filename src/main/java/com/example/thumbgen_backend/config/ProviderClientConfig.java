package com.example.thumbgen_backend.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import io.netty.resolver.DefaultAddressResolverGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.HttpProtocol;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * WebClients for the image provider and the LLM endpoint.
 */
@Configuration
@EnableConfigurationProperties({ReplicateProperties.class, LlmProperties.class})
public class ProviderClientConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProviderClientConfig.class);
    private static final int MAX_CONNECTIONS = 20;
    private static final Duration PENDING_ACQUIRE_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration MAX_IDLE_TIME = Duration.ofSeconds(20);
    private static final Duration MAX_LIFE_TIME = Duration.ofMinutes(5);

    @Bean("replicateWebClient")
    WebClient replicateWebClient(ReplicateProperties props) {
        Duration timeout = Duration.ofSeconds(props.getResponseTimeoutSeconds());
        HttpClient httpClient = httpClient("replicate-http", props.getConnectTimeoutMillis(), timeout);
        LOGGER.info("Configuring Replicate WebClient baseUrl={} connect={}ms response={}s tokenConfigured={}",
                props.getBaseUrl(), props.getConnectTimeoutMillis(), timeout.toSeconds(), props.hasToken());

        WebClient.Builder builder = WebClient.builder()
                .baseUrl(props.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader("Accept", "application/json")
                .codecs(c -> c.defaultCodecs().maxInMemorySize(16 * 1024 * 1024));
        if (props.hasToken()) {
            builder.defaultHeader("Authorization", "Token " + props.getApiToken().trim());
        }
        return builder.build();
    }

    @Bean("llmWebClient")
    WebClient llmWebClient(LlmProperties props) {
        Duration timeout = Duration.ofSeconds(props.getTimeoutSeconds());
        HttpClient httpClient = httpClient("llm-http", 10_000, timeout);
        LOGGER.info("Configuring LLM WebClient baseUrl={} model={} response={}s bypass={}",
                props.getBaseUrl(), props.getModel(), timeout.toSeconds(), props.isBypass());

        WebClient.Builder builder = WebClient.builder()
                .baseUrl(props.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader("Accept", "application/json");
        if (props.getApiKey() != null && !props.getApiKey().isBlank()) {
            builder.defaultHeader("Authorization", "Bearer " + props.getApiKey().trim());
        }
        return builder.build();
    }

    private static HttpClient httpClient(String poolName, int connectTimeoutMillis, Duration timeout) {
        ConnectionProvider provider = ConnectionProvider.builder(poolName)
                .maxConnections(MAX_CONNECTIONS)
                .pendingAcquireTimeout(PENDING_ACQUIRE_TIMEOUT)
                .maxIdleTime(MAX_IDLE_TIME)
                .maxLifeTime(MAX_LIFE_TIME)
                .build();

        return HttpClient.create(provider)
                .protocol(HttpProtocol.HTTP11)
                .responseTimeout(timeout)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMillis)
                .resolver(DefaultAddressResolverGroup.INSTANCE)
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeout.toSeconds(), TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeout.toSeconds(), TimeUnit.SECONDS))
                );
    }
}
