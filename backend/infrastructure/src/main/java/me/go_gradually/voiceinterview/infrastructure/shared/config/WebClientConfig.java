package me.go_gradually.voiceinterview.infrastructure.shared.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;

@Configuration
public class WebClientConfig {
    @Bean("backendWebClient")
    public WebClient backendWebClient(AppProperties properties) {
        AppProperties.Backend backend = properties.getBackend();
        ConnectionProvider provider = createConnectionProvider(backend);
        HttpClient httpClient = HttpClient.create(provider)
                .responseTimeout(Duration.ofMillis(backend.getResponseTimeoutMs()));
        return WebClient.builder()
                .baseUrl(backend.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(createExchangeStrategies(backend.getMaxInMemoryBytes()))
                .build();
    }

    private ConnectionProvider createConnectionProvider(AppProperties.Backend backend) {
        return ConnectionProvider.builder("voiceinterview-backend")
                .maxConnections(backend.getMaxConnections())
                .pendingAcquireTimeout(Duration.ofMillis(backend.getPendingAcquireTimeoutMs()))
                .build();
    }

    private ExchangeStrategies createExchangeStrategies(int maxInMemoryBytes) {
        return ExchangeStrategies.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(maxInMemoryBytes))
                .build();
    }
}
