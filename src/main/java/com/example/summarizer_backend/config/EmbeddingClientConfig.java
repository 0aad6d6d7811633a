package com.example.summarizer_backend.config;

import com.example.summarizer_backend.engine.ClipServerEmbeddingModel;
import com.example.summarizer_backend.engine.Interfaces.EmbeddingModel;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
@EnableConfigurationProperties(EmbeddingProperties.class)
public class EmbeddingClientConfig {

    @Bean("embeddingWebClient")
    public WebClient embeddingWebClient(EmbeddingProperties props) {
        var to = Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds()));
        int toSec = (int) to.getSeconds();

        // a batch of base64 frames plus the vectors that come back exceed the ~256KB default
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(c -> c.defaultCodecs().maxInMemorySize(32 * 1024 * 1024))
                .build();

        HttpClient http = HttpClient.create()
                .responseTimeout(to)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 15_000)
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(toSec))
                        .addHandlerLast(new WriteTimeoutHandler(toSec)));

        return WebClient.builder()
                .baseUrl(props.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(http))
                .exchangeStrategies(strategies)
                .build();
    }

    /**
     * The process-wide model handle shared by all jobs.
     */
    @Bean
    public EmbeddingModel embeddingModel(@Qualifier("embeddingWebClient") WebClient client, EmbeddingProperties props) {
        return new ClipServerEmbeddingModel(client, props);
    }
}
