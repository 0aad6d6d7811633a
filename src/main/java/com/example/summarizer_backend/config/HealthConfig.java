package com.example.summarizer_backend.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class HealthConfig {

    @Bean
    public HealthIndicator ffmpegHealth(ComposeProperties props) {
        return () -> {
            String bin = props.getFfmpegBinary();
            try {
                var p = new ProcessBuilder(bin, "-version").redirectErrorStream(true).start();
                p.getInputStream().transferTo(java.io.OutputStream.nullOutputStream());
                if (p.waitFor(5, TimeUnit.SECONDS) && p.exitValue() == 0) {
                    return Health.up().withDetail("ffmpeg", bin).build();
                }
                p.destroyForcibly();
                return Health.down().withDetail("ffmpeg", bin + " exited abnormally").build();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Health.down(e).withDetail("ffmpeg", bin).build();
            } catch (Exception e) {
                return Health.down(e).withDetail("ffmpeg", "missing").build();
            }
        };
    }

    @Bean
    public HealthIndicator embeddingServerHealth(@Qualifier("embeddingWebClient") WebClient client) {
        return () -> {
            try {
                client.get().uri("/health")
                        .retrieve()
                        .toBodilessEntity()
                        .block(Duration.ofSeconds(2));
                return Health.up().withDetail("embeddingServer", "ok").build();
            } catch (Exception e) {
                return Health.down(e).withDetail("embeddingServer", "unreachable").build();
            }
        };
    }
}
