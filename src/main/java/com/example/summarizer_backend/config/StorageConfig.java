package com.example.summarizer_backend.config;

import com.example.summarizer_backend.service.Interfaces.StorageService;
import com.example.summarizer_backend.service.LocalStorageService;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@EnableConfigurationProperties(StorageProperties.class)
@Configuration
public class StorageConfig {

    @Bean
    public StorageService storageService(StorageProperties properties) {
        Path base = Path.of(properties.getBaseDir());
        var svc = new LocalStorageService(base, properties.getRawPrefix(), properties.getOutPrefix());
        LoggerFactory.getLogger(StorageConfig.class)
                .info("Storage wired: base={}, rawPrefix={}, outPrefix={}, summaries={}",
                        base, properties.getRawPrefix(), properties.getOutPrefix(), properties.getSummaryPrefix());
        return svc;
    }
}
