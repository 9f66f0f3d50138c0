package com.sandkev.chatscrape.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandkev.chatscrape.sink.RecordJson;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;

@Configuration
@EnableConfigurationProperties(ScraperProperties.class)
public class ScraperConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    RecordJson recordJson(ObjectMapper objectMapper) {
        return new RecordJson(objectMapper);
    }

    /** Data channel: record lines and dialog listings only. Logging goes to stderr. */
    @Bean("dataOut")
    @Qualifier("dataOut")
    PrintStream dataOut() {
        return new PrintStream(new FileOutputStream(FileDescriptor.out), true, StandardCharsets.UTF_8);
    }
}
