package com.sandkev.chatscrape.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandkev.chatscrape.source.HttpBridgeMessageSource;
import com.sandkev.chatscrape.source.MessageSource;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
public class SourceClientConfig {

    @Bean("sourceClient")
    @Qualifier("sourceClient")
    public WebClient sourceClient(ScraperProperties props) {
        HttpClient http = HttpClient.create()
                .responseTimeout(Duration.ofMillis(props.source().timeoutMs()))
                .compress(true);
        return builder(props.source(), http).build();
    }

    /** For the live event stream, which stays idle between messages; no response timeout. */
    @Bean("sourceStreamClient")
    @Qualifier("sourceStreamClient")
    public WebClient sourceStreamClient(ScraperProperties props) {
        return builder(props.source(), HttpClient.create()).build();
    }

    // "messageSource" is taken by the context's i18n bean
    @Bean
    public MessageSource chatMessageSource(@Qualifier("sourceClient") WebClient sourceClient,
                                       @Qualifier("sourceStreamClient") WebClient sourceStreamClient,
                                       ObjectMapper objectMapper,
                                       ScraperProperties props) {
        return new HttpBridgeMessageSource(sourceClient, sourceStreamClient, objectMapper, props.source().pageSize());
    }

    private static WebClient.Builder builder(ScraperProperties.Source p, HttpClient http) {
        var builder = WebClient.builder()
                .baseUrl(p.baseUrl())
                .defaultHeader("X-Api-Id", p.apiId())
                .defaultHeader("X-Api-Hash", p.apiHash())
                .clientConnector(new ReactorClientHttpConnector(http));
        if (StringUtils.hasText(p.session())) {
            builder.defaultHeader("X-Session", p.session());
        }
        return builder;
    }
}
