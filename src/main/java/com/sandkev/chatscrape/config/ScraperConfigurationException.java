package com.sandkev.chatscrape.config;

public class ScraperConfigurationException extends RuntimeException {

    public ScraperConfigurationException(String message) {
        super(message);
    }
}
