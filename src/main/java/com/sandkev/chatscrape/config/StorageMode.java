package com.sandkev.chatscrape.config;

public enum StorageMode {
    /** cursor files under the data dir, records as JSON lines on stdout */
    FILE,
    /** scraper_state and messages tables */
    DATABASE
}
