package com.sandkev.chatscrape.config;

public enum ListFormat {
    TEXT,
    JSON
}
