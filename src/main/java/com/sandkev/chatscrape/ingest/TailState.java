package com.sandkev.chatscrape.ingest;

public enum TailState {
    INACTIVE,
    ACTIVE,
    STOPPED
}
