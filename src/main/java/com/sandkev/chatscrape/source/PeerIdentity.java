package com.sandkev.chatscrape.source;

public record PeerIdentity(long peerId, String target, String title) {

    public String displayName() {
        return title == null || title.isBlank() ? target : title;
    }
}
