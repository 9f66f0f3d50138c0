package com.sandkev.chatscrape.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DialogInfo(
        String title,
        Long id,
        String username,
        String type,
        @JsonProperty("peer_id") Long peerId,
        @JsonProperty("is_self") boolean self,
        @JsonProperty("is_bot") boolean bot,
        boolean deleted,
        @JsonProperty("participants_count") Integer participantsCount,
        Boolean megagroup,
        Boolean broadcast,
        @JsonProperty("input_peer") Map<String, Object> inputPeer
) {

    public DialogInfo {
        title = title == null || title.isBlank() ? "NoTitle" : title;
        inputPeer = inputPeer == null ? Map.of() : inputPeer;
    }
}
