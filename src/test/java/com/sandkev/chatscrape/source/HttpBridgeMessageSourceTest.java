package com.sandkev.chatscrape.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.sandkev.chatscrape.ingest.CatchUpFetcher;
import com.sandkev.chatscrape.ingest.CatchUpResult;
import com.sandkev.chatscrape.normalize.MessageNormalizer;
import com.sandkev.chatscrape.testsupport.CapturingRecordSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpBridgeMessageSourceTest {

    private static final Instant SINCE = Instant.parse("2024-05-01T00:00:00Z");
    private static final PeerIdentity PEER = new PeerIdentity(-1001L, "mychat", "My Chat");

    private WireMockServer wm;
    private HttpBridgeMessageSource source;

    @BeforeEach
    void setUp() {
        wm = new WireMockServer(0);
        wm.start();
        WebClient client = WebClient.builder()
                .baseUrl("http://localhost:" + wm.port())
                .defaultHeader("X-Api-Id", "123")
                .build();
        source = new HttpBridgeMessageSource(client, client, new ObjectMapper(), 2);
    }

    @AfterEach
    void tearDown() {
        wm.stop();
    }

    @Test
    void resolvesTargetToPeer() {
        wm.stubFor(get(urlEqualTo("/v1/entities/mychat"))
                .willReturn(okJson("{\"peer_id\": -1001, \"title\": \"My Chat\"}")));

        PeerIdentity peer = source.resolve("mychat");

        assertThat(peer).isEqualTo(new PeerIdentity(-1001L, "mychat", "My Chat"));
        wm.verify(getRequestedFor(urlEqualTo("/v1/entities/mychat")).withHeader("X-Api-Id", equalTo("123")));
    }

    @Test
    void unknownTargetIsASourceError() {
        wm.stubFor(get(urlEqualTo("/v1/entities/nope"))
                .willReturn(aResponse().withStatus(404).withBody("{\"error\": \"not found\"}")));

        assertThatThrownBy(() -> source.resolve("nope"))
                .isInstanceOf(SourceException.class)
                .hasMessageContaining("404");
    }

    @Test
    void responseWithoutPeerIdIsRejected() {
        wm.stubFor(get(urlEqualTo("/v1/entities/odd")).willReturn(okJson("{\"title\": \"Odd\"}")));

        assertThatThrownBy(() -> source.resolve("odd")).isInstanceOf(SourceException.class);
    }

    @Test
    void pagesForwardFromMinId() {
        wm.stubFor(get(urlPathEqualTo("/v1/peers/-1001/messages")).withQueryParam("min_id", equalTo("4"))
                .willReturn(okJson("[{\"id\": 5, \"date\": \"2024-05-01T01:00:00Z\"}, {\"id\": 6, \"date\": \"2024-05-01T02:00:00Z\"}]")));
        wm.stubFor(get(urlPathEqualTo("/v1/peers/-1001/messages")).withQueryParam("min_id", equalTo("6"))
                .willReturn(okJson("[{\"id\": 9, \"date\": \"2024-05-01T03:00:00Z\"}]")));

        List<Long> ids;
        try (Stream<RawMessage> backlog = source.fetchMessagesSince(PEER, 4, SINCE)) {
            ids = backlog.map(RawMessage::id).toList();
        }

        assertThat(ids).containsExactly(5L, 6L, 9L);
        wm.verify(getRequestedFor(urlPathEqualTo("/v1/peers/-1001/messages"))
                .withQueryParam("offset_date", equalTo("2024-05-01T00:00:00Z"))
                .withQueryParam("limit", equalTo("2")));
        wm.verify(2, getRequestedFor(urlPathEqualTo("/v1/peers/-1001/messages")));
    }

    @Test
    void fetchIsLazy() {
        wm.stubFor(get(urlPathEqualTo("/v1/peers/-1001/messages"))
                .willReturn(okJson("[]")));

        try (Stream<RawMessage> ignored = source.fetchMessagesSince(PEER, 0, SINCE)) {
            wm.verify(0, getRequestedFor(urlPathEqualTo("/v1/peers/-1001/messages")));
        }
    }

    @Test
    void retriesRateLimitedPage() {
        wm.stubFor(get(urlPathEqualTo("/v1/peers/-1001/messages")).inScenario("limit")
                .whenScenarioStateIs("Started")
                .willReturn(aResponse().withStatus(429).withHeader("Retry-After", "0"))
                .willSetStateTo("open"));
        wm.stubFor(get(urlPathEqualTo("/v1/peers/-1001/messages")).inScenario("limit")
                .whenScenarioStateIs("open")
                .willReturn(okJson("[{\"id\": 1}]")));

        List<Long> ids;
        try (Stream<RawMessage> backlog = source.fetchMessagesSince(PEER, 0, SINCE)) {
            ids = backlog.map(RawMessage::id).toList();
        }

        assertThat(ids).containsExactly(1L);
    }

    @Test
    void serverErrorMidBacklogSurfacesAsSourceException() {
        wm.stubFor(get(urlPathEqualTo("/v1/peers/-1001/messages")).withQueryParam("min_id", equalTo("0"))
                .willReturn(okJson("[{\"id\": 1}, {\"id\": 2}]")));
        wm.stubFor(get(urlPathEqualTo("/v1/peers/-1001/messages")).withQueryParam("min_id", equalTo("2"))
                .willReturn(aResponse().withStatus(500)));

        List<Long> seen = new ArrayList<>();
        assertThatThrownBy(() -> {
            try (Stream<RawMessage> backlog = source.fetchMessagesSince(PEER, 0, SINCE)) {
                backlog.forEach(m -> seen.add(m.id()));
            }
        }).isInstanceOf(SourceException.class).hasMessageContaining("500");
        assertThat(seen).containsExactly(1L, 2L);
    }

    @Test
    void oversizedRetryAfterStillRetriesThePage() {
        wm.stubFor(get(urlPathEqualTo("/v1/peers/-1001/messages")).inScenario("limit")
                .whenScenarioStateIs("Started")
                .willReturn(aResponse().withStatus(429).withHeader("Retry-After", "99999999999999999999"))
                .willSetStateTo("open"));
        wm.stubFor(get(urlPathEqualTo("/v1/peers/-1001/messages")).inScenario("limit")
                .whenScenarioStateIs("open")
                .willReturn(okJson("[{\"id\": 1}]")));

        List<Long> ids;
        try (Stream<RawMessage> backlog = source.fetchMessagesSince(PEER, 0, SINCE)) {
            ids = backlog.map(RawMessage::id).toList();
        }

        assertThat(ids).containsExactly(1L);
    }

    @Test
    void unreadablePageEndsCatchUpWithPartialProgress() {
        wm.stubFor(get(urlPathEqualTo("/v1/peers/-1001/messages")).withQueryParam("min_id", equalTo("0"))
                .willReturn(okJson("[{\"id\": 1}, {\"id\": 2}]")));
        wm.stubFor(get(urlPathEqualTo("/v1/peers/-1001/messages")).withQueryParam("min_id", equalTo("2"))
                .willReturn(aResponse().withHeader("Content-Type", "application/json").withBody("[{\"id\": 3,")));
        var sink = new CapturingRecordSink();

        CatchUpResult result = new CatchUpFetcher(source, new MessageNormalizer(), sink).fetch(PEER, 0, SINCE);

        assertThat(result.outcome()).isEqualTo(CatchUpResult.Outcome.FETCH_FAILED);
        assertThat(result.maxId()).isEqualTo(2);
        assertThat(result.count()).isEqualTo(2);
        assertThat(sink.writtenIds()).containsExactly(1L, 2L);
    }

    @Test
    void nonArrayPageIsRejected() {
        wm.stubFor(get(urlPathEqualTo("/v1/peers/-1001/messages")).willReturn(okJson("{\"messages\": []}")));

        assertThatThrownBy(() -> {
            try (Stream<RawMessage> backlog = source.fetchMessagesSince(PEER, 0, SINCE)) {
                backlog.count();
            }
        }).isInstanceOf(SourceException.class);
    }

    @Test
    void liveEventsArriveThroughTheSubscription() throws Exception {
        wm.stubFor(get(urlEqualTo("/v1/peers/-1001/updates"))
                .willReturn(aResponse()
                        .withHeader("Content-Type", "text/event-stream")
                        .withBody("""
                                event: message
                                data: {"id": 10, "date": "2024-05-01T05:00:00Z"}

                                event: ping
                                data: {}

                                data: not json

                                event: message
                                data: {"id": 11, "date": "2024-05-01T05:00:01Z"}

                                """)));

        List<Long> ids = new ArrayList<>();
        try (MessageSubscription sub = source.subscribeNewMessages(PEER)) {
            Optional<RawMessage> next;
            while ((next = sub.next()).isPresent()) {
                ids.add(next.get().id());
            }
        }

        assertThat(ids).containsExactly(10L, 11L);
    }

    @Test
    void listsDialogs() {
        wm.stubFor(get(urlEqualTo("/v1/dialogs")).willReturn(okJson("""
                [{"title": "Alice", "id": 42, "username": "alice", "type": "User", "peer_id": 42,
                  "is_self": false, "is_bot": false, "deleted": false, "extra": "ignored",
                  "input_peer": {"type": "InputPeerUser", "user_id": 42, "access_hash": 99}},
                 {"title": null, "id": 7, "type": "Channel", "peer_id": -1007, "broadcast": true}]
                """)));

        List<DialogInfo> dialogs = source.listDialogs();

        assertThat(dialogs).hasSize(2);
        assertThat(dialogs.get(0).inputPeer()).containsEntry("type", "InputPeerUser");
        assertThat(dialogs.get(1).title()).isEqualTo("NoTitle");
        assertThat(dialogs.get(1).broadcast()).isTrue();
        assertThat(dialogs.get(1).inputPeer()).isEmpty();
    }
}
