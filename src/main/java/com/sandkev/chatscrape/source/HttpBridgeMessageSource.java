package com.sandkev.chatscrape.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandkev.chatscrape.shared.http.HttpRetrySupport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Disposable;
import reactor.core.Disposables;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * {@link MessageSource} backed by a JSON/HTTP bridge that holds the chat session.
 * Backlog pages are pulled on demand; live messages arrive as server-sent events.
 */
@Slf4j
public class HttpBridgeMessageSource implements MessageSource {

    static final String ENTITY_PATH = "/v1/entities/{target}";
    static final String MESSAGES_PATH = "/v1/peers/{peerId}/messages";
    static final String UPDATES_PATH = "/v1/peers/{peerId}/updates";
    static final String DIALOGS_PATH = "/v1/dialogs";

    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<List<DialogInfo>> DIALOGS_TYPE =
            new ParameterizedTypeReference<>() {};

    private final WebClient client;
    private final WebClient streamClient;
    private final ObjectMapper mapper;
    private final int pageSize;

    public HttpBridgeMessageSource(WebClient client, WebClient streamClient, ObjectMapper mapper, int pageSize) {
        this.client = client;
        this.streamClient = streamClient;
        this.mapper = mapper;
        this.pageSize = pageSize;
    }

    @Override
    public PeerIdentity resolve(String target) {
        JsonNode body = call(ENTITY_PATH, () -> client.get()
                .uri(ENTITY_PATH, target)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block());
        JsonNode peerId = body == null ? null : body.get("peer_id");
        if (peerId == null || !peerId.canConvertToLong()) {
            throw new SourceException("Bridge returned no peer_id for target " + target);
        }
        return new PeerIdentity(peerId.asLong(), target, body.path("title").asText(null));
    }

    @Override
    public Stream<RawMessage> fetchMessagesSince(PeerIdentity peer, long minId, Instant since) {
        Iterator<RawMessage> pages = new PageIterator(peer.peerId(), minId, since);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(pages, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    @Override
    public MessageSubscription subscribeNewMessages(PeerIdentity peer) {
        Disposable.Swap upstream = Disposables.swap();
        QueueMessageSubscription subscription = new QueueMessageSubscription(upstream::dispose);

        upstream.update(streamClient.get()
                .uri(UPDATES_PATH, peer.peerId())
                .accept(MediaType.TEXT_EVENT_STREAM)
                .retrieve()
                .bodyToFlux(SSE_TYPE)
                .filter(e -> e.data() != null && !e.data().isBlank())
                .filter(e -> e.event() == null || "message".equals(e.event()))
                .subscribe(
                        e -> parseEvent(e.data()).ifPresent(subscription::publish),
                        subscription::fail,
                        subscription::complete));

        log.info("Subscribed to live messages for peer {}", peer.peerId());
        return subscription;
    }

    @Override
    public List<DialogInfo> listDialogs() {
        List<DialogInfo> dialogs = call(DIALOGS_PATH, () -> client.get()
                .uri(DIALOGS_PATH)
                .retrieve()
                .bodyToMono(DIALOGS_TYPE)
                .block());
        return dialogs == null ? List.of() : dialogs;
    }

    private Optional<RawMessage> parseEvent(String data) {
        try {
            return Optional.of(RawMessage.of(mapper.readTree(data)));
        } catch (JsonProcessingException e) {
            log.warn("Dropping unreadable live event: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private static <T> T call(String path, Supplier<T> request) {
        try {
            return HttpRetrySupport.withRetry(path, request);
        } catch (WebClientResponseException e) {
            throw new SourceException("Bridge " + path + " error " + e.getStatusCode().value()
                    + ": " + e.getResponseBodyAsString(), e);
        } catch (WebClientException e) {
            throw new SourceException("Bridge " + path + " unreachable: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new SourceException("Bridge " + path + " failed: " + e, e);
        }
    }

    /** Walks the backlog page by page, advancing min_id to the last id seen. */
    private final class PageIterator implements Iterator<RawMessage> {
        private final long peerId;
        private final Instant since;
        private final Deque<RawMessage> buffer = new ArrayDeque<>();
        private long nextMinId;
        private boolean exhausted;

        PageIterator(long peerId, long minId, Instant since) {
            this.peerId = peerId;
            this.nextMinId = minId;
            this.since = since;
        }

        @Override
        public boolean hasNext() {
            while (buffer.isEmpty() && !exhausted) {
                fetchPage();
            }
            return !buffer.isEmpty();
        }

        @Override
        public RawMessage next() {
            if (!hasNext()) throw new NoSuchElementException();
            return buffer.poll();
        }

        private void fetchPage() {
            final long minId = nextMinId;
            JsonNode page = call(MESSAGES_PATH, () -> client.get()
                    .uri(uri -> uri.path(MESSAGES_PATH)
                            .queryParam("min_id", minId)
                            .queryParam("offset_date", since.toString())
                            .queryParam("limit", pageSize)
                            .build(peerId))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block());
            if (page == null || page.isNull()) {
                exhausted = true;
                return;
            }
            if (!page.isArray()) {
                throw new SourceException("Bridge " + MESSAGES_PATH + " returned " + page.getNodeType() + ", expected array");
            }

            long maxId = minId;
            for (JsonNode node : page) {
                RawMessage msg = RawMessage.of(node);
                buffer.add(msg);
                maxId = Math.max(maxId, msg.id());
            }
            log.debug("peer {} page after id {}: {} messages", peerId, minId, page.size());

            // a page that does not move min_id forward would repeat forever
            if (page.size() < pageSize || maxId <= minId) {
                exhausted = true;
            }
            nextMinId = maxId;
        }
    }
}
