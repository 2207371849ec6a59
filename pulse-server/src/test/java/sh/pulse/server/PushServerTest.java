// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.server;

import static org.junit.jupiter.api.Assertions.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import sh.pulse.core.mux.DomainEvent;
import sh.pulse.core.mux.StreamCatalog;
import sh.pulse.core.stream.EventBroadcaster;
import sh.pulse.core.stream.EventSources;

/**
 * End-to-end tests against a server bound to an ephemeral loopback port, using
 * the JDK WebSocket client.
 */
class PushServerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final EventBroadcaster<Integer> ticks = new EventBroadcaster<>();
    private final List<String> domainEvents = Collections.synchronizedList(new ArrayList<>());
    private final CountDownLatch connectionClosed = new CountDownLatch(1);
    private final HttpClient httpClient = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(5))
            .build();

    private PushServer server;

    @BeforeEach
    void setUp() {
        StreamCatalog catalog = StreamCatalog.builder()
                .register("motd", (offset, connection, sessionId) -> EventSources.of("welcome", "to", "pulse"))
                .register("ticks", (offset, connection, sessionId) -> ticks)
                .build();
        PushServerConfig config = PushServerConfig.builder()
                .host("127.0.0.1")
                .port(0)
                .path("/push")
                .deliveryThreads(2)
                .build();

        server = PushServer.builder(config)
                .catalog(catalog)
                .eventSink((event, meta) -> {
                    domainEvents.add(event.type());
                    if (event.type().equals(DomainEvent.CONNECTION_CLOSED)) {
                        connectionClosed.countDown();
                    }
                })
                .start();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private URI uri(String scheme, String path) {
        return URI.create(scheme + "://127.0.0.1:" + server.port() + path);
    }

    private static final class QueueListener implements WebSocket.Listener {
        final BlockingQueue<String> messages = new LinkedBlockingQueue<>();
        private final StringBuilder partial = new StringBuilder();

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                messages.add(partial.toString());
                partial.setLength(0);
            }
            webSocket.request(1);
            return null;
        }
    }

    private JsonNode next(QueueListener listener) throws Exception {
        String message = listener.messages.poll(5, TimeUnit.SECONDS);
        assertNotNull(message, "timed out waiting for an envelope");
        return mapper.readTree(message);
    }

    private WebSocket connect(QueueListener listener) throws Exception {
        return httpClient.newWebSocketBuilder()
                .buildAsync(uri("ws", "/push"), listener)
                .get(5, TimeUnit.SECONDS);
    }

    @Test
    void testBindsEphemeralPort() {
        assertTrue(server.port() > 0);
        assertEquals(0, server.config().port());
    }

    @Test
    void testSubscribeReceivesBatchAndCompletion() throws Exception {
        QueueListener listener = new QueueListener();
        WebSocket ws = connect(listener);

        ws.sendText("{\"type\":\"hello\",\"sessionId\":\"s1\"}", true).get(5, TimeUnit.SECONDS);
        ws.sendText("{\"type\":\"subscribe\",\"subscriptionId\":1,\"name\":\"motd\",\"offset\":0}", true)
                .get(5, TimeUnit.SECONDS);

        assertEquals(mapper.readTree("{\"type\":\"events\",\"subscriptionId\":1,\"batch\":[\"welcome\",\"to\",\"pulse\"]}"),
                next(listener));
        assertEquals(mapper.readTree("{\"type\":\"complete\",\"subscriptionId\":1}"), next(listener));

        ws.sendClose(WebSocket.NORMAL_CLOSURE, "bye").get(5, TimeUnit.SECONDS);
        assertTrue(connectionClosed.await(5, TimeUnit.SECONDS));
        assertEquals(List.of(DomainEvent.CONNECTION_OPEN, DomainEvent.CONNECTION_CLOSED), domainEvents);
    }

    @Test
    void testUnknownStreamGetsNotFoundError() throws Exception {
        QueueListener listener = new QueueListener();
        WebSocket ws = connect(listener);

        ws.sendText("{\"type\":\"subscribe\",\"subscriptionId\":7,\"name\":\"nope\",\"offset\":0}", true)
                .get(5, TimeUnit.SECONDS);

        assertEquals(mapper.readTree(
                "{\"type\":\"error\",\"subscriptionId\":7,\"error\":{\"code\":404,\"message\":\"Not found\"}}"),
                next(listener));
        ws.abort();
    }

    @Test
    void testLiveStreamDeliversPublishedItems() throws Exception {
        QueueListener listener = new QueueListener();
        WebSocket ws = connect(listener);

        ws.sendText("{\"type\":\"subscribe\",\"subscriptionId\":2,\"name\":\"ticks\",\"offset\":0}", true)
                .get(5, TimeUnit.SECONDS);
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (ticks.observerCount() == 0 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(1, ticks.observerCount());

        ticks.publish(1);
        ticks.publish(2);
        ticks.complete();

        List<Integer> received = new ArrayList<>();
        JsonNode envelope;
        while ((envelope = next(listener)).get("type").asText().equals("events")) {
            assertEquals(2, envelope.get("subscriptionId").asInt());
            envelope.get("batch").forEach(item -> received.add(item.asInt()));
        }
        assertEquals("complete", envelope.get("type").asText());
        assertEquals(List.of(1, 2), received);
        ws.abort();
    }

    @Test
    void testPlainHttpRequestToOtherPathIsNotFound() throws Exception {
        HttpResponse<String> response = httpClient.send(
                HttpRequest.newBuilder(uri("http", "/elsewhere")).GET().timeout(Duration.ofSeconds(5)).build(),
                HttpResponse.BodyHandlers.ofString());

        assertEquals(404, response.statusCode());
        assertEquals("Not found", response.body());
    }

    @Test
    void testCloseIsIdempotent() {
        server.close();
        server.close();
    }

    @Test
    void testBindFailureIsReported() {
        PushServerConfig taken = PushServerConfig.builder().host("127.0.0.1").port(server.port()).build();

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> PushServer.builder(taken).start());
        assertTrue(ex.getMessage().contains(String.valueOf(server.port())));
    }
}
