package com.acme.furfolio.eventlog.transport;

import com.acme.furfolio.eventlog.audit.EventRecord;
import com.acme.furfolio.eventlog.context.AuditContext;
import com.acme.furfolio.eventlog.recorder.DeliveryMode;
import com.acme.furfolio.eventlog.recorder.EventRecorder;
import com.acme.furfolio.eventlog.util.JsonCodec;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpAnalyticsDeliveryTest {

    private static EventRecord record() {
        return new EventRecord("id-1", 7L, Instant.parse("2026-03-01T10:15:30Z"), "sync_error",
            Map.of("error", "Critical failure"), "Owner", "staff-7", "CloudKitSyncEngine", true);
    }

    @Test
    void shouldPostRecordAsJsonWithStaticHeaders() throws Exception {
        try (CapturingHttpServer server = new CapturingHttpServer(200);
             HttpAnalyticsDelivery delivery = new HttpAnalyticsDelivery(
                 server.uri("/v1/events"),
                 Map.of("Authorization", "Bearer t0k"),
                 8,
                 1_000
             )) {
            delivery.deliver(record());

            CapturedRequest request = server.requests.poll(3, TimeUnit.SECONDS);
            assertNotNull(request);
            assertEquals("POST /v1/events HTTP/1.1", request.requestLine());
            assertEquals("Bearer t0k", request.headers().get("authorization"));
            assertTrue(request.headers().get("content-type").startsWith("application/json"));

            JsonNode body = JsonCodec.readTree(request.body());
            assertEquals("id-1", body.get("id").asText());
            assertEquals(7L, body.get("sequence").asLong());
            assertEquals("sync_error", body.get("name").asText());
            assertEquals("Critical failure", body.get("metadata").get("error").asText());
            assertEquals("staff-7", body.get("staffID").asText());
            assertTrue(body.get("escalate").asBoolean());
        }
    }

    @Test
    void shouldFailOnNonSuccessStatus() throws Exception {
        try (CapturingHttpServer server = new CapturingHttpServer(500);
             HttpAnalyticsDelivery delivery = new HttpAnalyticsDelivery(server.uri("/v1/events"), Map.of(), 8, 1_000)) {
            IllegalStateException error = assertThrows(IllegalStateException.class, () -> delivery.deliver(record()));
            assertTrue(error.getMessage().contains("500"));
        }
    }

    @Test
    void shouldTimeoutAgainstHangingEndpoint() throws Exception {
        try (HangingHttpServer server = new HangingHttpServer();
             HttpAnalyticsDelivery delivery = new HttpAnalyticsDelivery(server.uri("/v1/events"), Map.of(), 1, 150)) {
            Throwable first = waitFailure(delivery.deliverAsync(record()));
            assertInstanceOf(TimeoutException.class, first);

            Throwable second = waitFailure(delivery.deliverAsync(record()));
            assertInstanceOf(TimeoutException.class, second);
        }
    }

    @Test
    void shouldRejectDeliveryBeyondInFlightCap() throws Exception {
        try (HangingHttpServer server = new HangingHttpServer();
             HttpAnalyticsDelivery delivery = new HttpAnalyticsDelivery(server.uri("/v1/events"), Map.of(), 1, 2_000)) {
            CompletableFuture<Integer> first = delivery.deliverAsync(record());
            CompletableFuture<Integer> second = delivery.deliverAsync(record());

            Throwable failure = waitFailure(second);
            assertInstanceOf(IllegalStateException.class, failure);
            assertTrue(failure.getMessage().contains("too many in-flight deliveries"));
            assertFalse(first.isDone(), "first delivery should still be waiting for the response");

            assertInstanceOf(TimeoutException.class, waitFailure(first));
        }
    }

    @Test
    void shouldFailFastOnConnectFailure() throws Exception {
        URI target = URI.create("http://127.0.0.1:" + freePort() + "/v1/events");
        try (HttpAnalyticsDelivery delivery = new HttpAnalyticsDelivery(target, Map.of(), 8, 300)) {
            Throwable failure = waitFailure(delivery.deliverAsync(record()));
            assertTrue(failure instanceof ConnectException || failure.getClass().getSimpleName().contains("Connect"),
                "Expected connect failure, got: " + failure);
        }
    }

    @Test
    void recorderShouldCountRemoteFailuresWithoutLosingEvents() throws Exception {
        try (CapturingHttpServer server = new CapturingHttpServer(503);
             HttpAnalyticsDelivery delivery = new HttpAnalyticsDelivery(server.uri("/v1/events"), Map.of(), 8, 1_000);
             EventRecorder recorder = EventRecorder.builder(AuditContext.create("CloudKitSyncEngine"))
                 .delivery(delivery)
                 .deliveryMode(DeliveryMode.INLINE)
                 .build()) {
            recorder.record("sync_started");
            recorder.record("sync_error", Map.of("error", "critical"));

            assertEquals(2, recorder.snapshot().size());
            assertEquals(2L, recorder.metrics().deliveryFailures());
            assertEquals(0L, recorder.metrics().delivered());
        }
    }

    private static Throwable waitFailure(Future<?> future) throws InterruptedException {
        ExecutionException error = assertThrows(ExecutionException.class, () -> future.get(3, TimeUnit.SECONDS));
        return error.getCause();
    }

    private static int freePort() throws Exception {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }

    private record CapturedRequest(String requestLine, Map<String, String> headers, String body) {
    }

    private static final class CapturingHttpServer implements AutoCloseable {
        private final ServerSocket serverSocket;
        private final ExecutorService acceptLoop;
        private final int statusCode;
        private final BlockingQueue<CapturedRequest> requests = new LinkedBlockingQueue<>();

        private CapturingHttpServer(int statusCode) throws IOException {
            this.serverSocket = new ServerSocket(0);
            this.acceptLoop = Executors.newSingleThreadExecutor();
            this.statusCode = statusCode;
            this.acceptLoop.submit(this::serveForever);
        }

        private void serveForever() {
            while (!serverSocket.isClosed()) {
                try (Socket socket = serverSocket.accept()) {
                    socket.setSoTimeout(2_000);
                    InputStream in = socket.getInputStream();
                    OutputStream out = socket.getOutputStream();
                    String head = readHead(in);
                    String[] lines = head.split("\r\n");
                    Map<String, String> headers = new ConcurrentHashMap<>();
                    for (int i = 1; i < lines.length; i++) {
                        int colon = lines[i].indexOf(':');
                        if (colon > 0) {
                            headers.put(lines[i].substring(0, colon).trim().toLowerCase(Locale.ROOT),
                                lines[i].substring(colon + 1).trim());
                        }
                    }
                    int length = Integer.parseInt(headers.getOrDefault("content-length", "0"));
                    byte[] body = in.readNBytes(length);
                    requests.add(new CapturedRequest(lines[0], headers, new String(body, StandardCharsets.UTF_8)));
                    String resp = "HTTP/1.1 " + statusCode + " X\r\n"
                        + "Content-Length: 0\r\n"
                        + "Connection: close\r\n"
                        + "\r\n";
                    out.write(resp.getBytes(StandardCharsets.US_ASCII));
                    out.flush();
                } catch (IOException ignored) {
                    if (serverSocket.isClosed()) {
                        return;
                    }
                }
            }
        }

        private static String readHead(InputStream in) throws IOException {
            ByteArrayOutputStream head = new ByteArrayOutputStream();
            int prev3 = -1, prev2 = -1, prev1 = -1;
            while (true) {
                int b = in.read();
                if (b == -1) {
                    break;
                }
                if (prev3 == '\r' && prev2 == '\n' && prev1 == '\r' && b == '\n') {
                    break;
                }
                head.write(b);
                prev3 = prev2;
                prev2 = prev1;
                prev1 = b;
            }
            return head.toString(StandardCharsets.US_ASCII).trim();
        }

        private URI uri(String path) {
            return URI.create("http://127.0.0.1:" + serverSocket.getLocalPort() + path);
        }

        @Override
        public void close() throws Exception {
            serverSocket.close();
            acceptLoop.shutdownNow();
            acceptLoop.awaitTermination(2, TimeUnit.SECONDS);
        }
    }

    private static final class HangingHttpServer implements AutoCloseable {
        private final ServerSocket serverSocket;
        private final ExecutorService acceptLoop;
        private final Set<Socket> sockets = ConcurrentHashMap.newKeySet();

        private HangingHttpServer() throws IOException {
            this.serverSocket = new ServerSocket(0);
            this.acceptLoop = Executors.newSingleThreadExecutor();
            this.acceptLoop.submit(this::acceptForever);
        }

        private void acceptForever() {
            while (!serverSocket.isClosed()) {
                try {
                    sockets.add(serverSocket.accept());
                } catch (IOException ignored) {
                    if (serverSocket.isClosed()) {
                        return;
                    }
                }
            }
        }

        private URI uri(String path) {
            return URI.create("http://127.0.0.1:" + serverSocket.getLocalPort() + path);
        }

        @Override
        public void close() throws Exception {
            for (Socket socket : sockets) {
                socket.close();
            }
            serverSocket.close();
            acceptLoop.shutdownNow();
            acceptLoop.awaitTermination(2, TimeUnit.SECONDS);
        }
    }
}
