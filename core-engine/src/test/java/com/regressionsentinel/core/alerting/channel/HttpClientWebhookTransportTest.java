package com.regressionsentinel.core.alerting.channel;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link HttpClientWebhookTransport} against a local HTTP server.
 */
class HttpClientWebhookTransportTest {

    private HttpServer server;
    private final List<String> bodies = new CopyOnWriteArrayList<>();
    private final List<String> contentTypes = new CopyOnWriteArrayList<>();
    private final AtomicInteger requests = new AtomicInteger();
    private volatile int[] statuses = {200};

    private final HttpClientWebhookTransport transport = new HttpClientWebhookTransport();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/hook", exchange -> {
            int index = requests.getAndIncrement();
            try (InputStream in = exchange.getRequestBody()) {
                bodies.add(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            }
            contentTypes.add(exchange.getRequestHeaders().getFirst("Content-Type"));
            int status = statuses[Math.min(index, statuses.length - 1)];
            exchange.sendResponseHeaders(status, -1);
            exchange.close();
        });
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    @DisplayName("Should POST the payload as JSON")
    void shouldPostJson() {
        transport.post(url(), Map.of("severity", "major"));

        assertThat(requests.get()).isEqualTo(1);
        assertThat(bodies).containsExactly("{\"severity\":\"major\"}");
        assertThat(contentTypes).containsExactly("application/json");
    }

    @Test
    @DisplayName("Should retry once after HTTP 429")
    void shouldRetryOnceWhenRateLimited() {
        statuses = new int[]{429, 204};

        transport.post(url(), Map.of("a", 1));

        assertThat(requests.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should fail when the retry after HTTP 429 is rate limited too")
    void shouldFailWhenStillRateLimited() {
        statuses = new int[]{429, 429};

        assertThatThrownBy(() -> transport.post(url(), Map.of("a", 1)))
                .isInstanceOf(AlertDeliveryException.class)
                .hasMessageStartingWith("HTTP 429");
        assertThat(requests.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should fail on HTTP 4xx/5xx without retrying")
    void shouldFailOnErrorStatus() {
        statuses = new int[]{500};

        assertThatThrownBy(() -> transport.post(url(), Map.of("a", 1)))
                .isInstanceOf(AlertDeliveryException.class)
                .hasMessage("HTTP 500 from " + url());
        assertThat(requests.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject a malformed URL")
    void shouldRejectMalformedUrl() {
        assertThatThrownBy(() -> transport.post("not a url", Map.of()))
                .isInstanceOf(AlertDeliveryException.class)
                .hasMessageContaining("Invalid webhook URL");
    }

    private String url() {
        return "http://127.0.0.1:" + server.getAddress().getPort() + "/hook";
    }
}
