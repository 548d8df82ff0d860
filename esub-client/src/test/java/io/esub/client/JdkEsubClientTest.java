package io.esub.client;

import io.esub.core.EsubConfig;
import io.esub.core.EsubException;
import io.esub.core.Protocol;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdkEsubClientTest {

    private MockWebServer server;
    private EsubClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        client = EsubClient.builder().config(configFor(server).token("env-token").build()).build();
    }

    @AfterEach
    void tearDown() throws Exception {
        client.close();
        server.shutdown();
    }

    @Test
    void subReturnsBodyAndSendsToken() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("hello"));

        byte[] body = client.sub(new SubRequest("orders", "t1", null, Duration.ofSeconds(5)));

        assertThat(new String(body, StandardCharsets.UTF_8)).isEqualTo("hello");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("GET");
        assertThat(request.getPath()).isEqualTo("/sub/orders?token=t1");
        assertThat(request.getHeader(Protocol.H_USER_AGENT)).isEqualTo(Protocol.USER_AGENT);
    }

    @Test
    void subFallsBackToConfiguredToken() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("v"));

        client.sub(SubRequest.of("orders"));

        assertThat(server.takeRequest().getPath()).isEqualTo("/sub/orders?token=env-token");
    }

    @Test
    void repPostsBodyWithPsubFlag() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200));

        client.rep(new RepRequest("orders", "payload".getBytes(StandardCharsets.UTF_8), "t1", null, null, true));

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/rep/orders?psub=1&token=t1");
        assertThat(request.getBody().readUtf8()).isEqualTo("payload");
    }

    @Test
    void errorStatusRaisesRequestFailed() {
        server.enqueue(new MockResponse().setResponseCode(404));

        assertThatThrownBy(() -> client.sub(SubRequest.of("missing")))
                .isInstanceOfSatisfying(EsubException.RequestFailed.class, e -> {
                    assertThat(e.status()).isEqualTo(404);
                    assertThat(e.url().getPath()).isEqualTo("/sub/missing");
                });
    }

    @Test
    void slowReplyRaisesTimeout() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("late")
                .setHeadersDelay(2, TimeUnit.SECONDS));

        assertThatThrownBy(() -> client.sub(new SubRequest("orders", null, null, Duration.ofMillis(200))))
                .isInstanceOf(EsubException.Timeout.class);
    }

    @Test
    void droppedConnectionIsRetried() throws Exception {
        try (EsubClient retrying = EsubClient.builder().config(configFor(server).retries(2).build()).build()) {
            server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));
            server.enqueue(new MockResponse().setResponseCode(200).setBody("second"));

            byte[] body = retrying.sub(SubRequest.of("orders"));

            assertThat(new String(body, StandardCharsets.UTF_8)).isEqualTo("second");
        }
    }

    @Test
    void nodeIpIsCached() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"ip\":\"10.1.2.3\"}"));

        assertThat(client.nodeIp()).isEqualTo("10.1.2.3");
        assertThat(client.nodeIp()).isEqualTo("10.1.2.3");

        assertThat(server.getRequestCount()).isEqualTo(1);
        assertThat(server.takeRequest().getPath()).isEqualTo("/info");
    }

    @Test
    void defaultPublishCallbackPrintsDataAndReply() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PublishCallback.printing(new PrintStream(buffer, true, StandardCharsets.UTF_8)).onConfirmed("a", "ok");

        assertThat(buffer.toString(StandardCharsets.UTF_8)).isEqualTo("'a': ok" + System.lineSeparator());
    }

    static EsubConfig.Builder configFor(MockWebServer server) {
        return EsubConfig.builder()
                .host(server.getHostName())
                .port(server.getPort());
    }
}
