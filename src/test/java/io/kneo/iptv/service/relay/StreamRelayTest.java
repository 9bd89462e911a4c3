package io.kneo.iptv.service.relay;

import io.kneo.iptv.config.RelayConfig;
import io.vertx.core.Future;
import io.vertx.core.MultiMap;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ServerSocket;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class StreamRelayTest {

    private static final int VIDEO_LENGTH = 1000;
    private static final String USER_AGENT = "RelayTestAgent/1.0";

    private Vertx vertx;
    private StreamRelay relay;
    private HttpClient client;
    private int originPort;
    private int relayPort;
    private final AtomicReference<MultiMap> originHeaders = new AtomicReference<>();
    private final CountDownLatch originReleased = new CountDownLatch(1);

    private record Result(int status, MultiMap headers, Buffer body) {
    }

    @BeforeEach
    void setUp() throws Exception {
        vertx = Vertx.vertx();

        RelayConfig config = mock(RelayConfig.class);
        when(config.isEnabled()).thenReturn(true);
        when(config.getMaxRedirects()).thenReturn(5);
        when(config.getConnectTimeout()).thenReturn(Duration.ofSeconds(2));
        when(config.getIdleTimeout()).thenReturn(Duration.ofSeconds(1));
        when(config.getUserAgents()).thenReturn(List.of(USER_AGENT));

        relay = new StreamRelay(vertx, config);
        relay.init();

        HttpServer origin = await(vertx.createHttpServer().requestHandler(this::handleOrigin).listen(0));
        originPort = origin.actualPort();
        HttpServer front = await(vertx.createHttpServer()
                .requestHandler(request -> relay.relay(request.getParam("url"), request))
                .listen(0));
        relayPort = front.actualPort();
        client = vertx.createHttpClient();
    }

    @AfterEach
    void tearDown() throws Exception {
        relay.shutdown();
        await(vertx.close());
    }

    @Test
    void forwardsRangeAndPassesPartialContent() throws Exception {
        Result result = call(HttpMethod.GET, originUrl("/video.mp4"), Map.of("Range", "bytes=100-"));

        assertEquals(206, result.status());
        assertEquals("bytes 100-999/1000", result.headers().get("Content-Range"));
        assertEquals("bytes", result.headers().get("Accept-Ranges"));
        assertEquals("video/mp4", result.headers().get("Content-Type"));
        assertEquals(900, result.body().length());
        assertEquals("bytes=100-", originHeaders.get().get("Range"));
    }

    @Test
    void substitutesBrowserHeaders() throws Exception {
        call(HttpMethod.GET, originUrl("/video.mp4"), Map.of("User-Agent", "SomePlayer/2.0"));

        MultiMap seen = originHeaders.get();
        assertEquals(USER_AGENT, seen.get("User-Agent"));
        assertEquals("http://localhost:" + originPort + "/", seen.get("Referer"));
        assertEquals("http://localhost:" + originPort, seen.get("Origin"));
    }

    @Test
    void headRequestReturnsHeadersOnly() throws Exception {
        Result result = call(HttpMethod.HEAD, originUrl("/video.mp4"), Map.of());

        assertEquals(200, result.status());
        assertEquals(String.valueOf(VIDEO_LENGTH), result.headers().get("Content-Length"));
        assertEquals(0, result.body().length());
    }

    @Test
    void followsFiveRedirects() throws Exception {
        Result result = call(HttpMethod.GET, originUrl("/hop/5"), Map.of());

        assertEquals(200, result.status());
        assertEquals("done", result.body().toString());
    }

    @Test
    void sixRedirectsAreTooMany() throws Exception {
        Result result = call(HttpMethod.GET, originUrl("/hop/6"), Map.of());

        assertEquals(502, result.status());
        assertEquals("Stream origin redirected too many times", result.body().toJsonObject().getString("error"));
    }

    @Test
    void passesOriginErrorStatus() throws Exception {
        Result result = call(HttpMethod.GET, originUrl("/missing"), Map.of());

        assertEquals(404, result.status());
    }

    @Test
    void guessesMissingContentType() throws Exception {
        Result result = call(HttpMethod.GET, originUrl("/live/index.m3u8"), Map.of());

        assertEquals(200, result.status());
        assertEquals("application/vnd.apple.mpegurl", result.headers().get("Content-Type"));
        assertEquals("*", result.headers().get("Access-Control-Allow-Origin"));
    }

    @Test
    void unreachableOriginIsBadGateway() throws Exception {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }

        Result result = call(HttpMethod.GET, "http://localhost:" + closedPort + "/video.mp4", Map.of());

        assertEquals(502, result.status());
        JsonObject body = result.body().toJsonObject();
        assertEquals("Stream origin unreachable", body.getString("error"));
    }

    @Test
    void silentOriginTimesOut() throws Exception {
        Result result = call(HttpMethod.GET, originUrl("/silent"), Map.of());

        assertEquals(504, result.status());
    }

    @Test
    void clientDisconnectReleasesOriginConnection() throws Exception {
        String uri = "/proxy?url=" + URLEncoder.encode(originUrl("/endless.ts"), StandardCharsets.UTF_8);
        CountDownLatch firstChunk = new CountDownLatch(1);

        int status = await(client.request(HttpMethod.GET, relayPort, "localhost", uri)
                .compose(request -> request.send())
                .map(response -> {
                    response.handler(chunk -> {
                        if (firstChunk.getCount() > 0) {
                            firstChunk.countDown();
                            response.request().connection().close();
                        }
                    });
                    return response.statusCode();
                }));

        assertEquals(200, status);
        assertTrue(firstChunk.await(5, TimeUnit.SECONDS));
        assertTrue(originReleased.await(5, TimeUnit.SECONDS));
    }

    @Test
    void rejectsNonHttpOrigin() throws Exception {
        Result result = call(HttpMethod.GET, "ftp://files.example.com/video.mp4", Map.of());

        assertEquals(400, result.status());
        assertNull(originHeaders.get());
    }

    @Test
    void parsesOnlyHttpOrigins() {
        assertEquals("example.com", StreamRelay.parseOrigin("https://example.com/a.ts").getHost());
        assertTrue(isRejected("rtmp://example.com/live"));
        assertTrue(isRejected("not a url"));
        assertTrue(isRejected(""));
    }

    private void handleOrigin(HttpServerRequest request) {
        originHeaders.set(MultiMap.caseInsensitiveMultiMap().addAll(request.headers()));
        String path = request.path();
        if (path.equals("/video.mp4")) {
            serveVideo(request);
        } else if (path.startsWith("/hop/")) {
            int remaining = Integer.parseInt(path.substring("/hop/".length()));
            if (remaining > 0) {
                request.response().setStatusCode(302).putHeader("Location", "/hop/" + (remaining - 1)).end();
            } else {
                request.response().putHeader("Content-Type", "text/plain").end("done");
            }
        } else if (path.equals("/live/index.m3u8")) {
            request.response().end("#EXTM3U\n");
        } else if (path.equals("/endless.ts")) {
            request.connection().closeHandler(v -> originReleased.countDown());
            request.response().setChunked(true).putHeader("Content-Type", "video/mp2t");
            vertx.setPeriodic(50, timerId -> {
                if (request.response().closed()) {
                    vertx.cancelTimer(timerId);
                } else {
                    request.response().write(Buffer.buffer(new byte[188]));
                }
            });
        } else if (path.equals("/silent")) {
            request.response().setChunked(true);
        } else {
            request.response().setStatusCode(404).end();
        }
    }

    private void serveVideo(HttpServerRequest request) {
        Buffer video = Buffer.buffer(new byte[VIDEO_LENGTH]);
        String range = request.getHeader("Range");
        request.response().putHeader("Content-Type", "video/mp4").putHeader("Accept-Ranges", "bytes");
        if (range != null && range.startsWith("bytes=")) {
            int from = Integer.parseInt(range.substring("bytes=".length(), range.indexOf('-')));
            request.response()
                    .setStatusCode(206)
                    .putHeader("Content-Range", "bytes " + from + "-" + (VIDEO_LENGTH - 1) + "/" + VIDEO_LENGTH)
                    .end(video.getBuffer(from, VIDEO_LENGTH));
        } else if (request.method() == HttpMethod.HEAD) {
            request.response().putHeader("Content-Length", String.valueOf(VIDEO_LENGTH)).end();
        } else {
            request.response().end(video);
        }
    }

    private Result call(HttpMethod method, String originUrl, Map<String, String> headers) throws Exception {
        String uri = "/proxy?url=" + URLEncoder.encode(originUrl, StandardCharsets.UTF_8);
        return await(client.request(method, relayPort, "localhost", uri)
                .compose(request -> {
                    headers.forEach(request::putHeader);
                    return request.send();
                })
                .compose(response -> response.body()
                        .map(body -> new Result(response.statusCode(), response.headers(), body))));
    }

    private String originUrl(String path) {
        return "http://localhost:" + originPort + path;
    }

    private static boolean isRejected(String url) {
        try {
            StreamRelay.parseOrigin(url);
            return false;
        } catch (RuntimeException e) {
            return true;
        }
    }

    private static <T> T await(Future<T> future) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
    }
}
