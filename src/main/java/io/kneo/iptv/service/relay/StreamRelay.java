package io.kneo.iptv.service.relay;

import io.kneo.iptv.config.RelayConfig;
import io.kneo.iptv.service.exceptions.RelayUpstreamException;
import io.kneo.iptv.service.exceptions.RelayUpstreamException.ErrorType;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.HttpClientRequest;
import io.vertx.core.http.HttpClientResponse;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.http.RequestOptions;
import io.vertx.core.http.StreamResetException;
import io.vertx.core.json.JsonObject;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Pass-through proxy from a playback client to a live-stream origin. Each call is one
 * request/response cycle; the origin body is piped to the client with back-pressure.
 */
@ApplicationScoped
public class StreamRelay {
    private static final Logger LOGGER = LoggerFactory.getLogger(StreamRelay.class);
    private static final Set<Integer> REDIRECT_STATUSES = Set.of(301, 302, 303, 307, 308);

    private final Vertx vertx;
    private final RelayConfig config;
    private HttpClient client;

    @Inject
    public StreamRelay(Vertx vertx, RelayConfig config) {
        this.vertx = vertx;
        this.config = config;
    }

    @PostConstruct
    void init() {
        client = vertx.createHttpClient(new HttpClientOptions()
                .setConnectTimeout((int) config.getConnectTimeout().toMillis())
                .setKeepAlive(true));
    }

    @PreDestroy
    void shutdown() {
        if (client != null) {
            client.close();
        }
    }

    /**
     * Relays {@code inbound} to {@code originUrl} and writes the origin's answer to the inbound
     * request's response. Upstream failures are answered with 400/502/504 before the returned
     * future fails with a {@link RelayUpstreamException}.
     */
    public Future<Void> relay(String originUrl, HttpServerRequest inbound) {
        HttpServerResponse outbound = inbound.response();
        URI target;
        try {
            target = parseOrigin(originUrl);
        } catch (RelayUpstreamException e) {
            respondFailure(outbound, e);
            return Future.failedFuture(e);
        }

        AtomicReference<HttpClientRequest> current = new AtomicReference<>();
        outbound.closeHandler(v -> {
            HttpClientRequest request = current.get();
            if (request != null && request.reset()) {
                LOGGER.debug("Client left, origin request to {} reset", originUrl);
            }
        });

        String userAgent = pickUserAgent();
        return forward(target, inbound, userAgent, 0, current)
                .compose(response -> stream(response, outbound, inbound.method(), target))
                .recover(failure -> {
                    RelayUpstreamException upstream = toUpstreamFailure(failure);
                    LOGGER.warn("Relay to {} failed: {}", originUrl, upstream.getMessage());
                    respondFailure(outbound, upstream);
                    return Future.failedFuture(upstream);
                });
    }

    private Future<HttpClientResponse> forward(URI target, HttpServerRequest inbound, String userAgent,
                                               int redirects, AtomicReference<HttpClientRequest> current) {
        RequestOptions options = new RequestOptions()
                .setAbsoluteURI(target.toString())
                .setMethod(inbound.method())
                .setFollowRedirects(false)
                .setConnectTimeout(config.getConnectTimeout().toMillis())
                .setIdleTimeout(config.getIdleTimeout().toMillis());
        for (String name : RelayHeaders.FORWARDED_REQUEST_HEADERS) {
            String value = inbound.getHeader(name);
            if (value != null) {
                options.putHeader(name, value);
            }
        }
        for (Map.Entry<String, String> header : RelayHeaders.originRequestHeaders(target.toString(), userAgent).entrySet()) {
            if (!"Accept".equals(header.getKey()) || inbound.getHeader("Accept") == null) {
                options.putHeader(header.getKey(), header.getValue());
            }
        }
        options.putHeader("Accept-Encoding", "identity");

        return client.request(options)
                .compose(request -> {
                    current.set(request);
                    request.exceptionHandler(failure -> logOriginEnded(target, failure));
                    return request.send();
                })
                .compose(response -> {
                    String location = response.getHeader("Location");
                    if (!REDIRECT_STATUSES.contains(response.statusCode()) || location == null) {
                        return Future.succeededFuture(response);
                    }
                    if (redirects >= config.getMaxRedirects()) {
                        response.request().reset();
                        return Future.failedFuture(new RelayUpstreamException(ErrorType.TOO_MANY_REDIRECTS,
                                "Origin exceeded " + config.getMaxRedirects() + " redirects at " + target));
                    }
                    URI next;
                    try {
                        next = parseOrigin(target.resolve(location).toString());
                    } catch (IllegalArgumentException | RelayUpstreamException e) {
                        return Future.failedFuture(new RelayUpstreamException(ErrorType.ORIGIN_UNREACHABLE,
                                "Origin sent an invalid redirect: " + location));
                    }
                    LOGGER.debug("Origin {} redirected ({}) to {}", target, response.statusCode(), next);
                    return response.body().compose(ignored -> forward(next, inbound, userAgent, redirects + 1, current));
                });
    }

    private Future<Void> stream(HttpClientResponse response, HttpServerResponse outbound, HttpMethod method, URI target) {
        response.exceptionHandler(failure -> logOriginEnded(target, failure));
        if (outbound.closed()) {
            response.request().reset();
            return Future.succeededFuture();
        }
        outbound.setStatusCode(response.statusCode());
        for (String name : RelayHeaders.PASSED_RESPONSE_HEADERS) {
            String value = response.getHeader(name);
            if (value != null) {
                outbound.putHeader(name, value);
            }
        }
        if (response.getHeader("Content-Type") == null) {
            outbound.putHeader("Content-Type", RelayHeaders.guessContentType(target.getPath() == null ? "" : target.getPath()));
        }
        outbound.putHeader("Cache-Control", "no-cache, no-store, must-revalidate")
                .putHeader("Access-Control-Allow-Origin", "*")
                .putHeader("Access-Control-Expose-Headers", RelayHeaders.EXPOSED_HEADERS);

        if (method == HttpMethod.HEAD) {
            return response.end().compose(v -> outbound.end());
        }
        if (response.getHeader("Content-Length") == null) {
            outbound.setChunked(true);
        }
        return response.pipeTo(outbound)
                .recover(failure -> {
                    LOGGER.debug("Relay stream from {} interrupted: {}", target, failure.getMessage());
                    return Future.succeededFuture();
                });
    }

    private static void logOriginEnded(URI target, Throwable failure) {
        if (failure instanceof StreamResetException) {
            LOGGER.debug("Origin exchange with {} reset after client disconnect", target);
        } else {
            LOGGER.debug("Origin exchange with {} ended: {}", target, failure.getMessage());
        }
    }

    private void respondFailure(HttpServerResponse outbound, RelayUpstreamException failure) {
        if (outbound.closed() || outbound.headWritten()) {
            return;
        }
        JsonObject body = new JsonObject()
                .put("error", failure.getErrorType().getDefaultMessage())
                .put("details", failure.getMessage());
        outbound.setStatusCode(failure.getErrorType().getHttpStatus())
                .putHeader("Content-Type", "application/json")
                .putHeader("Access-Control-Allow-Origin", "*")
                .end(body.encode());
    }

    private String pickUserAgent() {
        List<String> agents = config.getUserAgents();
        if (agents == null || agents.isEmpty()) {
            return RelayHeaders.FALLBACK_USER_AGENT;
        }
        return agents.get(ThreadLocalRandom.current().nextInt(agents.size()));
    }

    static URI parseOrigin(String url) {
        if (url == null || url.isBlank()) {
            throw new RelayUpstreamException(ErrorType.BAD_ORIGIN_URL, "Missing origin URL");
        }
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!("http".equals(scheme) || "https".equals(scheme)) || uri.getHost() == null) {
                throw new RelayUpstreamException(ErrorType.BAD_ORIGIN_URL, "Not an http(s) origin: " + url);
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new RelayUpstreamException(ErrorType.BAD_ORIGIN_URL, "Malformed origin URL: " + url);
        }
    }

    private static RelayUpstreamException toUpstreamFailure(Throwable failure) {
        if (failure instanceof RelayUpstreamException upstream) {
            return upstream;
        }
        if (failure instanceof TimeoutException || failure.getClass().getSimpleName().contains("Timeout")) {
            return new RelayUpstreamException(ErrorType.TIMEOUT, failure);
        }
        return new RelayUpstreamException(ErrorType.ORIGIN_UNREACHABLE, failure);
    }
}
