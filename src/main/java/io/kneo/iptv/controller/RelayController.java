package io.kneo.iptv.controller;

import io.kneo.iptv.config.RelayConfig;
import io.kneo.iptv.service.relay.RelayHeaders;
import io.kneo.iptv.service.relay.StreamRelay;
import io.kneo.iptv.util.ProblemDetailsUtil;
import io.vertx.core.http.HttpMethod;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@ApplicationScoped
public class RelayController {
    private static final Logger LOGGER = LoggerFactory.getLogger(RelayController.class);
    private static final String PATH = "/proxy";

    private final StreamRelay relay;
    private final RelayConfig config;

    @Inject
    public RelayController(StreamRelay relay, RelayConfig config) {
        this.relay = relay;
        this.config = config;
    }

    public void setupRoutes(Router router) {
        if (!config.isEnabled()) {
            LOGGER.info("Stream relay disabled, {} not registered", PATH);
            return;
        }
        router.route(HttpMethod.OPTIONS, PATH).handler(this::preflight);
        router.route(HttpMethod.GET, PATH).handler(this::relay);
        router.route(HttpMethod.HEAD, PATH).handler(this::relay);
    }

    private void preflight(RoutingContext rc) {
        rc.response()
                .setStatusCode(204)
                .putHeader("Access-Control-Allow-Origin", "*")
                .putHeader("Access-Control-Allow-Methods", "GET, HEAD, OPTIONS")
                .putHeader("Access-Control-Allow-Headers", "Range, Accept, If-Range")
                .putHeader("Access-Control-Expose-Headers", RelayHeaders.EXPOSED_HEADERS)
                .putHeader("Access-Control-Max-Age", "86400")
                .end();
    }

    private void relay(RoutingContext rc) {
        String url = rc.request().getParam("url");
        if (url == null || url.isBlank()) {
            ProblemDetailsUtil.respondBadRequest(rc, "Query parameter 'url' is required");
            return;
        }
        relay.relay(url, rc.request())
                .onFailure(failure -> LOGGER.debug("Relay request for {} ended with {}", url, failure.getMessage()));
    }
}
