package io.kneo.iptv.service.source;

import io.kneo.iptv.service.exceptions.SourceFetchException;
import io.smallrye.mutiny.Uni;
import io.vertx.ext.web.client.WebClientOptions;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.ext.web.client.WebClient;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Plain GET of a playlist or guide document.
 */
@ApplicationScoped
public class FeedFetcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(FeedFetcher.class);
    private static final String USER_AGENT = "Mozilla/5.0 (compatible; kneo-iptv)";
    private static final int MAX_FEED_REDIRECTS = 5;

    @Inject
    Vertx vertx;

    private WebClient webClient;

    @PostConstruct
    void init() {
        WebClientOptions options = new WebClientOptions()
                .setUserAgent(USER_AGENT)
                .setFollowRedirects(true);
        options.setMaxRedirects(MAX_FEED_REDIRECTS);
        options.setTryUseCompression(true);
        this.webClient = WebClient.create(vertx, options);
    }

    @PreDestroy
    void shutdown() {
        if (webClient != null) {
            webClient.close();
        }
    }

    public Uni<String> fetch(String url, Duration timeout) {
        LOGGER.debug("Fetching feed {}", url);
        return webClient.getAbs(url)
                .timeout(timeout.toMillis())
                .send()
                .onItem().transform(response -> {
                    if (response.statusCode() < 200 || response.statusCode() >= 300) {
                        throw new SourceFetchException(url, "HTTP " + response.statusCode() + " - " + response.statusMessage());
                    }
                    String body = response.bodyAsString();
                    return body == null ? "" : body;
                })
                .onFailure(failure -> !(failure instanceof SourceFetchException))
                .transform(failure -> new SourceFetchException(url, failure));
    }
}
