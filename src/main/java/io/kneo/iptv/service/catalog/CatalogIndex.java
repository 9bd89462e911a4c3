package io.kneo.iptv.service.catalog;

import io.kneo.iptv.model.CatalogSnapshot;
import io.kneo.iptv.model.Channel;
import io.kneo.iptv.model.GuideData;
import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holder of the published catalog snapshot. Readers take {@link #current()} and work against
 * that instance; publishing swaps the whole reference, so a reader never sees channels of one
 * refresh mixed with programmes of another.
 */
@ApplicationScoped
public class CatalogIndex {
    private static final Logger LOGGER = LoggerFactory.getLogger(CatalogIndex.class);

    private final AtomicReference<CatalogSnapshot> published = new AtomicReference<>(CatalogSnapshot.empty());

    public CatalogSnapshot current() {
        return published.get();
    }

    public CatalogSnapshot publishChannels(List<Channel> channels) {
        Instant now = Instant.now();
        CatalogSnapshot snapshot = published.updateAndGet(current -> current.withChannels(channels, now));
        LOGGER.info("Published catalog snapshot: {} channels in {} categories",
                snapshot.getChannels().size(), snapshot.getCategories().size());
        return snapshot;
    }

    public CatalogSnapshot publishGuide(GuideData guide) {
        Instant now = Instant.now();
        CatalogSnapshot snapshot = published.updateAndGet(current -> current.withGuide(guide, now));
        LOGGER.info("Published guide snapshot: {} guide channels", guide.channelCount());
        return snapshot;
    }
}
