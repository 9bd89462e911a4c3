package io.kneo.iptv.service.catalog;

import io.kneo.iptv.model.CatalogSnapshot;
import io.kneo.iptv.model.Channel;
import io.kneo.iptv.model.NowNext;
import io.kneo.iptv.model.Programme;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@ApplicationScoped
public class NowNextResolver {

    private final CatalogIndex index;

    @Inject
    public NowNextResolver(CatalogIndex index) {
        this.index = index;
    }

    public NowNext resolve(String guideId, Instant asOf) {
        return resolve(index.current(), guideId, asOf);
    }

    public NowNext resolve(CatalogSnapshot snapshot, String guideId, Instant asOf) {
        return resolve(snapshot.getGuide().programmesFor(guideId), asOf);
    }

    public NowNext resolve(CatalogSnapshot snapshot, Channel channel, Instant asOf) {
        return resolve(snapshot.programmesFor(channel), asOf);
    }

    /**
     * Current is the first entry whose [start, stop) holds {@code asOf}, next is the entry after it
     * in list order. Without a current entry, next is the first entry starting after {@code asOf}.
     * Expects {@code programmes} sorted by start.
     */
    public static NowNext resolve(List<Programme> programmes, Instant asOf) {
        if (programmes == null || programmes.isEmpty()) {
            return NowNext.none();
        }
        for (int i = 0; i < programmes.size(); i++) {
            Programme programme = programmes.get(i);
            if (programme.isAiringAt(asOf)) {
                Optional<Programme> next = i + 1 < programmes.size()
                        ? Optional.of(programmes.get(i + 1))
                        : Optional.empty();
                return new NowNext(Optional.of(programme), next);
            }
        }
        for (Programme programme : programmes) {
            if (programme.start().isAfter(asOf)) {
                return new NowNext(Optional.empty(), Optional.of(programme));
            }
        }
        return NowNext.none();
    }
}
