package io.kneo.iptv.service.catalog;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory favorites. Lost on restart.
 */
@ApplicationScoped
public class FavoritesService {
    private static final Logger LOGGER = LoggerFactory.getLogger(FavoritesService.class);

    private final Set<String> favorites = ConcurrentHashMap.newKeySet();

    public boolean add(String channelId) {
        boolean added = favorites.add(channelId);
        LOGGER.debug("Favorite {} added: {}", channelId, added);
        return added;
    }

    public boolean remove(String channelId) {
        return favorites.remove(channelId);
    }

    public boolean contains(String channelId) {
        return favorites.contains(channelId);
    }

    public Set<String> getAll() {
        return Set.copyOf(favorites);
    }
}
