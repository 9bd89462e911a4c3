package io.kneo.iptv.model;

import java.time.Instant;

public record Programme(String guideId,
                        String title,
                        String description,
                        String category,
                        Instant start,
                        Instant stop) {

    public boolean isAiringAt(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(stop);
    }
}
