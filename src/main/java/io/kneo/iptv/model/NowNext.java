package io.kneo.iptv.model;

import java.util.Optional;

public record NowNext(Optional<Programme> current, Optional<Programme> next) {
    private static final NowNext NONE = new NowNext(Optional.empty(), Optional.empty());

    public static NowNext none() {
        return NONE;
    }
}
