package io.kneo.iptv.model.cnst;

import lombok.Getter;

@Getter
public enum FeedState {
    UNLOADED("Never loaded"),
    LOADED("Loaded"),
    STALE("Loaded, refresh pending or failed");

    private final String description;

    FeedState(String description) {
        this.description = description;
    }

    public boolean hasData() {
        return this != UNLOADED;
    }
}
