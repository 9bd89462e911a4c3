package io.kneo.iptv.service.exceptions;

import lombok.Getter;

@Getter
public class SourceFetchException extends RuntimeException {
    private final String sourceUrl;

    public SourceFetchException(String sourceUrl, String msg) {
        super(msg);
        this.sourceUrl = sourceUrl;
    }

    public SourceFetchException(String sourceUrl, Throwable failure) {
        super("Failed to fetch " + sourceUrl + ": " + failure.getMessage(), failure);
        this.sourceUrl = sourceUrl;
    }
}
