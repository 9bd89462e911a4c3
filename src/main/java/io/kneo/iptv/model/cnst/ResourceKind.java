package io.kneo.iptv.model.cnst;

import java.util.Arrays;
import java.util.Optional;

public enum ResourceKind {
    CATALOG("catalog"),
    META("meta"),
    STREAM("stream");

    private final String pathSegment;

    ResourceKind(String pathSegment) {
        this.pathSegment = pathSegment;
    }

    public String getPathSegment() {
        return pathSegment;
    }

    public static Optional<ResourceKind> fromPathSegment(String segment) {
        return Arrays.stream(values())
                .filter(kind -> kind.pathSegment.equals(segment))
                .findFirst();
    }
}
