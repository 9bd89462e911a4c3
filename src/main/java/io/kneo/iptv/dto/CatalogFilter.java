package io.kneo.iptv.dto;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class CatalogFilter {
    private final String category;
    private final String searchText;
    private final boolean favoritesOnly;
    private final int skip;
    private final Integer limit;

    public static CatalogFilter all() {
        return CatalogFilter.builder().build();
    }

    public boolean hasCategory() {
        return category != null && !category.isBlank();
    }

    public boolean hasSearchText() {
        return searchText != null && !searchText.isBlank();
    }
}
