package io.kneo.iptv.model;

public record Channel(String id,
                      String name,
                      String artworkUrl,
                      String category,
                      String originUrl,
                      String guideId,
                      String tvgName,
                      String country,
                      String language) {
}
