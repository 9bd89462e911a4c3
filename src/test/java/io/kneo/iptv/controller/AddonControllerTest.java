package io.kneo.iptv.controller;

import io.kneo.iptv.model.Channel;
import io.kneo.iptv.model.GuideData;
import io.kneo.iptv.model.Programme;
import io.kneo.iptv.service.catalog.CatalogIndex;
import io.kneo.iptv.service.catalog.FavoritesService;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasItems;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;

@QuarkusTest
class AddonControllerTest {

    @Inject
    CatalogIndex index;

    @Inject
    FavoritesService favorites;

    @BeforeEach
    void publishCatalog() {
        index.publishChannels(List.of(
                channel(0, "News One", "News"),
                channel(1, "Sport One", "Sports"),
                channel(2, "News Two", "News"),
                channel(3, "Cartoons", "Kids Shows")));
        index.publishGuide(GuideData.empty());
        favorites.getAll().forEach(favorites::remove);
    }

    @Test
    void manifestListsCategoryCatalogs() {
        given()
                .when().get("/manifest.json")
                .then()
                .statusCode(200)
                .body("idPrefixes", hasItem("iptv:"))
                .body("resources", hasItems("catalog", "meta", "stream"))
                .body("catalogs.id", hasItems("iptv_News", "iptv_Sports", "iptv_Kids_Shows", "iptv_all", "iptv_favorites"));
    }

    @Test
    void categoryCatalogKeepsPlaylistOrder() {
        given()
                .when().get("/catalog/tv/iptv_News.json")
                .then()
                .statusCode(200)
                .body("metas", hasSize(2))
                .body("metas[0].name", equalTo("News One"))
                .body("metas[1].name", equalTo("News Two"))
                .body("metas[0].description", equalTo("Live TV - News"));
    }

    @Test
    void categoryWithSpacesResolves() {
        given()
                .when().get("/catalog/tv/iptv_Kids_Shows.json")
                .then()
                .statusCode(200)
                .body("metas.id", hasItem("iptv:3"));
    }

    @Test
    void allCatalogSearchesFromPathExtra() {
        given()
                .when().get("/catalog/tv/iptv_all/search=sport.json")
                .then()
                .statusCode(200)
                .body("metas", hasSize(1))
                .body("metas[0].id", equalTo("iptv:1"));
    }

    @Test
    void searchExtraIsDecodedOnce() {
        index.publishChannels(List.of(
                channel(0, "News One", "News"),
                channel(1, "100% Hits", "Music")));

        given()
                .urlEncodingEnabled(false)
                .when().get("/catalog/tv/iptv_all/search=100%25.json")
                .then()
                .statusCode(200)
                .body("metas", hasSize(1))
                .body("metas[0].name", equalTo("100% Hits"));
    }

    @Test
    void allCatalogReadsGenreFromQuery() {
        given()
                .queryParam("genre", "Sports")
                .when().get("/catalog/tv/iptv_all.json")
                .then()
                .statusCode(200)
                .body("metas", hasSize(1));
    }

    @Test
    void metaDescribesChannel() {
        given()
                .when().get("/meta/tv/iptv:2.json")
                .then()
                .statusCode(200)
                .body("meta.id", equalTo("iptv:2"))
                .body("meta.name", equalTo("News Two"))
                .body("meta.type", equalTo("tv"))
                .body("meta.genres", hasItem("News"));
    }

    @Test
    void metaCarriesCurrentAndNextProgramme() {
        Instant now = Instant.now();
        index.publishGuide(new GuideData(Map.of("g2", List.of(
                new Programme("g2", "Bulletin", "Top stories", "News", now.minus(Duration.ofMinutes(30)), now.plus(Duration.ofMinutes(30))),
                new Programme("g2", "Weather", null, null, now.plus(Duration.ofMinutes(30)), now.plus(Duration.ofMinutes(40))))),
                Map.of()));

        given()
                .when().get("/meta/tv/iptv:2.json")
                .then()
                .statusCode(200)
                .body("meta.current.title", equalTo("Bulletin"))
                .body("meta.current.description", equalTo("Top stories"))
                .body("meta.next.title", equalTo("Weather"))
                .body("meta.description", startsWith("Now: Bulletin"));
    }

    @Test
    void unknownChannelIsNotFound() {
        given()
                .when().get("/meta/tv/iptv:99.json")
                .then()
                .statusCode(404)
                .contentType(containsString("application/problem+json"));
    }

    @Test
    void unsupportedTypeIsNotFound() {
        given()
                .when().get("/meta/movie/iptv:0.json")
                .then()
                .statusCode(404);
    }

    @Test
    void streamPointsAtRelay() {
        given()
                .when().get("/stream/tv/iptv:0.json")
                .then()
                .statusCode(200)
                .body("streams", hasSize(1))
                .body("streams[0].title", equalTo("News One"))
                .body("streams[0].url", containsString("/proxy?url=http%3A%2F%2Fstreams.example.com%2F0.m3u8"))
                .body("streams[0].behaviorHints.notWebReady", equalTo(true));
    }

    @Test
    void favoritesCanBeAddedAndListed() {
        given()
                .when().get("/favorites/add/iptv:1")
                .then()
                .statusCode(200)
                .body("success", equalTo(true))
                .body("favorites", hasItem("iptv:1"));

        given()
                .when().get("/catalog/tv/iptv_favorites.json")
                .then()
                .statusCode(200)
                .body("metas.id", equalTo(List.of("iptv:1")));

        given()
                .when().get("/favorites/remove/iptv:1")
                .then()
                .statusCode(200)
                .body("favorites", hasSize(0));
    }

    @Test
    void favoriteOfUnknownChannelIsNotFound() {
        given()
                .when().get("/favorites/add/iptv:404")
                .then()
                .statusCode(404);
    }

    @Test
    void statusAndHealth() {
        given()
                .when().get("/status")
                .then()
                .statusCode(200)
                .body("status", equalTo("running"))
                .body("channels", equalTo(4))
                .body("categories", equalTo(3));

        given()
                .when().get("/health")
                .then()
                .statusCode(200)
                .body("status", equalTo("ok"));
    }

    @Test
    void relayNeedsOriginUrl() {
        given()
                .when().get("/proxy")
                .then()
                .statusCode(400);

        given()
                .when().options("/proxy")
                .then()
                .statusCode(204)
                .header("Access-Control-Allow-Methods", startsWith("GET"));
    }

    private static Channel channel(int position, String name, String category) {
        return new Channel("iptv:" + position, name, null, category,
                "http://streams.example.com/" + position + ".m3u8", "g" + position, null, null, null);
    }
}
