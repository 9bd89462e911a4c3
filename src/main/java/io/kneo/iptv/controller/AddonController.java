package io.kneo.iptv.controller;

import io.kneo.iptv.dto.CatalogFilter;
import io.kneo.iptv.dto.ChannelDetailDTO;
import io.kneo.iptv.dto.ChannelMetaDTO;
import io.kneo.iptv.dto.PlaybackTargetDTO;
import io.kneo.iptv.dto.ProgrammeDTO;
import io.kneo.iptv.model.cnst.ResourceKind;
import io.kneo.iptv.service.catalog.CatalogService;
import io.kneo.iptv.service.exceptions.ChannelNotFoundException;
import io.kneo.iptv.service.playlist.PlaylistParser;
import io.kneo.iptv.util.ProblemDetailsUtil;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.json.Json;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@ApplicationScoped
public class AddonController {
    private static final Logger LOGGER = LoggerFactory.getLogger(AddonController.class);

    static final String CATALOG_PREFIX = "iptv_";
    static final String ALL_CATALOG = CATALOG_PREFIX + "all";
    static final String FAVORITES_CATALOG = CATALOG_PREFIX + "favorites";
    private static final Set<String> CONTENT_TYPES = Set.of("tv", "channel");
    private static final String RESOURCE_ROUTE = "^/(catalog|meta|stream)/([^/]+)/([^/]+?)(?:/([^/]+?))?\\.json$";

    private final CatalogService service;

    @Inject
    public AddonController(CatalogService service) {
        this.service = service;
    }

    public void setupRoutes(Router router) {
        router.route("/*").handler(rc -> {
            rc.response().putHeader("Access-Control-Allow-Origin", "*");
            rc.next();
        });
        router.route(HttpMethod.GET, "/manifest.json").handler(this::getManifest);
        router.routeWithRegex(HttpMethod.GET, RESOURCE_ROUTE).handler(this::getResource);
        router.route(HttpMethod.GET, "/favorites/:action/:id").handler(this::changeFavorite);
        router.route(HttpMethod.GET, "/status").handler(this::getStatus);
        router.route(HttpMethod.GET, "/health").handler(rc -> respondJson(rc, new JsonObject().put("status", "ok")));
    }

    record AddonRequest(ResourceKind kind, String type, String id, Map<String, String> extras) {

        static AddonRequest from(RoutingContext rc) {
            ResourceKind kind = ResourceKind.fromPathSegment(rc.pathParam("param0"))
                    .orElseThrow(() -> new IllegalArgumentException("Unknown resource " + rc.pathParam("param0")));
            Map<String, String> extras = new HashMap<>();
            rc.queryParams().forEach(entry -> extras.put(entry.getKey(), entry.getValue()));
            extras.putAll(parseExtras(rc.pathParam("param3")));
            return new AddonRequest(kind, rc.pathParam("param1"), rc.pathParam("param2"), extras);
        }

        int skip() {
            try {
                return Integer.parseInt(extras.getOrDefault("skip", "0"));
            } catch (NumberFormatException e) {
                return 0;
            }
        }
    }

    private void getManifest(RoutingContext rc) {
        JsonArray catalogs = new JsonArray();
        for (String category : service.getCategories()) {
            catalogs.add(catalog(catalogId(category), category, List.of()));
        }
        catalogs.add(catalog(ALL_CATALOG, "All Channels", List.of("search", "genre", "skip")));
        catalogs.add(catalog(FAVORITES_CATALOG, "Favorites", List.of()));

        JsonObject manifest = new JsonObject()
                .put("id", "io.kneo.iptv")
                .put("version", "1.0.0")
                .put("name", "IPTV")
                .put("description", "Live TV channels from an M3U playlist with XMLTV programme data")
                .put("resources", new JsonArray(Arrays.stream(ResourceKind.values()).map(ResourceKind::getPathSegment).toList()))
                .put("types", new JsonArray().add("tv"))
                .put("idPrefixes", new JsonArray().add(PlaylistParser.ID_PREFIX))
                .put("catalogs", catalogs)
                .put("behaviorHints", new JsonObject().put("configurable", false));
        respondJson(rc, manifest);
    }

    private void getResource(RoutingContext rc) {
        AddonRequest request;
        try {
            request = AddonRequest.from(rc);
        } catch (IllegalArgumentException e) {
            ProblemDetailsUtil.respondNotFound(rc, e.getMessage());
            return;
        }
        if (!CONTENT_TYPES.contains(request.type().toLowerCase(Locale.ROOT))) {
            ProblemDetailsUtil.respondNotFound(rc, "Unsupported type " + request.type());
            return;
        }
        LOGGER.debug("Add-on request {} {} {}", request.kind(), request.id(), request.extras());
        switch (request.kind()) {
            case CATALOG -> getCatalog(rc, request);
            case META -> getMeta(rc, request);
            case STREAM -> getStream(rc, request);
        }
    }

    private void getCatalog(RoutingContext rc, AddonRequest request) {
        CatalogFilter.CatalogFilterBuilder filter = CatalogFilter.builder().skip(request.skip());
        if (FAVORITES_CATALOG.equals(request.id())) {
            filter.favoritesOnly(true);
        } else if (ALL_CATALOG.equals(request.id())) {
            filter.searchText(request.extras().get("search"));
            filter.category(request.extras().get("genre"));
        } else {
            Optional<String> category = categoryFor(request.id());
            if (category.isEmpty()) {
                respondJson(rc, new JsonObject().put("metas", new JsonArray()));
                return;
            }
            filter.category(category.get());
        }

        service.listCatalog(filter.build())
                .subscribe().with(
                        metas -> {
                            JsonArray items = new JsonArray();
                            metas.forEach(meta -> items.add(toMetaPreview(meta)));
                            respondJson(rc, new JsonObject().put("metas", items));
                        },
                        throwable -> handleFailure(rc, throwable)
                );
    }

    private void getMeta(RoutingContext rc, AddonRequest request) {
        service.getDetail(request.id())
                .subscribe().with(
                        detail -> respondJson(rc, new JsonObject().put("meta", toMeta(detail))),
                        throwable -> handleFailure(rc, throwable)
                );
    }

    private void getStream(RoutingContext rc, AddonRequest request) {
        service.getPlaybackTarget(request.id(), baseUrl(rc))
                .subscribe().with(
                        target -> respondJson(rc, new JsonObject().put("streams", new JsonArray().add(toStream(target)))),
                        throwable -> handleFailure(rc, throwable)
                );
    }

    private void changeFavorite(RoutingContext rc) {
        String action = rc.pathParam("action");
        String id = rc.pathParam("id");
        try {
            boolean changed;
            if ("add".equals(action)) {
                changed = service.addFavorite(id);
            } else if ("remove".equals(action)) {
                changed = service.removeFavorite(id);
            } else {
                ProblemDetailsUtil.respondBadRequest(rc, "Unknown favorites action " + action);
                return;
            }
            respondJson(rc, new JsonObject()
                    .put("success", true)
                    .put("changed", changed)
                    .put("favorites", new JsonArray(List.copyOf(service.getFavorites()))));
        } catch (ChannelNotFoundException e) {
            ProblemDetailsUtil.respondNotFound(rc, e.getMessage());
        }
    }

    private void getStatus(RoutingContext rc) {
        rc.response()
                .putHeader("Content-Type", "application/json")
                .end(Json.encode(service.getStatus()));
    }

    private void handleFailure(RoutingContext rc, Throwable throwable) {
        if (throwable instanceof ChannelNotFoundException) {
            ProblemDetailsUtil.respondNotFound(rc, throwable.getMessage());
        } else {
            LOGGER.error("Add-on request {} failed", rc.request().path(), throwable);
            ProblemDetailsUtil.respondError(rc, 500, "Internal Server Error", throwable.getMessage());
        }
    }

    private Optional<String> categoryFor(String catalogId) {
        return service.getCategories().stream()
                .filter(category -> catalogId(category).equals(catalogId))
                .findFirst();
    }

    static String catalogId(String category) {
        return CATALOG_PREFIX + category.replace(' ', '_');
    }

    /**
     * Splits an already decoded {@code key=value&key=value} extras segment.
     */
    static Map<String, String> parseExtras(String segment) {
        Map<String, String> extras = new HashMap<>();
        if (segment == null || segment.isBlank()) {
            return extras;
        }
        for (String pair : segment.split("&")) {
            int eq = pair.indexOf('=');
            if (eq > 0) {
                extras.put(pair.substring(0, eq), pair.substring(eq + 1));
            }
        }
        return extras;
    }

    static String baseUrl(RoutingContext rc) {
        String proto = Optional.ofNullable(rc.request().getHeader("X-Forwarded-Proto"))
                .orElse(rc.request().isSSL() ? "https" : "http");
        String host = Optional.ofNullable(rc.request().getHeader("X-Forwarded-Host"))
                .or(() -> Optional.ofNullable(rc.request().getHeader("Host")))
                .orElse("localhost");
        return proto + "://" + host;
    }

    private static JsonObject catalog(String id, String name, List<String> extras) {
        JsonObject catalog = new JsonObject()
                .put("type", "tv")
                .put("id", id)
                .put("name", name);
        if (!extras.isEmpty()) {
            JsonArray extra = new JsonArray();
            extras.forEach(extraName -> extra.add(new JsonObject().put("name", extraName).put("isRequired", false)));
            catalog.put("extra", extra);
        }
        return catalog;
    }

    private static JsonObject toMetaPreview(ChannelMetaDTO meta) {
        return new JsonObject()
                .put("id", meta.getId())
                .put("type", "tv")
                .put("name", meta.getName())
                .put("poster", meta.getArtworkUrl())
                .put("posterShape", "square")
                .put("description", meta.getDescription())
                .put("genres", new JsonArray().add(meta.getCategory()));
    }

    private static JsonObject toMeta(ChannelDetailDTO detail) {
        JsonObject meta = new JsonObject()
                .put("id", detail.getId())
                .put("type", "tv")
                .put("name", detail.getName())
                .put("poster", detail.getArtworkUrl())
                .put("logo", detail.getArtworkUrl())
                .put("description", detail.getDescription())
                .put("genres", new JsonArray().add(detail.getCategory()));
        if (detail.getReleaseInfo() != null) {
            meta.put("releaseInfo", detail.getReleaseInfo());
        }
        if (detail.getCurrent() != null) {
            meta.put("current", toProgramme(detail.getCurrent()));
        }
        if (detail.getNext() != null) {
            meta.put("next", toProgramme(detail.getNext()));
        }
        return meta;
    }

    private static JsonObject toProgramme(ProgrammeDTO programme) {
        JsonObject json = new JsonObject()
                .put("title", programme.getTitle())
                .put("start", programme.getStart().toString())
                .put("stop", programme.getStop().toString());
        if (programme.getDescription() != null) {
            json.put("description", programme.getDescription());
        }
        if (programme.getCategory() != null) {
            json.put("category", programme.getCategory());
        }
        return json;
    }

    private static JsonObject toStream(PlaybackTargetDTO target) {
        JsonObject hints = new JsonObject().put("notWebReady", true);
        if (!target.isRelayed()) {
            hints.put("proxyHeaders", new JsonObject()
                    .put("request", new JsonObject(new HashMap<>(target.getProxyHeaders()))));
        }
        return new JsonObject()
                .put("title", target.getTitle())
                .put("url", target.getUrl())
                .put("behaviorHints", hints);
    }

    private static void respondJson(RoutingContext rc, JsonObject body) {
        rc.response()
                .putHeader("Content-Type", "application/json")
                .end(body.encode());
    }
}
