package io.kneo.iptv.util;

import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;

public class ProblemDetailsUtil {
    private static final String PROBLEM_JSON = "application/problem+json";

    public static void respondError(RoutingContext rc, int status, String title, String detail) {
        if (rc.response().ended() || rc.response().closed()) {
            return;
        }
        JsonObject problem = new JsonObject()
                .put("title", title)
                .put("status", status)
                .put("detail", detail)
                .put("instance", rc.request().path());
        rc.response()
                .setStatusCode(status)
                .putHeader("Content-Type", PROBLEM_JSON)
                .end(problem.encode());
    }

    public static void respondNotFound(RoutingContext rc, String detail) {
        respondError(rc, 404, "Not Found", detail);
    }

    public static void respondBadRequest(RoutingContext rc, String detail) {
        respondError(rc, 400, "Bad Request", detail);
    }
}
