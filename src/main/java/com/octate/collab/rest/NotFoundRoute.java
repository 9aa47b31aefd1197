package com.octate.collab.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.octate.collab.message.MessageCodec;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;

/**
 * Answers paths no resource or socket claimed with the same JSON 404 body the
 * REST layer produces.
 */
@ApplicationScoped
public class NotFoundRoute {

    void register(@Observes Router router) {
        router.route().last().handler(this::notFound);
    }

    void notFound(RoutingContext ctx) {
        ErrorBody body = new ErrorBody("Not found", null, ctx.normalizedPath(), ctx.request().method().name());
        String json;
        try {
            json = MessageCodec.mapper().writeValueAsString(body);
        } catch (JsonProcessingException e) {
            json = "{\"error\":\"Not found\"}";
        }
        ctx.response()
            .setStatusCode(404)
            .putHeader("Content-Type", "application/json")
            .end(json);
    }
}
