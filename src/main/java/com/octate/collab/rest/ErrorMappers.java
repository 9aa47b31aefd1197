package com.octate.collab.rest;

import com.octate.collab.room.RoomNotFoundException;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Request;
import jakarta.ws.rs.core.UriInfo;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.RestResponse;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

/**
 * JSON error bodies for the HTTP API.
 */
public class ErrorMappers {

    private static final Logger LOG = Logger.getLogger(ErrorMappers.class);

    @ServerExceptionMapper
    public RestResponse<ErrorBody> roomNotFound(RoomNotFoundException e) {
        return RestResponse.status(RestResponse.Status.NOT_FOUND, ErrorBody.of("Room not found"));
    }

    @ServerExceptionMapper
    public RestResponse<ErrorBody> routeNotFound(NotFoundException e, UriInfo uriInfo, Request request) {
        return RestResponse.status(RestResponse.Status.NOT_FOUND,
            new ErrorBody("Not found", null, "/" + uriInfo.getPath(false).replaceFirst("^/", ""), request.getMethod()));
    }

    @ServerExceptionMapper
    public RestResponse<ErrorBody> webApplication(WebApplicationException e) {
        int status = e.getResponse().getStatus();
        return RestResponse.status(RestResponse.Status.fromStatusCode(status), ErrorBody.of(e.getMessage()));
    }

    @ServerExceptionMapper
    public RestResponse<ErrorBody> unexpected(RuntimeException e) {
        LOG.error("Unhandled HTTP error", e);
        return RestResponse.status(RestResponse.Status.INTERNAL_SERVER_ERROR,
            new ErrorBody("Internal server error", e.getMessage(), null, null));
    }
}
