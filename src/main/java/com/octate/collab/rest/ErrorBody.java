package com.octate.collab.rest;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorBody(String error, String message, String path, String method) {

    public static ErrorBody of(String error) {
        return new ErrorBody(error, null, null, null);
    }
}
