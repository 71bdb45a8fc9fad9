package com.docsage.api.controller;

public record NotifyResponse(
    String status,
    long id
) {
    public static NotifyResponse ok(long id) {
        return new NotifyResponse("ok", id);
    }
}
