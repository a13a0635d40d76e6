package com.trackinglog.api.rest;

/**
 * Request headers shared by the REST controllers.
 * Callers are authenticated upstream; the identity header is trusted as given.
 */
public final class CallerHeaders {

    public static final String CALLER_IDENTITY = "X-Caller-Identity";

    private CallerHeaders() {
    }
}
