package com.agrotrace.api.web;

/**
 * Request headers carrying the caller identity, set by the upstream gateway.
 */
public final class CallerHeaders {

    public static final String CALLER_ID = "X-Caller-Id";

    private CallerHeaders() {}
}
