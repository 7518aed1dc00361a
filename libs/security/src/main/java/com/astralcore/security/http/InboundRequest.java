package com.astralcore.security.http;

/**
 * Framework-neutral view of an inbound HTTP request, as much of it as the security
 * components read. The service module adapts servlet requests to it.
 */
public interface InboundRequest {

    String method();

    String path();

    /**
     * Returns the first value of the header (case-insensitive name), or {@code null}.
     */
    String header(String name);

    /**
     * Returns the value of the named cookie, or {@code null}.
     */
    String cookie(String name);

    /**
     * The transport-level peer address, or {@code null} when unknown.
     */
    String remoteAddress();
}
