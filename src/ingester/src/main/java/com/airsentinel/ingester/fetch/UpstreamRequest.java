package com.airsentinel.ingester.fetch;

import java.net.URI;

/**
 * One upstream GET call.
 *
 * @param key canonical request signature, used for caching and in-flight deduplication
 * @param uri fully-built request URI
 */
public record UpstreamRequest(String key, URI uri) {}
