package com.flowys.flowys_backend.executor.impl;

import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Turns a configured (and possibly interpolated) URL into a request URI. Values dropped into a
 * template may carry spaces or non-ASCII text, so a URL that is not already a legal URI is
 * percent-encoded rather than rejected. Already-encoded URLs are used as they are.
 */
final class OutboundUrls {

    private OutboundUrls() {}

    static URI parse(String url) throws URISyntaxException {
        String trimmed = url.trim();
        URI uri;
        try {
            uri = new URI(trimmed);
        } catch (URISyntaxException e) {
            uri = encode(trimmed, e);
        }
        if (!uri.isAbsolute() || uri.getHost() == null) {
            throw new URISyntaxException(url, "not an absolute http(s) URL");
        }
        return uri;
    }

    private static URI encode(String url, URISyntaxException original) throws URISyntaxException {
        try {
            return UriComponentsBuilder.fromUriString(url).build().encode().toUri();
        } catch (IllegalArgumentException | IllegalStateException e) {
            original.addSuppressed(e);
            throw original;
        }
    }
}
