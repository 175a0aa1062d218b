package com.futuresdca.exception;

import java.util.Map;

/** No price data for the requested symbol or window. */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String resource, String identifier) {
        super(
                ErrorCode.NOT_FOUND,
                String.format("%s not available for %s", resource, identifier),
                Map.of("resource", resource, "identifier", identifier));
    }
}
