package com.relaygate.exception;

import org.springframework.http.HttpStatus;

/**
 * No enabled provider can serve the request.
 */
public class NoRouteException extends GatewayException {

    public NoRouteException(String model) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "no_route", "No enabled provider available for model: " + model);
    }

    @Override
    public String getType() {
        return "service_unavailable";
    }
}
