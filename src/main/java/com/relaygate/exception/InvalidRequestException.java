package com.relaygate.exception;

import org.springframework.http.HttpStatus;

/**
 * Request body failed validation.
 */
public class InvalidRequestException extends GatewayException {

    public InvalidRequestException(String message) {
        super(HttpStatus.BAD_REQUEST, "invalid_request", message);
    }

    @Override
    public String getType() {
        return "invalid_request_error";
    }
}
