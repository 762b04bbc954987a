package com.relaygate.model;

import lombok.Value;

/**
 * One step of a fallback chain: which provider to call and with which model id.
 */
@Value
public class ProviderTarget {

    String provider;
    String model;

    @Override
    public String toString() {
        return provider + "/" + model;
    }
}
