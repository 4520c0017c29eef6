package com.questrail.hostlink.api;

import java.util.Optional;

/**
 * Status tag carried by every host response.
 */
public enum ResponseStatus
{
    SUCCESS("success"),
    ERROR("error");

    private final String wireValue;

    ResponseStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    /**
     * Resolve a wire tag. Matching is exact; the host always emits lower case.
     */
    public static Optional<ResponseStatus> fromWire(String value) {
        for (ResponseStatus status : values()) {
            if (status.wireValue.equals(value)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
