package com.questrail.hostlink.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * HostCommand
 * -----------------------------------------------------------------------------
 * An outbound request to the host: a command-type identifier plus a parameter
 * structure.
 *
 * <p>Parameters are an arbitrarily nested mapping from string keys to scalars,
 * lists, or nested maps. A command always carries a parameter map on the wire;
 * a command with no parameters carries an empty map.</p>
 *
 * <p>Parameter values may be {@code null} (the host treats an explicit null as
 * "use the active object / default"), so the map is copied with
 * {@link LinkedHashMap} rather than {@link Map#copyOf(Map)}.</p>
 */
public record HostCommand(String type, Map<String, Object> params)
{
    public HostCommand {
        Objects.requireNonNull(type, "type");
        if (type.isBlank()) {
            throw new IllegalArgumentException("Command type must not be blank");
        }
        params = params == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static HostCommand of(String type) {
        return new HostCommand(type, Collections.emptyMap());
    }

    public static HostCommand of(String type, Map<String, Object> params) {
        return new HostCommand(type, params);
    }
}
