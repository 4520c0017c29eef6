package com.questrail.hostlink.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.questrail.hostlink.api.HostLink;
import com.questrail.hostlink.api.HostLinkException;
import com.questrail.hostlink.api.HostResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * HostToolInvoker
 * -----------------------------------------------------------------------------
 * The send-and-render step shared by every agent-facing tool.
 *
 * <p>A tool sends one command and hands the agent text:</p>
 * <ul>
 *   <li>success: the {@code result} object as indented JSON</li>
 *   <li>error-status response: {@code Error <action>: <host message>}</li>
 *   <li>transport failure: {@code Error <action>: <exception message>}</li>
 * </ul>
 *
 * <p>{@code action} is a gerund phrase such as {@code "getting scene info"}.
 * The invoker never throws a {@link HostLinkException}; the agent always gets
 * something it can show.</p>
 */
public final class HostToolInvoker
{
    private static final Logger log = LoggerFactory.getLogger(HostToolInvoker.class);

    private final HostLink link;
    private final ObjectWriter writer;

    public HostToolInvoker(HostLink link, ObjectMapper mapper)
    {
        this.link = Objects.requireNonNull(link, "link");
        this.writer = Objects.requireNonNull(mapper, "mapper").writerWithDefaultPrettyPrinter();
    }

    public String invoke(String action, String commandType)
    {
        return invoke(action, commandType, Collections.emptyMap());
    }

    public String invoke(String action, String commandType, Map<String, Object> params)
    {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(commandType, "commandType");

        final HostResponse response;
        try {
            response = link.send(commandType, params);
        } catch (HostLinkException e) {
            log.error("Error {}: {}", action, e.getMessage());
            return "Error " + action + ": " + e.getMessage();
        }

        if (response.isError()) {
            String message = response.errorMessage().orElse("Unknown error");
            log.error("Host error while {}: {}", action, message);
            return "Error " + action + ": " + message;
        }

        try {
            return writer.writeValueAsString(response.result());
        } catch (JsonProcessingException e) {
            // A tree that was just parsed from JSON always serializes.
            throw new IllegalStateException("Could not render result of " + commandType, e);
        }
    }
}
