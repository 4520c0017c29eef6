package com.questrail.hostlink.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.hostlink.api.ConnectionFailureException;
import com.questrail.hostlink.api.HostCommand;
import com.questrail.hostlink.api.HostLink;
import com.questrail.hostlink.api.HostResponse;
import com.questrail.hostlink.api.ResponseStatus;
import com.questrail.hostlink.config.HostLinkConfig;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class HostToolInvokerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<HostCommand> sent = new ArrayList<>();

    private HostToolInvoker invokerAnswering(HostResponse response) {
        HostLink link = command -> {
            sent.add(command);
            return response;
        };
        return new HostToolInvoker(link, mapper);
    }

    @Test
    void successRendersResultAsIndentedJson() throws IOException {
        ObjectNode result = mapper.createObjectNode().put("name", "Scene").put("object_count", 2);
        HostToolInvoker invoker = invokerAnswering(HostResponse.success(result));

        String text = invoker.invoke("getting scene info", HostCommands.GET_SCENE_INFO);

        assertTrue(text.contains("\n"), "expected indented output");
        JsonNode parsed = mapper.readTree(text);
        assertEquals("Scene", parsed.get("name").asText());
        assertEquals(HostCommands.GET_SCENE_INFO, sent.get(0).type());
    }

    @Test
    void paramsArePassedThrough() {
        HostToolInvoker invoker = invokerAnswering(HostResponse.success(null));

        invoker.invoke("getting object info", HostCommands.GET_OBJECT_INFO, Map.of("name", "Cube"));

        assertEquals(Map.of("name", "Cube"), sent.get(0).params());
    }

    @Test
    void errorResponseRendersHostMessage() {
        HostToolInvoker invoker = invokerAnswering(HostResponse.error("Object not found: Foo"));

        String text = invoker.invoke("getting object info", HostCommands.GET_OBJECT_INFO, Map.of("name", "Foo"));

        assertEquals("Error getting object info: Object not found: Foo", text);
    }

    @Test
    void errorResponseWithoutMessageRendersFallback() {
        HostToolInvoker invoker = invokerAnswering(new HostResponse(
            ResponseStatus.ERROR, null, null));

        assertEquals("Error executing code: Unknown error",
            invoker.invoke("executing code", HostCommands.EXECUTE_CODE, Map.of("code", "x")));
    }

    @Test
    void transportFailureRendersExceptionMessage() {
        HostLink link = command -> {
            throw new ConnectionFailureException("Could not connect to host at localhost:9876");
        };
        HostToolInvoker invoker = new HostToolInvoker(link, mapper);

        assertEquals("Error getting scene info: Could not connect to host at localhost:9876",
            invoker.invoke("getting scene info", HostCommands.GET_SCENE_INFO));
    }

    @Test
    void healthCheckCommandMatchesConfigDefault() {
        assertEquals(HostLinkConfig.DEFAULT_HEALTH_CHECK_COMMAND, HostCommands.GET_POLYHAVEN_STATUS);
    }
}
