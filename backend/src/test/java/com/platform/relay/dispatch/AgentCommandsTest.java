package com.platform.relay.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.relay.config.RelayProperties;
import com.platform.relay.payload.EncryptedExecutionUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AgentCommandsTest {

    private CommandDispatcher dispatcher;
    private AgentCommands commands;

    @BeforeEach
    void setUp() {
        dispatcher = mock(CommandDispatcher.class);
        when(dispatcher.send(anyString(), anyString(), any())).thenReturn(new CompletableFuture<JsonNode>());
        commands = new AgentCommands(dispatcher, new RelayProperties());
    }

    @Test
    @SuppressWarnings("unchecked")
    void logsDefaultToHundredLines() {
        commands.containerLogs("agent-1", "c1", null);

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(dispatcher).send(eq("agent-1"), eq(AgentCommands.CONTAINER_LOGS), payload.capture());
        assertThat((Map<String, Object>) payload.getValue())
            .containsEntry("containerId", "c1")
            .containsEntry("tail", 100);
    }

    @Test
    @SuppressWarnings("unchecked")
    void execCarriesContainerAndCommand() {
        commands.execInContainer("agent-1", "c1", new String[] {"ls", "-la"});

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(dispatcher).send(eq("agent-1"), eq(AgentCommands.CONTAINER_EXEC), payload.capture());
        assertThat((Map<String, Object>) payload.getValue()).containsKeys("containerId", "command");
    }

    @Test
    void toolExecutionRelaysTheUnit() {
        EncryptedExecutionUnit unit = EncryptedExecutionUnit.builder().type("command").build();

        commands.executeTool("agent-1", unit);

        verify(dispatcher).send("agent-1", AgentCommands.TOOL_EXECUTE, unit);
    }
}
