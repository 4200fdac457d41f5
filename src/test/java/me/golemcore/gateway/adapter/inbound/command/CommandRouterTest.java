package me.golemcore.gateway.adapter.inbound.command;

import me.golemcore.gateway.domain.model.Sandbox;
import me.golemcore.gateway.domain.sandbox.SandboxService;
import me.golemcore.gateway.domain.service.AgentSessionStore;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.infrastructure.i18n.MessageService;
import me.golemcore.gateway.port.inbound.CommandPort;
import me.golemcore.gateway.security.AllowlistValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CommandRouterTest {

    private static final long CHAT_ID = -500L;
    private static final long ALLOWED_USER = 42L;

    private GatewayProperties properties;
    private AllowlistValidator allowlistValidator;
    private AgentSessionStore sessionStore;
    private SandboxService sandboxService;
    private CommandRouter router;

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        properties.getTelegram().setAllowFrom(List.of("42", "@carol"));
        properties.getAgent().setExecutable("codex");
        allowlistValidator = new AllowlistValidator(properties);
        sessionStore = new AgentSessionStore();
        sandboxService = mock(SandboxService.class);
        when(sandboxService.getAgentWorkdir()).thenReturn(Path.of("/srv/agent"));
        when(sandboxService.find(CHAT_ID)).thenReturn(Optional.empty());

        router = new CommandRouter(allowlistValidator, sessionStore, sandboxService, new MessageService("en"),
                properties);
    }

    @Test
    void shouldListHelpAndStatus() {
        assertTrue(router.hasCommand("help"));
        assertTrue(router.hasCommand("status"));
        assertFalse(router.hasCommand("reset"));
        assertEquals(List.of("help", "status"),
                router.listCommands().stream().map(CommandPort.CommandDefinition::name).toList());
    }

    @Test
    void shouldRenderHelp() {
        CommandPort.CommandResult result = router.execute("help", List.of(), context(ALLOWED_USER, null));

        assertTrue(result.success());
        assertTrue(result.output().contains("Commands:\n/help - show this message\n/status - "));
    }

    @Test
    void shouldRenderStatusWithoutSession() {
        CommandPort.CommandResult result = router.execute("status", List.of(), context(ALLOWED_USER, null));

        assertEquals("Agent: codex\nModel: default\nWorkdir: /srv/agent\nSession: none\nSandbox: none",
                result.output());
    }

    @Test
    void shouldRenderStatusWithSessionAndSandbox() {
        properties.getAgent().setModel("gpt-5");
        sessionStore.set(CHAT_ID, "s1");
        Path link = Path.of("/srv/agent/.tg-sandboxes/-500/s1");
        when(sandboxService.find(CHAT_ID)).thenReturn(Optional.of(new Sandbox("s1", Path.of("/tmp/q"), link)));

        CommandPort.CommandResult result = router.execute("status", List.of(), context(ALLOWED_USER, null));

        assertEquals("Agent: codex\nModel: gpt-5\nWorkdir: /srv/agent\nSession: s1\nSandbox: " + link,
                result.output());
    }

    @Test
    void shouldDenyCommandsFromStrangers() {
        CommandPort.CommandResult result = router.execute("status", List.of(), context(7L, "mallory"));

        assertFalse(result.success());
        assertEquals("No access", result.output());
        assertFalse(allowlistValidator.isAuthorizedChat(CHAT_ID, null));
    }

    @Test
    void shouldAuthorizeChatForAllowedUsername() {
        router.execute("help", List.of(), context(7L, "Carol"));

        assertTrue(allowlistValidator.isAuthorizedChat(CHAT_ID, null));
    }

    @Test
    void shouldReportUnknownCommand() {
        CommandPort.CommandResult result = router.execute("reset", List.of(), context(ALLOWED_USER, null));

        assertFalse(result.success());
        assertEquals("Unknown command: /reset", result.output());
    }

    private static Map<String, Object> context(Long senderId, String username) {
        Map<String, Object> ctx = new HashMap<>();
        ctx.put(CommandPort.CTX_CHAT_ID, CHAT_ID);
        ctx.put(CommandPort.CTX_SENDER_ID, senderId);
        ctx.put(CommandPort.CTX_SENDER_USERNAME, username);
        return ctx;
    }
}
