package me.golemcore.gateway.infrastructure.config;

import me.golemcore.gateway.port.inbound.ChannelPort;
import me.golemcore.gateway.security.AllowlistValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class AutoConfigurationTest {

    @TempDir
    Path tempDir;

    private GatewayProperties properties;

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        properties.getTelegram().setToken("test-token");
        properties.getTelegram().setAllowFrom(List.of("42"));
        properties.getAgent().setWorkdir(tempDir.toString());
    }

    @Test
    void shouldAcceptCompleteConfiguration() {
        assertDoesNotThrow(() -> configuration(List.of()).validate());
    }

    @Test
    void shouldRequireTokenWhenTelegramEnabled() {
        properties.getTelegram().setToken(" ");

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> configuration(List.of()).validate());
        assertTrue(ex.getMessage().contains("TELEGRAM_BOT_TOKEN"));
    }

    @Test
    void shouldRequireAllowList() {
        properties.getTelegram().setAllowFrom(List.of("https://t.me/+invite"));

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> configuration(List.of()).validate());
        assertTrue(ex.getMessage().contains("ALLOWED_CHAT_USER_IDS"));
    }

    @Test
    void shouldRequireExistingWorkdir() {
        properties.getAgent().setWorkdir(tempDir.resolve("missing").toString());

        assertThrows(IllegalStateException.class, () -> configuration(List.of()).validate());
    }

    @Test
    void shouldStartEveryChannel() {
        ChannelPort telegram = mock(ChannelPort.class);

        configuration(List.of(telegram)).startChannels();

        verify(telegram).start();
    }

    @Test
    void shouldNameExecutorThreads() {
        Thread thread = AutoConfiguration.namedThreadFactory("gateway-agent").newThread(() -> {
        });

        assertEquals("gateway-agent-1", thread.getName());
        assertTrue(thread.isDaemon());
    }

    private AutoConfiguration configuration(List<ChannelPort> channels) {
        return new AutoConfiguration(properties, new AllowlistValidator(properties), channels);
    }
}
