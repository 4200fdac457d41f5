package me.golemcore.gateway.infrastructure.i18n;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class MessageServiceTest {

    @Test
    void shouldResolveEnglishMessages() {
        MessageService service = new MessageService("en");

        assertEquals("No access", service.getMessage("access.denied"));
        assertEquals("Error: boom", service.getMessage("agent.error", "boom"));
    }

    @Test
    void shouldResolveRussianMessages() {
        MessageService service = new MessageService("ru");

        assertEquals("ru", service.getLanguage());
        assertEquals("Нет доступа", service.getMessage("access.denied"));
    }

    @Test
    void shouldFallBackToEnglishForUnsupportedLanguage() {
        MessageService service = new MessageService("de");

        assertEquals("en", service.getLanguage());
        assertEquals("File is too large", service.getMessage("upload.too-large"));
    }

    @Test
    void shouldReturnKeyWhenMessageIsMissing() {
        MessageService service = new MessageService("en");

        assertEquals("no.such.key", service.getMessage("no.such.key"));
    }

    @Test
    void shouldFormatCountsWithoutGrouping() {
        MessageService service = new MessageService("en");

        assertEquals("File saved: /srv/a.zip, files extracted: 2000",
                service.getMessage("upload.saved.extracted", "/srv/a.zip", String.valueOf(2000)));
    }

    @Test
    void shouldSwitchLanguageAtRuntime() {
        MessageService service = new MessageService("en");

        service.setLanguage("ru");

        assertEquals("Ошибка: boom", service.getMessage("agent.error", "boom"));
    }
}
