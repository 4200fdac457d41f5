package me.golemcore.gateway.security;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AllowlistEntriesTest {

    @Test
    void shouldParseNumericIdsAsUsersAndChats() {
        AllowlistEntries entries = AllowlistEntries.parse(List.of("123, -1001234567890"));

        assertTrue(entries.userIds().contains(123L));
        assertTrue(entries.chatIds().contains(123L));
        assertTrue(entries.chatIds().contains(-1001234567890L));
        assertTrue(entries.unresolved().isEmpty());
    }

    @Test
    void shouldParseUsernamesAndLinksCaseInsensitively() {
        AllowlistEntries entries = AllowlistEntries.parse(List.of("@Alice", "https://t.me/Team_Chat", "t.me/bob"));

        assertTrue(entries.usernames().containsAll(List.of("alice", "team_chat", "bob")));
        assertTrue(entries.chatUsernames().contains("team_chat"));
    }

    @Test
    void shouldCollectUnresolvedEntries() {
        AllowlistEntries entries = AllowlistEntries.parse(List.of("https://t.me/+AbCdEf", "t.me/joinchat/xyz"));

        assertEquals(List.of("https://t.me/+AbCdEf", "t.me/joinchat/xyz"), entries.unresolved());
        assertTrue(entries.isEmpty());
    }

    @Test
    void shouldTreatMissingConfigurationAsEmpty() {
        assertTrue(AllowlistEntries.parse(null).isEmpty());
        assertTrue(AllowlistEntries.parse(List.of(" , ")).isEmpty());
    }

    @Test
    void shouldRejectInviteLinksWhenExtractingUsername() {
        assertNull(AllowlistEntries.extractUsername("+invite"));
        assertNull(AllowlistEntries.extractUsername("@"));
        assertEquals("name", AllowlistEntries.extractUsername("http://t.me/name"));
    }
}
