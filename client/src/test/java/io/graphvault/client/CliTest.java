package io.graphvault.client;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CliTest {

    @Test
    void create_joins_reason_words() {
        Cli.Call call = Cli.toCall(new String[]{"create", "before", "\"big\"", "migration"});

        assertEquals("POST", call.method());
        assertEquals("/snapshots", call.path());
        assertEquals("{\"reason\":\"before \\\"big\\\" migration\"}", call.body());
    }

    @Test
    void read_commands_are_gets() {
        assertEquals("/snapshots", Cli.toCall(new String[]{"list"}).path());
        assertNull(Cli.toCall(new String[]{"status"}).body());
        assertEquals("/snapshots/20250101_000000_000",
                Cli.toCall(new String[]{"info", "20250101_000000_000"}).path());
    }

    @Test
    void full_restore_requires_confirmation() {
        assertThrows(Cli.CliException.class, () -> Cli.toCall(new String[]{"restore"}));

        Cli.Call latest = Cli.toCall(new String[]{"restore", "--yes"});
        Cli.Call byId = Cli.toCall(new String[]{"restore", "20250101_000000_000", "--yes"});

        assertEquals("{\"snapshotId\":null}", latest.body());
        assertEquals("{\"snapshotId\":\"20250101_000000_000\"}", byId.body());
    }

    @Test
    void selective_restore_parses_preserve_list() {
        Cli.Call call = Cli.toCall(new String[]{"selective-restore", "--preserve", "User, Account"});

        assertEquals("/restore/selective", call.path());
        assertEquals("{\"snapshotId\":null,\"preserveLabels\":[\"User\",\"Account\"]}", call.body());
        assertThrows(Cli.CliException.class, () -> Cli.toCall(new String[]{"selective-restore"}));
    }

    @Test
    void unknown_or_malformed_commands_fail() {
        assertThrows(Cli.CliException.class, () -> Cli.toCall(new String[]{"drop-everything"}));
        assertThrows(Cli.CliException.class, () -> Cli.toCall(new String[]{"info"}));
        assertThrows(Cli.CliException.class, () -> Cli.toCall(new String[]{"list", "extra"}));
    }
}
