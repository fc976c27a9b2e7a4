package com.repolens.core.scanner;

import com.repolens.core.model.Deadline;
import com.repolens.core.model.ScanOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class TreeFingerprintTest {

    @TempDir
    Path root;

    private final ScanOptions options = new ScanOptions(4, 40_000, List.of());

    private String fingerprint() throws ScanException {
        return TreeFingerprint.compute(root, options, Deadline.none()).orElseThrow();
    }

    @Test
    @DisplayName("unchanged tree fingerprints identically")
    void stable() throws Exception {
        Files.writeString(root.resolve("a.py"), "import b\n");
        Files.writeString(root.resolve("b.py"), "x = 1\n");

        String first = fingerprint();
        assertTrue(first.startsWith("fp:"));
        assertEquals(first, fingerprint());
    }

    @Test
    @DisplayName("adding or resizing a file changes the fingerprint")
    void changesWithTree() throws Exception {
        Files.writeString(root.resolve("a.py"), "x = 1\n");
        String before = fingerprint();

        Files.writeString(root.resolve("a.py"), "x = 12345\n");
        String resized = fingerprint();
        assertNotEquals(before, resized);

        Files.writeString(root.resolve("c.py"), "y = 2\n");
        assertNotEquals(resized, fingerprint());
    }

    @Test
    @DisplayName("excluded files do not affect the fingerprint")
    void ignoresExcluded() throws Exception {
        Files.writeString(root.resolve("a.py"), "x = 1\n");
        String before = fingerprint();

        Files.createDirectories(root.resolve("node_modules"));
        Files.writeString(root.resolve("node_modules/dep.js"), "module.exports = 1;\n");
        Files.writeString(root.resolve("debug.log"), "noise\n");

        assertEquals(before, fingerprint());
    }

    @Test
    @DisplayName("a walk stopped by the deadline yields no fingerprint")
    void expiredDeadline() throws Exception {
        Files.writeString(root.resolve("a.py"), "x = 1\n");
        var now = new AtomicReference<>(Instant.parse("2026-03-01T00:00:00Z"));
        var clock = new Clock() {
            @Override public ZoneId getZone() { return ZoneOffset.UTC; }
            @Override public Clock withZone(ZoneId zone) { return this; }
            @Override public Instant instant() { return now.get(); }
        };
        var deadline = Deadline.after(Duration.ofSeconds(1), clock);
        now.set(now.get().plusSeconds(2));

        assertTrue(TreeFingerprint.compute(root, options, deadline).isEmpty());
    }

    @Test
    @DisplayName("identity is the real path of the root")
    void identity() throws Exception {
        assertEquals(root.toRealPath().toString(), TreeFingerprint.identityOf(root));
        assertThrows(ScanException.class, () -> TreeFingerprint.identityOf(root.resolve("missing")));
    }
}
