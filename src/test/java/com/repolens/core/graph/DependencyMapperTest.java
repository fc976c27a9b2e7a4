package com.repolens.core.graph;

import com.repolens.core.model.Deadline;
import com.repolens.core.model.FileRecord;
import com.repolens.core.model.Language;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class DependencyMapperTest {

    private final DependencyMapper mapper = new DependencyMapper(ImportSyntaxRegistry.defaults());

    @Test
    @DisplayName("adds an edge for each resolved import")
    void resolvedImports() {
        var graph = mapper.buildGraph(List.of(
                FileRecord.ofContent("auth/login.py", "from auth.tokens import create_token\n"),
                FileRecord.ofContent("auth/tokens.py", "import hashlib\n"),
                FileRecord.ofContent("README.md", "# Auth service\n")));

        assertTrue(graph.hasEdge("auth/login.py", "auth/tokens.py"));
        assertEquals(1, graph.edgeCount());
        assertEquals(Set.of("auth/login.py"), graph.dependentsOf("auth/tokens.py"));
        assertEquals(Set.of("auth/login.py"), graph.neighborsOf("auth/tokens.py"));
    }

    @Test
    @DisplayName("unresolved imports never become nodes")
    void unresolvedDropped() {
        var graph = mapper.buildGraph(List.of(
                FileRecord.ofContent("app.py", "import requests\nfrom flask import Flask\n"),
                FileRecord.ofContent("web/index.js", "import React from 'react';\nimport x from './missing';\n")));

        assertEquals(0, graph.edgeCount());
        assertTrue(graph.asMap().isEmpty());
    }

    @Test
    @DisplayName("import cycles are kept in both directions")
    void cycles() {
        var graph = mapper.buildGraph(List.of(
                FileRecord.ofContent("a.py", "import b\n"),
                FileRecord.ofContent("b.py", "import a\n"),
                FileRecord.ofContent("c.py", "import c\n")));

        assertTrue(graph.hasEdge("a.py", "b.py"));
        assertTrue(graph.hasEdge("b.py", "a.py"));
        assertEquals(2, graph.edgeCount(), "self-import is ignored");
    }

    @Test
    @DisplayName("files without content or without import rules are skipped")
    void skipsUnsupported() {
        var unread = new FileRecord("b.py", Language.PYTHON, 10, Instant.EPOCH, null);
        var graph = mapper.buildGraph(List.of(
                FileRecord.ofContent("a.py", "import b\n"),
                unread,
                FileRecord.ofContent("notes.md", "see [a](a.py)\n")));

        // b.py is a known path even though its content was never read
        assertTrue(graph.hasEdge("a.py", "b.py"));
        assertEquals(1, graph.edgeCount());
    }

    @Test
    @DisplayName("registering a syntax adds support for another language")
    void customSyntax() {
        var registry = ImportSyntaxRegistry.defaults().register(Language.MARKDOWN, new MarkdownLinks());
        assertTrue(registry.supports(Language.MARKDOWN));

        var graph = new DependencyMapper(registry).buildGraph(List.of(
                FileRecord.ofContent("docs/index.md", "See [setup](setup.md).\n"),
                FileRecord.ofContent("docs/setup.md", "# Setup\n")));

        assertTrue(graph.hasEdge("docs/index.md", "docs/setup.md"));
    }

    @Test
    @DisplayName("an expired deadline stops mapping and reports partial")
    void deadline() {
        var now = new AtomicReference<>(Instant.parse("2026-01-01T00:00:00Z"));
        Clock clock = new Clock() {
            @Override public ZoneId getZone() { return ZoneOffset.UTC; }
            @Override public Clock withZone(ZoneId zone) { return this; }
            @Override public Instant instant() { return now.get(); }
        };
        Deadline deadline = Deadline.after(Duration.ofSeconds(1), clock);
        now.set(now.get().plusSeconds(5));

        var result = mapper.buildGraph(List.of(
                FileRecord.ofContent("a.py", "import b\n"),
                FileRecord.ofContent("b.py", "")), deadline);

        assertTrue(result.partial());
        assertEquals(0, result.graph().edgeCount());
        assertFalse(mapper.buildGraph(List.of(FileRecord.ofContent("a.py", "")), Deadline.none()).partial());
    }

    private static final class MarkdownLinks implements ImportSyntax {
        private static final Pattern LINK = Pattern.compile("\\]\\(([^)]+\\.md)\\)");

        @Override
        public List<String> references(String content) {
            var refs = new ArrayList<String>();
            Matcher m = LINK.matcher(content);
            while (m.find()) {
                refs.add(m.group(1));
            }
            return refs;
        }

        @Override
        public Optional<String> resolve(String fromPath, String reference, KnownFiles known) {
            return KnownFiles.join(KnownFiles.directoryOf(fromPath), reference)
                    .flatMap(p -> known.firstExisting(List.of(p)));
        }
    }
}
