package com.repolens.core.graph;

import com.repolens.core.model.FileRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Reference extraction and resolution for each built-in language group.
 */
class ImportSyntaxTest {

    private static KnownFiles known(String... paths) {
        return new KnownFiles(Arrays.stream(paths).map(p -> FileRecord.ofContent(p, "")).toList());
    }

    // ── Python ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("Python")
    class Python {

        private final PythonImports syntax = new PythonImports();
        private final KnownFiles files = known(
                "auth/login.py", "auth/tokens.py", "pkg/__init__.py", "pkg/core/base.py",
                "pkg/api/views.py", "lib/src/utils/helpers.py");

        @Test
        @DisplayName("collects from-imports, plain imports and parenthesised name lists")
        void references() {
            var refs = syntax.references("""
                    from auth.tokens import create_token, verify_token
                    import os, utils.helpers as h
                    from . import models
                    from ..core import (
                        base,
                        other
                    )
                    """);
            assertTrue(refs.containsAll(List.of(
                    "auth.tokens.create_token", "auth.tokens.verify_token", "auth.tokens",
                    ".models", "..core.base", "..core.other", "..core", "os", "utils.helpers")));
            assertFalse(refs.contains("."));
        }

        @Test
        @DisplayName("resolves modules and packages from the root")
        void resolvesAbsolute() {
            assertEquals(Optional.of("auth/tokens.py"), syntax.resolve("auth/login.py", "auth.tokens", files));
            assertEquals(Optional.of("pkg/__init__.py"), syntax.resolve("auth/login.py", "pkg", files));
            assertTrue(syntax.resolve("auth/login.py", "auth.tokens.create_token", files).isEmpty());
        }

        @Test
        @DisplayName("resolves relative imports by walking up one directory per extra dot")
        void resolvesRelative() {
            assertEquals(Optional.of("pkg/core/base.py"), syntax.resolve("pkg/api/views.py", "..core.base", files));
            assertTrue(syntax.resolve("views.py", "...core", files).isEmpty());
        }

        @Test
        @DisplayName("falls back to a suffix match for nested source roots")
        void resolvesBySuffix() {
            assertEquals(Optional.of("lib/src/utils/helpers.py"), syntax.resolve("app.py", "utils.helpers", files));
            assertTrue(syntax.resolve("app.py", "requests", files).isEmpty());
        }
    }

    // ── JavaScript / TypeScript ──────────────────────────────────────

    @Nested
    @DisplayName("JavaScript and TypeScript")
    class Scripts {

        private final ScriptImports syntax = new ScriptImports();
        private final KnownFiles files = known(
                "src/app.ts", "src/a.ts", "src/components/index.tsx", "shared/util.js");

        @Test
        @DisplayName("collects static, side-effect, re-export, require and dynamic imports")
        void references() {
            var refs = syntax.references("""
                    import { a } from './a';
                    import './styles.css';
                    export * from '../shared/util';
                    import React from 'react';
                    const legacy = require('./legacy');
                    const lazy = await import('./lazy');
                    """);
            assertEquals(List.of("./a", "./styles.css", "../shared/util", "react", "./legacy", "./lazy"), refs);
        }

        @Test
        @DisplayName("tries extensions, compiled-name swaps and index files")
        void resolves() {
            assertEquals(Optional.of("src/a.ts"), syntax.resolve("src/app.ts", "./a", files));
            assertEquals(Optional.of("src/a.ts"), syntax.resolve("src/app.ts", "./a.js", files));
            assertEquals(Optional.of("src/components/index.tsx"), syntax.resolve("src/app.ts", "./components", files));
            assertEquals(Optional.of("shared/util.js"), syntax.resolve("src/app.ts", "../shared/util", files));
        }

        @Test
        @DisplayName("package names and paths above the root do not resolve")
        void unresolved() {
            assertTrue(syntax.resolve("src/app.ts", "react", files).isEmpty());
            assertTrue(syntax.resolve("src/app.ts", "../../outside", files).isEmpty());
        }
    }

    // ── JVM ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("Java, Kotlin and Scala")
    class Jvm {

        private final JvmImports syntax = new JvmImports();
        private final KnownFiles files = known(
                "src/main/java/com/acme/auth/TokenService.java",
                "src/main/java/com/acme/util/Strings.java",
                "src/main/kotlin/com/acme/model/User.kt",
                "src/main/kotlin/com/acme/model/Order.kt");

        @Test
        @DisplayName("collects plain, static, aliased and selector imports, skipping wildcards")
        void references() {
            var refs = syntax.references("""
                    import com.acme.auth.TokenService;
                    import static com.acme.util.Strings.isBlank;
                    import java.util.*;
                    import com.acme.auth.TokenService as Tokens
                    import com.acme.model.{User, Order => O}
                    """);
            assertEquals(List.of("com.acme.auth.TokenService", "com.acme.util.Strings.isBlank",
                    "com.acme.model.User", "com.acme.model.Order"), refs);
        }

        @Test
        @DisplayName("resolves through source roots, dropping member names")
        void resolves() {
            assertEquals(Optional.of("src/main/java/com/acme/util/Strings.java"),
                    syntax.resolve("src/main/java/com/acme/App.java", "com.acme.util.Strings.isBlank", files));
            assertEquals(Optional.of("src/main/kotlin/com/acme/model/User.kt"),
                    syntax.resolve("src/main/scala/com/acme/Report.scala", "com.acme.model.User", files));
            assertTrue(syntax.resolve("src/main/java/com/acme/App.java", "java.util.List", files).isEmpty());
        }
    }

    // ── Go ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("Go")
    class Go {

        private final GoImports syntax = new GoImports();
        private final KnownFiles files = known(
                "main.go", "internal/auth/a_test.go", "internal/auth/auth.go", "config/config.go");

        @Test
        @DisplayName("collects single and block imports")
        void references() {
            var refs = syntax.references("""
                    package main

                    import "fmt"
                    import (
                        "github.com/acme/app/internal/auth"
                        cfg "github.com/acme/app/config"
                    )
                    """);
            assertEquals(List.of("fmt", "github.com/acme/app/internal/auth", "github.com/acme/app/config"), refs);
        }

        @Test
        @DisplayName("resolves module paths to the first non-test file of the package directory")
        void resolves() {
            assertEquals(Optional.of("internal/auth/auth.go"),
                    syntax.resolve("main.go", "github.com/acme/app/internal/auth", files));
            assertEquals(Optional.of("config/config.go"), syntax.resolve("main.go", "./config", files));
            assertTrue(syntax.resolve("main.go", "fmt", files).isEmpty());
        }

        @Test
        @DisplayName("standard library imports do not match local directories of the same name")
        void standardLibrary() {
            var local = known("main.go", "errors/errors.go", "strings/pad.go", "http/client.go");

            assertTrue(syntax.resolve("main.go", "errors", local).isEmpty());
            assertTrue(syntax.resolve("main.go", "strings", local).isEmpty());
            assertTrue(syntax.resolve("main.go", "net/http", local).isEmpty());
        }

        @Test
        @DisplayName("imports under the go.mod module map onto the module directory")
        void modulePrefix() {
            var module = new KnownFiles(List.of(
                    FileRecord.ofContent("svc/go.mod", "module github.com/acme/svc\n\ngo 1.22\n"),
                    FileRecord.ofContent("svc/main.go", ""),
                    FileRecord.ofContent("svc/config/config.go", ""),
                    FileRecord.ofContent("errors/errors.go", "")));

            assertEquals(Optional.of("svc/config/config.go"),
                    syntax.resolve("svc/main.go", "github.com/acme/svc/config", module));
            assertEquals(Optional.of("svc/main.go"), syntax.resolve("svc/main.go", "github.com/acme/svc", module));
            assertTrue(syntax.resolve("svc/main.go", "errors", module).isEmpty());
        }
    }

    // ── C / C++ ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("C and C++")
    class C {

        private final CIncludes syntax = new CIncludes();
        private final KnownFiles files = known("src/main.c", "src/util.h", "include/net/socket.h");

        @Test
        @DisplayName("collects quoted and angle-bracket includes")
        void references() {
            assertEquals(List.of("stdio.h", "util.h", "net/socket.h"), syntax.references("""
                    #include <stdio.h>
                    #include "util.h"
                    #  include "net/socket.h"
                    """));
        }

        @Test
        @DisplayName("resolves next to the includer, then from include directories")
        void resolves() {
            assertEquals(Optional.of("src/util.h"), syntax.resolve("src/main.c", "util.h", files));
            assertEquals(Optional.of("include/net/socket.h"), syntax.resolve("src/main.c", "net/socket.h", files));
            assertTrue(syntax.resolve("src/main.c", "stdio.h", files).isEmpty());
        }
    }

    // ── Rust ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("Rust")
    class Rust {

        private final RustImports syntax = new RustImports();
        private final KnownFiles files = known(
                "src/main.rs", "src/config.rs", "src/handlers/mod.rs", "src/db/pool.rs",
                "src/api/mod.rs", "src/api/routes.rs", "src/api/models.rs", "src/models.rs");

        @Test
        @DisplayName("collects mod declarations and crate-local use paths")
        void references() {
            var refs = syntax.references("""
                    mod config;
                    pub mod handlers;
                    use crate::db::pool::Pool;
                    use super::models;
                    use std::io;
                    """);
            assertEquals(List.of("mod:config", "mod:handlers", "crate::db::pool::Pool", "super::models"), refs);
        }

        @Test
        @DisplayName("resolves mod declarations to name.rs or name/mod.rs")
        void resolvesMods() {
            assertEquals(Optional.of("src/config.rs"), syntax.resolve("src/main.rs", "mod:config", files));
            assertEquals(Optional.of("src/handlers/mod.rs"), syntax.resolve("src/main.rs", "mod:handlers", files));
        }

        @Test
        @DisplayName("resolves crate and super paths, dropping item names")
        void resolvesUse() {
            assertEquals(Optional.of("src/db/pool.rs"),
                    syntax.resolve("src/api/routes.rs", "crate::db::pool::Pool", files));
            assertEquals(Optional.of("src/api/models.rs"),
                    syntax.resolve("src/api/routes.rs", "super::models", files));
            assertEquals(Optional.of("src/models.rs"),
                    syntax.resolve("src/api/mod.rs", "super::models", files));
        }
    }

    // ── Ruby ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("Ruby")
    class Ruby {

        private final RubyImports syntax = new RubyImports();
        private final KnownFiles files = known("lib/acme/cli.rb", "lib/acme/helpers/format.rb", "lib/acme/client.rb");

        @Test
        @DisplayName("resolves require_relative next to the file and require from lib/")
        void resolves() {
            var refs = syntax.references("""
                    require_relative 'helpers/format'
                    require 'json'
                    require 'acme/client'
                    """);
            assertEquals(List.of("./helpers/format", "json", "acme/client"), refs);

            assertEquals(Optional.of("lib/acme/helpers/format.rb"),
                    syntax.resolve("lib/acme/cli.rb", "./helpers/format", files));
            assertEquals(Optional.of("lib/acme/client.rb"), syntax.resolve("lib/acme/cli.rb", "acme/client", files));
            assertTrue(syntax.resolve("lib/acme/cli.rb", "json", files).isEmpty());
        }
    }
}
