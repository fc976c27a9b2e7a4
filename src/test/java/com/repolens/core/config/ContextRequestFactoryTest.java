package com.repolens.core.config;

import com.repolens.core.model.ContextBudget;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContextRequestFactoryTest {

    private RepoLensProperties properties;
    private ContextRequestFactory factory;

    @BeforeEach
    void setUp() {
        properties = new RepoLensProperties();
        properties.getScan().setExcludePatterns(new ArrayList<>(List.of("*.lock")));
        factory = new ContextRequestFactory(properties);
    }

    @Test
    @DisplayName("unset limits come from configuration")
    void defaults() {
        var request = factory.forPrompt(Path.of("/repo"), "fix login").build();

        assertEquals(new ContextBudget(15000, 20, 10000, 4), request.budget());
        assertEquals(Duration.ofSeconds(30), request.timeout());
        assertEquals(40000, request.maxFileSizeBytes());
        assertEquals(List.of("*.lock"), request.excludePatterns());
        assertNull(request.repositoryIdentity());
        assertNull(request.treeVersion());
    }

    @Test
    @DisplayName("caller limits override configuration and excludes are appended")
    void overrides() {
        var request = factory.forPrompt(Path.of("/repo"), "fix login")
                .repositoryId("acme/shop")
                .treeVersion("abc123")
                .maxTokens(500)
                .maxFiles(3)
                .maxCharsPerFile(2000)
                .maxDepth(2)
                .timeoutSeconds(0)
                .excludes(List.of("docs/**"))
                .build();

        assertEquals(new ContextBudget(500, 3, 2000, 2), request.budget());
        assertEquals(Duration.ZERO, request.timeout());
        assertEquals(List.of("*.lock", "docs/**"), request.excludePatterns());
        assertEquals("acme/shop", request.repositoryIdentity());
        assertEquals("abc123", request.treeVersion());
    }

    @Test
    @DisplayName("out-of-range limits are rejected")
    void invalidLimits() {
        assertThrows(IllegalArgumentException.class,
                () -> factory.forPrompt(Path.of("/repo"), "p").maxTokens(-1).build());
        assertThrows(IllegalArgumentException.class,
                () -> factory.forPrompt(Path.of("/repo"), "p").maxDepth(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> factory.forPrompt(Path.of("/repo"), "p").timeoutSeconds(-1).build());
    }

    @Test
    @DisplayName("scoring properties map onto weights")
    void scoringWeights() {
        properties.getScoring().setFileNameWeight(5.0);
        properties.getScoring().setMaxHops(2);

        var weights = properties.getScoring().toWeights();

        assertEquals(5.0, weights.fileNameWeight());
        assertEquals(2, weights.maxHops());
    }
}
