package com.repolens.core.keywords;

import java.util.Set;

final class StopWords {

    private StopWords() {}

    static final Set<String> ENGLISH = Set.of(
            "a", "about", "above", "after", "again", "against", "all", "also", "am", "an", "and",
            "any", "are", "as", "at", "be", "because", "been", "before", "being", "below",
            "between", "both", "but", "by", "can", "could", "did", "do", "does", "doing", "down",
            "during", "each", "few", "for", "from", "further", "had", "has", "have", "having",
            "he", "her", "here", "hers", "him", "his", "how", "i", "if", "in", "into", "is", "it",
            "its", "itself", "just", "me", "more", "most", "my", "no", "nor", "not", "now", "of",
            "off", "on", "once", "only", "or", "other", "our", "ours", "out", "over", "own",
            "please", "same", "she", "should", "so", "some", "such", "than", "that", "the",
            "their", "theirs", "them", "then", "there", "these", "they", "this", "those",
            "through", "to", "too", "under", "until", "up", "us", "very", "was", "we", "were",
            "what", "when", "where", "which", "while", "who", "whom", "why", "will", "with",
            "would", "you", "your", "yours", "yourself"
    );

    /** Short terms kept despite being under three characters. */
    static final Set<String> ACRONYMS = Set.of(
            "db", "ui", "ux", "io", "id", "ip", "os", "ci", "cd", "qa", "ai", "ml", "vm", "k8s"
    );

    /** Programming vocabulary that earns a small boost over ordinary words. */
    static final Set<String> TECHNICAL = Set.of(
            "function", "class", "method", "component", "service", "controller", "model", "view",
            "router", "handler", "middleware", "config", "setup", "init", "create", "update",
            "delete", "api", "endpoint", "database", "db", "auth", "login", "register", "user",
            "admin", "dashboard", "form", "button", "input", "validation", "error", "exception",
            "test", "spec", "mock", "util", "helper", "lib", "library", "module", "package",
            "import", "export", "token", "session", "cache", "query", "schema", "migration"
    );
}
