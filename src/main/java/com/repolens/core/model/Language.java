package com.repolens.core.model;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Source languages the engine recognises, inferred from file extensions.
 * <p>
 * Each constant also carries the names a prompt may use to refer to it
 * (e.g. "py", "golang"), which the keyword extractor turns into language hints.
 */
public enum Language {

    PYTHON("python", List.of(".py"), List.of("python", "py")),
    JAVASCRIPT("javascript", List.of(".js", ".jsx", ".mjs", ".cjs"), List.of("javascript", "js", "jsx", "node")),
    TYPESCRIPT("typescript", List.of(".ts", ".tsx"), List.of("typescript", "ts", "tsx")),
    JAVA("java", List.of(".java"), List.of("java")),
    KOTLIN("kotlin", List.of(".kt", ".kts"), List.of("kotlin", "kt")),
    SCALA("scala", List.of(".scala"), List.of("scala")),
    C("c", List.of(".c", ".h"), List.of()),
    CPP("cpp", List.of(".cpp", ".cc", ".cxx", ".hpp", ".hh"), List.of("cpp", "cxx")),
    CSHARP("csharp", List.of(".cs"), List.of("csharp", "cs")),
    PHP("php", List.of(".php"), List.of("php")),
    RUBY("ruby", List.of(".rb"), List.of("ruby", "rb")),
    GO("go", List.of(".go"), List.of("golang")),
    RUST("rust", List.of(".rs"), List.of("rust", "rs")),
    SWIFT("swift", List.of(".swift"), List.of("swift")),
    R("r", List.of(".r"), List.of()),
    SQL("sql", List.of(".sql"), List.of("sql")),
    BASH("bash", List.of(".sh", ".bash"), List.of("bash", "sh", "shell")),
    BATCH("batch", List.of(".bat", ".cmd"), List.of("batch", "bat")),
    POWERSHELL("powershell", List.of(".ps1"), List.of("powershell", "ps1")),
    YAML("yaml", List.of(".yml", ".yaml"), List.of("yaml", "yml")),
    JSON("json", List.of(".json"), List.of("json")),
    XML("xml", List.of(".xml"), List.of("xml")),
    HTML("html", List.of(".html", ".htm"), List.of("html")),
    CSS("css", List.of(".css"), List.of("css")),
    SCSS("scss", List.of(".scss"), List.of("scss")),
    SASS("sass", List.of(".sass"), List.of("sass")),
    MARKDOWN("markdown", List.of(".md", ".markdown"), List.of("markdown", "md")),
    DOCKERFILE("dockerfile", List.of(".dockerfile"), List.of("dockerfile", "docker")),
    TERRAFORM("terraform", List.of(".tf"), List.of("terraform", "tf")),
    UNKNOWN("unknown", List.of(), List.of());

    private static final Map<String, Language> BY_EXTENSION = new HashMap<>();
    private static final Map<String, Language> BY_NAME = new HashMap<>();

    static {
        for (Language language : values()) {
            for (String ext : language.extensions) {
                BY_EXTENSION.put(ext, language);
            }
            for (String name : language.promptNames) {
                BY_NAME.put(name, language);
            }
        }
    }

    private final String id;
    private final List<String> extensions;
    private final List<String> promptNames;

    Language(String id, List<String> extensions, List<String> promptNames) {
        this.id = id;
        this.extensions = extensions;
        this.promptNames = promptNames;
    }

    public String id() {
        return id;
    }

    public List<String> extensions() {
        return extensions;
    }

    /**
     * Infers the language of a file from its name. {@code Dockerfile} is
     * recognised by name; everything else by its lower-cased extension.
     */
    public static Language fromFileName(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.equals("dockerfile") || lower.startsWith("dockerfile.")) {
            return DOCKERFILE;
        }
        int dot = lower.lastIndexOf('.');
        if (dot < 0) {
            return UNKNOWN;
        }
        return BY_EXTENSION.getOrDefault(lower.substring(dot), UNKNOWN);
    }

    /**
     * Resolves a language name as written in a prompt ("python", "ts", "golang").
     * Bare extensions that double as English words ("go") are not names.
     */
    public static Optional<Language> fromPromptWord(String word) {
        return Optional.ofNullable(BY_NAME.get(word.toLowerCase(Locale.ROOT)));
    }

    /** Resolves an extension written without its dot ("py", "go"). */
    public static Optional<Language> fromExtension(String extension) {
        return Optional.ofNullable(BY_EXTENSION.get("." + extension.toLowerCase(Locale.ROOT)));
    }

    /** True when {@code word} is the extension (without dot) of a known language. */
    public static boolean isKnownExtension(String word) {
        return BY_EXTENSION.containsKey("." + word.toLowerCase(Locale.ROOT));
    }
}
