package com.repolens.core.graph;

import com.repolens.core.model.Language;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps each language to the import rules that apply to its files. New languages
 * are supported by registering another {@link ImportSyntax}.
 */
public final class ImportSyntaxRegistry {

    private final Map<Language, ImportSyntax> syntaxes = new EnumMap<>(Language.class);

    /** Registry with every built-in language group. */
    public static ImportSyntaxRegistry defaults() {
        var registry = new ImportSyntaxRegistry();
        registry.register(Language.PYTHON, new PythonImports());

        var scripts = new ScriptImports();
        registry.register(Language.JAVASCRIPT, scripts);
        registry.register(Language.TYPESCRIPT, scripts);

        var jvm = new JvmImports();
        registry.register(Language.JAVA, jvm);
        registry.register(Language.KOTLIN, jvm);
        registry.register(Language.SCALA, jvm);

        registry.register(Language.GO, new GoImports());

        var includes = new CIncludes();
        registry.register(Language.C, includes);
        registry.register(Language.CPP, includes);

        registry.register(Language.RUST, new RustImports());
        registry.register(Language.RUBY, new RubyImports());
        return registry;
    }

    public ImportSyntaxRegistry register(Language language, ImportSyntax syntax) {
        syntaxes.put(language, syntax);
        return this;
    }

    public Optional<ImportSyntax> forLanguage(Language language) {
        return Optional.ofNullable(syntaxes.get(language));
    }

    public boolean supports(Language language) {
        return syntaxes.containsKey(language);
    }
}
