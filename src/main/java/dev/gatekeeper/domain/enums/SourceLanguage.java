package dev.gatekeeper.domain.enums;

import java.util.Map;

/**
 * Source language detected from a file extension. {@link #TEXT} means "not a recognized source file".
 */
public enum SourceLanguage {
    C, CPP, CSHARP, GO, JAVA, JAVASCRIPT, KOTLIN, PHP, PYTHON, RUBY, RUST, SCALA, SHELL, SQL, SWIFT,
    TYPESCRIPT, TEXT;

    private static final Map<String, SourceLanguage> BY_EXTENSION = Map.ofEntries(
            Map.entry(".c", C),
            Map.entry(".cc", CPP),
            Map.entry(".cpp", CPP),
            Map.entry(".cs", CSHARP),
            Map.entry(".go", GO),
            Map.entry(".java", JAVA),
            Map.entry(".js", JAVASCRIPT),
            Map.entry(".jsx", JAVASCRIPT),
            Map.entry(".kt", KOTLIN),
            Map.entry(".php", PHP),
            Map.entry(".py", PYTHON),
            Map.entry(".rb", RUBY),
            Map.entry(".rs", RUST),
            Map.entry(".scala", SCALA),
            Map.entry(".sh", SHELL),
            Map.entry(".sql", SQL),
            Map.entry(".swift", SWIFT),
            Map.entry(".ts", TYPESCRIPT),
            Map.entry(".tsx", TYPESCRIPT));

    public static SourceLanguage detect(String path) {
        if (path == null) return TEXT;
        String lower = path.toLowerCase();
        int slash = lower.lastIndexOf('/');
        int dot = lower.lastIndexOf('.');
        if (dot <= slash + 1) return TEXT;
        return BY_EXTENSION.getOrDefault(lower.substring(dot), TEXT);
    }

    public boolean isRecognizedSource() {
        return this != TEXT;
    }
}
