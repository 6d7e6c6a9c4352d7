package com.codeforge.orchestrator.pipeline.stage;

import java.util.Locale;
import java.util.Optional;

/** Languages the reviewer and tester recognise, by file extension. */
enum SourceLanguage {
    PYTHON("python", "tests", "#", ".py"),
    JAVASCRIPT("javascript", "__tests__", "//", ".js", ".jsx"),
    TYPESCRIPT("typescript", "__tests__", "//", ".ts", ".tsx"),
    JAVA("java", null, "//", ".java"),
    GO("go", null, "//", ".go"),
    RUST("rust", null, "//", ".rs"),
    CPP("c++", null, "//", ".cpp"),
    C("c", null, "//", ".c");

    private final String   label;
    private final String   testDir;
    private final String   commentPrefix;
    private final String[] extensions;

    SourceLanguage(String label, String testDir, String commentPrefix, String... extensions) {
        this.label         = label;
        this.testDir       = testDir;
        this.commentPrefix = commentPrefix;
        this.extensions    = extensions;
    }

    String label()         { return label; }
    String commentPrefix() { return commentPrefix; }

    /** Only languages with a test directory get generated tests. */
    boolean testable()     { return testDir != null; }

    static Optional<SourceLanguage> of(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        for (SourceLanguage lang : values()) {
            for (String ext : lang.extensions) {
                if (lower.endsWith(ext)) return Optional.of(lang);
            }
        }
        return Optional.empty();
    }

    static String extension(String path) {
        String name = fileName(path);
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot);
    }

    static String stem(String path) {
        String name = fileName(path);
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? name : name.substring(0, dot);
    }

    /** {@code tests/test_<stem><ext>} or {@code __tests__/test_<stem><ext>}. */
    String testPathFor(String path) {
        return testDir + "/test_" + stem(path) + extension(path);
    }

    private static String fileName(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }
}
