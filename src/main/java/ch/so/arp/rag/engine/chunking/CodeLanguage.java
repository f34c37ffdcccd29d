package ch.so.arp.rag.engine.chunking;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Languages the code splitter understands, each with the pattern of a line
 * that opens a top-level or member declaration.
 */
public enum CodeLanguage {

    JAVA("^\\s{0,4}(?:@\\w+.*|(?:public|protected|private|static|final|abstract|sealed|default|synchronized)\\s.*|(?:class|interface|enum|record)\\s+\\w+.*)$",
            "java"),
    KOTLIN("^\\s{0,4}(?:@\\w+.*|(?:(?:public|private|internal|protected|open|data|sealed|abstract|override|suspend|inline)\\s+)*(?:fun|class|object|interface|val|var)\\s.*)$",
            "kotlin", "kt"),
    SCALA("^\\s{0,2}(?:(?:private|protected|override|final|sealed|abstract|implicit|case)\\s+)*(?:def|class|object|trait|val|var)\\s.*$",
            "scala"),
    CSHARP("^\\s{0,8}(?:\\[\\w+.*|(?:public|protected|private|internal|static|sealed|abstract|partial|override|async)\\s.*|(?:class|interface|struct|enum|namespace)\\s+\\w+.*)$",
            "csharp", "c#", "cs"),
    C("^(?:[A-Za-z_][\\w\\s\\*]*\\s+\\**[A-Za-z_]\\w*\\s*\\(.*|struct\\s+\\w+.*|typedef\\s.*|#define\\s.*)$",
            "c", "h"),
    CPP("^\\s{0,4}(?:template\\s*<.*|namespace\\s+\\w+.*|(?:class|struct)\\s+\\w+.*|[A-Za-z_][\\w:<>,\\s\\*&]*\\s+[\\*&]*[A-Za-z_][\\w:~]*\\s*\\(.*)$",
            "cpp", "c++", "cc", "hpp"),
    GO("^(?:func|type|var|const)\\s.*$", "go", "golang"),
    RUST("^\\s{0,4}(?:#\\[.*|(?:pub(?:\\([^)]*\\))?\\s+)?(?:async\\s+)?(?:fn|struct|enum|trait|impl|mod|type|const|static)\\b.*)$",
            "rust", "rs"),
    JAVASCRIPT("^\\s{0,2}(?:export\\s+)?(?:default\\s+)?(?:async\\s+)?(?:function\\*?\\s|class\\s|const\\s|let\\s|var\\s).*$",
            "javascript", "js", "jsx"),
    TYPESCRIPT("^\\s{0,2}(?:export\\s+)?(?:default\\s+)?(?:declare\\s+)?(?:abstract\\s+)?(?:async\\s+)?(?:function\\*?\\s|class\\s|interface\\s|type\\s|enum\\s|namespace\\s|const\\s|let\\s).*$",
            "typescript", "ts", "tsx"),
    PYTHON("^\\s{0,4}(?:@\\w.*|(?:async\\s+)?def\\s.*|class\\s.*)$", "python", "py"),
    RUBY("^\\s{0,2}(?:def|class|module)\\s.*$", "ruby", "rb"),
    PHP("^\\s{0,4}(?:(?:public|protected|private|static|abstract|final)\\s+)*(?:function|class|interface|trait)\\s.*$",
            "php"),
    SWIFT("^\\s{0,4}(?:@\\w+.*|(?:(?:public|private|internal|fileprivate|open|static|final|override|mutating)\\s+)*(?:func|class|struct|enum|protocol|extension)\\s.*)$",
            "swift");

    private final Pattern declaration;
    private final List<String> names;

    CodeLanguage(String declaration, String... names) {
        this.declaration = Pattern.compile(declaration);
        this.names = List.of(names);
    }

    boolean opensDeclaration(String line) {
        return declaration.matcher(line).matches();
    }

    public static Optional<CodeLanguage> forName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(language -> language.names.contains(normalized)).findFirst();
    }
}
