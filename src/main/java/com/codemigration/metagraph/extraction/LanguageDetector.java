package com.codemigration.metagraph.extraction;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static java.util.Map.entry;

/**
 * Maps file extensions to language tags.
 */
@Component
public class LanguageDetector {

    public static final String UNKNOWN = "unknown";

    private static final Map<String, String> EXTENSIONS = Map.ofEntries(
        entry("py", "python"),
        entry("js", "javascript"),
        entry("ts", "typescript"),
        entry("jsx", "react"),
        entry("tsx", "react"),
        entry("html", "html"),
        entry("htm", "html"),
        entry("css", "css"),
        entry("scss", "scss"),
        entry("sass", "sass"),
        entry("java", "java"),
        entry("kt", "kotlin"),
        entry("kts", "kotlin"),
        entry("c", "c"),
        entry("cpp", "cpp"),
        entry("h", "c_header"),
        entry("hpp", "cpp_header"),
        entry("cs", "csharp"),
        entry("go", "go"),
        entry("rs", "rust"),
        entry("rb", "ruby"),
        entry("php", "php"),
        entry("swift", "swift"),
        entry("m", "objective_c"),
        entry("mm", "objective_cpp"),
        entry("sql", "sql"),
        entry("json", "json"),
        entry("xml", "xml"),
        entry("yaml", "yaml"),
        entry("yml", "yaml"),
        entry("md", "markdown"),
        entry("cob", "cobol"),
        entry("cbl", "cobol"),
        entry("dpr", "delphi"),
        entry("pas", "pascal"),
        entry("f", "fortran"),
        entry("f90", "fortran"),
        entry("sh", "shell"),
        entry("bat", "batch"),
        entry("ps1", "powershell"),
        entry("config", "config"),
        entry("toml", "toml"),
        entry("ini", "ini"),
        entry("csv", "csv"),
        entry("txt", "text"));

    /** Languages whose files hold no program structure worth parsing or inferring. */
    private static final Set<String> NON_CODE = Set.of("json", "xml", "yaml", "markdown", "config", "toml",
        "ini", "csv", "text", "css", "scss", "sass", UNKNOWN);

    public String detect(String path) {
        String name = path.substring(path.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return UNKNOWN;
        }
        return EXTENSIONS.getOrDefault(name.substring(dot + 1).toLowerCase(Locale.ROOT), UNKNOWN);
    }

    public boolean isCode(String language) {
        return !NON_CODE.contains(language);
    }
}
