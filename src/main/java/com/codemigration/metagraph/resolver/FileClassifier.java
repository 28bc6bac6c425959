package com.codemigration.metagraph.resolver;

import com.codemigration.metagraph.model.entity.ComponentType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static java.util.Map.entry;

/**
 * Rule-based file classification. Rules run in order and the first decisive one wins:
 * <ol>
 *   <li>language (markup and styles are ui, structured config formats are config, sql/csv are data)</li>
 *   <li>directory naming ({@code /ui/}, {@code /view}, {@code /template}, {@code /data/}, {@code /model},
 *       {@code /entity}, {@code /config/}, {@code /setting}), which overrides the language rule</li>
 *   <li>imports of well-known ui or persistence libraries</li>
 *   <li>declared entities: data-only classes and enums are data, anything else with code is logic</li>
 * </ol>
 * A file no rule decides is {@link ComponentType#UNKNOWN}.
 */
@Component
public class FileClassifier {

    private static final Map<String, ComponentType> BY_LANGUAGE = Map.ofEntries(
        entry("html", ComponentType.UI),
        entry("css", ComponentType.UI),
        entry("scss", ComponentType.UI),
        entry("sass", ComponentType.UI),
        entry("react", ComponentType.UI),
        entry("json", ComponentType.CONFIG),
        entry("yaml", ComponentType.CONFIG),
        entry("xml", ComponentType.CONFIG),
        entry("toml", ComponentType.CONFIG),
        entry("ini", ComponentType.CONFIG),
        entry("config", ComponentType.CONFIG),
        entry("sql", ComponentType.DATA),
        entry("csv", ComponentType.DATA));

    private static final List<Map.Entry<String, ComponentType>> BY_PATH = List.of(
        entry("/ui/", ComponentType.UI),
        entry("/view", ComponentType.UI),
        entry("/template", ComponentType.UI),
        entry("/data/", ComponentType.DATA),
        entry("/model", ComponentType.DATA),
        entry("/entity", ComponentType.DATA),
        entry("/config/", ComponentType.CONFIG),
        entry("/setting", ComponentType.CONFIG));

    private static final List<String> UI_LIBRARIES = List.of("tkinter", "pyqt", "pyside", "wx", "kivy",
        "flask.render_template", "django.shortcuts", "django.views", "jinja2", "javax.swing", "java.awt",
        "javafx", "android.widget", "android.view", "react", "vue", "angular");

    private static final List<String> DATA_LIBRARIES = List.of("sqlalchemy", "django.db", "sqlite3", "psycopg2",
        "pymongo", "peewee", "pandas", "java.sql", "javax.persistence", "jakarta.persistence",
        "org.hibernate", "org.springframework.data");

    private static final Set<String> DATA_CLASS_KINDS = Set.of("dataclass", "record");

    private static final Set<String> CONFIG_FILE_NAMES = Set.of("settings", "config", "configuration", "constants",
        "conf");

    public Classification classify(FileFacts facts) {
        String lowerPath = "/" + facts.path().toLowerCase(Locale.ROOT);

        for (Map.Entry<String, ComponentType> rule : BY_PATH) {
            if (lowerPath.contains(rule.getKey())) {
                return Classification.syntax(rule.getValue(), "path contains " + rule.getKey());
            }
        }
        ComponentType byLanguage = BY_LANGUAGE.get(facts.language());
        if (byLanguage != null) {
            return Classification.syntax(byLanguage, "language " + facts.language());
        }

        String baseName = baseName(lowerPath);
        if (CONFIG_FILE_NAMES.contains(baseName)) {
            return Classification.syntax(ComponentType.CONFIG, "file name " + baseName);
        }

        for (String module : facts.imports()) {
            String lower = module.toLowerCase(Locale.ROOT);
            if (matchesLibrary(lower, UI_LIBRARIES)) {
                return Classification.syntax(ComponentType.UI, "imports " + module);
            }
            if (matchesLibrary(lower, DATA_LIBRARIES)) {
                return Classification.syntax(ComponentType.DATA, "imports " + module);
            }
        }

        if (!facts.hasEntities()) {
            return Classification.syntax(ComponentType.UNKNOWN, "no declared entities");
        }
        boolean dataOnly = facts.functionNames().isEmpty()
            && facts.classKinds().stream().allMatch(DATA_CLASS_KINDS::contains);
        if (dataOnly) {
            return Classification.syntax(ComponentType.DATA, "declares only data classes and enums");
        }
        return Classification.syntax(ComponentType.LOGIC, "declares functions or behavioural classes");
    }

    private static boolean matchesLibrary(String module, List<String> libraries) {
        for (String library : libraries) {
            if (module.equals(library) || module.startsWith(library + ".") || module.startsWith(library + "/")) {
                return true;
            }
        }
        return false;
    }

    private static String baseName(String path) {
        String name = path.substring(path.lastIndexOf('/') + 1);
        int dot = name.indexOf('.');
        return dot < 0 ? name : name.substring(0, dot);
    }
}
