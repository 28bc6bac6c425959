package com.codemigration.metagraph.resolver;

import com.codemigration.metagraph.model.entity.ComponentType;
import com.codemigration.metagraph.model.entity.Provenance;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("File Classifier Tests")
class FileClassifierTest {

    private final FileClassifier classifier = new FileClassifier();

    private static FileFacts facts(String path, String language, List<String> functions, List<String> classKinds,
                                   int enums, List<String> imports) {
        return new FileFacts(path, language, "parsed", functions, classKinds,
            classKinds.stream().map(k -> "C" + k).toList(), enums, imports);
    }

    @Test
    @DisplayName("Should classify markup, config formats and sql by language")
    void testLanguageRule() {
        assertEquals(ComponentType.UI, classifier.classify(facts("index.html", "html", List.of(), List.of(), 0,
            List.of())).type());
        assertEquals(ComponentType.CONFIG, classifier.classify(facts("app.yaml", "yaml", List.of(), List.of(), 0,
            List.of())).type());
        assertEquals(ComponentType.DATA, classifier.classify(facts("schema.sql", "sql", List.of(), List.of(), 0,
            List.of())).type());
    }

    @Test
    @DisplayName("Should let directory naming override the language")
    void testPathRule_ShouldOverrideLanguage() {
        Classification classification = classifier.classify(facts("app/templates/base.html", "html", List.of(),
            List.of(), 0, List.of()));
        assertEquals(ComponentType.UI, classification.type());

        Classification model = classifier.classify(facts("shop/models/order.py", "python", List.of("total"),
            List.of("plain"), 0, List.of()));
        assertEquals(ComponentType.DATA, model.type());
        assertEquals(Provenance.SYNTAX, model.source());
        assertTrue(model.reason().contains("/model"));

        assertEquals(ComponentType.CONFIG, classifier.classify(facts("config/defaults.json", "json", List.of(),
            List.of(), 0, List.of())).type());
    }

    @Test
    @DisplayName("Should treat well-known config file names as config")
    void testConfigFileName() {
        assertEquals(ComponentType.CONFIG, classifier.classify(facts("settings.py", "python", List.of(),
            List.of(), 0, List.of())).type());
    }

    @Test
    @DisplayName("Should classify by ui and persistence library imports")
    void testImportRule() {
        assertEquals(ComponentType.UI, classifier.classify(facts("window.py", "python", List.of("show"),
            List.of(), 0, List.of("tkinter.ttk"))).type());
        assertEquals(ComponentType.DATA, classifier.classify(facts("Repo.java", "java", List.of(),
            List.of("plain"), 0, List.of("java.sql.Connection"))).type());
        assertEquals(ComponentType.LOGIC, classifier.classify(facts("helpers.py", "python", List.of("fmt"),
            List.of(), 0, List.of("reactor"))).type(), "Prefix match respects module boundaries");
    }

    @Test
    @DisplayName("Should tell data-only files from logic by their entities")
    void testEntityRule() {
        assertEquals(ComponentType.DATA, classifier.classify(facts("point.py", "python", List.of(),
            List.of("dataclass"), 1, List.of())).type());
        assertEquals(ComponentType.LOGIC, classifier.classify(facts("main.py", "python", List.of("main"),
            List.of("singleton"), 0, List.of("utils"))).type());
    }

    @Test
    @DisplayName("Should leave files without entities unknown")
    void testNoEntities_ShouldBeUnknown() {
        Classification classification = classifier.classify(facts("utils.py", "python", List.of(), List.of(), 0,
            List.of()));

        assertEquals(ComponentType.UNKNOWN, classification.type());
        assertEquals("no declared entities", classification.reason());
    }
}
