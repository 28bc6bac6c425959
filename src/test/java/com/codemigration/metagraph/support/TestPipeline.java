package com.codemigration.metagraph.support;

import com.codemigration.metagraph.config.MigrationProperties;
import com.codemigration.metagraph.config.RetryProperties;
import com.codemigration.metagraph.extraction.CrossFileResolver;
import com.codemigration.metagraph.extraction.ExtractionEngine;
import com.codemigration.metagraph.extraction.FileExtractor;
import com.codemigration.metagraph.extraction.InferenceMerger;
import com.codemigration.metagraph.extraction.LanguageDetector;
import com.codemigration.metagraph.extraction.StructureScanner;
import com.codemigration.metagraph.extraction.parser.JavaSourceParser;
import com.codemigration.metagraph.extraction.parser.ParserRegistry;
import com.codemigration.metagraph.extraction.parser.PythonSkeletonParser;
import com.codemigration.metagraph.feedback.FeedbackService;
import com.codemigration.metagraph.inference.SemanticInference;
import com.codemigration.metagraph.pipeline.PipelineOrchestrator;
import com.codemigration.metagraph.pipeline.PipelineStage;
import com.codemigration.metagraph.pipeline.ProjectRegistry;
import com.codemigration.metagraph.pipeline.RetryExecutor;
import com.codemigration.metagraph.pipeline.stage.ClassificationStage;
import com.codemigration.metagraph.pipeline.stage.ContentAnalysisStage;
import com.codemigration.metagraph.pipeline.stage.HandoffStage;
import com.codemigration.metagraph.pipeline.stage.MappingStage;
import com.codemigration.metagraph.pipeline.stage.StrategyStage;
import com.codemigration.metagraph.pipeline.stage.StructureScanStage;
import com.codemigration.metagraph.planner.MappingGenerator;
import com.codemigration.metagraph.planner.MappingRuleTable;
import com.codemigration.metagraph.planner.StrategyScheduler;
import com.codemigration.metagraph.resolver.ClassificationService;
import com.codemigration.metagraph.resolver.ClosureService;
import com.codemigration.metagraph.resolver.DependencyGraphReader;
import com.codemigration.metagraph.resolver.FileClassifier;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * The whole pipeline wired by hand over an {@link InMemoryGraphStore}: direct executors, and a
 * retry policy that never sleeps.
 */
public final class TestPipeline {

    public static final Executor DIRECT = Runnable::run;

    public final InMemoryGraphStore store = new InMemoryGraphStore();
    public final MigrationProperties properties = new MigrationProperties();
    public final RetryProperties retryProperties = new RetryProperties();
    public final LanguageDetector languageDetector = new LanguageDetector();
    public final SemanticInference inference;

    public final StructureScanner structureScanner;
    public final ExtractionEngine extractionEngine;
    public final DependencyGraphReader graphReader;
    public final ClosureService closureService;
    public final FeedbackService feedbackService;
    public final ClassificationService classificationService;
    public final MappingGenerator mappingGenerator;
    public final StrategyScheduler strategyScheduler;
    public final ProjectRegistry registry;
    public final RetryExecutor retryExecutor;
    public final List<PipelineStage> stages;
    public final PipelineOrchestrator orchestrator;

    public TestPipeline(SemanticInference inference) {
        this.inference = inference;
        ParserRegistry parsers = new ParserRegistry(List.of(new PythonSkeletonParser(), new JavaSourceParser()));
        this.structureScanner = new StructureScanner(store, languageDetector, properties);
        FileExtractor fileExtractor = new FileExtractor(store, parsers, languageDetector, inference,
            new InferenceMerger(), properties);
        this.extractionEngine = new ExtractionEngine(store, structureScanner, fileExtractor,
            new CrossFileResolver(store), DIRECT);
        this.graphReader = new DependencyGraphReader(store);
        this.closureService = new ClosureService(store, graphReader, properties);
        this.feedbackService = new FeedbackService(store);
        this.classificationService = new ClassificationService(store, new FileClassifier(), inference,
            languageDetector, feedbackService);
        this.mappingGenerator = new MappingGenerator(store, new MappingRuleTable(), inference, feedbackService,
            properties);
        this.strategyScheduler = new StrategyScheduler(store, graphReader);
        this.registry = new ProjectRegistry(store);
        this.retryExecutor = new RetryExecutor(retryProperties, millis -> { });
        this.stages = List.of(
            new StructureScanStage(structureScanner, languageDetector, store),
            new ContentAnalysisStage(extractionEngine),
            new ClassificationStage(closureService, classificationService),
            new MappingStage(mappingGenerator),
            new StrategyStage(strategyScheduler),
            new HandoffStage(store));
        this.orchestrator = orchestrator(stages);
    }

    public PipelineOrchestrator orchestrator(List<PipelineStage> customStages) {
        return new PipelineOrchestrator(customStages, registry, store, feedbackService, retryExecutor, DIRECT);
    }

    /**
     * Write {@code files} (relative path to contents) under {@code root}.
     */
    public static Path sourceTree(Path root, Map<String, String> files) {
        files.forEach((path, contents) -> {
            Path target = root.resolve(path);
            try {
                Files.createDirectories(target.getParent());
                Files.writeString(target, contents, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
        return root;
    }
}
