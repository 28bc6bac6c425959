package com.codemigration.metagraph.pipeline;

import com.codemigration.metagraph.metadata.MetadataService;
import com.codemigration.metagraph.model.entity.Project;
import com.codemigration.metagraph.model.entity.ProjectState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Runs one project from the command line:
 * <pre>
 *   --source-dir=legacy/app [--name=app] [--target-language=java] [--target-framework=spring-boot] [--export=graph.json]
 * </pre>
 * Without {@code --source-dir} the application only hosts the pipeline beans.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineCommandLineRunner implements ApplicationRunner {

    private final PipelineOrchestrator orchestrator;
    private final MetadataService metadataService;

    @Override
    public void run(ApplicationArguments args) {
        String sourceDir = option(args, "source-dir");
        if (sourceDir == null) {
            return;
        }
        Project project = orchestrator.createProject(ProjectIntake.builder()
            .name(option(args, "name"))
            .sourceDir(sourceDir)
            .sourceLanguage(option(args, "source-language"))
            .targetLanguage(option(args, "target-language"))
            .targetFramework(option(args, "target-framework"))
            .build());

        ProjectState state = orchestrator.runToCompletion(project.getId());
        ProjectStatus status = orchestrator.getStatus(project.getId());
        log.info("Project {} ended as {} ({} pending feedback, {} reports)", project.getId(), state.tag(),
            status.pendingFeedback(), status.reports());
        log.info("Summary: {}", metadataService.summarize(project.getId()));

        String export = option(args, "export");
        if (export != null) {
            try {
                Files.writeString(Path.of(export), metadataService.exportJson(project.getId(), Set.of(), Set.of()),
                    StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot write graph export to " + export, e);
            }
            log.info("Graph exported to {}", export);
        }
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
