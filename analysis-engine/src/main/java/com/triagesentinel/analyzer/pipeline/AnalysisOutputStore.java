package com.triagesentinel.analyzer.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.triagesentinel.analyzer.analysis.AnalysisResult;
import com.triagesentinel.analyzer.config.PipelineConfig;
import com.triagesentinel.analyzer.util.JsonFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Analysis documents, one per content hash: {@code <output-dir>/<hash>.json}.
 *
 * @author Naveed Gung
 */
@Component
public class AnalysisOutputStore {

    private static final Logger log = LoggerFactory.getLogger(AnalysisOutputStore.class);

    private final Path outputDir;
    private final ObjectMapper objectMapper;

    public AnalysisOutputStore(PipelineConfig config, ObjectMapper objectMapper) {
        this.outputDir = config.outputPath();
        this.objectMapper = objectMapper;
    }

    public Path pathFor(String contentHash) {
        return outputDir.resolve(contentHash + ".json");
    }

    /**
     * Persist a result, replacing any earlier document for the same hash.
     *
     * @return where the document was written
     */
    public Path write(String contentHash, AnalysisResult result) throws IOException {
        Path target = pathFor(contentHash);
        JsonFiles.writeReplacing(target, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(result));
        return target;
    }

    /**
     * Read a document back.
     *
     * @return empty if the path is unset, missing or unreadable
     */
    public Optional<AnalysisResult> read(String path) {
        if (path == null || path.isEmpty()) {
            return Optional.empty();
        }
        Path file = Path.of(path);
        if (!Files.isRegularFile(file)) {
            log.warn("Analysis document {} not found", file);
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), AnalysisResult.class));
        } catch (IOException e) {
            log.warn("Failed to read analysis document {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
