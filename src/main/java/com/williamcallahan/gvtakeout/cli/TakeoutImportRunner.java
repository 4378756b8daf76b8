package com.williamcallahan.gvtakeout.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.gvtakeout.config.AppProperties;
import com.williamcallahan.gvtakeout.importer.ConversationSink;
import com.williamcallahan.gvtakeout.importer.ImportFailure;
import com.williamcallahan.gvtakeout.importer.ImportSummary;
import com.williamcallahan.gvtakeout.importer.JsonLinesConversationSink;
import com.williamcallahan.gvtakeout.importer.StoreConversationSink;
import com.williamcallahan.gvtakeout.importer.TakeoutImportService;
import com.williamcallahan.gvtakeout.storage.ConversationStore;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs one import over {@code app.takeout.input-dir} when {@code app.import.enabled=true}.
 */
@Component
@ConditionalOnProperty(prefix = "app.import", name = "enabled", havingValue = "true")
public class TakeoutImportRunner implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(TakeoutImportRunner.class);

    private final TakeoutImportService importService;
    private final ConversationStore conversationStore;
    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;

    public TakeoutImportRunner(TakeoutImportService importService, ConversationStore conversationStore,
                               ObjectMapper objectMapper, AppProperties appProperties) {
        this.importService = importService;
        this.conversationStore = conversationStore;
        this.objectMapper = objectMapper;
        this.appProperties = appProperties;
    }

    @Override
    public void run(String... args) throws IOException {
        AppProperties.Takeout takeout = appProperties.getTakeout();
        Path inputDir = Paths.get(takeout.getInputDir());
        if (!Files.isDirectory(inputDir)) {
            throw new IllegalArgumentException("Input directory does not exist: " + inputDir.toAbsolutePath());
        }

        log.info("===============================================");
        log.info("Starting takeout import");
        log.info("===============================================");
        log.info("Input directory: {}", inputDir.toAbsolutePath());
        log.info("Output format: {}", takeout.getFormat());
        log.info("Media capture: {}", takeout.isCaptureMedia() ? "ENABLED" : "DISABLED");

        long startTime = System.currentTimeMillis();
        ImportSummary summary = switch (takeout.getFormat()) {
            case JSON -> importAsJson(inputDir, takeout.getJsonOutput());
            case SQLITE -> importInto(inputDir, new StoreConversationSink(conversationStore));
        };
        long duration = System.currentTimeMillis() - startTime;

        log.info("===============================================");
        log.info("IMPORT COMPLETE in {} ms", duration);
        log.info("Files seen: {}", summary.filesSeen());
        log.info("Imported: {}", summary.imported());
        log.info("Failed: {}", summary.failures().size());
        for (ImportFailure failure : summary.failures()) {
            log.warn("  {} [{}] {}", failure.filePath(), failure.phase(), failure.details());
        }
        log.info("===============================================");
    }

    private ImportSummary importAsJson(Path inputDir, String jsonOutput) throws IOException {
        if (jsonOutput == null || jsonOutput.isBlank()) {
            Writer stdout = new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
            return importInto(inputDir, new JsonLinesConversationSink(objectMapper, stdout));
        }
        try (Writer fileWriter = Files.newBufferedWriter(Paths.get(jsonOutput), StandardCharsets.UTF_8)) {
            return importInto(inputDir, new JsonLinesConversationSink(objectMapper, fileWriter));
        }
    }

    private ImportSummary importInto(Path inputDir, ConversationSink sink) throws IOException {
        try (sink) {
            return importService.importDirectory(inputDir, sink);
        }
    }
}
