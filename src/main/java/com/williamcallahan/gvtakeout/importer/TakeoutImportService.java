package com.williamcallahan.gvtakeout.importer;

import com.williamcallahan.gvtakeout.extract.ConversationExtractor;
import com.williamcallahan.gvtakeout.extract.ExtractionOutcome;
import com.williamcallahan.gvtakeout.model.Conversation;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Stream;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Imports every markup file of a takeout directory into a {@link ConversationSink}.
 *
 * <p>Files are processed one at a time in file-name order. A file that fails to parse, extract or
 * store is recorded as a failure and the run continues with the next file.</p>
 */
@Service
public class TakeoutImportService {
    private static final Logger log = LoggerFactory.getLogger(TakeoutImportService.class);
    private static final Logger IMPORT_LOG = LoggerFactory.getLogger("IMPORT");

    private static final String MARKUP_EXTENSION = ".html";

    private final ConversationExtractor extractor;
    private final ImportFailureFactory failureFactory;

    public TakeoutImportService(ConversationExtractor extractor, ImportFailureFactory failureFactory) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.failureFactory = Objects.requireNonNull(failureFactory, "failureFactory");
    }

    /**
     * Imports the {@code *.html} files directly inside {@code directory}.
     *
     * @param directory takeout directory; subdirectories are not visited
     * @param sink destination for extracted conversations
     * @return totals and per-file failures
     * @throws IOException when the directory itself cannot be listed
     */
    public ImportSummary importDirectory(Path directory, ConversationSink sink) throws IOException {
        Objects.requireNonNull(directory, "directory");
        Objects.requireNonNull(sink, "sink");

        List<Path> files = markupFiles(directory);
        IMPORT_LOG.info("[IMPORT] Found {} markup files in {}", files.size(), directory);

        int imported = 0;
        List<ImportFailure> failures = new ArrayList<>();
        for (Path file : files) {
            TakeoutFileOutcome outcome = importFile(file, sink);
            if (outcome.imported()) {
                imported++;
            }
            outcome.failure().ifPresent(failures::add);
        }

        IMPORT_LOG.info("[IMPORT] Done: {} imported, {} failed of {} files", imported, failures.size(), files.size());
        return new ImportSummary(files.size(), imported, failures);
    }

    /**
     * Parses, extracts and writes a single file.
     */
    public TakeoutFileOutcome importFile(Path file, ConversationSink sink) {
        Path fileNamePath = file.getFileName();
        String fileName = fileNamePath == null ? file.toString() : fileNamePath.toString();

        final Document document;
        try {
            document = Jsoup.parse(file.toFile(), StandardCharsets.UTF_8.name());
        } catch (IOException parseException) {
            return failed(failureFactory.parseFailure(file, parseException));
        }

        final Conversation conversation;
        try {
            ExtractionOutcome outcome = extractor.extract(document);
            if (outcome instanceof ExtractionOutcome.Unrecognized unrecognized) {
                return failed(failureFactory.unrecognized(file, unrecognized.reason()));
            }
            conversation = outcome.conversation().orElseThrow().withSourceFile(fileName);
        } catch (RuntimeException extractException) {
            return failed(failureFactory.extractFailure(file, extractException));
        }

        try {
            sink.write(conversation, file.toAbsolutePath().getParent());
        } catch (IOException | RuntimeException storeException) {
            return failed(failureFactory.storeFailure(file, storeException));
        }

        IMPORT_LOG.info("[IMPORT] ✓ {} → {} ({} participants, {} messages)",
                fileName, conversation.type().wireName(),
                conversation.participants().size(), conversation.messages().size());
        return TakeoutFileOutcome.importedFile(conversation.type());
    }

    private TakeoutFileOutcome failed(ImportFailure failure) {
        IMPORT_LOG.error("[IMPORT] ✗ {} failed during {}: {}", failure.filePath(), failure.phase(), failure.details());
        return TakeoutFileOutcome.failedFile(failure);
    }

    private static List<Path> markupFiles(Path directory) throws IOException {
        try (Stream<Path> paths = Files.list(directory)) {
            List<Path> files = paths
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(MARKUP_EXTENSION))
                    .sorted()
                    .toList();
            log.debug("Listed {} markup files under {}", files.size(), directory);
            return files;
        }
    }
}
