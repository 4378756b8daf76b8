package com.williamcallahan.gvtakeout.media;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps an attachment reference from a message to a file in the export directory.
 *
 * <p>References look like {@code "Tony Smehrik - Text - 2022-07-01T01_06_39Z-2-1"} while the file on
 * disk may carry an extension or drop the final {@code -N} counter. The last space-separated token
 * is matched against file names; when nothing matches, the trailing counter is stripped and the
 * lookup runs once more. Candidates are ordered by file name, so the same listing always yields the
 * same file.</p>
 */
@Component
public class MediaFileResolver {
    private static final Logger log = LoggerFactory.getLogger(MediaFileResolver.class);

    private static final Pattern TRAILING_COUNTER = Pattern.compile("-\\d+$");
    private static final String MARKUP_EXTENSION = ".html";

    /**
     * Resolves an attachment reference to a regular file directly inside {@code directory}.
     *
     * @param reference attachment reference as written in the markup
     * @param directory directory holding the export files
     * @return the first matching file by name, or empty when none matches or the directory cannot be listed
     */
    public Optional<Path> resolve(String reference, Path directory) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        String token = lastToken(reference);
        Optional<Path> match = findContaining(token, directory);
        if (match.isPresent()) {
            return match;
        }
        String withoutCounter = TRAILING_COUNTER.matcher(token).replaceFirst("");
        if (withoutCounter.isEmpty() || withoutCounter.equals(token)) {
            log.warn("No media file for reference '{}' in {}", reference, directory);
            return Optional.empty();
        }
        match = findContaining(withoutCounter, directory);
        if (match.isEmpty()) {
            log.warn("No media file for reference '{}' in {} (also tried '{}')", reference, directory, withoutCounter);
        }
        return match;
    }

    static String lastToken(String reference) {
        String[] tokens = reference.trim().split(" ");
        return tokens[tokens.length - 1];
    }

    private Optional<Path> findContaining(String token, Path directory) {
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(path -> {
                        String fileName = path.getFileName().toString();
                        return fileName.contains(token)
                                && !fileName.toLowerCase(Locale.ROOT).endsWith(MARKUP_EXTENSION);
                    })
                    .min(Comparator.comparing(path -> path.getFileName().toString()));
        } catch (IOException e) {
            log.warn("Unable to list {} while resolving media '{}': {}", directory, token, e.getMessage());
            return Optional.empty();
        }
    }
}
