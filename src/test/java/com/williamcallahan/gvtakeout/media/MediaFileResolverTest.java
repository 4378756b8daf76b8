package com.williamcallahan.gvtakeout.media;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Verifies attachment references resolve to export files deterministically.
 */
class MediaFileResolverTest {

    private static final String REFERENCE = "Tony Smehrik - Text - 2022-07-01T01_06_39Z-2-1";

    @TempDir
    Path tempDir;

    private final MediaFileResolver resolver = new MediaFileResolver();

    @Test
    void resolve_matchesFileContainingLastToken() throws IOException {
        Path image = Files.write(tempDir.resolve("Tony Smehrik - Text - 2022-07-01T01_06_39Z-2-1.jpg"), new byte[] {1});
        Files.writeString(tempDir.resolve("Tony Smehrik - Text - 2022-07-01T01_06_39Z-2-1.html"), "<html/>");

        assertEquals(image, resolver.resolve(REFERENCE, tempDir).orElseThrow());
    }

    @Test
    void resolve_retriesWithoutTrailingCounter() throws IOException {
        Path image = Files.write(tempDir.resolve("Tony Smehrik - Text - 2022-07-01T01_06_39Z-2.jpg"), new byte[] {1});

        assertEquals(image, resolver.resolve(REFERENCE, tempDir).orElseThrow());
    }

    @Test
    void resolve_picksSmallestFileNameAmongCandidates() throws IOException {
        Files.write(tempDir.resolve("b 2022-07-01T01_06_39Z-2-1.jpg"), new byte[] {1});
        Path first = Files.write(tempDir.resolve("a 2022-07-01T01_06_39Z-2-1.gif"), new byte[] {1});

        assertEquals(first, resolver.resolve(REFERENCE, tempDir).orElseThrow());
    }

    @Test
    void resolve_returnsEmptyWhenNothingMatches() throws IOException {
        Files.write(tempDir.resolve("unrelated.jpg"), new byte[] {1});

        assertTrue(resolver.resolve(REFERENCE, tempDir).isEmpty());
        assertTrue(resolver.resolve(" ", tempDir).isEmpty());
    }

    @Test
    void resolve_returnsEmptyForMissingDirectory() {
        assertTrue(resolver.resolve(REFERENCE, tempDir.resolve("missing")).isEmpty());
    }

    @Test
    void lastToken_takesFinalSpaceSeparatedWord() {
        assertEquals("2022-07-01T01_06_39Z-2-1", MediaFileResolver.lastToken(REFERENCE));
        assertEquals("single", MediaFileResolver.lastToken("single"));
    }
}
