package com.example.webcrawler;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SeedLoaderTest {
    @Test
    void readsNormalizedSeedsSkippingCommentsAndDuplicates() throws Exception {
        Path file = Files.createTempFile("seeds", ".txt");
        Files.writeString(file, """
                # seeds for the nightly crawl
                https://Example.com/

                example.com
                http://other.test/docs/#intro
                not a url
                """);

        List<String> seeds = new SeedLoader().load(Optional.of(file.toString()), Optional.of("https://extra.test"));

        assertEquals(List.of("https://example.com/", "http://other.test/docs", "https://extra.test/"), seeds);
    }

    @Test
    void emptyFileIsAConfigurationError() throws Exception {
        Path file = Files.createTempFile("seeds", ".txt");
        Files.writeString(file, "# nothing here\n\n");

        ConfigException ex = assertThrows(ConfigException.class,
                () -> new SeedLoader().load(Optional.of(file.toString()), Optional.empty()));
        assertEquals("No URLs given in URL file " + file, ex.getMessage());
    }

    @Test
    void fileWithOnlyInvalidUrlsIsAConfigurationError() throws Exception {
        Path file = Files.createTempFile("seeds", ".txt");
        Files.writeString(file, "ftp://files.test/\nhttp://exa mple.test/\n");

        assertThrows(ConfigException.class, () -> new SeedLoader().load(Optional.of(file.toString()), Optional.empty()));
    }

    @Test
    void missingFileOrNoSourceIsAConfigurationError() {
        SeedLoader loader = new SeedLoader();
        assertThrows(ConfigException.class, () -> loader.load(Optional.of("/no/such/seeds.txt"), Optional.empty()));
        assertThrows(ConfigException.class, () -> loader.load(Optional.empty(), Optional.empty()));
    }

    @Test
    void dashReadsStandardInput() {
        ByteArrayInputStream stdin = new ByteArrayInputStream("a.test\nhttp://b.test/x\n".getBytes(StandardCharsets.UTF_8));

        List<String> seeds = new SeedLoader(stdin).load(Optional.of("-"), Optional.empty());

        assertEquals(List.of("https://a.test/", "http://b.test/x"), seeds);
    }
}
