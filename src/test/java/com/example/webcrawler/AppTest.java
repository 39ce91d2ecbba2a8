package com.example.webcrawler;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import com.example.webcrawler.report.CrawlSummary;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppTest {
    @Test
    void emptyUrlFileIsFatal() throws Exception {
        Path dir = Files.createTempDirectory("app-test");
        Path urlFile = Files.writeString(dir.resolve("urls.txt"), "\n# nothing\n");

        int exitCode = new CommandLine(new App()).execute(urlFile.toString(), "--output-dir", dir.resolve("out").toString());

        assertEquals(App.EXIT_FATAL, exitCode);
        assertFalse(Files.exists(dir.resolve("out").resolve("crawl-summary.json")));
    }

    @Test
    void invalidSettingsAreFatal() throws Exception {
        Path dir = Files.createTempDirectory("app-test");
        String out = dir.resolve("out").toString();

        assertEquals(App.EXIT_FATAL, new CommandLine(new App())
                .execute("--url", "http://a.test/", "--percentage", "150", "--output-dir", out));
        assertEquals(App.EXIT_FATAL, new CommandLine(new App())
                .execute("--url", "http://a.test/", "--log-level", "LOUD", "--output-dir", out));
    }

    @Test
    void unknownOptionIsAUsageError() {
        assertEquals(2, new CommandLine(new App()).execute("--no-such-option"));
    }

    @Test
    void eachRunLogsOnlyToItsOwnLogFile() throws Exception {
        Path first = Files.createTempDirectory("app-test");
        Path second = Files.createTempDirectory("app-test");
        Path firstUrls = Files.writeString(first.resolve("first-urls.txt"), "");
        Path secondUrls = Files.writeString(second.resolve("second-urls.txt"), "");

        new CommandLine(new App()).execute(firstUrls.toString(), "--output-dir", first.resolve("out").toString());
        new CommandLine(new App()).execute(secondUrls.toString(), "--output-dir", second.resolve("out").toString());

        ch.qos.logback.classic.Logger root = ((LoggerContext) LoggerFactory.getILoggerFactory())
                .getLogger(Logger.ROOT_LOGGER_NAME);
        List<String> logFiles = new ArrayList<>();
        root.iteratorForAppenders().forEachRemaining(appender -> {
            if (appender instanceof FileAppender<ILoggingEvent> file && App.LOG_FILE_APPENDER.equals(file.getName())) {
                logFiles.add(file.getFile());
            }
        });
        assertEquals(List.of(second.resolve("out").resolve("crawler.log").toString()), logFiles);

        String firstLog = Files.readString(first.resolve("out").resolve("crawler.log"));
        String secondLog = Files.readString(second.resolve("out").resolve("crawler.log"));
        assertTrue(firstLog.contains("first-urls.txt"));
        assertFalse(firstLog.contains("second-urls.txt"));
        assertTrue(secondLog.contains("second-urls.txt"));
    }

    @Test
    void abortedCrawlExitsWithFailure() {
        assertEquals(App.EXIT_FATAL, App.exitCode(summary(CrawlState.ABORTED)));
        assertEquals(0, App.exitCode(summary(CrawlState.COMPLETED)));
        assertEquals(0, App.exitCode(summary(CrawlState.PAUSED)));
    }

    @Test
    void crawlsALocalSiteAndWritesTheSummary() throws Exception {
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            String body = exchange.getRequestURI().getPath().equals("/")
                    ? "<html><body><a href=\"/one\">1</a><a href=\"/two\">2</a></body></html>"
                    : "<html><body><a href=\"/\">home</a></body></html>";
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "text/html");
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
        try {
            Path dir = Files.createTempDirectory("app-test");
            Path out = dir.resolve("out");
            String seed = "http://127.0.0.1:" + server.getAddress().getPort() + "/";

            int exitCode = new CommandLine(new App()).execute(
                    "--url", seed, "--depth", "1", "-c", "2", "--exfiltrate", "--output-dir", out.toString());

            assertEquals(0, exitCode);
            JsonNode summary = new ObjectMapper().readTree(out.resolve("crawl-summary.json").toFile());
            assertEquals("COMPLETED", summary.get("state").asText());
            assertEquals(3, summary.get("visitedCount").asInt());
            assertEquals(1, summary.get("longestPathLength").asInt());
            assertTrue(Files.exists(out.resolve("crawler.log")));
            assertFalse(Files.exists(out.resolve("checkpoint.json")));
        } finally {
            server.stop(0);
        }
    }

    private static CrawlSummary summary(CrawlState state) {
        Instant now = Instant.now();
        return new CrawlSummary(state, now, now, List.of("http://a.test/"), 1, 1, 0, 0, List.of(), List.of(), null, null);
    }
}
