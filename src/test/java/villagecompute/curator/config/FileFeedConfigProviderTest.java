package villagecompute.curator.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.ObjectMapper;

import villagecompute.curator.exceptions.ValidationException;

class FileFeedConfigProviderTest {

    private static final String CONFIG = """
            {
              "feeds": [
                {
                  "id": "tech",
                  "name": "Tech",
                  "sources": [{"type": "rss", "url": "https://example.com/feed.xml"}],
                  "outputs": {
                    "recap": {
                      "enabled": true,
                      "schedule": "0 8 * * 1",
                      "transform": [{"plugin": "summarize", "config": {"maxWords": 40}}],
                      "distribute": [{"plugin": "telegram", "config": {"chat": "@tech"}, "transform": [{"plugin": "markdown"}]}]
                    },
                    "rss": {"enabled": true}
                  }
                },
                {"id": "quiet", "name": "Quiet"}
              ]
            }
            """;

    @TempDir
    Path tempDir;

    private FileFeedConfigProvider provider;
    private Path configFile;

    @BeforeEach
    void setUp() {
        configFile = tempDir.resolve("curate.config.json");
        provider = new FileFeedConfigProvider();
        provider.objectMapper = new ObjectMapper();
        provider.configPath = configFile.toString();
    }

    @Test
    void testGetFeeds_parsesRecapOutput() throws IOException {
        Files.writeString(configFile, CONFIG);

        FeedConfig tech = provider.getFeed("tech").orElseThrow();

        assertTrue(tech.isRecapEnabled());
        RecapConfig recap = tech.recap();
        assertEquals("0 8 * * 1", recap.scheduleOrDefault());
        assertEquals("summarize", recap.transform().get(0).plugin());
        assertEquals(40, recap.transform().get(0).config().get("maxWords"));
        assertEquals("@tech", recap.distribute().get(0).config().get("chat"));
        assertEquals("markdown", recap.distribute().get(0).transform().get(0).plugin());
        assertTrue(recap.batchTransform().isEmpty());
    }

    @Test
    void testGetFeeds_feedWithoutOutputs() throws IOException {
        Files.writeString(configFile, CONFIG);

        FeedConfig quiet = provider.getFeed("quiet").orElseThrow();

        assertFalse(quiet.isRecapEnabled());
        assertEquals(2, provider.getFeeds().size());
        assertTrue(provider.getFeed("missing").isEmpty());
    }

    @Test
    void testGetFeeds_missingFile_isEmpty() {
        assertTrue(provider.getFeeds().isEmpty());
    }

    @Test
    void testGetFeeds_malformedFile_throwsValidation() throws IOException {
        Files.writeString(configFile, "{ \"feeds\": [ ");

        assertThrows(ValidationException.class, () -> provider.getFeeds());
    }

    @Test
    void testReload_picksUpChanges() throws IOException {
        Files.writeString(configFile, CONFIG);
        assertEquals(2, provider.getFeeds().size());

        Files.writeString(configFile, "{\"feeds\": [{\"id\": \"solo\", \"name\": \"Solo\"}]}");
        assertEquals(2, provider.getFeeds().size());

        provider.reload();
        assertEquals(1, provider.getFeeds().size());
        assertEquals("Solo", provider.getFeed("solo").orElseThrow().name());
    }
}
