package com.jupiter.query.provider.mock;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MockDatasetLoader Tests")
class MockDatasetLoaderTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private final MockDatasetLoader loader =
        new MockDatasetLoader(new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    @DisplayName("Should load records from a JSON array file")
    void shouldLoadFromFile() throws Exception {
        Path path = Path.of(getClass().getResource("/mock_events.json").toURI());

        List<Map<String, Object>> records = loader.load(path.toString());

        assertThat(records).hasSize(3);
        assertThat(records.get(0)).containsEntry("tenant_id", "acme");
        assertThat(records.get(2)).containsKey("tags");
        assertThat(records.get(2).get("tags")).isNull();
    }

    @Test
    @DisplayName("Should fall back to the built-in sample when the file is missing")
    void shouldUseDefaultsWhenMissing(@TempDir Path tempDir) {
        List<Map<String, Object>> records = loader.load(tempDir.resolve("absent.json").toString());

        assertThat(records).hasSize(4);
        assertThat(records).extracting(record -> record.get("tenant_id"))
            .containsExactly("main_tenant", "main_tenant", "main_tenant", "tenant_2");
        assertThat(records.get(3)).containsEntry("time", NOW.toString());
    }

    @Test
    @DisplayName("Should fall back to the built-in sample when the file is malformed")
    void shouldUseDefaultsWhenMalformed(@TempDir Path tempDir) throws Exception {
        Path broken = tempDir.resolve("broken.json");
        Files.writeString(broken, "{not json");

        assertThat(loader.load(broken.toString())).hasSize(4);
        assertThat(loader.load(null)).hasSize(4);
    }

    @Test
    @DisplayName("Should freeze records deeply")
    @SuppressWarnings("unchecked")
    void shouldFreezeRecords() {
        List<Map<String, Object>> records = loader.load("");
        Map<String, Object> user = (Map<String, Object>) records.get(0).get("user");

        assertThatThrownBy(() -> records.get(0).put("severity", "Low"))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> user.put("name", "root"))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> records.remove(0))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
