package com.jupiter.query.provider.mock;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the OCSF sample records served by {@link MockQueryProvider}.
 *
 * Records come from a JSON array file when it exists, otherwise from a small
 * built-in sample set timestamped relative to the loader's clock. Either way
 * the result is deeply unmodifiable so it can be shared between threads.
 */
public class MockDatasetLoader {

    private static final Logger log = LoggerFactory.getLogger(MockDatasetLoader.class);

    private static final TypeReference<List<Map<String, Object>>> RECORDS = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public MockDatasetLoader(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * @param dataPath JSON file with an array of records, may be null or blank
     * @return frozen records
     */
    public List<Map<String, Object>> load(String dataPath) {
        if (dataPath != null && !dataPath.isBlank()) {
            Path path = Path.of(dataPath);
            if (Files.isRegularFile(path)) {
                try {
                    List<Map<String, Object>> records = objectMapper.readValue(path.toFile(), RECORDS);
                    log.info("Loaded {} mock records from {}", records.size(), path);
                    return freeze(records);
                } catch (IOException e) {
                    log.warn("Failed to load mock data from {}: {}. Using default data.", path, e.getMessage());
                }
            } else {
                log.info("Mock data file {} not found, using default data", path);
            }
        }
        return freeze(defaultRecords());
    }

    /**
     * Sample OCSF events: three for {@code main_tenant} and one for
     * {@code tenant_2}, all within the last five minutes.
     */
    public List<Map<String, Object>> defaultRecords() {
        Instant now = clock.instant();
        List<Map<String, Object>> records = new ArrayList<>();

        records.add(record(
            "time", now.minus(Duration.ofMinutes(5)).toString(),
            "tenant_id", "main_tenant",
            "class_uid", 1001,
            "category_uid", 1,
            "activity_name", "failed_login",
            "severity", "Medium",
            "user", Map.of("name", "john.doe", "uid", "1001"),
            "src_endpoint", Map.of("ip", "192.168.1.100", "port", 0),
            "dst_endpoint", Map.of("ip", "192.168.1.10", "port", 22),
            "device", Map.of("name", "WORKSTATION-01", "type", "Desktop"),
            "message", "Failed SSH login attempt"));

        records.add(record(
            "time", now.minus(Duration.ofMinutes(3)).toString(),
            "tenant_id", "main_tenant",
            "class_uid", 1002,
            "category_uid", 1,
            "activity_name", "process_started",
            "severity", "Low",
            "process", Map.of(
                "name", "powershell.exe",
                "cmd_line", "powershell.exe -ExecutionPolicy Bypass -File malware.ps1",
                "pid", 1234),
            "user", Map.of("name", "admin", "uid", "500"),
            "device", Map.of("name", "SERVER-01", "type", "Server"),
            "message", "Suspicious PowerShell process started"));

        records.add(record(
            "time", now.minus(Duration.ofMinutes(1)).toString(),
            "tenant_id", "main_tenant",
            "class_uid", 1003,
            "category_uid", 2,
            "activity_name", "file_created",
            "severity", "High",
            "file", Map.of(
                "name", "ransomware.exe",
                "path", "C:\\temp\\ransomware.exe",
                "size", 1048576,
                "hash", Map.of("sha256", "a1b2c3d4e5f6...")),
            "user", Map.of("name", "user1", "uid", "1002"),
            "device", Map.of("name", "WORKSTATION-02", "type", "Desktop"),
            "message", "Suspicious executable created"));

        records.add(record(
            "time", now.toString(),
            "tenant_id", "tenant_2",
            "class_uid", 1004,
            "category_uid", 3,
            "activity_name", "network_connection",
            "severity", "Medium",
            "src_endpoint", Map.of("ip", "10.0.0.50", "port", 12345),
            "dst_endpoint", Map.of("ip", "185.199.108.153", "port", 443),
            "network", Map.of("protocol", "TCP"),
            "device", Map.of("name", "LAPTOP-01", "type", "Laptop"),
            "message", "Outbound connection to suspicious IP"));

        return records;
    }

    private static Map<String, Object> record(Object... keyValues) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("metadata", Map.of("version", "1.0.0"));
        for (int i = 0; i < keyValues.length; i += 2) {
            record.put((String) keyValues[i], keyValues[i + 1]);
        }
        return record;
    }

    /**
     * Deep copy into unmodifiable maps and lists. Null values are kept.
     */
    static List<Map<String, Object>> freeze(List<Map<String, Object>> records) {
        List<Map<String, Object>> frozen = new ArrayList<>(records.size());
        for (Map<String, Object> record : records) {
            frozen.add(freezeMap(record));
        }
        return Collections.unmodifiableList(frozen);
    }

    @SuppressWarnings("unchecked")
    private static Object freezeValue(Object value) {
        if (value instanceof Map) {
            return freezeMap((Map<String, Object>) value);
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (List<Object>) value) {
                copy.add(freezeValue(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    private static Map<String, Object> freezeMap(Map<String, Object> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((key, value) -> copy.put(key, freezeValue(value)));
        return Collections.unmodifiableMap(copy);
    }
}
