package com.jupiter.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jupiter.domain.QueryAuditRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class LoggingQueryAuditSinkTest {

    @Mock
    private Logger auditLog;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void testRecordIsWrittenAsSingleJsonLine() throws Exception {
        // Given
        LoggingQueryAuditSink sink = new LoggingQueryAuditSink(objectMapper, auditLog);
        QueryAuditRecord record = new QueryAuditRecord("query_1", "analyst", "t1", "mock",
            true, 0.012, 3, "2024-06-01T12:00:00Z");

        // When
        sink.record(record);

        // Then
        ArgumentCaptor<String> line = ArgumentCaptor.forClass(String.class);
        verify(auditLog).info(line.capture());
        assertThat(line.getValue()).doesNotContain("\n");

        JsonNode json = objectMapper.readTree(line.getValue());
        assertThat(json.get("query_id").asText()).isEqualTo("query_1");
        assertThat(json.get("user_id").asText()).isEqualTo("analyst");
        assertThat(json.get("tenant_id").asText()).isEqualTo("t1");
        assertThat(json.get("backend").asText()).isEqualTo("mock");
        assertThat(json.get("success").asBoolean()).isTrue();
        assertThat(json.get("result_count").asInt()).isEqualTo(3);
    }

    @Test
    void testDefaultLoggerName() {
        assertThat(LoggingQueryAuditSink.AUDIT_LOGGER).isEqualTo("jupiter.audit");
    }
}
