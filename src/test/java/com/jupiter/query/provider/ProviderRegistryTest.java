package com.jupiter.query.provider;

import com.jupiter.query.provider.mock.MockQueryProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("ProviderRegistry Tests")
class ProviderRegistryTest {

    private final MockQueryProvider mockProvider = new MockQueryProvider(List.of(), new AstValidator(), Clock.systemUTC());

    @Test
    @DisplayName("Should look providers up by backend")
    void shouldLookUpProviders() {
        ProviderRegistry registry = ProviderRegistry.of(mockProvider);

        assertThat(registry.get(QueryBackend.MOCK)).containsSame(mockProvider);
        assertThat(registry.get(QueryBackend.SQL)).isEmpty();
        assertThat(registry.isRegistered(QueryBackend.MOCK)).isTrue();
        assertThat(registry.backends()).containsExactly(QueryBackend.MOCK);
    }

    @Test
    @DisplayName("Should reject duplicate and auto registrations")
    void shouldRejectInvalidRegistrations() {
        QueryProvider auto = mock(QueryProvider.class);
        when(auto.backend()).thenReturn(QueryBackend.AUTO);

        assertThatThrownBy(() -> ProviderRegistry.of(mockProvider, mockProvider))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Duplicate provider for backend mock");
        assertThatThrownBy(() -> ProviderRegistry.of(auto))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should parse backend names")
    void shouldParseBackendNames() {
        assertThat(QueryBackend.fromValue("SQL")).isEqualTo(QueryBackend.SQL);
        assertThat(QueryBackend.fromValue("clickhouse")).isEqualTo(QueryBackend.SQL);
        assertThat(QueryBackend.fromValue(" mock ")).isEqualTo(QueryBackend.MOCK);
        assertThat(QueryBackend.fromValue(null)).isEqualTo(QueryBackend.AUTO);
        assertThat(QueryBackend.fromValue("")).isEqualTo(QueryBackend.AUTO);
        assertThatThrownBy(() -> QueryBackend.fromValue("oracle"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Unknown query backend: oracle");
    }
}
