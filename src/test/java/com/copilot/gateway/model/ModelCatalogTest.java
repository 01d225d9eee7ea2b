package com.copilot.gateway.model;

import com.alibaba.fastjson2.JSONObject;
import com.copilot.gateway.auth.AuthService;
import com.copilot.gateway.config.AppProperties;
import com.copilot.gateway.dto.openai.ModelList;
import com.copilot.gateway.exception.UpstreamException;
import com.copilot.gateway.proxy.CopilotRestApi;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ModelCatalogTest {

    private final CopilotRestApi restApi = mock(CopilotRestApi.class);
    private final AuthService authService = mock(AuthService.class);
    private final ModelRenamer renamer = new ModelRenamer(true, Map.of());
    private final AppProperties properties = new AppProperties();
    private final Clock clock = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);

    @BeforeEach
    void setUp() {
        when(restApi.listModels(anyString())).thenReturn(models("claude-sonnet-4.5", "gpt-4o-2024-11-20", "gpt-4o"));
    }

    @Test
    void shouldRenameModelsAndRegisterReverseMapping() {
        ModelCatalog catalog = new ModelCatalog(restApi, renamer, authService, properties, clock);

        ModelList list = catalog.getModels("tid=copilot");

        assertThat(list.data()).extracting(ModelList.ModelEntry::id).containsExactly("claude-sonnet-4-5", "gpt-4o");
        assertThat(list.data().get(0).raw().getString("id")).isEqualTo("claude-sonnet-4-5");
        assertThat(list.data().get(0).raw().getString("vendor")).isEqualTo("test");
        assertThat(renamer.toBackend("claude-sonnet-4-5")).isEqualTo("claude-sonnet-4.5");
        assertThat(renamer.toBackend("gpt-4o")).isEqualTo("gpt-4o");
    }

    @Test
    void shouldServeSecondCallFromCacheWithinTtl() {
        ModelCatalog catalog = new ModelCatalog(restApi, renamer, authService, properties, clock);

        catalog.getModels("tid=copilot");
        catalog.getModels("tid=copilot");

        verify(restApi, times(1)).listModels(anyString());
    }

    @Test
    void shouldFetchEveryCallWhenCacheDisabled() {
        properties.getModels().setCacheTtlSeconds(0);
        ModelCatalog catalog = new ModelCatalog(restApi, renamer, authService, properties, clock);

        catalog.getModels("tid=copilot");
        catalog.getModels("tid=copilot");

        verify(restApi, times(2)).listModels(anyString());
    }

    @Test
    void shouldPropagateUpstreamFailureWithoutRetry() {
        when(restApi.listModels(anyString())).thenThrow(new UpstreamException(503, "unavailable"));
        ModelCatalog catalog = new ModelCatalog(restApi, renamer, authService, properties, clock);

        assertThatThrownBy(() -> catalog.getModels("tid=copilot"))
                .isInstanceOf(UpstreamException.class)
                .satisfies(e -> assertThat(((UpstreamException) e).getStatusCode()).isEqualTo(503));
        verify(restApi, times(1)).listModels(anyString());
    }

    @Test
    void shouldSkipWarmUpWithoutOperatorToken() {
        ModelCatalog catalog = new ModelCatalog(restApi, renamer, authService, properties, clock);

        catalog.warmUp();

        verify(authService, never()).current();
        verify(restApi, never()).listModels(anyString());
    }

    private static ModelList models(String... ids) {
        List<ModelList.ModelEntry> entries = new ArrayList<>();
        for (String id : ids) {
            entries.add(new ModelList.ModelEntry(id, JSONObject.of("id", id, "object", "model", "vendor", "test")));
        }
        return new ModelList(entries);
    }
}
