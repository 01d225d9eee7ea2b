package com.copilot.gateway.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ModelRenamerTest {

    private static final List<String> COPILOT_MODELS = List.of(
            "claude-opus-4.6-fast",
            "claude-opus-4.6",
            "claude-sonnet-4.6",
            "gpt-5.2-codex",
            "gpt-5-mini",
            "gpt-5",
            "gpt-4o-mini-2024-07-18",
            "gpt-4o-2024-11-20",
            "grok-code-fast-1",
            "gpt-5.1-codex-max",
            "text-embedding-3-small",
            "claude-sonnet-4",
            "claude-sonnet-4.5",
            "claude-opus-4.5",
            "claude-haiku-4.5",
            "claude-3.5-sonnet",
            "gemini-2.5-pro",
            "gpt-4.1-2025-04-14",
            "gpt-3.5-turbo-0613",
            "gpt-4o",
            "text-embedding-ada-002");

    @Test
    void shouldRenameVersionFirstClaudeModels() {
        assertThat(ModelRenamer.autoRename("claude-3.5-sonnet")).isEqualTo("claude-sonnet-3-5");
        assertThat(ModelRenamer.autoRename("claude-3.5-haiku")).isEqualTo("claude-haiku-3-5");
        assertThat(ModelRenamer.autoRename("claude-3-opus")).isEqualTo("claude-opus-3");
    }

    @Test
    void shouldReplaceDotsInVariantFirstClaudeModels() {
        assertThat(ModelRenamer.autoRename("claude-sonnet-4.5")).isEqualTo("claude-sonnet-4-5");
        assertThat(ModelRenamer.autoRename("claude-opus-4.6")).isEqualTo("claude-opus-4-6");
        assertThat(ModelRenamer.autoRename("claude-opus-4.6-fast")).isEqualTo("claude-opus-4-6-fast");
        assertThat(ModelRenamer.autoRename("claude-haiku-4.5")).isEqualTo("claude-haiku-4-5");
    }

    @Test
    void shouldReturnNullWhenNoRenameNeeded() {
        assertThat(ModelRenamer.autoRename("claude-sonnet-4")).isNull();
        assertThat(ModelRenamer.autoRename("claude-opus-4")).isNull();
        assertThat(ModelRenamer.autoRename("gpt-4o")).isNull();
        assertThat(ModelRenamer.autoRename("o1-mini")).isNull();
    }

    @Test
    void shouldOnlyReplaceDotsBetweenDigits() {
        assertThat(ModelRenamer.replaceVersionDots("4.6")).isEqualTo("4-6");
        assertThat(ModelRenamer.replaceVersionDots("3.5.1")).isEqualTo("3-5-1");
        assertThat(ModelRenamer.replaceVersionDots("opus-4.6-fast")).isEqualTo("opus-4-6-fast");
        assertThat(ModelRenamer.replaceVersionDots("v2.beta")).isEqualTo("v2.beta");
        assertThat(ModelRenamer.replaceVersionDots(".5")).isEqualTo(".5");
        assertThat(ModelRenamer.replaceVersionDots("4.")).isEqualTo("4.");
    }

    @Test
    void shouldStripTrailingDateSuffix() {
        assertThat(ModelRenamer.stripDate("claude-sonnet-4-5-20250115")).isEqualTo("claude-sonnet-4-5");
        assertThat(ModelRenamer.stripDate("gpt-4o-2024-11-20")).isEqualTo("gpt-4o");
        assertThat(ModelRenamer.stripDate("gpt-3.5-turbo-0613")).isEqualTo("gpt-3.5-turbo-0613");
    }

    @Test
    void shouldMapCopilotModelListToClientNames() {
        ModelRenamer renamer = new ModelRenamer(true, Map.of());

        assertThat(renamer.toClient("claude-opus-4.6-fast")).isEqualTo("claude-opus-4-6-fast");
        assertThat(renamer.toClient("claude-sonnet-4.5")).isEqualTo("claude-sonnet-4-5");
        assertThat(renamer.toClient("claude-sonnet-4")).isEqualTo("claude-sonnet-4");
        assertThat(renamer.toClient("gpt-4o")).isEqualTo("gpt-4o");
        assertThat(renamer.toClient("gemini-2.5-pro")).isEqualTo("gemini-2.5-pro");
        assertThat(renamer.toClient("gpt-4o-2024-11-20")).isEqualTo("gpt-4o");
    }

    @Test
    void shouldResolveLearnedNamesBackToCopilotNames() {
        ModelRenamer renamer = new ModelRenamer(true, Map.of());
        for (String id : List.of("claude-sonnet-4.5", "claude-opus-4.6-fast", "claude-sonnet-4", "claude-3.5-sonnet")) {
            renamer.register(id, renamer.toClient(id));
        }

        assertThat(renamer.toBackend("claude-sonnet-4-5")).isEqualTo("claude-sonnet-4.5");
        assertThat(renamer.toBackend("claude-opus-4-6-fast")).isEqualTo("claude-opus-4.6-fast");
        assertThat(renamer.toBackend("claude-sonnet-4")).isEqualTo("claude-sonnet-4");
        assertThat(renamer.toBackend("claude-sonnet-3-5")).isEqualTo("claude-3.5-sonnet");
    }

    @Test
    void shouldResolveDatedClientNameWithoutCatalog() {
        ModelRenamer renamer = new ModelRenamer(true, Map.of());

        assertThat(renamer.toBackend("claude-sonnet-4-5-20250115")).isEqualTo("claude-sonnet-4.5");
        assertThat(renamer.toBackend("claude-sonnet-4-20250514")).isEqualTo("claude-sonnet-4");
        assertThat(renamer.toBackend("some-unknown-model")).isEqualTo("some-unknown-model");
    }

    @Test
    void shouldKeepIdempotentRoundTripForCopilotModels() {
        ModelRenamer cold = new ModelRenamer(true, Map.of());
        ModelRenamer warm = new ModelRenamer(true, Map.of());
        COPILOT_MODELS.forEach(id -> warm.register(id, warm.toClient(id)));

        for (ModelRenamer renamer : List.of(cold, warm)) {
            for (String id : COPILOT_MODELS) {
                String client = renamer.toClient(id);
                assertThat(renamer.toClient(renamer.toBackend(client))).as(id).isEqualTo(client);
            }
        }
    }

    @Test
    void shouldPreferBackendIdEqualToClientIdWhenNamesCollapse() {
        ModelRenamer renamer = new ModelRenamer(true, Map.of());
        renamer.register("gpt-4o-2024-11-20", "gpt-4o");
        renamer.register("gpt-4o", "gpt-4o");
        renamer.register("gpt-4o-2024-08-06", "gpt-4o");

        assertThat(renamer.toBackend("gpt-4o")).isEqualTo("gpt-4o");
    }

    @Test
    void shouldKeepFirstRegisteredWhenNoExactMatch() {
        ModelRenamer renamer = new ModelRenamer(true, Map.of());
        renamer.register("gpt-4o-mini-2024-07-18", "gpt-4o-mini-x");
        renamer.register("gpt-4o-mini-2024-09-01", "gpt-4o-mini-x");

        assertThat(renamer.toBackend("gpt-4o-mini-x")).isEqualTo("gpt-4o-mini-2024-07-18");
    }

    @Test
    void shouldApplyOverridesBeforeAutoRename() {
        ModelRenamer renamer = new ModelRenamer(true, Map.of("claude-sonnet-4.5", "my-sonnet"));

        assertThat(renamer.toClient("claude-sonnet-4.5")).isEqualTo("my-sonnet");
        assertThat(renamer.toBackend("my-sonnet")).isEqualTo("claude-sonnet-4.5");
    }

    @Test
    void shouldAllowOverrideTargetWithDateSuffix() {
        ModelRenamer renamer = new ModelRenamer(true, Map.of("claude-sonnet-4", "claude-sonnet-4-20250514"));

        assertThat(renamer.toClient("claude-sonnet-4")).isEqualTo("claude-sonnet-4-20250514");
        assertThat(renamer.toBackend("claude-sonnet-4-20250514")).isEqualTo("claude-sonnet-4");
    }

    @Test
    void shouldPassThroughWhenAutoDisabled() {
        ModelRenamer renamer = new ModelRenamer(false, Map.of("foo", "bar"));

        assertThat(renamer.toClient("foo")).isEqualTo("bar");
        assertThat(renamer.toBackend("bar")).isEqualTo("foo");
        assertThat(renamer.toClient("claude-sonnet-4.5")).isEqualTo("claude-sonnet-4.5");
        assertThat(renamer.toClient("claude-3.5-sonnet")).isEqualTo("claude-3.5-sonnet");
        assertThat(renamer.toClient("gpt-4o-2024-11-20")).isEqualTo("gpt-4o-2024-11-20");
        assertThat(renamer.toBackend("claude-sonnet-4-5")).isEqualTo("claude-sonnet-4-5");
    }

    @Test
    void shouldParseOverrideMapAndIgnoreInvalidInput() {
        assertThat(ModelRenamer.parseOverrides("{\"a\":\"b\",\"c\":1}")).containsExactly(Map.entry("a", "b"));
        assertThat(ModelRenamer.parseOverrides("not json")).isEmpty();
        assertThat(ModelRenamer.parseOverrides("")).isEmpty();
        assertThat(ModelRenamer.parseOverrides(null)).isEmpty();
    }
}
