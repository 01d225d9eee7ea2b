package com.copilot.gateway.auth;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import static org.assertj.core.api.Assertions.assertThat;

class TokenExtractorTest {

    @Test
    void shouldPreferApiKeyHeader() {
        HttpHeaders headers = new HttpHeaders();
        headers.set("x-api-key", "ghu_from_api_key");
        headers.set(HttpHeaders.AUTHORIZATION, "Bearer ghp_from_bearer");

        assertThat(TokenExtractor.extract(headers)).isEqualTo("ghu_from_api_key");
    }

    @Test
    void shouldAcceptBearerInEitherCase() {
        HttpHeaders upper = new HttpHeaders();
        upper.set(HttpHeaders.AUTHORIZATION, "Bearer ghp_upper");
        HttpHeaders lower = new HttpHeaders();
        lower.set(HttpHeaders.AUTHORIZATION, "bearer gho_lower ");

        assertThat(TokenExtractor.extract(upper)).isEqualTo("ghp_upper");
        assertThat(TokenExtractor.extract(lower)).isEqualTo("gho_lower");
    }

    @Test
    void shouldFallBackToAzureStyleApiKeyHeader() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "Bearer sk-ant-not-github");
        headers.set("api-key", "github_pat_11AAAA");

        assertThat(TokenExtractor.extract(headers)).isEqualTo("github_pat_11AAAA");
    }

    @Test
    void shouldIgnoreValuesWithoutGitHubPrefix() {
        HttpHeaders headers = new HttpHeaders();
        headers.set("x-api-key", "sk-ant-api03-xxx");
        headers.set(HttpHeaders.AUTHORIZATION, "Basic Z2hwX3Rlc3Q=");

        assertThat(TokenExtractor.extract(headers)).isNull();
        assertThat(TokenExtractor.extract(new HttpHeaders())).isNull();
    }
}
