package com.indicationscout.evidence.infrastructure.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import com.github.tomakehurst.wiremock.stubbing.Scenario;
import com.indicationscout.evidence.domain.exception.ExhaustedRetryException;
import com.indicationscout.evidence.domain.exception.TerminalResponseException;
import com.indicationscout.evidence.infrastructure.config.RetrofitDataSourceConfig;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.containing;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Exercises the executor over a real Retrofit and OkHttp stack against WireMock.
 */
class RetryingRequestExecutorIntegrationTest {

    private WireMockServer wireMockServer;
    private RequestExecutor executor;

    @BeforeEach
    void setUp() {
        wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMockServer.start();

        RequestConfig config = new RequestConfig(Duration.ofSeconds(5), 2, Duration.ofMillis(10),
                Duration.ofMillis(50), 2.0, RequestConfig.DEFAULT_RETRYABLE_STATUS_CODES, 100, 100);
        executor = RetrofitDataSourceConfig.createExecutor("test_source", wireMockServer.baseUrl() + "/api/",
                new OkHttpClient(), config, new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        if (wireMockServer != null) {
            wireMockServer.stop();
        }
    }

    @Test
    void shouldRetryGraphQlPostUntilItSucceeds() {
        // Given
        wireMockServer.stubFor(post(urlEqualTo("/api/graphql"))
                .inScenario("Retry Scenario")
                .whenScenarioStateIs(Scenario.STARTED)
                .willReturn(aResponse().withStatus(502))
                .willSetStateTo("FirstFailed"));

        wireMockServer.stubFor(post(urlEqualTo("/api/graphql"))
                .inScenario("Retry Scenario")
                .whenScenarioStateIs("FirstFailed")
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"data\": {\"target\": {\"id\": \"ENSG00000146648\"}}}")));

        // When
        JsonNode data = executor.graphQl("target", "graphql", "query($id: String!) { target }",
                Map.of("id", "ENSG00000146648"));

        // Then
        assertThat(data.path("target").path("id").asText()).isEqualTo("ENSG00000146648");
        wireMockServer.verify(2, postRequestedFor(urlEqualTo("/api/graphql"))
                .withRequestBody(containing("\"variables\":{\"id\":\"ENSG00000146648\"}")));
    }

    @Test
    void shouldSendQueryParametersOnGet() {
        // Given
        wireMockServer.stubFor(get(urlPathEqualTo("/api/studies"))
                .withQueryParam("query.cond", equalTo("asthma"))
                .withQueryParam("pageSize", equalTo("1"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"totalCount\": 42, \"studies\": []}")));

        // When
        JsonNode page = executor.get("count", "studies", Map.of("query.cond", "asthma", "pageSize", "1"));

        // Then
        assertThat(page.path("totalCount").asInt()).isEqualTo(42);
    }

    @Test
    void shouldGiveUpAfterRetryBudgetOnPersistentRateLimiting() {
        // Given
        wireMockServer.stubFor(get(urlPathEqualTo("/api/studies"))
                .willReturn(aResponse().withStatus(429).withBody("slow down")));

        // When / Then
        assertThatThrownBy(() -> executor.get("search", "studies", Map.of()))
                .isInstanceOfSatisfying(ExhaustedRetryException.class, e -> {
                    assertThat(e.getAttempts()).isEqualTo(3);
                    assertThat(e.getStatusCode()).isEqualTo(429);
                });
        wireMockServer.verify(3, getRequestedFor(urlPathEqualTo("/api/studies")));
    }

    @Test
    void shouldFailImmediatelyOnNotFound() {
        // Given
        wireMockServer.stubFor(get(urlPathEqualTo("/api/studies/NCT00000000"))
                .willReturn(aResponse().withStatus(404).withBody("{\"message\": \"not found\"}")));

        // When / Then
        assertThatThrownBy(() -> executor.get("study", "studies/NCT00000000", Map.of()))
                .isInstanceOfSatisfying(TerminalResponseException.class,
                        e -> assertThat(e.getStatusCode()).isEqualTo(404));
        wireMockServer.verify(1, getRequestedFor(urlPathEqualTo("/api/studies/NCT00000000")));
    }

    @Test
    void shouldDecodeStructuredTextReplies() {
        // Given
        wireMockServer.stubFor(get(urlPathEqualTo("/api/esearch"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/xml")
                        .withBody("<eSearchResult><Count>3</Count><RetMax>3</RetMax></eSearchResult>")));

        // When
        JsonNode result = executor.getStructuredText("esearch", "esearch", Map.of("term", "metformin"));

        // Then
        assertThat(result.path("Count").asText()).isEqualTo("3");
    }
}
