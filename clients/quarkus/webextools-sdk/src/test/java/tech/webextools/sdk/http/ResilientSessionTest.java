package tech.webextools.sdk.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.stubbing.Scenario;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.webextools.sdk.exception.AuthenticationException;
import tech.webextools.sdk.exception.PaginationException;
import tech.webextools.sdk.exception.ProxyAuthenticationException;
import tech.webextools.sdk.exception.RetryExhaustedException;
import tech.webextools.sdk.exception.TransportException;
import tech.webextools.sdk.exception.WebexApiException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResilientSessionTest {

    private WireMockServer wireMockServer;
    private final List<Duration> sleeps = new ArrayList<>();
    private final Sleeper recordingSleeper = sleeps::add;

    @BeforeEach
    void setUp() {
        wireMockServer = new WireMockServer(options().dynamicPort());
        wireMockServer.start();
    }

    @AfterEach
    void tearDown() {
        wireMockServer.stop();
    }

    private ResilientSession session(int maxRetries) {
        return session(maxRetries, null);
    }

    private ResilientSession session(int maxRetries, ProxyCredentialsProvider provider) {
        var options = SessionOptions.builder()
            .baseUrl(wireMockServer.baseUrl())
            .bearerToken("test-token")
            .maxRetries(maxRetries)
            .timeout(Duration.ofSeconds(5))
            .build();
        return new ResilientSession(options, new ObjectMapper(), provider, recordingSleeper);
    }

    @Test
    @DisplayName("Should follow Link headers and stop on the last page")
    void shouldFollowLinkPagination() {
        // Arrange
        wireMockServer.stubFor(get(urlEqualTo("/people"))
            .willReturn(okJson("{\"items\":[1]}")
                .withHeader("Link", "<" + wireMockServer.baseUrl() + "/people?cursor=2>; rel=\"next\"")));
        wireMockServer.stubFor(get(urlEqualTo("/people?cursor=2"))
            .willReturn(okJson("{\"items\":[2]}")
                .withHeader("Link", "<" + wireMockServer.baseUrl() + "/people?cursor=3>; rel=\"next\"")));
        wireMockServer.stubFor(get(urlEqualTo("/people?cursor=3"))
            .willReturn(okJson("{\"items\":[3]}")));

        // Act
        var pages = session(6).get("people");
        var bodies = pages.stream().map(ApiResponse::body).toList();

        // Assert
        assertThat(bodies).containsExactly("{\"items\":[1]}", "{\"items\":[2]}", "{\"items\":[3]}");
        assertThat(pages.getPagesFetched()).isEqualTo(3);
        assertThat(pages.hasNext()).isFalse();
        wireMockServer.verify(1, getRequestedFor(urlEqualTo("/people"))
            .withHeader("Authorization", equalTo("Bearer test-token"))
            .withHeader("Accept", equalTo("application/json")));
    }

    @Test
    @DisplayName("Should not send anything until the first page is requested")
    void shouldBeLazy() {
        wireMockServer.stubFor(get(urlEqualTo("/people")).willReturn(okJson("{}")));

        var pages = session(6).get("people");

        wireMockServer.verify(0, getRequestedFor(anyUrl()));
        assertThat(pages.first()).isPresent();
        wireMockServer.verify(1, getRequestedFor(urlEqualTo("/people")));
    }

    @Test
    @DisplayName("Should append query parameters to the first request only")
    void shouldApplyQueryToFirstRequestOnly() {
        wireMockServer.stubFor(get(urlEqualTo("/reports?from=2024-01-01&hostEmail=all"))
            .willReturn(okJson("{}")
                .withHeader("Link", "<" + wireMockServer.baseUrl() + "/reports?cursor=x>; rel=\"next\"")));
        wireMockServer.stubFor(get(urlEqualTo("/reports?cursor=x")).willReturn(okJson("{}")));

        var options = RequestOptions.builder()
            .query("from", "2024-01-01")
            .query("hostEmail", "all")
            .build();
        long count = session(6).get("/reports", options).stream().count();

        assertThat(count).isEqualTo(2);
        wireMockServer.verify(1, getRequestedFor(urlEqualTo("/reports?cursor=x")));
    }

    @Test
    @DisplayName("Should wait for Retry-After on 429 and repeat the same request")
    void shouldRetryAfterRateLimit() {
        // Arrange
        wireMockServer.stubFor(get(urlEqualTo("/people")).inScenario("throttle")
            .whenScenarioStateIs(Scenario.STARTED)
            .willReturn(aResponse().withStatus(429).withHeader("Retry-After", "3"))
            .willSetStateTo("open"));
        wireMockServer.stubFor(get(urlEqualTo("/people")).inScenario("throttle")
            .whenScenarioStateIs("open")
            .willReturn(okJson("{\"ok\":true}")));

        // Act
        var response = session(6).get("people").first();

        // Assert
        assertThat(response).isPresent();
        assertThat(response.get().statusCode()).isEqualTo(200);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(3));
        wireMockServer.verify(2, getRequestedFor(urlEqualTo("/people")));
    }

    @Test
    @DisplayName("Should use the default wait when 429 carries no Retry-After")
    void shouldUseDefaultRetryAfter() {
        wireMockServer.stubFor(get(urlEqualTo("/people")).inScenario("throttle")
            .whenScenarioStateIs(Scenario.STARTED)
            .willReturn(aResponse().withStatus(429))
            .willSetStateTo("open"));
        wireMockServer.stubFor(get(urlEqualTo("/people")).inScenario("throttle")
            .whenScenarioStateIs("open")
            .willReturn(okJson("{}")));

        session(6).get("people").first();

        assertThat(sleeps).containsExactly(SessionOptions.DEFAULT_RETRY_AFTER);
    }

    @Test
    @DisplayName("Should give up after maxRetries retries")
    void shouldExhaustRetryBudget() {
        wireMockServer.stubFor(get(urlEqualTo("/people"))
            .willReturn(aResponse().withStatus(429).withHeader("Retry-After", "1")));

        var pages = session(2).get("people");

        assertThatThrownBy(pages::first)
            .isInstanceOf(RetryExhaustedException.class)
            .satisfies(e -> {
                var exhausted = (RetryExhaustedException) e;
                assertThat(exhausted.getAttempts()).isEqualTo(3);
                assertThat(exhausted.getStatusCode()).isEqualTo(429);
            });
        assertThat(sleeps).hasSize(2);
        wireMockServer.verify(3, getRequestedFor(urlEqualTo("/people")));
    }

    @Test
    @DisplayName("Should not retry at all when maxRetries is zero")
    void shouldFailImmediatelyWithZeroRetries() {
        wireMockServer.stubFor(get(urlEqualTo("/people")).willReturn(aResponse().withStatus(429)));

        assertThatThrownBy(() -> session(0).get("people").first())
            .isInstanceOf(RetryExhaustedException.class);
        assertThat(sleeps).isEmpty();
        wireMockServer.verify(1, getRequestedFor(urlEqualTo("/people")));
    }

    @Test
    @DisplayName("Should ask for proxy credentials on 407 and repeat")
    void shouldObtainProxyCredentials() {
        // Arrange
        wireMockServer.stubFor(get(urlEqualTo("/people")).inScenario("proxy")
            .whenScenarioStateIs(Scenario.STARTED)
            .willReturn(aResponse().withStatus(407))
            .willSetStateTo("authenticated"));
        wireMockServer.stubFor(get(urlEqualTo("/people")).inScenario("proxy")
            .whenScenarioStateIs("authenticated")
            .willReturn(okJson("{}")));
        var challenges = new ArrayList<String>();
        ProxyCredentialsProvider provider = challenge -> {
            challenges.add(challenge);
            return new ProxyCredentials("alice", "secret");
        };

        // Act
        var response = session(6, provider).get("people").first();

        // Assert
        assertThat(response).isPresent();
        assertThat(challenges).hasSize(1);
        assertThat(sleeps).isEmpty();
        wireMockServer.verify(2, getRequestedFor(urlEqualTo("/people")));
    }

    @Test
    @DisplayName("Should fail on 407 when no credentials provider is configured")
    void shouldFailProxyChallengeWithoutProvider() {
        wireMockServer.stubFor(get(urlEqualTo("/people")).willReturn(aResponse().withStatus(407)));

        assertThatThrownBy(() -> session(6).get("people").first())
            .isInstanceOf(ProxyAuthenticationException.class);
    }

    @Test
    @DisplayName("Should surface non-retryable errors with the Webex tracking id")
    void shouldSurfaceFatalErrors() {
        wireMockServer.stubFor(get(urlEqualTo("/people/missing"))
            .willReturn(aResponse().withStatus(404)
                .withHeader("Content-Type", "application/json")
                .withBody("{\"message\":\"Person not found\",\"trackingId\":\"ROUTER_1234\"}")));

        assertThatThrownBy(() -> session(6).get("people/missing").first())
            .isInstanceOf(WebexApiException.class)
            .hasMessage("Person not found")
            .satisfies(e -> {
                var error = (WebexApiException) e;
                assertThat(error.getStatusCode()).isEqualTo(404);
                assertThat(error.getTrackingId()).contains("ROUTER_1234");
            });
        assertThat(sleeps).isEmpty();
        wireMockServer.verify(1, getRequestedFor(urlEqualTo("/people/missing")));
    }

    @Test
    @DisplayName("Should raise AuthenticationException on 401")
    void shouldRaiseAuthenticationException() {
        wireMockServer.stubFor(get(urlEqualTo("/people")).willReturn(aResponse().withStatus(401)));

        assertThatThrownBy(() -> session(6).get("people").first())
            .isInstanceOf(AuthenticationException.class)
            .extracting(e -> ((WebexApiException) e).getStatusCode())
            .isEqualTo(401);
    }

    @Test
    @DisplayName("Should wrap connection failures in TransportException")
    void shouldWrapTransportFailures() {
        var options = SessionOptions.builder()
            .baseUrl("http://localhost:1")
            .timeout(Duration.ofSeconds(2))
            .build();
        var session = new ResilientSession(options, new ObjectMapper(), null, recordingSleeper);

        assertThatThrownBy(() -> session.get("people").first())
            .isInstanceOf(TransportException.class)
            .hasMessageContaining("http://localhost:1/people");
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("Should send cookies set by earlier responses")
    void shouldMergeCookies() {
        wireMockServer.stubFor(get(urlEqualTo("/login"))
            .willReturn(okJson("{}").withHeader("Set-Cookie", "sid=abc123; Path=/")));
        wireMockServer.stubFor(get(urlEqualTo("/people")).willReturn(okJson("{}")));

        var session = session(6);
        session.get("login").first();
        session.get("people").first();

        assertThat(session.getCookies()).containsEntry("sid", "abc123");
        wireMockServer.verify(getRequestedFor(urlEqualTo("/people"))
            .withHeader("Cookie", containing("sid=abc123")));
    }

    @Test
    @DisplayName("Should serialize request bodies as JSON")
    void shouldSendJsonBody() {
        wireMockServer.stubFor(patch(urlEqualTo("/people/1")).willReturn(okJson("{\"id\":\"1\"}")));

        session(6).patch("people/1", RequestOptions.json(Map.of("active", false))).first();

        wireMockServer.verify(patchRequestedFor(urlEqualTo("/people/1"))
            .withHeader("Content-Type", containing("application/json"))
            .withRequestBody(equalToJson("{\"active\":false}")));
    }

    @Test
    @DisplayName("Should fail when a next link points back at a fetched page")
    void shouldDetectRepeatedLinks() {
        wireMockServer.stubFor(get(urlEqualTo("/loop"))
            .willReturn(okJson("{}")
                .withHeader("Link", "<" + wireMockServer.baseUrl() + "/loop>; rel=\"next\"")));

        var pages = session(6).get("loop");

        assertThat(pages.next().statusCode()).isEqualTo(200);
        assertThat(pages.hasNext()).isTrue();
        assertThatThrownBy(pages::next).isInstanceOf(PaginationException.class);
        wireMockServer.verify(1, getRequestedFor(urlEqualTo("/loop")));
    }

    @Test
    @DisplayName("Should fail when a call follows more pages than allowed")
    void shouldEnforcePageLimit() {
        wireMockServer.stubFor(get(urlEqualTo("/endless"))
            .willReturn(okJson("{}")
                .withHeader("Link", "<" + wireMockServer.baseUrl() + "/endless?page=next>; rel=\"next\"")));
        wireMockServer.stubFor(get(urlEqualTo("/endless?page=next"))
            .willReturn(okJson("{}")
                .withHeader("Link", "<" + wireMockServer.baseUrl() + "/endless?page=last>; rel=\"next\"")));
        var options = SessionOptions.builder().baseUrl(wireMockServer.baseUrl()).maxPages(2).build();
        var pages = new ResilientSession(options, new ObjectMapper(), null, recordingSleeper).get("endless");

        pages.next();
        pages.next();

        assertThatThrownBy(pages::next).isInstanceOf(PaginationException.class);
    }

    @Test
    @DisplayName("Should resolve relative URLs against the base URL")
    void shouldNormalizeUrls() {
        var options = SessionOptions.builder().baseUrl("https://webexapis.com/v1/").build();
        var session = new ResilientSession(options);

        assertThat(session.normalizeUrl("people")).isEqualTo("https://webexapis.com/v1/people");
        assertThat(session.normalizeUrl("/people")).isEqualTo("https://webexapis.com/v1/people");
        assertThat(session.normalizeUrl("https://other.example/x")).isEqualTo("https://other.example/x");
    }

    @Test
    @DisplayName("Should stop after the first page when only the first is requested")
    void shouldFetchOnlyFirstPage() {
        wireMockServer.stubFor(get(urlEqualTo("/people"))
            .willReturn(okJson("{}")
                .withHeader("Link", "<" + wireMockServer.baseUrl() + "/people?cursor=2>; rel=\"next\"")));

        session(6).get("people").first();

        wireMockServer.verify(0, getRequestedFor(urlEqualTo("/people?cursor=2")));
    }
}
