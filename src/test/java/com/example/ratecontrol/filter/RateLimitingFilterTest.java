package com.example.ratecontrol.filter;

import com.example.ratecontrol.audit.AuditSink;
import com.example.ratecontrol.config.RateLimitPolicyRegistry;
import com.example.ratecontrol.config.RateLimiterProperties;
import com.example.ratecontrol.identity.IdentifierStrategy;
import com.example.ratecontrol.service.RateLimiterService;
import com.example.ratecontrol.store.CounterStore;
import com.example.ratecontrol.store.CounterStoreException;
import com.example.ratecontrol.store.LocalCounterStore;
import com.example.ratecontrol.support.MutableClock;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;

@DisplayName("RateLimitingFilter")
class RateLimitingFilterTest {

    private static final long WINDOW_START = 28_333_334L * 60_000L;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private MutableClock clock;
    private LocalCounterStore localStore;
    private RateLimitPolicyRegistry registry;
    private RateLimitResponses responses;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at(WINDOW_START + 15_000);
        localStore = new LocalCounterStore(clock, Duration.ofSeconds(60), Duration.ofHours(1));

        RateLimiterProperties properties = new RateLimiterProperties();
        properties.getFilter().setExcludedPaths(List.of("/api/health"));
        properties.getFilter().setDefaultWhitelist(List.of("127.0.0.1"));
        RateLimiterProperties.Policy defaultPolicy = new RateLimiterProperties.Policy();
        defaultPolicy.setMaxRequests(100L);
        defaultPolicy.setWindow(Duration.ofMinutes(1));
        defaultPolicy.setStrategy(IdentifierStrategy.NETWORK_ADDRESS);
        properties.setDefaultPolicy(defaultPolicy);
        RateLimiterProperties.Policy login = new RateLimiterProperties.Policy();
        login.setMaxRequests(2L);
        login.setWindow(Duration.ofMinutes(1));
        login.setStrategy(IdentifierStrategy.NETWORK_ADDRESS);
        login.setMessage("Too many login attempts");
        properties.getPolicies().put("/api/auth/login", login);

        registry = new RateLimitPolicyRegistry(properties);
        responses = new RateLimitResponses(clock);
    }

    @AfterEach
    void tearDown() {
        localStore.close();
    }

    private RateLimitingFilter filter(RateLimiterService service) {
        return new RateLimitingFilter(service, registry, responses, objectMapper);
    }

    private RateLimitingFilter localFilter() {
        return filter(new RateLimiterService(localStore, localStore, mock(AuditSink.class), clock, true));
    }

    private static MockHttpServletRequest request(String path, String address) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", path);
        request.addHeader("X-Forwarded-For", address);
        return request;
    }

    @Test
    @DisplayName("passes allowed requests through with rate-limit headers")
    void allowedRequest() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        localFilter().doFilter(request("/api/auth/login", "203.0.113.10"), response, chain);

        assertThat(chain.getRequest()).isNotNull();
        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(response.getHeader("X-RateLimit-Limit")).isEqualTo("2");
        assertThat(response.getHeader("X-RateLimit-Remaining")).isEqualTo("1");
        assertThat(response.getHeader("X-RateLimit-Reset")).isEqualTo(Long.toString(WINDOW_START + 60_000));
        assertThat(response.getHeader("X-RateLimit-Degraded")).isNull();
    }

    @Test
    @DisplayName("answers 429 with a JSON body and Retry-After once the route limit is spent")
    void rejectedRequest() throws Exception {
        RateLimitingFilter filter = localFilter();
        filter.doFilter(request("/api/auth/login", "203.0.113.10"), new MockHttpServletResponse(), new MockFilterChain());
        filter.doFilter(request("/api/auth/login", "203.0.113.10"), new MockHttpServletResponse(), new MockFilterChain());

        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();
        filter.doFilter(request("/api/auth/login", "203.0.113.10"), response, chain);

        assertThat(chain.getRequest()).isNull();
        assertThat(response.getStatus()).isEqualTo(429);
        assertThat(response.getContentType()).startsWith("application/json");
        assertThat(response.getHeader("Retry-After")).isEqualTo("45");
        assertThat(response.getHeader("X-RateLimit-Remaining")).isEqualTo("0");

        JsonNode body = objectMapper.readTree(response.getContentAsString());
        assertThat(body.get("error").asText()).isEqualTo("Too many login attempts");
        assertThat(body.get("success").asBoolean()).isFalse();
        assertThat(body.get("code").asText()).isEqualTo("RATE_LIMIT_EXCEEDED");
        assertThat(body.at("/details/limit").asLong()).isEqualTo(2);
        assertThat(body.at("/details/remaining").asLong()).isZero();
        assertThat(body.at("/details/resetTime").asLong()).isEqualTo(WINDOW_START + 60_000);
    }

    @Test
    @DisplayName("other routes keep their own counters")
    void routesCountedSeparately() throws Exception {
        RateLimitingFilter filter = localFilter();
        for (int i = 0; i < 3; i++) {
            filter.doFilter(request("/api/auth/login", "203.0.113.10"), new MockHttpServletResponse(),
                    new MockFilterChain());
        }

        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(request("/api/orders", "198.51.100.7"), response, new MockFilterChain());

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(response.getHeader("X-RateLimit-Limit")).isEqualTo("100");
    }

    @Test
    @DisplayName("never counts excluded paths")
    void excludedPath() throws Exception {
        RateLimitingFilter filter = localFilter();
        for (int i = 0; i < 5; i++) {
            MockHttpServletResponse response = new MockHttpServletResponse();
            MockFilterChain chain = new MockFilterChain();
            filter.doFilter(request("/api/health", "203.0.113.10"), response, chain);

            assertThat(chain.getRequest()).isNotNull();
            assertThat(response.getHeader("X-RateLimit-Limit")).isNull();
        }
        assertThat(localStore.get("ratelimit:203.0.113.10:" + WINDOW_START / 60_000L)).isEmpty();
    }

    @Test
    @DisplayName("the default whitelist exempts loopback callers")
    void defaultWhitelist() throws Exception {
        RateLimitingFilter filter = localFilter();
        for (int i = 0; i < 5; i++) {
            MockHttpServletResponse response = new MockHttpServletResponse();
            filter.doFilter(request("/api/auth/login", "127.0.0.1"), response, new MockFilterChain());
            assertThat(response.getStatus()).isEqualTo(200);
        }
    }

    @Test
    @DisplayName("answers 503 when no store can count and the limiter fails closed")
    void failClosed() throws Exception {
        CounterStore broken = mock(CounterStore.class);
        given(broken.name()).willReturn("redis");
        given(broken.incrementIfBelow(anyString(), anyLong(), any())).willThrow(new CounterStoreException("down"));
        RateLimitingFilter filter = filter(new RateLimiterService(broken, broken, mock(AuditSink.class), clock, false));

        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();
        filter.doFilter(request("/api/auth/login", "203.0.113.10"), response, chain);

        assertThat(chain.getRequest()).isNull();
        assertThat(response.getStatus()).isEqualTo(503);
        assertThat(response.getHeader("Retry-After")).isNull();
        JsonNode body = objectMapper.readTree(response.getContentAsString());
        assertThat(body.get("code").asText()).isEqualTo("RATE_LIMIT_UNAVAILABLE");
    }

    @Test
    @DisplayName("flags responses counted on the fallback store")
    void degradedHeader() throws Exception {
        CounterStore broken = mock(CounterStore.class);
        given(broken.name()).willReturn("redis");
        given(broken.incrementIfBelow(anyString(), anyLong(), any())).willThrow(new CounterStoreException("down"));
        RateLimitingFilter filter = filter(new RateLimiterService(broken, localStore, mock(AuditSink.class), clock, true));

        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(request("/api/auth/login", "203.0.113.10"), response, new MockFilterChain());

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(response.getHeader("X-RateLimit-Degraded")).isEqualTo("true");
        assertThat(response.getHeader("X-RateLimit-Remaining")).isEqualTo("1");
    }
}
