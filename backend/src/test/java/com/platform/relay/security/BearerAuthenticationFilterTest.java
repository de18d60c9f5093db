package com.platform.relay.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.relay.error.AuthenticationException;
import com.platform.relay.keystore.KeyStore;
import com.platform.relay.keystore.TenantKey;
import jakarta.servlet.FilterChain;
import jakarta.servlet.http.HttpServletRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BearerAuthenticationFilterTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private KeyStore keyStore;
    private BearerAuthenticationFilter filter;

    @BeforeEach
    void setUp() {
        keyStore = mock(KeyStore.class);
        filter = new BearerAuthenticationFilter(keyStore, new SecurityAuditLogger(), new ErrorResponseWriter(objectMapper));
    }

    @Test
    void validSecretExposesTenantContext() throws Exception {
        when(keyStore.resolve("s3cret")).thenReturn(new TenantKey("tenant-1", "vm-1", "aa".repeat(32)));
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/execute");
        request.addHeader("Authorization", "Bearer s3cret");
        AtomicReference<Object> seen = new AtomicReference<>();
        FilterChain chain = (req, res) -> seen.set(((HttpServletRequest) req).getAttribute(TenantContext.ATTRIBUTE));

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(seen.get()).isInstanceOf(TenantContext.class);
        TenantContext context = (TenantContext) seen.get();
        assertThat(context.tenantId()).isEqualTo("tenant-1");
        assertThat(context.toTenantKey().encryptionKey()).isEqualTo("aa".repeat(32));
    }

    @Test
    void missingHeaderIsUnauthorized() throws Exception {
        when(keyStore.resolve(null)).thenThrow(AuthenticationException.missing());
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/tools");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(chain.getRequest()).isNull();
        JsonNode body = objectMapper.readTree(response.getContentAsString());
        assertThat(body.get("success").asBoolean()).isFalse();
        assertThat(body.get("code").asText()).isEqualTo("RL-200");
    }

    @Test
    void invalidSecretIsUnauthorized() throws Exception {
        when(keyStore.resolve("wrong")).thenThrow(AuthenticationException.invalid());
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/agents");
        request.addHeader("Authorization", "Bearer wrong");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(objectMapper.readTree(response.getContentAsString()).get("code").asText()).isEqualTo("RL-201");
    }

    @Test
    void healthAndNonApiPathsAreOpen() throws Exception {
        for (String path : new String[] {"/api/health", "/actuator/health", "/internal/agents"}) {
            MockFilterChain chain = new MockFilterChain();
            filter.doFilter(new MockHttpServletRequest("GET", path), new MockHttpServletResponse(), chain);
            assertThat(chain.getRequest()).as(path).isNotNull();
        }
        verify(keyStore, never()).resolve(any());
    }
}
