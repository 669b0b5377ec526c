package com.wakecycle.tools.backend.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Authenticates tool calls using the X-Agent-Api-Key header.
 * Only applies to /tools/** and only when a key is configured.
 */
@Component
public class AgentApiKeyAuthFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AgentApiKeyAuthFilter.class);

    public static final String AGENT_API_KEY_HEADER = "X-Agent-Api-Key";

    private final String agentApiKey;

    public AgentApiKeyAuthFilter(@Value("${agent.api.key:}") String agentApiKey) {
        this.agentApiKey = agentApiKey;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        if (!request.getRequestURI().startsWith("/tools/")) {
            filterChain.doFilter(request, response);
            return;
        }

        // No key configured: open access
        if (agentApiKey == null || agentApiKey.isBlank()) {
            filterChain.doFilter(request, response);
            return;
        }

        String providedKey = request.getHeader(AGENT_API_KEY_HEADER);

        if (providedKey == null || providedKey.isBlank()) {
            reject(response, "Missing " + AGENT_API_KEY_HEADER + " header");
            return;
        }

        if (!agentApiKey.equals(providedKey)) {
            log.warn("Rejected tool call to {} with invalid API key", request.getRequestURI());
            reject(response, "Invalid API key");
            return;
        }

        filterChain.doFilter(request, response);
    }

    private void reject(HttpServletResponse response, String detail) throws IOException {
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType("application/json");
        response.getWriter().write("{\"detail\":\"" + detail + "\"}");
    }
}
