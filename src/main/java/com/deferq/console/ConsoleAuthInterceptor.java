package com.deferq.console;

import com.deferq.config.DeferQProperties;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;

/**
 * HTTP Basic authentication for the job console. Requests are rejected when
 * no credentials are configured.
 */
@Component
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@ConditionalOnProperty(prefix = "deferq.console", name = "enabled", havingValue = "true")
public class ConsoleAuthInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(ConsoleAuthInterceptor.class);
    private static final String BASIC_PREFIX = "Basic ";
    private static final String CHALLENGE = "Basic realm=\"DeferQ Console\"";

    private final DeferQProperties properties;

    public ConsoleAuthInterceptor(DeferQProperties properties) {
        this.properties = properties;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String expectedUsername = properties.getConsole().getUsername();
        String expectedPassword = properties.getConsole().getPassword();

        if (isBlank(expectedUsername) || isBlank(expectedPassword)) {
            log.warn("DeferQ console is enabled but deferq.console.username/password are not set; denying access");
            return challenge(response);
        }

        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.regionMatches(true, 0, BASIC_PREFIX, 0, BASIC_PREFIX.length())) {
            return challenge(response);
        }

        String credentials;
        try {
            byte[] decoded = Base64.getDecoder().decode(header.substring(BASIC_PREFIX.length()).trim());
            credentials = new String(decoded, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid Base64 encoded Basic credentials for the DeferQ console");
            return challenge(response);
        }

        String[] parts = credentials.split(":", 2);
        if (parts.length == 2
                && constantTimeEquals(expectedUsername, parts[0])
                && constantTimeEquals(expectedPassword, parts[1])) {
            return true;
        }
        return challenge(response);
    }

    private boolean challenge(HttpServletResponse response) {
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, CHALLENGE);
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        return false;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static boolean constantTimeEquals(String expected, String actual) {
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), actual.getBytes(StandardCharsets.UTF_8));
    }
}
