package com.libragraph.nsm.api;

import com.libragraph.nsm.api.model.ErrorResponse;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerRequestFilter;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;

/**
 * Requires {@code Authorization: Bearer <nsm.api.key>} on {@code /api/v1}
 * when a key is configured. Diagnostics and health stay open.
 */
public class ApiKeyFilter {

    private static final Logger log = Logger.getLogger(ApiKeyFilter.class);

    static final String PROTECTED_PREFIX = "/api/v1";
    private static final String BEARER = "Bearer ";

    @ConfigProperty(name = "nsm.api.key")
    Optional<String> apiKey;

    @ServerRequestFilter
    public Optional<Response> authenticate(ContainerRequestContext context) {
        Optional<String> key = apiKey.filter(k -> !k.isBlank());
        if (key.isEmpty() || !context.getUriInfo().getRequestUri().getPath().startsWith(PROTECTED_PREFIX)) {
            return Optional.empty();
        }
        String header = context.getHeaderString(HttpHeaders.AUTHORIZATION);
        if (header != null && header.startsWith(BEARER) && matches(header.substring(BEARER.length()), key.get())) {
            return Optional.empty();
        }
        log.debugf("Rejected unauthenticated request to %s", context.getUriInfo().getPath());
        return Optional.of(Response.status(Response.Status.UNAUTHORIZED)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse("UNAUTHORIZED", "Missing or invalid API key"))
                .build());
    }

    private static boolean matches(String presented, String expected) {
        return MessageDigest.isEqual(
                presented.trim().getBytes(StandardCharsets.UTF_8),
                expected.getBytes(StandardCharsets.UTF_8));
    }
}
