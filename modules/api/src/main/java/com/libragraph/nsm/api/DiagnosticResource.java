package com.libragraph.nsm.api;

import com.libragraph.nsm.formats.compress.CompressionEngine;
import com.libragraph.nsm.formats.archive.ArchiveHeader;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.Map;

@Path("/api/diagnostic")
@Produces(MediaType.APPLICATION_JSON)
public class DiagnosticResource {

    @ConfigProperty(name = "quarkus.application.name")
    String appName;

    @ConfigProperty(name = "quarkus.application.version")
    String appVersion;

    @ConfigProperty(name = "quarkus.profile", defaultValue = "prod")
    String profile;

    @Inject
    CompressionEngine compression;

    @Inject
    ArchiveSettings settings;

    @GET
    @Path("/ping")
    public Map<String, String> ping() {
        return Map.of(
                "status", "ok",
                "message", "NSM archive service is running"
        );
    }

    @GET
    @Path("/info")
    public Map<String, Object> info() {
        return Map.of(
                "name", appName,
                "version", appVersion,
                "profile", profile,
                "formatVersion", ArchiveHeader.CURRENT_VERSION,
                "defaultCompression", settings.defaultCompression().label(),
                "compressionPermits", compression.permits(),
                "activeCompressions", compression.activeOperations(),
                "java", System.getProperty("java.version")
        );
    }
}
