package com.libragraph.nsm.api;

import com.libragraph.nsm.api.model.ArchiveInfoView;
import com.libragraph.nsm.api.model.ArchiveRef;
import com.libragraph.nsm.api.model.ArchiveSummaryView;
import com.libragraph.nsm.api.model.CreateArchiveRequest;
import com.libragraph.nsm.api.model.ExtractRequest;
import com.libragraph.nsm.api.model.ExtractView;
import com.libragraph.nsm.api.model.SearchRequest;
import com.libragraph.nsm.api.model.SearchView;
import com.libragraph.nsm.core.archive.ArchiveEngine;
import com.libragraph.nsm.core.archive.ArchiveSummary;
import com.libragraph.nsm.core.archive.CreateOptions;
import com.libragraph.nsm.core.archive.EntrySelection;
import com.libragraph.nsm.core.archive.SearchOptions;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Archive operations over HTTP. Paths in request bodies refer to the
 * server's filesystem.
 */
@Path("/api/v1/archives")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ArchiveResource {

    private static final Logger log = Logger.getLogger(ArchiveResource.class);

    @Inject
    ArchiveEngine engine;

    @Inject
    ArchiveSettings settings;

    @POST
    public Response create(CreateArchiveRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        java.nio.file.Path output = settings.resolve(request.output(), "output");
        if (request.inputs() == null || request.inputs().isEmpty()) {
            throw new IllegalArgumentException("At least one input is required");
        }
        List<java.nio.file.Path> inputs = request.inputs().stream().map(p -> settings.resolve(p, "inputs")).toList();

        CreateOptions options = CreateOptions.defaults()
                .withCompression(settings.compression(request.compression()))
                .withSearchIndex(request.searchIndex() == null || request.searchIndex());
        if (Boolean.TRUE.equals(request.encrypt())) {
            options = options.withCipher(settings.requireCipher());
        }

        log.infof("Create %s from %d input(s)", output, inputs.size());
        ArchiveSummary summary = engine.create(output, inputs, options);
        return Response.status(Response.Status.CREATED).entity(ArchiveSummaryView.of(summary)).build();
    }

    @POST
    @Path("/extract")
    public ExtractView extract(ExtractRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        EntrySelection selection = request.paths() == null || request.paths().isEmpty()
                ? EntrySelection.all()
                : EntrySelection.of(request.paths());
        return ExtractView.of(engine.extract(
                settings.resolve(request.archive(), "archive"),
                selection,
                settings.resolve(request.destination(), "destination"),
                settings.cipher()));
    }

    @POST
    @Path("/search")
    public SearchView search(SearchRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        if (request.query() == null) {
            throw new IllegalArgumentException("query is required");
        }
        SearchOptions defaults = engine.defaultSearchOptions();
        SearchOptions options = new SearchOptions(
                Boolean.TRUE.equals(request.substring()),
                request.limit() != null ? request.limit() : defaults.maxResults());
        return SearchView.of(engine.search(settings.resolve(request.archive(), "archive"), request.query(), options,
                settings.cipher()));
    }

    @POST
    @Path("/inspect")
    public ArchiveInfoView inspect(ArchiveRef request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        return ArchiveInfoView.of(engine.inspect(settings.resolve(request.archive(), "archive"), settings.cipher()));
    }

    @POST
    @Path("/verify")
    public ArchiveInfoView verify(ArchiveRef request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        return ArchiveInfoView.of(engine.verify(settings.resolve(request.archive(), "archive"), settings.cipher()));
    }
}
