package com.libragraph.nsm.api;

import com.libragraph.nsm.api.model.ErrorResponse;
import com.libragraph.nsm.core.ledger.LedgerPersistenceException;
import com.libragraph.nsm.core.ledger.LicenseValidationException;
import com.libragraph.nsm.core.ledger.NoTokensAvailableException;
import com.libragraph.nsm.formats.api.ArchiveError;
import com.libragraph.nsm.formats.api.ArchiveException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

/**
 * Maps domain exceptions to HTTP status codes and an {@link ErrorResponse} body.
 */
public class ErrorMappers {

    private static final Logger log = Logger.getLogger(ErrorMappers.class);

    static final int PAYMENT_REQUIRED = 402;
    static final int UNPROCESSABLE = 422;

    @ServerExceptionMapper
    public Response archiveFailure(ArchiveException e) {
        int status = statusFor(e.error());
        if (status >= 500) {
            log.errorf(e, "Archive operation failed: %s", e.getMessage());
        } else {
            log.debugf("Archive request rejected (%s): %s", e.error(), e.getMessage());
        }
        return error(status, e.error().name(), e.getMessage());
    }

    @ServerExceptionMapper
    public Response noTokens(NoTokensAvailableException e) {
        return error(PAYMENT_REQUIRED, "NO_TOKENS_AVAILABLE", e.getMessage());
    }

    @ServerExceptionMapper
    public Response ledgerFailure(LedgerPersistenceException e) {
        log.errorf(e, "Ledger persistence failed: %s", e.getMessage());
        return error(Response.Status.SERVICE_UNAVAILABLE.getStatusCode(), "LEDGER_UNAVAILABLE", e.getMessage());
    }

    @ServerExceptionMapper
    public Response licenseFailure(LicenseValidationException e) {
        log.warnf("License operation failed: %s", e.getMessage());
        return error(Response.Status.BAD_GATEWAY.getStatusCode(), "LICENSE_VALIDATION_FAILED", e.getMessage());
    }

    @ServerExceptionMapper
    public Response badRequest(IllegalArgumentException e) {
        return error(Response.Status.BAD_REQUEST.getStatusCode(), "BAD_REQUEST", e.getMessage());
    }

    static int statusFor(ArchiveError error) {
        return switch (error) {
            case INVALID_FORMAT, UNSUPPORTED_VERSION, UNSUPPORTED_ALGORITHM, CHECKSUM_MISMATCH -> UNPROCESSABLE;
            case ENCRYPTION_KEY_REQUIRED, UNSAFE_PATH -> Response.Status.BAD_REQUEST.getStatusCode();
            case ENTRY_NOT_FOUND -> Response.Status.NOT_FOUND.getStatusCode();
            case ARCHIVE_READ_FAILURE, ARCHIVE_WRITE_FAILURE -> Response.Status.INTERNAL_SERVER_ERROR.getStatusCode();
        };
    }

    static Response error(int status, String code, String message) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(code, message))
                .build();
    }
}
