package com.ammann.blockstats.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.List;

/**
 * Global JAX-RS exception mapper that translates application and framework exceptions
 * into structured JSON error responses with appropriate HTTP status codes.
 *
 * <p>Handles validation, unknown block, missing statistics, store outage and generic
 * internal errors. Unhandled exceptions are logged at ERROR level and returned as
 * HTTP 500 responses.
 */
@Provider
public class GlobalExceptionHandler implements ExceptionMapper<Exception>
{
    private static final Logger LOG = Logger.getLogger(GlobalExceptionHandler.class);

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(Exception exception)
    {
        String path = uriInfo != null ? uriInfo.getPath() : null;

        if (exception instanceof ValidationException validation) {
            return createResponse(
                    Response.Status.BAD_REQUEST,
                    exception.getMessage(),
                    "VALIDATION_ERROR",
                    path,
                    validation.getErrors()
            );
        }

        if (exception instanceof BlockNotFoundException || exception instanceof StatsUnavailableException) {
            LOG.warnf("Resource not found for path %s: %s", path, exception.getMessage());
            return createResponse(
                    Response.Status.NOT_FOUND,
                    exception.getMessage(),
                    "NOT_FOUND",
                    path,
                    null
            );
        }

        if (exception instanceof NotFoundException) {
            return createResponse(
                    Response.Status.NOT_FOUND,
                    exception.getMessage(),
                    "NOT_FOUND",
                    path,
                    null
            );
        }

        if (exception instanceof StoreUnavailableException) {
            LOG.errorf(exception, "Block store unavailable for path %s", path);
            return createResponse(
                    Response.Status.SERVICE_UNAVAILABLE,
                    exception.getMessage(),
                    "STORE_UNAVAILABLE",
                    path,
                    null
            );
        }

        LOG.error("Unhandled exception: " + exception.getClass().getSimpleName(), exception);
        return createResponse(
                Response.Status.INTERNAL_SERVER_ERROR,
                "Internal server error",
                "INTERNAL_ERROR",
                path,
                null
        );
    }

    private Response createResponse(Response.Status status, String message, String code, String path,
                                     List<ValidationException.FieldError> errors)
    {
        ErrorResponse errorResponse = new ErrorResponse(code, message, path, errors);
        return Response.status(status).entity(errorResponse).build();
    }


    /**
     * Structured error response body returned to API clients.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorResponse
    {
        public final String status = "error";
        public String code;
        public String message;
        public Instant timestamp;
        public String path;
        public List<ValidationException.FieldError> errors;

        public ErrorResponse(String code, String message)
        {
            this.code = code;
            this.message = message;
            this.timestamp = Instant.now();
        }

        public ErrorResponse(String code, String message, String path,
                             List<ValidationException.FieldError> errors)
        {
            this(code, message);
            this.path = path;
            this.errors = errors == null || errors.isEmpty() ? null : errors;
        }
    }
}
