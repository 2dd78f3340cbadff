/*
 * Copyright 2013-2021 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.util.logging;

import com.google.common.annotations.VisibleForTesting;
import io.dropwizard.jersey.errors.LoggingExceptionMapper;
import jakarta.inject.Provider;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.glassfish.jersey.server.ContainerRequest;
import org.idenap2p.relay.entities.ErrorResponse;
import org.slf4j.Logger;

/**
 * Extends {@link LoggingExceptionMapper} to include the method and path in the log message, if they are available,
 * and to answer unexpected failures with a generic {@code error} body.
 */
public class LoggingUnhandledExceptionMapper extends LoggingExceptionMapper<Throwable> {

  @VisibleForTesting
  static final String INTERNAL_SERVER_ERROR_MESSAGE = "Internal server error";

  @Context
  private Provider<ContainerRequest> request;

  public LoggingUnhandledExceptionMapper() {
    super();
  }

  @VisibleForTesting
  LoggingUnhandledExceptionMapper(final Logger logger) {
    super(logger);
  }

  @Override
  public Response toResponse(final Throwable exception) {
    if (exception instanceof WebApplicationException) {
      return super.toResponse(exception);
    }

    logException(exception);

    return Response.serverError()
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(new ErrorResponse(INTERNAL_SERVER_ERROR_MESSAGE))
        .build();
  }

  @Override
  protected String formatLogMessage(final long id, final Throwable exception) {
    String requestMethod = "unknown method";
    String requestPath = "/{unknown path}";
    try {
      // request shouldn’t be `null`, but it is technically possible
      requestMethod = request.get().getMethod();
      requestPath = UriInfoUtil.getPathTemplate(request.get().getUriInfo());
    } catch (final Exception e) {
      logger.warn("Unexpected exception getting request details", e);
    }

    return String.format("%s at %s %s",
        super.formatLogMessage(id, exception),
        requestMethod,
        requestPath);
  }
}
