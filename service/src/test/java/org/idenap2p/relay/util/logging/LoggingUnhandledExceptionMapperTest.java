/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.util.logging;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.verify;

import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import io.dropwizard.testing.junit5.ResourceExtension;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.core.Response;
import org.glassfish.jersey.test.grizzly.GrizzlyWebTestContainerFactory;
import org.idenap2p.relay.entities.ErrorResponse;
import org.idenap2p.relay.util.SystemMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.Logger;

@ExtendWith(DropwizardExtensionsSupport.class)
class LoggingUnhandledExceptionMapperTest {

  private static final Logger logger = mock(Logger.class);

  @Path("/v1/test")
  public static class TestController {

    @GET
    @Path("/unhandled/{address}")
    public String unhandled(@PathParam("address") final String address) {
      throw new IllegalArgumentException("OH NO");
    }

    @GET
    @Path("/missing")
    public String missing() {
      throw new NotFoundException();
    }
  }

  private static final ResourceExtension resources = ResourceExtension.builder()
      .setRegisterDefaultExceptionMappers(false)
      .addProvider(new LoggingUnhandledExceptionMapper(logger))
      .setMapper(SystemMapper.jsonMapper())
      .setTestContainerFactory(new GrizzlyWebTestContainerFactory())
      .addResource(new TestController())
      .build();

  @BeforeEach
  void setUp() {
    reset(logger);
  }

  @Test
  void unhandledExceptionIsLoggedWithPathTemplate() {
    final Response response = resources.getJerseyTest()
        .target("/v1/test/unhandled/0xabcdefabcdef0123456789abcdefabcdef012345")
        .request()
        .get();

    assertThat(response.getStatus()).isEqualTo(500);
    assertThat(response.readEntity(ErrorResponse.class))
        .isEqualTo(new ErrorResponse(LoggingUnhandledExceptionMapper.INTERNAL_SERVER_ERROR_MESSAGE));

    verify(logger).error(contains("GET /v1/test/unhandled/{address}"), any(IllegalArgumentException.class));
  }

  @Test
  void webApplicationExceptionKeepsStatus() {
    final Response response = resources.getJerseyTest()
        .target("/v1/test/missing")
        .request()
        .get();

    assertThat(response.getStatus()).isEqualTo(404);
    verify(logger, never()).error(any(String.class), any(Throwable.class));
  }
}
