/*
 * Copyright 2013 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.idenap2p.relay;

import static org.idenap2p.relay.metrics.MetricsUtil.name;

import io.dropwizard.configuration.EnvironmentVariableSubstitutor;
import io.dropwizard.configuration.SubstitutingSourceProvider;
import io.dropwizard.core.Application;
import io.dropwizard.core.server.AbstractServerFactory;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import io.dropwizard.jersey.errors.EarlyEofExceptionMapper;
import io.dropwizard.jersey.jackson.JsonProcessingExceptionMapper;
import io.dropwizard.jersey.validation.JerseyViolationExceptionMapper;
import jakarta.servlet.ServletRegistration;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import org.eclipse.jetty.websocket.server.config.JettyWebSocketServletContainerInitializer;
import org.idenap2p.relay.configuration.HeartbeatConfiguration;
import org.idenap2p.relay.configuration.MessageQueueConfiguration;
import org.idenap2p.relay.controllers.HealthController;
import org.idenap2p.relay.controllers.MessageController;
import org.idenap2p.relay.controllers.PresenceController;
import org.idenap2p.relay.controllers.PublicKeyController;
import org.idenap2p.relay.mappers.InvalidRequestExceptionMapper;
import org.idenap2p.relay.metrics.MetricsUtil;
import org.idenap2p.relay.providers.RelayHealthCheck;
import org.idenap2p.relay.storage.MessageQueue;
import org.idenap2p.relay.storage.MessageQueueCleaner;
import org.idenap2p.relay.storage.PublicKeyDirectory;
import org.idenap2p.relay.util.SystemMapper;
import org.idenap2p.relay.util.logging.LoggingUnhandledExceptionMapper;
import org.idenap2p.relay.websocket.ConnectionRegistry;
import org.idenap2p.relay.websocket.HeartbeatMonitor;
import org.idenap2p.relay.websocket.RelayConnectListener;
import org.idenap2p.relay.websocket.RelayFrameCodec;
import org.idenap2p.websocket.WebSocketProviderFactory;
import org.idenap2p.websocket.setup.WebSocketEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RelayServerService extends Application<RelayServerConfiguration> {

  private static final Logger log = LoggerFactory.getLogger(RelayServerService.class);

  @Override
  public void initialize(final Bootstrap<RelayServerConfiguration> bootstrap) {
    // Initializing SystemMapper here because parsing of the main application config happens before `run()` method is called.
    SystemMapper.configureMapper(bootstrap.getObjectMapper());

    // Enable variable substitution with environment variables
    // https://www.dropwizard.io/en/stable/manual/core.html#environment-variables
    final EnvironmentVariableSubstitutor substitutor = new EnvironmentVariableSubstitutor(false);
    final SubstitutingSourceProvider provider =
        new SubstitutingSourceProvider(bootstrap.getConfigurationSourceProvider(), substitutor);
    bootstrap.setConfigurationSourceProvider(provider);
  }

  @Override
  public String getName() {
    return "idena-relay";
  }

  @Override
  public void run(final RelayServerConfiguration config, final Environment environment) throws Exception {
    final Clock clock = Clock.systemUTC();

    MetricsUtil.configureRegistries(environment);

    final MessageQueueConfiguration messageQueueConfiguration = config.getMessageQueueConfiguration();
    final HeartbeatConfiguration heartbeatConfiguration = config.getHeartbeatConfiguration();

    final MessageQueue messageQueue = new MessageQueue(messageQueueConfiguration.getMaxMessagesPerAddress(),
        messageQueueConfiguration.getRetention().toJavaDuration(), clock);
    final PublicKeyDirectory publicKeyDirectory = new PublicKeyDirectory(clock);
    final ConnectionRegistry connectionRegistry = new ConnectionRegistry();
    final RelayFrameCodec codec = new RelayFrameCodec(SystemMapper.jsonMapper());

    final ScheduledExecutorService periodicWorkExecutor = environment.lifecycle()
        .scheduledExecutorService(name(getClass(), "periodicWork") + "-%d")
        .threads(1)
        .build();

    final MessageQueueCleaner messageQueueCleaner = new MessageQueueCleaner(messageQueue,
        messageQueueConfiguration.getCleanupInterval().toJavaDuration(), periodicWorkExecutor);
    final HeartbeatMonitor heartbeatMonitor = new HeartbeatMonitor(connectionRegistry,
        heartbeatConfiguration.getInterval().toJavaDuration(), heartbeatConfiguration.getTimeout().toJavaDuration(),
        clock, periodicWorkExecutor);

    environment.lifecycle().manage(connectionRegistry);
    environment.lifecycle().manage(messageQueueCleaner);
    environment.lifecycle().manage(heartbeatMonitor);

    environment.healthChecks().register("relay", new RelayHealthCheck(connectionRegistry, messageQueue));

    registerExceptionMappers(config, environment);

    environment.jersey().register(new MessageController(messageQueue));
    environment.jersey().register(new PublicKeyController(publicKeyDirectory));
    environment.jersey().register(new PresenceController(connectionRegistry, clock));
    environment.jersey().register(new HealthController(connectionRegistry, messageQueue, clock));

    final WebSocketEnvironment webSocketEnvironment = new WebSocketEnvironment(config.getWebSocketConfiguration());
    webSocketEnvironment.setConnectListener(new RelayConnectListener(connectionRegistry, messageQueue, codec, clock));

    JettyWebSocketServletContainerInitializer.configure(environment.getApplicationContext(), null);

    final WebSocketProviderFactory webSocketServlet =
        new WebSocketProviderFactory(webSocketEnvironment, config.getWebSocketConfiguration());

    final ServletRegistration.Dynamic websocket = environment.servlets().addServlet("WebSocket", webSocketServlet);
    websocket.addMapping(config.getWebSocketPath());
    websocket.setAsyncSupported(true);

    log.info("Relay WebSocket endpoint mapped at {}", config.getWebSocketPath());
  }

  private void registerExceptionMappers(final RelayServerConfiguration config, final Environment environment) {
    if (config.getServerFactory() instanceof AbstractServerFactory serverFactory) {
      serverFactory.setRegisterDefaultExceptionMappers(false);
    }

    List.of(
        new LoggingUnhandledExceptionMapper(),
        new InvalidRequestExceptionMapper(),
        new JerseyViolationExceptionMapper(),
        new JsonProcessingExceptionMapper(),
        new EarlyEofExceptionMapper()
    ).forEach(exceptionMapper -> environment.jersey().register(exceptionMapper));
  }

  public static void main(final String[] args) throws Exception {
    new RelayServerService().run(args);
  }
}
