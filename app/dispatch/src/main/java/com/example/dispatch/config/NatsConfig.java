/*
 * Where: Dispatch infrastructure configuration
 * What: Puts the NATS connection and JetStream context under Spring management
 * Why: The outbox publisher and stream bootstrap share one connection
 */
package com.example.dispatch.config;

import io.nats.client.Connection;
import io.nats.client.ConnectionListener;
import io.nats.client.JetStream;
import io.nats.client.Nats;
import io.nats.client.Options;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsConfig {

  private static final Logger logger = LoggerFactory.getLogger(NatsConfig.class);

  @Bean(destroyMethod = "close")
  public Connection natsConnection(NatsProperties properties)
      throws IOException, InterruptedException {
    final ConnectionListener listener =
        (connection, event) ->
            logger.info(
                "nats connection event={} name={} url={}",
                event,
                properties.connectionName(),
                connection.getConnectedUrl());
    final Options options =
        new Options.Builder()
            .server(properties.url())
            .connectionName(properties.connectionName())
            .connectionTimeout(properties.connectionTimeout())
            .maxReconnects(properties.maxReconnects())
            .connectionListener(listener)
            .build();
    return Nats.connect(options);
  }

  @Bean
  public JetStream jetStream(Connection natsConnection) throws IOException {
    return natsConnection.jetStream();
  }
}
