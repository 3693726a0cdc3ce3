package com.example.dispatch.gateway;

import com.example.dispatch.model.Channel;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

@Component
public class ChannelGatewayRegistry {

  private static final Logger logger = LoggerFactory.getLogger(ChannelGatewayRegistry.class);

  private final Map<Channel, ChannelGateway> gateways = new EnumMap<>(Channel.class);

  public ChannelGatewayRegistry(
      List<ChannelGateway> channelGateways, ObjectProvider<GatewayFailureInjector> injector) {
    final GatewayFailureInjector failureInjector = injector.getIfAvailable();
    for (ChannelGateway gateway : channelGateways) {
      final ChannelGateway effective =
          failureInjector == null ? gateway : failureInjector.decorate(gateway);
      if (gateways.putIfAbsent(gateway.channel(), effective) != null) {
        throw new IllegalStateException("duplicate gateway for channel " + gateway.channel());
      }
    }
    logger.info(
        "channel gateways registered channels={} failureInjection={}",
        gateways.keySet(),
        failureInjector != null);
  }

  /** Throws {@link PermanentGatewayException} when the channel has no provider configured. */
  public ChannelGateway gatewayFor(Channel channel) {
    final ChannelGateway gateway = gateways.get(channel);
    if (gateway == null) {
      throw new PermanentGatewayException("no gateway configured for channel " + channel);
    }
    return gateway;
  }
}
