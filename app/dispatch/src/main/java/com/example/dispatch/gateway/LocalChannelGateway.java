package com.example.dispatch.gateway;

import com.example.dispatch.model.Channel;
import com.example.dispatch.model.RenderedMessage;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public abstract class LocalChannelGateway implements ChannelGateway {

  private static final Logger logger = LoggerFactory.getLogger(LocalChannelGateway.class);

  private final Channel channel;
  private final Pattern addressPattern;

  protected LocalChannelGateway(Channel channel, Pattern addressPattern) {
    this.channel = channel;
    this.addressPattern = addressPattern;
  }

  @Override
  public Channel channel() {
    return channel;
  }

  @Override
  public GatewayReceipt send(RenderedMessage message, String address) {
    if (address == null || !addressPattern.matcher(address).matches()) {
      throw new PermanentGatewayException("malformed " + channel + " address: " + address);
    }
    final String providerMessageId = channel.name().toLowerCase() + "-" + UUID.randomUUID();
    // no provider call; the log line is the only side effect
    logger.info(
        "notification simulated send channel={} providerMessageId={} bodyLength={}",
        channel,
        providerMessageId,
        message.body() == null ? 0 : message.body().length());
    return new GatewayReceipt(providerMessageId);
  }
}
