package com.example.dispatch.gateway;

import com.example.dispatch.model.Channel;
import com.example.dispatch.model.RenderedMessage;

public interface ChannelGateway {

  Channel channel();

  /**
   * Sends one message.
   *
   * @throws TransientGatewayException when the call may succeed later
   * @throws PermanentGatewayException when the address or message is rejected
   */
  GatewayReceipt send(RenderedMessage message, String address);

  boolean supportsDeliveryReceipts();

  boolean supportsReadReceipts();
}
