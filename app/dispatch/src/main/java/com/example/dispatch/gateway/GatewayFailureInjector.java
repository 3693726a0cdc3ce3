/*
 * Where: Dispatch channel gateways
 * What: Test/CI-only decorator that fails sends for configured address prefixes
 * Why: Reproduces retry and permanent-failure paths end to end without a real provider
 */
package com.example.dispatch.gateway;

import com.example.dispatch.model.Channel;
import com.example.dispatch.model.RenderedMessage;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Profile({"ci", "test"})
@ConditionalOnProperty(
    prefix = "dispatch.gateway.failure-injection",
    name = "enabled",
    havingValue = "true")
public class GatewayFailureInjector {

  @Value("${dispatch.gateway.failure-injection.transient-address-prefix:}")
  private String transientAddressPrefix;

  @Value("${dispatch.gateway.failure-injection.permanent-address-prefix:}")
  private String permanentAddressPrefix;

  public ChannelGateway decorate(ChannelGateway delegate) {
    return new ChannelGateway() {
      @Override
      public Channel channel() {
        return delegate.channel();
      }

      @Override
      public GatewayReceipt send(RenderedMessage message, String address) {
        if (matches(permanentAddressPrefix, address)) {
          throw new PermanentGatewayException("failure injection rejected address=" + address);
        }
        if (matches(transientAddressPrefix, address)) {
          throw new TransientGatewayException("failure injection timed out address=" + address);
        }
        return delegate.send(message, address);
      }

      @Override
      public boolean supportsDeliveryReceipts() {
        return delegate.supportsDeliveryReceipts();
      }

      @Override
      public boolean supportsReadReceipts() {
        return delegate.supportsReadReceipts();
      }
    };
  }

  private static boolean matches(String prefix, String address) {
    if (prefix == null || prefix.isBlank() || address == null) {
      return false;
    }
    return address.startsWith(prefix);
  }
}
