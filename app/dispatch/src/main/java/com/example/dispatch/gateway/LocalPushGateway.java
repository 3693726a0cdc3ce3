package com.example.dispatch.gateway;

import com.example.dispatch.model.Channel;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

@Component
public class LocalPushGateway extends LocalChannelGateway {

  private static final Pattern DEVICE_TOKEN = Pattern.compile("^[A-Za-z0-9:_\\-]{8,256}$");

  public LocalPushGateway() {
    super(Channel.PUSH, DEVICE_TOKEN);
  }

  @Override
  public boolean supportsDeliveryReceipts() {
    return true;
  }

  @Override
  public boolean supportsReadReceipts() {
    return true;
  }
}
