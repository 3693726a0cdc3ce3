package com.example.dispatch.gateway;

import com.example.dispatch.model.Channel;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

@Component
public class LocalSmsGateway extends LocalChannelGateway {

  private static final Pattern E164 = Pattern.compile("^\\+[1-9][0-9]{6,14}$");

  public LocalSmsGateway() {
    super(Channel.SMS, E164);
  }

  @Override
  public boolean supportsDeliveryReceipts() {
    return true;
  }

  @Override
  public boolean supportsReadReceipts() {
    return false;
  }
}
