package com.example.dispatch.gateway;

import com.example.dispatch.model.Channel;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** SMTP-style provider: accepted means delivered, no receipts come back. */
@Component
public class LocalEmailGateway extends LocalChannelGateway {

  private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

  public LocalEmailGateway() {
    super(Channel.EMAIL, EMAIL);
  }

  @Override
  public boolean supportsDeliveryReceipts() {
    return false;
  }

  @Override
  public boolean supportsReadReceipts() {
    return false;
  }
}
