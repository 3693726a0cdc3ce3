package com.example.dispatch.nats;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.dispatch.config.DispatchNatsProperties;
import io.nats.client.Connection;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.Error;
import io.nats.client.api.StreamConfiguration;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DispatchJetStreamBootstrapTest {

  private static final DispatchNatsProperties PROPERTIES =
      new DispatchNatsProperties("dispatch.events", "DISPATCH_EVENTS", Duration.ofMinutes(2));

  @Mock private Connection connection;

  @Mock private JetStreamManagement jetStreamManagement;

  @Test
  void startCreatesStreamWithDuplicateWindowWhenMissing() throws Exception {
    when(connection.jetStreamManagement()).thenReturn(jetStreamManagement);
    when(jetStreamManagement.updateStream(any(StreamConfiguration.class)))
        .thenThrow(new StreamNotFoundException());

    new DispatchJetStreamBootstrap(connection, PROPERTIES).start();

    final ArgumentCaptor<StreamConfiguration> captor =
        ArgumentCaptor.forClass(StreamConfiguration.class);
    verify(jetStreamManagement).addStream(captor.capture());
    assertThat(captor.getValue().getName()).isEqualTo("DISPATCH_EVENTS");
    assertThat(captor.getValue().getSubjects()).containsExactly("dispatch.events.>");
    assertThat(captor.getValue().getDuplicateWindow()).isEqualTo(Duration.ofMinutes(2));
  }

  @Test
  void startUpdatesExistingStream() throws Exception {
    when(connection.jetStreamManagement()).thenReturn(jetStreamManagement);

    new DispatchJetStreamBootstrap(connection, PROPERTIES).start();

    verify(jetStreamManagement).updateStream(any(StreamConfiguration.class));
    verify(jetStreamManagement, never()).addStream(any(StreamConfiguration.class));
  }

  @Test
  void startRejectsZeroDuplicateWindow() {
    final DispatchNatsProperties invalid =
        new DispatchNatsProperties("dispatch.events", "DISPATCH_EVENTS", Duration.ZERO);

    assertThatThrownBy(() -> new DispatchJetStreamBootstrap(connection, invalid).start())
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("duplicate-window");
    verifyNoInteractions(connection);
  }

  private static final class StreamNotFoundException extends JetStreamApiException {
    private StreamNotFoundException() {
      super(Error.JsBadRequestErr);
    }

    @Override
    public int getApiErrorCode() {
      return 10059;
    }

    @Override
    public int getErrorCode() {
      return 404;
    }
  }
}
