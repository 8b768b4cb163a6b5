package com.acme.delivery.processor;

import com.acme.delivery.event.DlqEvent;
import com.acme.delivery.event.DlqEventType;
import io.micronaut.context.event.ApplicationEventListener;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Logs dead letter events; threshold breaches are logged at ERROR for alerting on the log stream. */
@Singleton
public class DlqAlertListener implements ApplicationEventListener<DlqEvent> {
  private static final Logger LOG = LoggerFactory.getLogger(DlqAlertListener.class);

  @Override
  public void onApplicationEvent(DlqEvent event) {
    if (event.type() == DlqEventType.THRESHOLD_EXCEEDED) {
      LOG.error(
          "ALERT {} queue={} count={} threshold={}",
          event.name(),
          event.queue(),
          event.attributes().get("count"),
          event.attributes().get("threshold"));
      return;
    }
    LOG.info("{} queue={} id={} {}", event.name(), event.queue(), event.messageId(), event.attributes());
  }
}
