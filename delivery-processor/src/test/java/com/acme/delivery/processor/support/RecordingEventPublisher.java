package com.acme.delivery.processor.support;

import com.acme.delivery.event.DlqEvent;
import io.micronaut.context.event.ApplicationEventPublisher;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;

/** Captures published events; optionally fails every publish like a broken listener. */
public class RecordingEventPublisher implements ApplicationEventPublisher<DlqEvent> {

  private final List<DlqEvent> events = new CopyOnWriteArrayList<>();
  private final boolean failing;

  public RecordingEventPublisher() {
    this(false);
  }

  public RecordingEventPublisher(boolean failing) {
    this.failing = failing;
  }

  @Override
  public void publishEvent(DlqEvent event) {
    if (failing) {
      throw new IllegalStateException("listener down");
    }
    events.add(event);
  }

  @Override
  public Future<Void> publishEventAsync(DlqEvent event) {
    publishEvent(event);
    return CompletableFuture.completedFuture(null);
  }

  public List<DlqEvent> events() {
    return events;
  }
}
