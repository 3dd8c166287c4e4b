package com.phillippitts.speakerlink.testutil;

import com.phillippitts.speakerlink.service.pipeline.event.PipelineCompletedEvent;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test double for ApplicationEventPublisher that captures events for verification.
 */
public class EventCapturingPublisher implements ApplicationEventPublisher {
    final List<Object> events = new CopyOnWriteArrayList<>();

    @Override
    public void publishEvent(ApplicationEvent event) {
        events.add(event);
    }

    @Override
    public void publishEvent(Object event) {
        events.add(event);
    }

    /**
     * @return every PipelineCompletedEvent captured so far, in publication order
     */
    public List<PipelineCompletedEvent> completedEvents() {
        return events.stream()
                .filter(e -> e instanceof PipelineCompletedEvent)
                .map(e -> (PipelineCompletedEvent) e)
                .toList();
    }

    public void clear() {
        events.clear();
    }
}
