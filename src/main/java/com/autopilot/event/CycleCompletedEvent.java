package com.autopilot.event;

import com.autopilot.domain.model.CycleResult;
import org.springframework.context.ApplicationEvent;

/** Published after a cycle's result has been recorded and its snapshot swapped in. */
public class CycleCompletedEvent extends ApplicationEvent {

    private final CycleResult result;

    public CycleCompletedEvent(Object source, CycleResult result) {
        super(source);
        this.result = result;
    }

    public CycleResult getResult() {
        return result;
    }
}
