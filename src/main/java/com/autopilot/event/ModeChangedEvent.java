package com.autopilot.event;

import com.autopilot.domain.enums.OperatingMode;
import org.springframework.context.ApplicationEvent;

public class ModeChangedEvent extends ApplicationEvent {

    private final OperatingMode previousMode;
    private final OperatingMode currentMode;

    public ModeChangedEvent(Object source, OperatingMode previousMode, OperatingMode currentMode) {
        super(source);
        this.previousMode = previousMode;
        this.currentMode = currentMode;
    }

    public OperatingMode getPreviousMode() {
        return previousMode;
    }

    public OperatingMode getCurrentMode() {
        return currentMode;
    }
}
