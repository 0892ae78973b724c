package com.autopilot.event;

import com.autopilot.domain.enums.AdapterName;
import org.springframework.context.ApplicationEvent;

/** Published when an adapter goes from reachable to unreachable, or back. */
public class AdapterStatusEvent extends ApplicationEvent {

    private final AdapterName adapter;
    private final boolean connected;
    private final String error;

    public AdapterStatusEvent(Object source, AdapterName adapter, boolean connected, String error) {
        super(source);
        this.adapter = adapter;
        this.connected = connected;
        this.error = error;
    }

    public AdapterName getAdapter() {
        return adapter;
    }

    public boolean isConnected() {
        return connected;
    }

    public String getError() {
        return error;
    }
}
