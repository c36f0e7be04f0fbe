package com.questrail.insights.client;

/**
 * Actions that can be sent to a managed network device.
 */
public enum DeviceCommand
{
    RESTART("RESTART");

    private final String action;

    DeviceCommand(String action) {
        this.action = action;
    }

    /** Value of the {@code action} field in the request body. */
    public String action() {
        return action;
    }
}
