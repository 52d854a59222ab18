package com.clientspaces.quota;

/**
 * The plan catalog is inconsistent with itself or with live subscriptions. Raised at startup.
 */
public class PlanConfigurationException extends RuntimeException {

    public PlanConfigurationException(String message) {
        super(message);
    }
}
