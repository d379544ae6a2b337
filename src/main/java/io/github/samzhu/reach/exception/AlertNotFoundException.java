package io.github.samzhu.reach.exception;

/**
 * 找不到指定告警時拋出。
 */
public class AlertNotFoundException extends RuntimeException {

    private final String alertId;

    public AlertNotFoundException(String alertId) {
        super("Alert not found: " + alertId);
        this.alertId = alertId;
    }

    public String getAlertId() {
        return alertId;
    }
}
