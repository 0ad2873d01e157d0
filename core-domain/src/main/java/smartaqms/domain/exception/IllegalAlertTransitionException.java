package smartaqms.domain.exception;

import smartaqms.domain.alert.AlertStatus;

public class IllegalAlertTransitionException extends RuntimeException {

    public IllegalAlertTransitionException(String alertId, AlertStatus from, AlertStatus to) {
        super(String.format("Alert %s cannot move from %s to %s", alertId, from, to));
    }
}
