package com.locofleet.common.alerting;

import com.locofleet.common.exception.FleetException;

public class AlertDeliveryException extends FleetException {

    public AlertDeliveryException(String message) {
        super(message);
    }

    public AlertDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
