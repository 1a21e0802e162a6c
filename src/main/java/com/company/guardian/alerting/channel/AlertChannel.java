package com.company.guardian.alerting.channel;

import com.company.guardian.alerting.Alert;
import com.company.guardian.exception.AlertSendException;

/**
 * A notification destination. Implementations own payload rendering and transport.
 */
public interface AlertChannel {

    String getName();

    String getType();

    /**
     * Deliver one alert. Any exception counts as a failed delivery.
     */
    void send(Alert alert) throws AlertSendException;
}
