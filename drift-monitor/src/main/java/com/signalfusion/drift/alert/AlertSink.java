package com.signalfusion.drift.alert;

import com.signalfusion.drift.model.DriftAlert;

/** Destination of drift alerts. Implementations must not throw back into the monitor loop. */
public interface AlertSink {

    void emit(DriftAlert alert);
}
