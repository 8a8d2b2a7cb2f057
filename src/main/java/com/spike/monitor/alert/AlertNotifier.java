package com.spike.monitor.alert;

/**
 * Receives each alert after it has been appended to the history.
 */
public interface AlertNotifier {

    void notify(AlertHistoryEntry entry);
}
