package com.trustbridge.spi;

/**
 * Receives configuration changes detected by a refresh or a watched file. A listener that throws is logged
 * and skipped; the remaining listeners are still notified.
 */
@FunctionalInterface
public interface ConfigChangeListener {

    /**
     * @param key      the changed key, or {@code file:<path>} when a watched file changed
     * @param newValue the new value
     * @param oldValue the previous value, null for an added key
     */
    void onConfigChange(String key, Object newValue, Object oldValue);
}
