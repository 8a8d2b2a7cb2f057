package com.spike.monitor.frame;

/**
 * Supplies the current frame to the monitor. Rows must be deduplicated and sorted.
 */
public interface TimeSeriesSource {

    TimeSeriesFrame currentFrame();
}
