package com.uberlite.analytics.metrics;

public interface PipelineMetricsMBean {
    long getEventsIn();
    long getEventsNormalized();
    long getEventsRejected();
    long getDecodeFailures();
    long getDuplicates();
    long getLateDropped();
    long getOutOfBoundsDropped();
    long getWindowsFinalized();
    long getWindowsEvicted();
    long getRowsEmitted();
    long getTransportRetries();
    long getSinkRetries();
    long getBatches();
    long getOpenWindows();
    long getWatermark();
    long getWatermarkLagMs();
    String getHaltReason();
}
