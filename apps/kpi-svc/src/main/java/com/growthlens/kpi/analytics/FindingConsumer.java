package com.growthlens.kpi.analytics;

import com.growthlens.kpi.model.KpiReport;

/**
 * Receives finished reports. Rendering and delivery are entirely the consumer's concern.
 */
@FunctionalInterface
public interface FindingConsumer {

    void accept(KpiReport report);
}
