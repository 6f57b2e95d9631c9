package io.crosspost4j;

import io.crosspost4j.core.MetricSnapshot;

public interface MetricsCollector {

    MetricSnapshot fetch(String entityId, String platform) throws Exception;
}
