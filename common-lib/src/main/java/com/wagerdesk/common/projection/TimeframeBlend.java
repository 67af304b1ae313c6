package com.wagerdesk.common.projection;

import com.wagerdesk.common.model.Window;
import com.wagerdesk.common.model.WindowAggregate;

import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Weighted average over the windows that are present; weights of missing windows are
 * redistributed proportionally.
 */
final class TimeframeBlend {

    private TimeframeBlend() {}

    static double blend(Map<Window, WindowAggregate> windows, Map<Window, Double> weights,
                        ToDoubleFunction<WindowAggregate> metric) {
        double weighted = 0.0;
        double total = 0.0;
        for (Map.Entry<Window, Double> e : weights.entrySet()) {
            WindowAggregate agg = windows.get(e.getKey());
            if (agg == null) continue;
            weighted += e.getValue() * metric.applyAsDouble(agg);
            total += e.getValue();
        }
        if (total <= 0) {
            throw new IllegalArgumentException("No weighted window present in " + windows.keySet());
        }
        return weighted / total;
    }

    static double blendValues(Map<Window, Double> values, Map<Window, Double> weights) {
        double weighted = 0.0;
        double total = 0.0;
        for (Map.Entry<Window, Double> e : weights.entrySet()) {
            Double v = values.get(e.getKey());
            if (v == null) continue;
            weighted += e.getValue() * v;
            total += e.getValue();
        }
        if (total <= 0) {
            throw new IllegalArgumentException("No weighted window present in " + values.keySet());
        }
        return weighted / total;
    }
}
