package com.example.focusroom.service;

import com.example.focusroom.config.SessionProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Flags a frame as confused when any brow signal (browInnerUp, browDownLeft, ...) reaches the threshold.
 * Stateless; non-numeric values are skipped.
 */
@Component
public class ConfusionDetector {

    private static final String BROW_PREFIX = "brow";

    private final double threshold;

    @Autowired
    public ConfusionDetector(SessionProperties props) {
        this(props.confusionThreshold());
    }

    ConfusionDetector(double threshold) {
        this.threshold = threshold;
    }

    public double getThreshold() { return threshold; }

    public boolean isConfused(Map<String, ?> frame) {
        if (frame == null || frame.isEmpty()) return false;
        for (Map.Entry<String, ?> e : frame.entrySet()) {
            String name = e.getKey();
            if (name == null || !name.toLowerCase(Locale.ROOT).startsWith(BROW_PREFIX)) continue;
            Double v = intensity(e.getValue());
            if (v != null && v >= threshold) return true;
        }
        return false;
    }

    private static Double intensity(Object raw) {
        double v;
        if (raw instanceof Number n) {
            v = n.doubleValue();
        } else if (raw instanceof String s) {
            try { v = Double.parseDouble(s.trim()); }
            catch (NumberFormatException ex) { return null; }
        } else {
            return null;
        }
        return Double.isFinite(v) ? v : null;
    }
}
