package com.lifter.resolution.merge;

import com.lifter.resolution.core.model.Lifter;
import com.lifter.resolution.core.model.LifterField;
import com.lifter.resolution.core.model.MeetResult;
import com.lifter.resolution.core.model.ResultField;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Null-only merge of enrichment values into lifters and results.
 *
 * <p>A field is written only when the target's current value is null, so applying the same
 * values twice leaves the record unchanged. Null and blank incoming values are ignored.
 * Every enrichment path (Tier 1 harvesting, Tier 2 stable-id discovery, peer enrichment)
 * goes through this class.</p>
 */
public final class EnrichmentMerger {

    private EnrichmentMerger() {
        // utility class
    }

    /**
     * Returns the subset of {@code values} that would fill a currently null field of the lifter.
     */
    public static Map<LifterField, Object> missingFields(Lifter target, Map<LifterField, Object> values) {
        return missing(target::get, values);
    }

    /**
     * Returns the subset of {@code values} that would fill a currently null field of the result.
     */
    public static Map<ResultField, Object> missingFields(MeetResult target, Map<ResultField, Object> values) {
        return missing(target::get, values);
    }

    public static Lifter merge(Lifter target, Map<LifterField, Object> values) {
        Map<LifterField, Object> patch = missingFields(target, values);
        if (patch.isEmpty()) {
            return target;
        }
        Lifter.Builder builder = target.toBuilder();
        patch.forEach(builder::set);
        return builder.build();
    }

    public static MeetResult merge(MeetResult target, Map<ResultField, Object> values) {
        Map<ResultField, Object> patch = missingFields(target, values);
        if (patch.isEmpty()) {
            return target;
        }
        MeetResult.Builder builder = target.toBuilder();
        patch.forEach(builder::set);
        return builder.build();
    }

    private static <F> Map<F, Object> missing(Function<F, Object> current, Map<F, Object> values) {
        Map<F, Object> patch = new LinkedHashMap<>();
        if (values == null) {
            return patch;
        }
        for (Map.Entry<F, Object> entry : values.entrySet()) {
            Object value = entry.getValue();
            if (value == null || (value instanceof String s && s.isBlank())) {
                continue;
            }
            if (current.apply(entry.getKey()) == null) {
                patch.put(entry.getKey(), value);
            }
        }
        return patch;
    }
}
