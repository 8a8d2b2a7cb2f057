package com.spike.monitor.alert;

import lombok.Builder;
import lombok.Value;

import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Aggregate counts over the alert history. Levels and reason types with no alerts are omitted.
 */
@Value
@Builder
public class AlertStats {

    private static final String CHANNEL_MARKER = " in ";

    long total;
    long unresolved;
    Map<AlertLevel, Long> byLevel;
    /** Alerts per reason type; an alert counts once for each distinct type among its reasons. */
    Map<String, Long> byType;

    public static AlertStats of(List<AlertHistoryEntry> entries) {
        Map<AlertLevel, Long> byLevel = new EnumMap<>(AlertLevel.class);
        Map<String, Long> byType = new TreeMap<>();
        long unresolved = 0;
        for (AlertHistoryEntry entry : entries) {
            byLevel.merge(entry.getLevel(), 1L, Long::sum);
            countTypes(entry.getAlert().getReasons(), byType);
            if (!entry.isResolved()) unresolved++;
        }
        return AlertStats.builder()
                .total(entries.size())
                .unresolved(unresolved)
                .byLevel(byLevel)
                .byType(byType)
                .build();
    }

    /** Adds one count per distinct reason type of a single alert. */
    public static void countTypes(Collection<String> reasons, Map<String, Long> byType) {
        Set<String> types = new LinkedHashSet<>();
        for (String reason : reasons) {
            types.add(reasonType(reason));
        }
        types.forEach(t -> byType.merge(t, 1L, Long::sum));
    }

    /**
     * Family reasons read {@code "<family surge> in <channel> (z=..)"} and map to the text before the
     * channel; co-occurrence bonuses map to their whole line.
     */
    public static String reasonType(String reason) {
        int idx = reason.indexOf(CHANNEL_MARKER);
        return idx > 0 ? reason.substring(0, idx) : reason;
    }
}
