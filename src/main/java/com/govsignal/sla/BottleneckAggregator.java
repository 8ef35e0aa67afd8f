package com.govsignal.sla;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups classified steps by approver identity: user id, else group id, else unassigned.
 */
public final class BottleneckAggregator {

    private BottleneckAggregator() {}

    public static List<BottleneckRow> aggregate(List<SlaCacheRow> rows, Instant computedAt) {
        Map<String, Tally> byApprover = new LinkedHashMap<>();
        for (SlaCacheRow row : rows) {
            Tally tally = byApprover.computeIfAbsent(approverKey(row), k -> new Tally(row));
            tally.open++;
            if (row.slaStatus().isBreached()) {
                tally.breached++;
            }
            if (row.slaStatus() == SlaStatus.AT_RISK) {
                tally.atRisk++;
            }
            if (row.hoursOverdue() != null) {
                tally.maxHoursOverdue = Math.max(tally.maxHoursOverdue, row.hoursOverdue());
            }
        }

        List<BottleneckRow> result = new ArrayList<>();
        for (Tally t : byApprover.values()) {
            result.add(new BottleneckRow(t.userId, t.groupId, t.label, t.open, t.breached, t.atRisk,
                t.maxHoursOverdue, BottleneckRow.scoreOf(t.breached, t.atRisk, t.open), computedAt));
        }
        result.sort(Comparator.comparingInt(BottleneckRow::blockerScore).reversed()
            .thenComparing(BottleneckRow::approverLabel));
        return result;
    }

    static String approverKey(SlaCacheRow row) {
        if (row.approverUserId() != null) {
            return "U:" + row.approverUserId();
        }
        if (row.approverGroupId() != null) {
            return "G:" + row.approverGroupId();
        }
        return "X:unassigned";
    }

    private static final class Tally {
        private final String userId;
        private final String groupId;
        private final String label;
        private int open;
        private int breached;
        private int atRisk;
        private long maxHoursOverdue;

        private Tally(SlaCacheRow first) {
            this.userId = first.approverUserId();
            this.groupId = first.approverUserId() == null ? first.approverGroupId() : null;
            this.label = first.approverLabel();
        }
    }
}
