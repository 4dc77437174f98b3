package io.github.yok.flexetl.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.time.LocalDateTime;
import org.junit.jupiter.api.Test;

class PipelineStatsTest {

    private static PipelineStats stats(long total, PipelineStatus status, LocalDateTime start,
            LocalDateTime end) {
        PipelineStats stats = new PipelineStats();
        stats.setTotalRecords(total);
        stats.setDuplicatesRemoved(1);
        stats.setTransformationsApplied(2);
        stats.setExecutionTime(1.5);
        stats.setStatus(status);
        stats.setStartTime(start);
        stats.setEndTime(end);
        return stats;
    }

    @Test
    void constructor_正常ケース_初期値_pendingで各件数が0であること() {
        PipelineStats stats = new PipelineStats();
        assertEquals(PipelineStatus.PENDING, stats.getStatus());
        assertEquals(0, stats.getTotalRecords());
        assertNull(stats.getStartTime());
    }

    @Test
    void merge_正常ケース_件数と時間が合算され期間が両方を覆うこと() {
        LocalDateTime t1 = LocalDateTime.of(2024, 1, 1, 10, 0);
        LocalDateTime t2 = LocalDateTime.of(2024, 1, 1, 11, 0);
        PipelineStats a = stats(10, PipelineStatus.COMPLETED, t1, t1.plusMinutes(5));
        PipelineStats b = stats(5, PipelineStatus.COMPLETED, t2, t2.plusMinutes(5));

        PipelineStats merged = a.merge(b);

        assertEquals(15, merged.getTotalRecords());
        assertEquals(2, merged.getDuplicatesRemoved());
        assertEquals(4, merged.getTransformationsApplied());
        assertEquals(3.0, merged.getExecutionTime());
        assertEquals(t1, merged.getStartTime());
        assertEquals(t2.plusMinutes(5), merged.getEndTime());
        assertEquals(PipelineStatus.COMPLETED, merged.getStatus());
        assertEquals(10, a.getTotalRecords());
    }

    @Test
    void merge_正常ケース_状態の優先順位_failedが最優先であること() {
        PipelineStats failed = stats(0, PipelineStatus.FAILED, null, null);
        PipelineStats running = stats(0, PipelineStatus.RUNNING, null, null);
        PipelineStats pending = stats(0, PipelineStatus.PENDING, null, null);
        PipelineStats completed = stats(0, PipelineStatus.COMPLETED, null, null);

        assertEquals(PipelineStatus.FAILED, running.merge(failed).getStatus());
        assertEquals(PipelineStatus.RUNNING, completed.merge(running).getStatus());
        assertEquals(PipelineStatus.PENDING, pending.merge(completed).getStatus());
        assertNull(pending.merge(completed).getStartTime());
    }

    @Test
    void copy_正常ケース_コピーを変更しても元が変わらないこと() {
        PipelineStats original = stats(3, PipelineStatus.RUNNING, null, null);
        PipelineStats copy = original.copy();
        assertEquals(original, copy);

        copy.setTotalRecords(4);
        assertEquals(3, original.getTotalRecords());
    }

    @Test
    void canTransitionTo_正常ケース_許可された遷移のみtrueとなること() {
        assertTrue(PipelineStatus.PENDING.canTransitionTo(PipelineStatus.RUNNING));
        assertTrue(PipelineStatus.RUNNING.canTransitionTo(PipelineStatus.COMPLETED));
        assertTrue(PipelineStatus.RUNNING.canTransitionTo(PipelineStatus.FAILED));
        assertFalse(PipelineStatus.PENDING.canTransitionTo(PipelineStatus.COMPLETED));
        assertFalse(PipelineStatus.COMPLETED.canTransitionTo(PipelineStatus.RUNNING));
        assertFalse(PipelineStatus.FAILED.canTransitionTo(PipelineStatus.RUNNING));
        assertEquals("failed", PipelineStatus.FAILED.getValue());
    }
}
