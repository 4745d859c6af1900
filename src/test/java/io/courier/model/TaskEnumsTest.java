package io.courier.model;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class TaskEnumsTest {

    @Test
    void priorityParsingDefaultsToNormalAndRanksUrgentFirst() {
        Assertions.assertEquals(TaskPriority.NORMAL, TaskPriority.fromString(null));
        Assertions.assertEquals(TaskPriority.NORMAL, TaskPriority.fromString(" "));
        Assertions.assertEquals(TaskPriority.URGENT, TaskPriority.fromString("URGENT"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> TaskPriority.fromString("asap"));
        Assertions.assertTrue(TaskPriority.URGENT.rank() < TaskPriority.HIGH.rank());
        Assertions.assertTrue(TaskPriority.HIGH.rank() < TaskPriority.NORMAL.rank());
        Assertions.assertTrue(TaskPriority.NORMAL.rank() < TaskPriority.LOW.rank());
    }

    @Test
    void modeParsingDefaultsToWorker() {
        Assertions.assertEquals(TaskMode.WORKER, TaskMode.fromString(""));
        Assertions.assertEquals(TaskMode.BACKGROUND, TaskMode.fromString("background"));
        Assertions.assertEquals("subagent", TaskMode.SUBAGENT.wireName());
        Assertions.assertThrows(IllegalArgumentException.class, () -> TaskMode.fromString("daemon"));
    }

    @Test
    void statusKnowsWhichStatesAreTerminal() {
        Assertions.assertFalse(TaskStatus.PENDING.terminal());
        Assertions.assertFalse(TaskStatus.RUNNING.terminal());
        Assertions.assertTrue(TaskStatus.COMPLETED.terminal());
        Assertions.assertTrue(TaskStatus.FAILED.terminal());
        Assertions.assertTrue(TaskStatus.CANCELLED.terminal());
        Assertions.assertThrows(IllegalArgumentException.class, () -> TaskStatus.fromString(""));
        Assertions.assertEquals(TaskEventType.CANCEL_REQUESTED, TaskEventType.fromString("cancel_requested"));
    }
}
