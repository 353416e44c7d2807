package caseflow.coordinator.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProcessingStatusTest {

    @Test
    void pendingOnlyStartsProcessing() {
        assertTrue(ProcessingStatus.PENDING.canTransitionTo(ProcessingStatus.PROCESSING));
        assertFalse(ProcessingStatus.PENDING.canTransitionTo(ProcessingStatus.COMPLETED));
        assertFalse(ProcessingStatus.PENDING.canTransitionTo(ProcessingStatus.FAILED));
    }

    @Test
    void processingEndsInTerminalStatus() {
        assertTrue(ProcessingStatus.PROCESSING.canTransitionTo(ProcessingStatus.COMPLETED));
        assertTrue(ProcessingStatus.PROCESSING.canTransitionTo(ProcessingStatus.FAILED));
        assertFalse(ProcessingStatus.PROCESSING.canTransitionTo(ProcessingStatus.PENDING));
        assertFalse(ProcessingStatus.PROCESSING.canTransitionTo(ProcessingStatus.PROCESSING));
    }

    @Test
    void terminalStatusesOnlyRestart() {
        for (ProcessingStatus terminal : new ProcessingStatus[] { ProcessingStatus.COMPLETED, ProcessingStatus.FAILED }) {
            assertTrue(terminal.canTransitionTo(ProcessingStatus.PROCESSING));
            assertFalse(terminal.canTransitionTo(ProcessingStatus.COMPLETED));
            assertFalse(terminal.canTransitionTo(ProcessingStatus.FAILED));
            assertFalse(terminal.canTransitionTo(ProcessingStatus.PENDING));
        }
    }

    @Test
    void wireNames() {
        assertEquals(ProcessingStatus.FAILED, ProcessingStatus.fromWire(" failed "));
        assertEquals(ProcessingStatus.PENDING, ProcessingStatus.fromWire(null));
        assertEquals("completed", ProcessingStatus.COMPLETED.wireName());
        assertThrows(IllegalArgumentException.class, () -> ProcessingStatus.fromWire("archived"));
    }
}
