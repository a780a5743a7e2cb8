package com.banana.core.session;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SlotSessionManagerTest {

    @Test
    void fillsSlotsInAscendingOrder() {
        SlotSessionManager session = new SlotSessionManager();

        assertTrue(session.addToNextAvailable("a.png"));
        assertTrue(session.addToNextAvailable("b.png"));

        assertEquals("a.png", session.slot(0).path());
        assertEquals("b.png", session.slot(1).path());
        assertFalse(session.slot(2).isOccupied());
        assertEquals(2, session.count());
    }

    @Test
    void fullSessionRejectsAndStaysUnchanged() {
        SlotSessionManager session = new SlotSessionManager();
        for (String path : List.of("a.png", "b.png", "c.png", "d.png")) {
            assertTrue(session.addToNextAvailable(path));
        }

        assertTrue(session.isFull());
        assertFalse(session.addToNextAvailable("e.png"));
        assertEquals(List.of("a.png", "b.png", "c.png", "d.png"), session.activePaths());
        assertEquals(4, session.count());
    }

    @Test
    void removedSlotIsReusedWithoutShiftingOthers() {
        SlotSessionManager session = new SlotSessionManager();
        session.addToNextAvailable("a.png");
        session.addToNextAvailable("b.png");
        session.addToNextAvailable("c.png");

        session.removeAt(1);
        assertNull(session.slot(1).path());
        assertEquals("c.png", session.slot(2).path());
        assertEquals(List.of("a.png", "c.png"), session.activePaths());

        session.addToNextAvailable("x.png");
        assertEquals("x.png", session.slot(1).path());
        assertEquals(List.of("a.png", "x.png", "c.png"), session.activePaths());
    }

    @Test
    void activeSlotsKeepTheirIndices() {
        SlotSessionManager session = new SlotSessionManager();
        session.replaceAt(0, "first.png");
        session.replaceAt(2, "third.png");

        List<ImageSlot> active = session.activeSlots();

        assertEquals(2, active.size());
        assertEquals(1, active.get(0).displayNumber());
        assertEquals(3, active.get(1).displayNumber());
        assertEquals("third.png", active.get(1).path());
    }

    @Test
    void clearAllEmptiesEverySlot() {
        SlotSessionManager session = new SlotSessionManager();
        session.addToNextAvailable("a.png");
        session.addToNextAvailable("b.png");

        session.clearAll();

        assertEquals(0, session.count());
        assertTrue(session.activePaths().isEmpty());
        assertEquals(SlotSessionManager.SLOT_COUNT, session.slots().size());
    }

    @Test
    void indexOutsideRangeIsRejected() {
        SlotSessionManager session = new SlotSessionManager();

        assertThrows(IllegalArgumentException.class, () -> session.removeAt(4));
        assertThrows(IllegalArgumentException.class, () -> session.removeAt(-1));
        assertThrows(IllegalArgumentException.class, () -> session.replaceAt(7, "a.png"));
    }

    @Test
    void snapshotsDoNotExposeInternalState() {
        SlotSessionManager session = new SlotSessionManager();
        session.addToNextAvailable("a.png");

        List<String> snapshot = session.activePaths();
        session.removeAt(0);

        assertEquals(List.of("a.png"), snapshot);
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add("b.png"));
    }
}
