package com.morris.core.env;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PropagationControlTest {

    @Test
    void strips_skip_suffix() {
        PropagationControl.Suffixed s = PropagationControl.strip("5 ~-2");
        assertEquals("5", s.text);
        assertEquals(2, s.control.skipRemaining());
        assertEquals(PropagationControl.UNLIMITED, s.control.acceptRemaining());
    }

    @Test
    void strips_accept_suffix_from_expressions() {
        PropagationControl.Suffixed s = PropagationControl.strip("a + 1 ~+3");
        assertEquals("a + 1", s.text);
        assertEquals(0, s.control.skipRemaining());
        assertEquals(3, s.control.acceptRemaining());
    }

    @Test
    void combined_suffixes() {
        PropagationControl.Suffixed s = PropagationControl.strip("5 ~-1 ~+2");
        assertEquals("5", s.text);
        assertEquals("~-1 ~+2", s.control.toString());
    }

    @Test
    void no_suffix_leaves_control_unset() {
        PropagationControl.Suffixed s = PropagationControl.strip("a + 1");
        assertEquals("a + 1", s.text);
        assertNull(s.control);
    }

    @Test
    void oversized_count_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> PropagationControl.strip("5 ~-99999999999999999999"));
    }

    @Test
    void skip_ignores_then_resumes() {
        PropagationControl c = PropagationControl.skipNext(2);
        assertFalse(c.admit());
        assertFalse(c.admit());
        assertTrue(c.admit());
        assertTrue(c.isOpen());
    }

    @Test
    void accept_allows_n_then_becomes_immune() {
        PropagationControl c = PropagationControl.acceptNext(1);
        assertTrue(c.admit());
        c.applied();
        assertFalse(c.admit());
        assertFalse(c.admit());
        assertEquals("~+0", c.toString());
    }

    @Test
    void open_control_always_admits() {
        PropagationControl c = PropagationControl.open();
        for (int i = 0; i < 5; i++) {
            assertTrue(c.admit());
            c.applied();
        }
        assertEquals("open", c.toString());
    }

    @Test
    void copies_are_independent() {
        PropagationControl c = PropagationControl.skipNext(1);
        PropagationControl copy = c.copy();
        c.admit();
        assertEquals(1, copy.skipRemaining());
    }
}
