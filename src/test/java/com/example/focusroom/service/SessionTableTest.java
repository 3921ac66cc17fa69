package com.example.focusroom.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SessionTableTest {

    @Test
    void conditionalRemove_onlyRemovesExpectedEntry() {
        SessionTable table = new SessionTable();
        table.put("c1", "abc", "Alice");
        SessionTable.Session stale = new SessionTable.Session("old", "Alice");

        assertFalse(table.remove("c1", stale));
        assertTrue(table.get("c1").isPresent());

        SessionTable.Session current = table.get("c1").orElseThrow();
        assertTrue(table.remove("c1", current));
        assertTrue(table.get("c1").isEmpty());
        assertEquals(0, table.size());
    }

    @Test
    void nullConnection_isNeverFound() {
        SessionTable table = new SessionTable();
        assertTrue(table.get(null).isEmpty());
        assertTrue(table.remove(null).isEmpty());
    }
}
