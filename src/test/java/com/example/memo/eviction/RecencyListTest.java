package com.example.memo.eviction;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RecencyListTest {

    @Test
    void promoteLinksNewItemsAtHead() {
        RecencyList<String> list = new RecencyList<>();
        list.promote("a");
        list.promote("b");
        list.promote("c");

        assertEquals(List.of("c", "b", "a"), list.toList());
        assertEquals(Optional.of("a"), list.leastRecent());
        assertEquals(Optional.of("c"), list.mostRecent());
        assertEquals(3, list.size());
    }

    @Test
    void promoteMovesTrackedItemToHead() {
        RecencyList<String> list = new RecencyList<>();
        list.promote("a");
        list.promote("b");
        list.promote("c");

        list.promote("a");
        assertEquals(List.of("a", "c", "b"), list.toList());
        assertEquals(Optional.of("b"), list.leastRecent());

        list.promote("c");
        assertEquals(List.of("c", "a", "b"), list.toList());
        assertEquals(3, list.size());
    }

    @Test
    void promotingHeadKeepsOrder() {
        RecencyList<String> list = new RecencyList<>();
        list.promote("a");
        list.promote("b");
        list.promote("b");

        assertEquals(List.of("b", "a"), list.toList());
        assertEquals(2, list.size());
    }

    @Test
    void removeUnlinksFromAnyPosition() {
        RecencyList<String> list = new RecencyList<>();
        for (String s : List.of("a", "b", "c", "d")) {
            list.promote(s);
        }

        assertTrue(list.remove("c"));   // middle
        assertEquals(List.of("d", "b", "a"), list.toList());
        assertTrue(list.remove("d"));   // head
        assertEquals(Optional.of("b"), list.mostRecent());
        assertTrue(list.remove("a"));   // tail
        assertEquals(Optional.of("b"), list.leastRecent());
        assertEquals(List.of("b"), list.toList());
        assertEquals(1, list.size());
    }

    @Test
    void removingSoleItemEmptiesList() {
        RecencyList<String> list = new RecencyList<>();
        list.promote("a");

        assertTrue(list.remove("a"));
        assertTrue(list.isEmpty());
        assertEquals(0, list.size());
        assertEquals(Optional.empty(), list.leastRecent());
        assertEquals(Optional.empty(), list.mostRecent());
    }

    @Test
    void removingUnknownItemIsNoOp() {
        RecencyList<String> list = new RecencyList<>();
        list.promote("a");

        assertFalse(list.remove("zzz"));
        assertEquals(List.of("a"), list.toList());
        assertFalse(new RecencyList<String>().remove("a"));
    }

    @Test
    void removedItemCanBePromotedAgain() {
        RecencyList<String> list = new RecencyList<>();
        list.promote("a");
        list.promote("b");
        list.remove("a");
        list.promote("a");

        assertEquals(List.of("a", "b"), list.toList());
        assertEquals(Optional.of("b"), list.leastRecent());
    }

    @Test
    void tracksItemsByIdentity() {
        RecencyList<String> list = new RecencyList<>();
        String first = new String("same");
        String second = new String("same");
        list.promote(first);
        list.promote(second);

        assertEquals(2, list.size());
        assertSame(first, list.leastRecent().orElseThrow());
        assertTrue(list.remove(first));
        assertTrue(list.contains(second));
        assertFalse(list.contains(first));
    }

    @Test
    void clearDropsEverything() {
        RecencyList<String> list = new RecencyList<>();
        list.promote("a");
        list.promote("b");
        list.clear();

        assertTrue(list.isEmpty());
        assertEquals(List.of(), list.toList());
        list.promote("c");
        assertEquals(List.of("c"), list.toList());
    }
}
