package com.example.memo.eviction;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Recency order over a set of items.
 * Head is the most recently promoted item, tail the least recent one.
 *
 * Items are tracked by identity, not by equals(), so two distinct items that
 * happen to be equal still get their own node. All operations are O(1).
 *
 * Not thread-safe. The owner is expected to serialize access.
 */
public class RecencyList<T> {

    private static final class Node<T> {
        final T item;
        Node<T> prev; // towards head
        Node<T> next; // towards tail

        Node(T item) {
            this.item = item;
        }
    }

    // Item -> Node map for O(1) access
    private final Map<T, Node<T>> nodeMap = new IdentityHashMap<>();

    private Node<T> head;
    private Node<T> tail;

    /**
     * Makes {@code item} the most recent one, linking it if it is not tracked yet.
     */
    public void promote(T item) {
        Node<T> node = nodeMap.get(item);
        if (node == null) {
            node = new Node<>(item);
            nodeMap.put(item, node);
        } else if (node == head) {
            return;
        } else {
            unlink(node);
        }
        addToHead(node);
    }

    /**
     * Unlinks {@code item}. Does nothing when the item is not tracked.
     *
     * @return true if the item was tracked
     */
    public boolean remove(T item) {
        Node<T> node = nodeMap.remove(item);
        if (node == null) {
            return false;
        }
        unlink(node);
        return true;
    }

    public boolean contains(T item) {
        return nodeMap.containsKey(item);
    }

    public int size() {
        return nodeMap.size();
    }

    public boolean isEmpty() {
        return head == null;
    }

    public Optional<T> leastRecent() {
        return tail == null ? Optional.empty() : Optional.of(tail.item);
    }

    public Optional<T> mostRecent() {
        return head == null ? Optional.empty() : Optional.of(head.item);
    }

    /**
     * Copies the items from most to least recent.
     */
    public List<T> toList() {
        List<T> items = new ArrayList<>(nodeMap.size());
        for (Node<T> node = head; node != null; node = node.next) {
            items.add(node.item);
        }
        return items;
    }

    public void clear() {
        Node<T> node = head;
        while (node != null) {
            Node<T> next = node.next;
            node.prev = null;
            node.next = null;
            node = next;
        }
        head = null;
        tail = null;
        nodeMap.clear();
    }

    // --- Helper Methods (Doubly Linked List Operations) ---

    private void addToHead(Node<T> node) {
        if (head == null) {
            head = tail = node;
        } else {
            node.next = head;
            head.prev = node;
            head = node;
        }
    }

    private void unlink(Node<T> node) {
        if (node.prev != null) {
            node.prev.next = node.next;
        } else {
            head = node.next; // Removing Head
        }

        if (node.next != null) {
            node.next.prev = node.prev;
        } else {
            tail = node.prev; // Removing Tail
        }

        node.prev = null;
        node.next = null;
    }
}
