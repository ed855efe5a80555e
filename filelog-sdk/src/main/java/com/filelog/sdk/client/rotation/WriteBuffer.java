package com.filelog.sdk.client.rotation;

import java.util.ArrayDeque;

/**
 * Bounded FIFO of formatted lines waiting for a usable stream.
 *
 * <p>Not thread-safe; the owning sink guards it with its lock.</p>
 */
public class WriteBuffer {

    private final int capacity;
    private final ArrayDeque<String> lines = new ArrayDeque<>();

    public WriteBuffer(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * @return false if the buffer is full and {@code line} was not added
     */
    public boolean offer(String line) {
        if (lines.size() >= capacity) {
            return false;
        }
        lines.addLast(line);
        return true;
    }

    public String peek() {
        return lines.peekFirst();
    }

    public String poll() {
        return lines.pollFirst();
    }

    public int size() {
        return lines.size();
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    public int getCapacity() {
        return capacity;
    }
}
