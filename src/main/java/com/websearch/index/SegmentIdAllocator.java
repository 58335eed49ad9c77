package com.websearch.index;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 全部索引线程共享的段编号分配器，保证编号唯一且单调递增。
 */
public final class SegmentIdAllocator {
    private final AtomicInteger nextId;

    public SegmentIdAllocator() {
        this(0);
    }

    public SegmentIdAllocator(int firstId) {
        if (firstId < 0) {
            throw new IllegalArgumentException("段编号不能为负数: " + firstId);
        }
        this.nextId = new AtomicInteger(firstId);
    }

    public int next() {
        return nextId.getAndIncrement();
    }

    /**
     * 已分配的段数量（相对起始编号）。
     */
    public int peek() {
        return nextId.get();
    }
}
