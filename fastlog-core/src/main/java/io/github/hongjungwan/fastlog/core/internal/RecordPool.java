package io.github.hongjungwan.fastlog.core.internal;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

/**
 * 크기 제한 레코드 풀 (lock-free free list).
 *
 * <p>버퍼 용량이 {@code recordLength * recordFactor} 이상인 레코드는 반환 시 보존하지 않고 GC에 맡긴다.
 * 보존 개수는 {@code maxPooled}로 제한한다.</p>
 */
public final class RecordPool {

    public static final int DEFAULT_MAX_POOLED = 1024;

    private final Queue<LogRecord> free = new ConcurrentLinkedQueue<>();
    private final AtomicInteger idle = new AtomicInteger();

    private final int recordLength;
    private final int threshold;
    private final int maxPooled;

    private final LongAdder created = new LongAdder();
    private final LongAdder reused = new LongAdder();
    private final LongAdder rejected = new LongAdder();

    public RecordPool(int recordLength, int recordFactor) {
        this(recordLength, recordFactor, DEFAULT_MAX_POOLED);
    }

    public RecordPool(int recordLength, int recordFactor, int maxPooled) {
        if (recordLength <= 0 || recordFactor <= 0) {
            throw new IllegalArgumentException(
                    "recordLength and recordFactor must be positive: " + recordLength + ", " + recordFactor);
        }
        this.recordLength = recordLength;
        this.threshold = (int) Math.min(Integer.MAX_VALUE, (long) recordLength * recordFactor);
        this.maxPooled = Math.max(0, maxPooled);
    }

    /** 비어 있는 레코드 획득. 재사용 레코드는 이전 용량을 유지한다. */
    public LogRecord acquire() {
        LogRecord record = free.poll();
        if (record == null) {
            created.increment();
            return new LogRecord(recordLength);
        }
        idle.decrementAndGet();
        reused.increment();
        record.reset();
        return record;
    }

    /** 용량이 임계치 미만이고 보존 한도 이내일 때만 풀에 반환 */
    public void release(LogRecord record) {
        if (record == null) {
            return;
        }
        if (record.capacity() >= threshold) {
            rejected.increment();
            return;
        }
        if (idle.incrementAndGet() > maxPooled) {
            idle.decrementAndGet();
            rejected.increment();
            return;
        }
        free.offer(record);
    }

    /** 보존 임계 용량 (bytes) */
    public int getThreshold() {
        return threshold;
    }

    public int getIdleCount() {
        return idle.get();
    }

    public long getCreatedCount() {
        return created.sum();
    }

    public long getReusedCount() {
        return reused.sum();
    }

    public long getRejectedCount() {
        return rejected.sum();
    }
}
