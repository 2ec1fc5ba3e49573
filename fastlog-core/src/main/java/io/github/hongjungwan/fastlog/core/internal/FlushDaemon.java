package io.github.hongjungwan.fastlog.core.internal;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

/**
 * 폐기 큐 소비 + 주기적 flush 데몬. 싱크당 단일 스레드.
 *
 * <p>매 반복에서 큐의 레코드 또는 flush 타이머 중 먼저 온 것을 처리한다.
 * 종료 신호({@link #SHUTDOWN})를 받으면 그 앞에 쌓인 레코드를 모두 기록한 뒤 끝난다.
 * 반복 중 예외와 {@link Error}는 보고 후 루프를 재시작한다. {@link VirtualMachineError}는 재시작하지 않는다.</p>
 */
@Slf4j
public final class FlushDaemon {

    /** 큐 종료 신호. 기록되지 않는다. */
    static final LogRecord SHUTDOWN = new LogRecord(0);

    private static final AtomicInteger THREAD_SEQUENCE = new AtomicInteger();

    private final BlockingQueue<LogRecord> queue;
    private final RecordWriter writer;
    private final long periodNanos;
    private final ExecutorService executor;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean shutdownSignalled = new AtomicBoolean(false);
    private final CountDownLatch terminated = new CountDownLatch(1);
    private final LongAdder faults = new LongAdder();

    public FlushDaemon(BlockingQueue<LogRecord> queue, RecordWriter writer, Duration period) {
        this.queue = queue;
        this.writer = writer;
        this.periodNanos = Math.max(1, period.toNanos());
        String threadName = "fastlog-flush-" + THREAD_SEQUENCE.incrementAndGet();
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, threadName);
            thread.setDaemon(true);
            return thread;
        });
    }

    public void start() {
        if (started.compareAndSet(false, true)) {
            executor.execute(this::supervise);
            executor.shutdown();
            log.debug("FlushDaemon started with period: {}ms", TimeUnit.NANOSECONDS.toMillis(periodNanos));
        }
    }

    /** 종료 신호 전달까지 반복 재시작 */
    private void supervise() {
        try {
            while (true) {
                try {
                    runLoop();
                    return;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("FlushDaemon interrupted, stopping");
                    return;
                } catch (VirtualMachineError e) {
                    log.error("FlushDaemon died, queued records will no longer be written", e);
                    throw e;
                } catch (RuntimeException | Error e) {
                    faults.increment();
                    log.error("FlushDaemon iteration failed, restarting loop", e);
                }
            }
        } finally {
            terminated.countDown();
            log.debug("FlushDaemon stopped");
        }
    }

    private void runLoop() throws InterruptedException {
        long nextFlush = System.nanoTime() + periodNanos;
        while (true) {
            long wait = nextFlush - System.nanoTime();
            if (wait <= 0) {
                writer.flush();
                nextFlush = System.nanoTime() + periodNanos;
                continue;
            }
            LogRecord record = queue.poll(wait, TimeUnit.NANOSECONDS);
            if (record == SHUTDOWN) {
                return;
            }
            if (record != null) {
                writer.writeDirect(record);
            }
        }
    }

    /**
     * 종료 신호를 큐에 넣고 데몬 종료를 기다린다. 큐가 가득 차 있으면 제한 시간 안에서 공간이 생길 때까지 대기한다.
     * 신호 전달이나 종료 대기가 제한 시간을 넘기면 데몬 스레드를 인터럽트해 멈춘다. 이때 큐에 남은 레코드는 기록되지 않는다.
     *
     * @return 큐를 모두 비우고 제한 시간 내 종료했는지 여부
     */
    public boolean shutdown(Duration timeout) {
        if (!shutdownSignalled.compareAndSet(false, true)) {
            return awaitTermination(timeout);
        }
        if (!started.get()) {
            terminated.countDown();
            return true;
        }
        try {
            if (!queue.offer(SHUTDOWN, timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Timeout signalling FlushDaemon shutdown, queue still full");
                forceStop(timeout);
                return false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while signalling FlushDaemon shutdown");
            executor.shutdownNow();
            return false;
        }
        if (!awaitTermination(timeout)) {
            forceStop(timeout);
            return false;
        }
        return true;
    }

    private void forceStop(Duration timeout) {
        executor.shutdownNow();
        if (awaitTermination(timeout)) {
            log.warn("FlushDaemon interrupted with {} records left in queue", queue.size());
        }
    }

    private boolean awaitTermination(Duration timeout) {
        try {
            boolean done = terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!done) {
                log.warn("Timeout waiting for FlushDaemon to drain queue");
            }
            return done;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public boolean isTerminated() {
        return terminated.getCount() == 0;
    }

    /** 재시작된 반복 횟수 */
    public long getFaultCount() {
        return faults.sum();
    }
}
