package io.github.hongjungwan.fastlog.core.internal;

import io.github.hongjungwan.fastlog.api.config.FileLoggerConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 출력 대상 파일과 버퍼를 소유하는 싱크.
 *
 * <p>쓰기 모드는 생성 시 결정된다:</p>
 * <ul>
 *   <li>DIRECT - 호출 스레드에서 락을 잡고 기록</li>
 *   <li>DISCARD - 제한 큐에 non-blocking으로 넣고, 가득 차면 즉시 버린다. {@link FlushDaemon}이 소비.</li>
 * </ul>
 *
 * <p>파일 핸들, 버퍼, 로테이션 상태는 모두 {@code lock}으로 보호된다.
 * 쓰기/로테이션 오류는 SLF4J로 보고하고 호출자에게 전파하지 않는다.</p>
 */
@Slf4j
public class FileSink implements RecordWriter, AutoCloseable {

    static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    public enum WriteMode {
        DIRECT,
        DISCARD
    }

    private final FileLoggerConfig config;
    private final RecordPool pool;
    private final Clock clock;
    private final DestinationOpener opener;
    private final ReentrantLock lock = new ReentrantLock();

    private final WriteMode mode;
    private final BlockingQueue<LogRecord> discardQueue;
    private final FlushDaemon daemon;

    /** null이면 로테이션 비적용 (표준 스트림 또는 설정 없음) */
    private final RotationPolicy rotation;

    /** 재오픈 실패 후 다음 로테이션 성공 전까지 null */
    private Destination destination;
    private BufferedOutputStream writer;

    private final AtomicBoolean closed = new AtomicBoolean(false);
    /** lock 보호. 데몬이 남은 큐를 비운 뒤에 설정된다. */
    private boolean fileClosed;
    private final LongAdder droppedRecords = new LongAdder();
    private final LongAdder writeErrors = new LongAdder();
    private long rotationCount;

    /**
     * @throws IOException 출력 대상을 열 수 없음
     */
    public FileSink(FileLoggerConfig config, RecordPool pool, Clock clock, DestinationOpener opener) throws IOException {
        this.config = config;
        this.pool = pool;
        this.clock = clock;
        this.opener = opener;

        this.destination = opener.open(config.getFile());
        this.writer = new BufferedOutputStream(destination.stream(), config.getBufferLength());

        this.rotation = !destination.isStandardStream() && config.isRotationEnabled()
                ? new RotationPolicy(config.getRotateCycle(), config.getRotateBytes(), LocalDateTime.now(clock))
                : null;

        if (config.isDiscardEnabled()) {
            this.mode = WriteMode.DISCARD;
            this.discardQueue = new ArrayBlockingQueue<>(config.getDiscardThreshold());
            this.daemon = new FlushDaemon(discardQueue, this, config.getBufferPeriod());
            this.daemon.start();
        } else {
            this.mode = WriteMode.DIRECT;
            this.discardQueue = null;
            this.daemon = null;
        }

        log.debug("FileSink opened: file={}, mode={}, rotation={}", config.getFile(), mode, rotation != null);
    }

    /** 생성 시 결정된 모드로 기록 */
    public void write(LogRecord record) {
        if (mode == WriteMode.DISCARD && !closed.get()) {
            writeDiscard(record);
        } else {
            writeDirect(record);
        }
    }

    /**
     * 락을 잡고 로테이션 판단 후 버퍼에 기록한다. 기록 결과와 무관하게 레코드는 풀로 반환된다.
     */
    @Override
    public void writeDirect(LogRecord record) {
        lock.lock();
        try {
            if (fileClosed) {
                throw new IOException("FileSink is closed");
            }
            if (rotation != null && (writer == null || rotation.shouldRotate(record))) {
                rollover();
            }
            if (writer == null) {
                throw new IOException("no active file");
            }
            record.writeTo(writer);
        } catch (IOException e) {
            writeErrors.increment();
            log.error("FastLog write failed: {}", config.getFile(), e);
        } finally {
            lock.unlock();
            pool.release(record);
        }
    }

    /**
     * non-blocking으로 큐에 넣는다. 큐가 가득 차면 조용히 버리고 레코드는 풀로 재활용한다.
     */
    public void writeDiscard(LogRecord record) {
        if (!discardQueue.offer(record)) {
            droppedRecords.increment();
            pool.release(record);
        }
    }

    /**
     * 닫기 → 이름 변경 → 재오픈. 재오픈에 실패하면 활성 파일 없이 남고,
     * 재오픈이 성공할 때까지 매 쓰기마다 재오픈을 시도하며 실패는 쓰기 오류로 보고된다.
     */
    private void rollover() {
        Path active = Paths.get(config.getFile());

        if (writer != null) {
            Path rotated = rotation.rotatedPath(config.getFile());
            try {
                writer.flush();
            } catch (IOException e) {
                log.error("Failed to flush before rotation: {}", active, e);
            }
            try {
                destination.close();
            } catch (IOException e) {
                log.error("Failed to close before rotation: {}", active, e);
            }
            this.writer = null;
            this.destination = null;
            try {
                Files.move(active, rotated);
                log.debug("Rotated {} to {}", active, rotated);
            } catch (IOException e) {
                log.error("Failed to rename {} to {}", active, rotated, e);
            }
        }

        try {
            Destination reopened = opener.open(config.getFile());
            this.destination = reopened;
            this.writer = new BufferedOutputStream(reopened.stream(), config.getBufferLength());
            rotation.reset(LocalDateTime.now(clock));
            rotationCount++;
        } catch (IOException e) {
            log.error("Failed to reopen log file after rotation: {}", active, e);
        }
    }

    /** 버퍼 flush + 디스크 sync. 쓰기와 같은 락으로 직렬화된다. */
    @Override
    public void flush() {
        lock.lock();
        try {
            if (fileClosed || writer == null) {
                return;
            }
            writer.flush();
            destination.sync();
        } catch (IOException e) {
            log.error("FastLog flush failed: {}", config.getFile(), e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 데몬 종료 신호 후 대기, flush, 파일 닫기. 표준 스트림은 닫지 않는다. 여러 번 호출해도 안전하다.
     * 데몬이 제한 시간 안에 큐를 비우지 못하면 남은 레코드는 버린 것으로 집계한다.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (daemon != null && !daemon.shutdown(SHUTDOWN_TIMEOUT)) {
            discardRemaining();
        }
        lock.lock();
        try {
            fileClosed = true;
            if (writer == null) {
                return;
            }
            writer.flush();
            if (!destination.isStandardStream()) {
                destination.close();
            }
        } catch (IOException e) {
            log.error("FastLog close failed: {}", config.getFile(), e);
        } finally {
            lock.unlock();
        }
        log.debug("FileSink closed: file={}, dropped={}", config.getFile(), droppedRecords.sum());
    }

    /** 데몬이 비우지 못한 큐의 레코드를 버린 것으로 집계하고 풀로 반환 */
    private void discardRemaining() {
        List<LogRecord> remaining = new ArrayList<>();
        discardQueue.drainTo(remaining);
        int discarded = 0;
        for (LogRecord record : remaining) {
            if (record != FlushDaemon.SHUTDOWN) {
                discarded++;
                pool.release(record);
            }
        }
        if (discarded > 0) {
            droppedRecords.add(discarded);
            log.warn("FastLog discarded {} queued records on close: {}", discarded, config.getFile());
        }
    }

    public WriteMode getMode() {
        return mode;
    }

    public boolean isRotationEnabled() {
        return rotation != null;
    }

    /** 크기 예산 잔량. 로테이션 비적용 시 -1. */
    public long getRemainingBytes() {
        lock.lock();
        try {
            return rotation == null ? -1 : rotation.getRemaining();
        } finally {
            lock.unlock();
        }
    }

    public long getRotationCount() {
        lock.lock();
        try {
            return rotationCount;
        } finally {
            lock.unlock();
        }
    }

    public long getDroppedRecords() {
        return droppedRecords.sum();
    }

    public long getWriteErrors() {
        return writeErrors.sum();
    }

    /** 폐기 큐에 대기 중인 레코드 수 */
    public int getQueueSize() {
        return discardQueue == null ? 0 : discardQueue.size();
    }

    public boolean isClosed() {
        return closed.get();
    }

    FlushDaemon getDaemon() {
        return daemon;
    }
}
