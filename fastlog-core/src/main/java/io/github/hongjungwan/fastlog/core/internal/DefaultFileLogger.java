package io.github.hongjungwan.fastlog.core.internal;

import io.github.hongjungwan.fastlog.api.FileLogger;
import io.github.hongjungwan.fastlog.api.Level;
import io.github.hongjungwan.fastlog.api.config.FileLoggerConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 기본 FileLogger 구현. 풀에서 레코드 획득 → 포맷 → 싱크 기록.
 *
 * <p>포맷 중 예외(잘못된 format, 인자의 toString 실패)는 SLF4J로 보고하고 해당 로그는 버린다.</p>
 */
@Slf4j
public class DefaultFileLogger implements FileLogger {

    /** 파이프라인 프레임 이후 추가로 건너뛸 프레임 수 */
    private static final int CALLER_SKIP = 0;

    private final FileLoggerConfig config;
    private final Level level;
    private final Clock clock;
    private final RecordPool pool;
    private final FileSink sink;

    /**
     * @param config 기본값이 적용된 설정
     * @throws IOException 출력 대상을 열 수 없음
     */
    public DefaultFileLogger(FileLoggerConfig config, Clock clock, DestinationOpener opener) throws IOException {
        this.config = config;
        this.level = config.getLevel();
        this.clock = clock;
        this.pool = new RecordPool(config.getRecordLength(), config.getRecordFactor());
        this.sink = new FileSink(config, pool, clock, opener);
    }

    @Override
    public void debug(String format, Object... args) {
        if (Level.DEBUG.isEnabledAt(level)) {
            emit(Level.DEBUG, false, format, args);
        }
    }

    @Override
    public void info(String format, Object... args) {
        if (Level.INFO.isEnabledAt(level)) {
            emit(Level.INFO, false, format, args);
        }
    }

    @Override
    public void warn(String format, Object... args) {
        if (Level.WARN.isEnabledAt(level)) {
            emit(Level.WARN, false, format, args);
        }
    }

    @Override
    public void error(String format, Object... args) {
        if (Level.ERROR.isEnabledAt(level)) {
            emit(Level.ERROR, false, format, args);
        }
    }

    @Override
    public void fatal(String format, Object... args) {
        if (Level.FATAL.isEnabledAt(level)) {
            emit(Level.FATAL, false, format, args);
        }
    }

    @Override
    public void errorStack(String format, Object... args) {
        if (Level.ERROR.isEnabledAt(level)) {
            emit(Level.ERROR, true, format, args);
        }
    }

    private void emit(Level recordLevel, boolean withStack, String format, Object[] args) {
        LogRecord record = pool.acquire();
        try {
            record.header(recordLevel, LocalDateTime.now(clock));
            record.location(CALLER_SKIP);
            record.printf(format, args);
            if (withStack) {
                record.printStack(CALLER_SKIP);
            }
        } catch (RuntimeException e) {
            pool.release(record);
            log.warn("FastLog failed to format message: {}", format, e);
            return;
        }
        sink.write(record);
    }

    @Override
    public boolean isEnabled(Level target) {
        return target.isEnabledAt(level);
    }

    @Override
    public void flush() {
        sink.flush();
    }

    @Override
    public void close() {
        sink.close();
    }

    @Override
    public long getDroppedRecords() {
        return sink.getDroppedRecords();
    }

    public FileLoggerConfig getConfig() {
        return config;
    }

    public FileSink getSink() {
        return sink;
    }

    public RecordPool getPool() {
        return pool;
    }
}
