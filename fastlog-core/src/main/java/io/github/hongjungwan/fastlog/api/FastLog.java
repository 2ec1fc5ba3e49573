package io.github.hongjungwan.fastlog.api;

import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 프로세스 전역 기본 로거. 시작 시 stdout 로거가 설치되어 있다.
 *
 * <pre>{@code
 * FileLogger logger = FileLoggers.create(FileLoggerConfig.builder()
 *         .file("logs/app.log")
 *         .rotateCycle(Cycle.DAILY)
 *         .discardThreshold(4096)
 *         .build());
 * FastLog.install(logger);
 *
 * FastLog.info("order %s accepted", orderId);
 * }</pre>
 *
 * <p>JVM 종료 시 설치된 로거를 flush 한다.</p>
 */
@Slf4j
public final class FastLog {

    private static final ReentrantLock INSTALL_LOCK = new ReentrantLock();

    private static volatile FastLogger current = FileLoggers.stdout();

    static {
        Runtime.getRuntime().addShutdownHook(new Thread(FastLog::flushQuietly, "fastlog-shutdown-flush"));
    }

    private FastLog() {}

    /**
     * 기본 로거 교체. 이전 로거를 flush 한 뒤 교체하며, 이전 로거는 닫지 않고 반환한다.
     */
    public static FastLogger install(FastLogger logger) {
        Objects.requireNonNull(logger, "logger");
        INSTALL_LOCK.lock();
        try {
            FastLogger previous = current;
            if (previous != null) {
                previous.flush();
            }
            current = logger;
            return previous;
        } finally {
            INSTALL_LOCK.unlock();
        }
    }

    public static FastLogger current() {
        return current;
    }

    public static void debug(String format, Object... args) {
        current.debug(format, args);
    }

    public static void info(String format, Object... args) {
        current.info(format, args);
    }

    public static void warn(String format, Object... args) {
        current.warn(format, args);
    }

    public static void error(String format, Object... args) {
        current.error(format, args);
    }

    public static void fatal(String format, Object... args) {
        current.fatal(format, args);
    }

    public static void errorStack(String format, Object... args) {
        current.errorStack(format, args);
    }

    public static void flush() {
        current.flush();
    }

    private static void flushQuietly() {
        try {
            current.flush();
        } catch (RuntimeException e) {
            log.warn("Failed to flush FastLog at shutdown", e);
        }
    }
}
