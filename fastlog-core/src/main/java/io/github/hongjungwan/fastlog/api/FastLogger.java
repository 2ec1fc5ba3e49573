package io.github.hongjungwan.fastlog.api;

/**
 * FastLog 로거 인터페이스. 메시지는 {@link java.util.Formatter} 문법 ({@code %s}, {@code %d} ...).
 *
 * <p>인자가 없으면 format 문자열을 그대로 출력한다. 로깅 호출은 예외를 던지지 않는다.</p>
 */
public interface FastLogger {

    void debug(String format, Object... args);

    void info(String format, Object... args);

    void warn(String format, Object... args);

    void error(String format, Object... args);

    void fatal(String format, Object... args);

    /** ERROR 레벨 + 호출 스택 ("File.java:line|..." 한 줄) */
    void errorStack(String format, Object... args);

    boolean isEnabled(Level level);

    /** 버퍼 flush + 디스크 sync */
    void flush();
}
