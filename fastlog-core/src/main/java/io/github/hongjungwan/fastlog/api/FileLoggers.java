package io.github.hongjungwan.fastlog.api;

import io.github.hongjungwan.fastlog.api.config.FileLoggerConfig;
import io.github.hongjungwan.fastlog.core.internal.DefaultFileLogger;
import io.github.hongjungwan.fastlog.core.internal.DestinationOpener;

import java.io.IOException;
import java.time.Clock;
import java.util.Objects;

/**
 * FileLogger 팩토리.
 */
public final class FileLoggers {

    private FileLoggers() {}

    /**
     * 설정으로 로거 생성. 0 이하 값은 기본값으로 대체되고, 폐기 큐가 설정되면 플러시 데몬이 시작된다.
     *
     * @throws IOException 출력 대상 파일을 열 수 없음
     */
    public static FileLogger create(FileLoggerConfig config) throws IOException {
        Objects.requireNonNull(config, "config");
        return new DefaultFileLogger(config.withDefaults(), Clock.systemDefaultZone(), DestinationOpener.DEFAULT);
    }

    /** stdout, DEBUG, 로테이션 없음, 동기 쓰기 */
    public static FileLogger stdout() {
        try {
            return create(FileLoggerConfig.defaultConfig());
        } catch (IOException e) {
            throw new IllegalStateException("stdout destination unavailable", e);
        }
    }
}
