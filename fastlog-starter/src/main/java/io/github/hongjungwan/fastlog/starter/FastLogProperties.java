package io.github.hongjungwan.fastlog.starter;

import io.github.hongjungwan.fastlog.api.Cycle;
import io.github.hongjungwan.fastlog.api.Level;
import io.github.hongjungwan.fastlog.api.config.FileLoggerConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * FastLog 설정 Properties (prefix: fastlog).
 */
@Data
@ConfigurationProperties(prefix = "fastlog")
public class FastLogProperties {

    /** 자동 설정 활성화 여부 */
    private boolean enabled = true;

    /** 생성한 로거를 프로세스 기본 로거(FastLog)로 설치할지 여부 */
    private boolean installDefault = true;

    /** JSON 설정 파일 경로. 지정하면 아래 개별 항목 대신 파일 내용을 사용한다. */
    private String configFile;

    /** 출력 대상: stdout | stderr | 파일 경로 */
    private String file = FileLoggerConfig.STDOUT;

    private Level level = Level.DEBUG;

    /** 크기 기반 로테이션 임계치 (bytes, 0이면 비활성) */
    private long rotateBytes = 0;

    private Cycle rotateCycle = Cycle.OFF;

    private int bufferLength = FileLoggerConfig.DEFAULT_BUFFER_LENGTH;

    private Duration bufferPeriod = FileLoggerConfig.DEFAULT_BUFFER_PERIOD;

    private int recordLength = FileLoggerConfig.DEFAULT_RECORD_LENGTH;

    private int recordFactor = FileLoggerConfig.DEFAULT_RECORD_FACTOR;

    /** 폐기 큐 용량 (0이면 동기 쓰기) */
    private int discardThreshold = 0;
}
