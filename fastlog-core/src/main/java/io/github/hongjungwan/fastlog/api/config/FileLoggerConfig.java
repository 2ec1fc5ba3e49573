package io.github.hongjungwan.fastlog.api.config;

import io.github.hongjungwan.fastlog.api.Cycle;
import io.github.hongjungwan.fastlog.api.Level;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * 파일 로거 설정. 출력 대상, 레벨, 로테이션, 버퍼, 레코드 풀, 폐기 큐 설정 포함.
 *
 * <p>값 검증은 하지 않는다. 0 이하의 값은 {@link #withDefaults()}에서 기본값으로 대체된다.</p>
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class FileLoggerConfig {

    public static final String STDOUT = "stdout";
    public static final String STDERR = "stderr";

    public static final int DEFAULT_BUFFER_LENGTH = 256 * 1024;
    public static final Duration DEFAULT_BUFFER_PERIOD = Duration.ofSeconds(15);
    public static final int DEFAULT_RECORD_LENGTH = 2048;
    public static final int DEFAULT_RECORD_FACTOR = 10;

    /** 출력 대상: stdout | stderr (대소문자 무시) | 파일 경로 */
    @Builder.Default
    private final String file = STDOUT;

    /** 최소 출력 레벨 */
    @Builder.Default
    private final Level level = Level.DEBUG;

    /** 크기 기반 로테이션 임계치 (bytes, 0이면 비활성) */
    @Builder.Default
    private final long rotateBytes = 0;

    /** 달력 기반 로테이션 주기 */
    @Builder.Default
    private final Cycle rotateCycle = Cycle.OFF;

    /** 쓰기 버퍼 크기 (bytes) */
    @Builder.Default
    private final int bufferLength = DEFAULT_BUFFER_LENGTH;

    /** 주기적 flush/sync 간격 (폐기 큐 사용 시에만 동작) */
    @Builder.Default
    private final Duration bufferPeriod = DEFAULT_BUFFER_PERIOD;

    /** 레코드 버퍼 초기 크기 (bytes) */
    @Builder.Default
    private final int recordLength = DEFAULT_RECORD_LENGTH;

    /** 레코드 풀 보존 계수. recordLength * recordFactor 이상으로 커진 레코드는 풀에 반환하지 않는다. */
    @Builder.Default
    private final int recordFactor = DEFAULT_RECORD_FACTOR;

    /** 폐기 큐 용량. 0이면 동기 쓰기, 양수면 큐가 가득 찼을 때 레코드를 버린다. */
    @Builder.Default
    private final int discardThreshold = 0;

    /** 기본 설정 (stdout, DEBUG, 로테이션 없음, 동기 쓰기) */
    public static FileLoggerConfig defaultConfig() {
        return FileLoggerConfig.builder().build();
    }

    /** 비어 있거나 0 이하인 값을 기본값으로 대체한 사본 */
    public FileLoggerConfig withDefaults() {
        return toBuilder()
                .file(file == null || file.isBlank() ? STDOUT : file)
                .level(level == null ? Level.DEBUG : level)
                .rotateBytes(Math.max(0, rotateBytes))
                .rotateCycle(rotateCycle == null ? Cycle.OFF : rotateCycle)
                .bufferLength(bufferLength <= 0 ? DEFAULT_BUFFER_LENGTH : bufferLength)
                .bufferPeriod(bufferPeriod == null || bufferPeriod.isNegative() || bufferPeriod.isZero()
                        ? DEFAULT_BUFFER_PERIOD : bufferPeriod)
                .recordLength(recordLength <= 0 ? DEFAULT_RECORD_LENGTH : recordLength)
                .recordFactor(recordFactor <= 0 ? DEFAULT_RECORD_FACTOR : recordFactor)
                .discardThreshold(Math.max(0, discardThreshold))
                .build();
    }

    /** 표준 스트림(stdout/stderr) 대상 여부 */
    public boolean isStandardStream() {
        return STDOUT.equalsIgnoreCase(file) || STDERR.equalsIgnoreCase(file);
    }

    /** 로테이션 적용 여부. 표준 스트림에는 적용되지 않는다. */
    public boolean isRotationEnabled() {
        return !isStandardStream() && (rotateBytes > 0 || (rotateCycle != null && rotateCycle != Cycle.OFF));
    }

    /** 폐기 큐(비동기 쓰기) 사용 여부 */
    public boolean isDiscardEnabled() {
        return discardThreshold > 0;
    }
}
