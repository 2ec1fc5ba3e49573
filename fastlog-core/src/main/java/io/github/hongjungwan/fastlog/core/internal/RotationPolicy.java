package io.github.hongjungwan.fastlog.core.internal;

import io.github.hongjungwan.fastlog.api.Cycle;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * 로테이션 판단 및 상태 관리. 싱크 락 안에서만 호출된다.
 *
 * <p>판단 순서:</p>
 * <ol>
 *   <li>달력 주기 - 레코드의 캡처된 달력 필드와 마지막 로테이션 스냅샷 비교</li>
 *   <li>크기 - 남은 바이트 예산에서 기록할 길이를 차감, 음수가 되면 로테이션</li>
 * </ol>
 *
 * <p>로테이션을 유발한 레코드는 새 파일에 기록되며 새 예산에서 차감하지 않는다.</p>
 */
public final class RotationPolicy {

    /** 로테이션 파일 접미사 형식 (.HHmmss) */
    public static final DateTimeFormatter SUFFIX_FORMAT = DateTimeFormatter.ofPattern("HHmmss");

    private final Cycle cycle;
    private final long rotateBytes;

    private int month;
    private int weekday;
    private int day;
    private int hour;
    private long remaining;
    private String suffix;

    public RotationPolicy(Cycle cycle, long rotateBytes, LocalDateTime now) {
        this.cycle = cycle == null ? Cycle.OFF : cycle;
        this.rotateBytes = Math.max(0, rotateBytes);
        reset(now);
    }

    /**
     * 레코드 기록 전 로테이션 필요 여부 판단. 크기 예산은 로테이션이 없을 때 차감된다.
     */
    public boolean shouldRotate(LogRecord record) {
        if (cycle != Cycle.OFF && crossesCycle(record)) {
            return true;
        }
        if (rotateBytes > 0) {
            remaining -= record.length();
            return remaining < 0;
        }
        return false;
    }

    /** 짧은 주기일수록 비교 필드가 누적된다 (월 → 요일 → 일 → 시). */
    private boolean crossesCycle(LogRecord record) {
        boolean monthChanged = record.getMonth() != month;
        boolean weekdayChanged = monthChanged || record.getWeekday() != weekday;
        boolean dayChanged = weekdayChanged || record.getDay() != day;
        boolean hourChanged = dayChanged || record.getHour() != hour;

        return switch (cycle) {
            case MONTHLY -> monthChanged;
            case WEEKLY -> weekdayChanged;
            case DAILY -> dayChanged;
            case HOURLY -> hourChanged;
            case OFF -> false;
        };
    }

    /** 새 파일을 연 시점 기준으로 스냅샷, 예산, 접미사를 초기화 */
    public void reset(LocalDateTime now) {
        this.month = now.getMonthValue();
        this.weekday = now.getDayOfWeek().getValue();
        this.day = now.getDayOfMonth();
        this.hour = now.getHour();
        this.remaining = rotateBytes;
        this.suffix = SUFFIX_FORMAT.format(now);
    }

    /**
     * {@code <file>.<HHmmss>} 형식의 로테이션 파일명. 이미 존재하면 {@code .0}, {@code .1}, ... 을 붙인다.
     */
    public Path rotatedPath(String file) {
        String base = file + "." + suffix;
        Path candidate = Paths.get(base);
        if (!Files.exists(candidate)) {
            return candidate;
        }
        for (int count = 0; ; count++) {
            candidate = Paths.get(base + "." + count);
            if (!Files.exists(candidate)) {
                return candidate;
            }
        }
    }

    public Cycle getCycle() {
        return cycle;
    }

    public long getRotateBytes() {
        return rotateBytes;
    }

    /** 남은 크기 예산 (bytes) */
    public long getRemaining() {
        return remaining;
    }

    public String getSuffix() {
        return suffix;
    }
}
