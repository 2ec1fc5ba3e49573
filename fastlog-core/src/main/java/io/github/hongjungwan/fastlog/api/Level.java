package io.github.hongjungwan.fastlog.api;

import java.util.Locale;

/**
 * 로그 레벨. 선언 순서가 곧 심각도 순서이며 OFF는 출력되지 않는 가상 레벨.
 */
public enum Level {
    DEBUG("DEBUG"),
    INFO(" INFO"),
    WARN(" WARN"),
    ERROR("ERROR"),
    FATAL("FATAL"),
    /** 모든 출력 억제 (헤더에 기록되지 않음) */
    OFF("  OFF");

    /** 헤더용 5자리 우측 정렬 레이블 (US-ASCII) */
    private final String label;

    Level(String label) {
        this.label = label;
    }

    /** 임계 레벨 {@code threshold}로 설정된 로거에서 이 레벨이 출력되는지 여부 */
    public boolean isEnabledAt(Level threshold) {
        return this != OFF && threshold != OFF && ordinal() >= threshold.ordinal();
    }

    public String label() {
        return label;
    }

    /**
     * 대소문자 구분 없이 레벨 문자열을 파싱한다.
     *
     * @throws IllegalArgumentException 알 수 없는 값
     */
    public static Level parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("invalid level value: null");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "debug" -> DEBUG;
            case "info" -> INFO;
            case "warn" -> WARN;
            case "error" -> ERROR;
            case "fatal" -> FATAL;
            case "off" -> OFF;
            default -> throw new IllegalArgumentException("invalid level value: " + value);
        };
    }
}
