package io.github.hongjungwan.fastlog.api;

import java.util.Locale;

/**
 * 달력 기반 로테이션 주기. 상위 주기일수록 비교 필드가 적다.
 *
 * <ul>
 *   <li>MONTHLY - 월 변경</li>
 *   <li>WEEKLY - 월 또는 요일 변경</li>
 *   <li>DAILY - 월, 요일 또는 일 변경</li>
 *   <li>HOURLY - 월, 요일, 일 또는 시 변경</li>
 * </ul>
 */
public enum Cycle {
    OFF,
    HOURLY,
    DAILY,
    WEEKLY,
    MONTHLY;

    /**
     * 대소문자 구분 없이 주기 문자열을 파싱한다. {@code never}는 {@code off}와 같다.
     *
     * @throws IllegalArgumentException 알 수 없는 값
     */
    public static Cycle parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("invalid cycle value: null");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "hourly" -> HOURLY;
            case "daily" -> DAILY;
            case "weekly" -> WEEKLY;
            case "monthly" -> MONTHLY;
            case "off", "never" -> OFF;
            default -> throw new IllegalArgumentException("invalid cycle value: " + value);
        };
    }
}
