package io.github.hongjungwan.fastlog.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Level / Cycle 테스트")
class LevelTest {

    @Nested
    @DisplayName("Level")
    class LevelTests {

        @Test
        @DisplayName("대소문자 구분 없이 파싱해야 한다")
        void shouldParseCaseInsensitive() {
            assertThat(Level.parse("debug")).isEqualTo(Level.DEBUG);
            assertThat(Level.parse("INFO")).isEqualTo(Level.INFO);
            assertThat(Level.parse(" Warn ")).isEqualTo(Level.WARN);
            assertThat(Level.parse("error")).isEqualTo(Level.ERROR);
            assertThat(Level.parse("Fatal")).isEqualTo(Level.FATAL);
            assertThat(Level.parse("off")).isEqualTo(Level.OFF);
        }

        @Test
        @DisplayName("알 수 없는 값은 invalid level value 오류")
        void shouldRejectUnknownLevel() {
            assertThatThrownBy(() -> Level.parse("verbose"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("invalid level value: verbose");
            assertThatThrownBy(() -> Level.parse(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("임계 레벨 이상만 활성화된다")
        void shouldCompareSeverity() {
            assertThat(Level.WARN.isEnabledAt(Level.INFO)).isTrue();
            assertThat(Level.WARN.isEnabledAt(Level.WARN)).isTrue();
            assertThat(Level.INFO.isEnabledAt(Level.WARN)).isFalse();
            assertThat(Level.FATAL.isEnabledAt(Level.OFF)).isFalse();
            assertThat(Level.OFF.isEnabledAt(Level.DEBUG)).isFalse();
        }

        @Test
        @DisplayName("헤더 레이블은 모두 5자이다")
        void shouldHaveFiveCharLabels() {
            for (Level level : Level.values()) {
                assertThat(level.label()).hasSize(5);
                assertThat(level.label().trim()).isEqualTo(level.name());
            }
        }
    }

    @Nested
    @DisplayName("Cycle")
    class CycleTests {

        @Test
        @DisplayName("주기 문자열을 파싱하고 never는 off와 같다")
        void shouldParseCycle() {
            assertThat(Cycle.parse("hourly")).isEqualTo(Cycle.HOURLY);
            assertThat(Cycle.parse("DAILY")).isEqualTo(Cycle.DAILY);
            assertThat(Cycle.parse("Weekly")).isEqualTo(Cycle.WEEKLY);
            assertThat(Cycle.parse("monthly")).isEqualTo(Cycle.MONTHLY);
            assertThat(Cycle.parse("never")).isEqualTo(Cycle.OFF);
            assertThat(Cycle.parse("off")).isEqualTo(Cycle.OFF);
        }

        @Test
        @DisplayName("알 수 없는 값은 invalid cycle value 오류")
        void shouldRejectUnknownCycle() {
            assertThatThrownBy(() -> Cycle.parse("yearly"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("invalid cycle value: yearly");
        }
    }
}
