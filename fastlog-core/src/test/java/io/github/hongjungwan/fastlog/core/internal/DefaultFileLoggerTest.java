package io.github.hongjungwan.fastlog.core.internal;

import io.github.hongjungwan.fastlog.api.Level;
import io.github.hongjungwan.fastlog.api.config.FileLoggerConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

@DisplayName("DefaultFileLogger 테스트")
class DefaultFileLoggerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-15T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path dir;

    private DefaultFileLogger open(Level level) throws IOException {
        FileLoggerConfig config = FileLoggerConfig.builder()
                .file(dir.resolve("app.log").toString())
                .level(level)
                .build()
                .withDefaults();
        return new DefaultFileLogger(config, CLOCK, DestinationOpener.DEFAULT);
    }

    private List<String> lines() throws IOException {
        return Files.readAllLines(dir.resolve("app.log"), StandardCharsets.UTF_8);
    }

    private static int nextLine() {
        return StackWalker.getInstance().walk(frames -> frames.skip(1).findFirst()).orElseThrow().getLineNumber() + 1;
    }

    @Nested
    @DisplayName("출력 형식")
    class FormatTests {

        @Test
        @DisplayName("헤더, 호출 위치, 메시지 순으로 한 줄을 기록해야 한다")
        void shouldWriteHeaderLocationAndMessage() throws Exception {
            // given
            DefaultFileLogger logger = open(Level.DEBUG);

            // when
            int line = nextLine();
            logger.info("order %s accepted (%d items)", "A-100", 3);
            logger.close();

            // then
            assertThat(lines()).containsExactly(
                    "2024-03-15 12:00:00  INFO DefaultFileLoggerTest.java:" + line + " - order A-100 accepted (3 items)");
        }

        @Test
        @DisplayName("레벨마다 5자리 레이블을 사용해야 한다")
        void shouldUseLevelLabels() throws Exception {
            DefaultFileLogger logger = open(Level.DEBUG);

            logger.debug("d");
            logger.info("i");
            logger.warn("w");
            logger.error("e");
            logger.fatal("f");
            logger.close();

            assertThat(lines()).extracting(l -> l.substring(20, 25))
                    .containsExactly("DEBUG", " INFO", " WARN", "ERROR", "FATAL");
        }

        @Test
        @DisplayName("errorStack은 메시지 다음 줄에 호출 스택을 기록해야 한다")
        void shouldWriteStackOnErrorStack() throws Exception {
            // given
            DefaultFileLogger logger = open(Level.DEBUG);

            // when
            int line = nextLine();
            logger.errorStack("failed: %s", "timeout");
            logger.close();

            // then
            List<String> lines = lines();
            assertThat(lines).hasSize(2);
            assertThat(lines.get(0)).startsWith("2024-03-15 12:00:00 ERROR DefaultFileLoggerTest.java:" + line)
                    .endsWith(" - failed: timeout");
            assertThat(lines.get(1)).startsWith("DefaultFileLoggerTest.java:" + line + "|")
                    .endsWith("|")
                    .doesNotContain("DefaultFileLogger.java", "LogRecord.java");
        }
    }

    @Nested
    @DisplayName("레벨 필터")
    class LevelTests {

        @Test
        @DisplayName("설정 레벨 미만의 호출은 한 바이트도 기록하지 않는다")
        void shouldSuppressBelowThreshold() throws Exception {
            // given
            DefaultFileLogger logger = open(Level.WARN);

            // when
            logger.debug("hidden");
            logger.info("hidden");
            logger.flush();

            // then
            assertThat(Files.size(dir.resolve("app.log"))).isZero();
            assertThat(logger.getPool().getCreatedCount()).isZero();
            logger.close();
        }

        @Test
        @DisplayName("설정 레벨 이상은 모두 기록한다")
        void shouldWriteAtOrAboveThreshold() throws Exception {
            DefaultFileLogger logger = open(Level.WARN);

            logger.info("hidden");
            logger.warn("w");
            logger.error("e");
            logger.errorStack("s");
            logger.fatal("f");
            logger.close();

            assertThat(lines()).hasSize(5).noneMatch(l -> l.endsWith("hidden"));
        }

        @Test
        @DisplayName("OFF면 FATAL도 기록하지 않는다")
        void shouldSuppressEverythingWhenOff() throws Exception {
            DefaultFileLogger logger = open(Level.OFF);

            logger.fatal("f");
            logger.errorStack("s");
            logger.close();

            assertThat(Files.size(dir.resolve("app.log"))).isZero();
            assertThat(logger.isEnabled(Level.FATAL)).isFalse();
        }
    }

    @Nested
    @DisplayName("오류 처리")
    class ErrorTests {

        @Test
        @DisplayName("포맷 실패는 전파하지 않고 레코드를 풀로 반환한다")
        void shouldSwallowFormatErrors() throws Exception {
            // given
            DefaultFileLogger logger = open(Level.DEBUG);

            // when / then
            assertThatCode(() -> logger.info("%d", "not-a-number")).doesNotThrowAnyException();
            logger.close();
            assertThat(Files.size(dir.resolve("app.log"))).isZero();
            assertThat(logger.getPool().getIdleCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("인자의 toString 예외도 전파하지 않는다")
        void shouldSwallowArgumentFailures() throws Exception {
            DefaultFileLogger logger = open(Level.DEBUG);
            Object broken = new Object() {
                @Override
                public String toString() {
                    throw new IllegalStateException("broken");
                }
            };

            assertThatCode(() -> logger.warn("value=%s", broken)).doesNotThrowAnyException();
            logger.close();
        }
    }

    @Test
    @DisplayName("stdout 대상은 System.out으로 기록하고 닫지 않는다")
    void shouldWriteToStdout() throws Exception {
        // given
        PrintStream original = System.out;
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
        try {
            FileLoggerConfig config = FileLoggerConfig.builder().file("STDOUT").build().withDefaults();
            DefaultFileLogger logger = new DefaultFileLogger(config, CLOCK, DestinationOpener.DEFAULT);

            // when
            logger.info("to console");
            logger.close();

            // then
            assertThat(captured.toString(StandardCharsets.UTF_8))
                    .startsWith("2024-03-15 12:00:00  INFO DefaultFileLoggerTest.java:")
                    .endsWith(" - to console\n");
        } finally {
            System.setOut(original);
        }
    }
}
