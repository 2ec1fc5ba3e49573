package io.github.hongjungwan.fastlog.starter;

import io.github.hongjungwan.fastlog.api.Cycle;
import io.github.hongjungwan.fastlog.api.FastLog;
import io.github.hongjungwan.fastlog.api.FastLogger;
import io.github.hongjungwan.fastlog.api.FileLogger;
import io.github.hongjungwan.fastlog.api.Level;
import io.github.hongjungwan.fastlog.api.config.FileLoggerConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FastLogAutoConfiguration 테스트")
class FastLogAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(FastLogAutoConfiguration.class));

    @TempDir
    Path dir;

    @Nested
    @DisplayName("빈 등록")
    class BeanRegistrationTests {

        @Test
        @DisplayName("기본 설정으로 stdout 로거가 등록되어야 한다")
        void shouldRegisterDefaultBeans() {
            contextRunner.run(context -> {
                assertThat(context).hasSingleBean(FileLoggerConfig.class);
                assertThat(context).hasSingleBean(FileLogger.class);

                FileLoggerConfig config = context.getBean(FileLoggerConfig.class);
                assertThat(config.getFile()).isEqualTo(FileLoggerConfig.STDOUT);
                assertThat(config.getLevel()).isEqualTo(Level.DEBUG);
                assertThat(config.isDiscardEnabled()).isFalse();
            });
        }

        @Test
        @DisplayName("fastlog.enabled=false면 빈을 등록하지 않는다")
        void shouldBackOffWhenDisabled() {
            contextRunner
                    .withPropertyValues("fastlog.enabled=false")
                    .run(context -> {
                        assertThat(context).doesNotHaveBean(FileLogger.class);
                        assertThat(context).doesNotHaveBean(FileLoggerConfig.class);
                    });
        }

        @Test
        @DisplayName("사용자가 정의한 설정 빈을 우선 사용한다")
        void shouldUseUserDefinedConfig() {
            contextRunner
                    .withUserConfiguration(CustomConfig.class)
                    .run(context -> {
                        assertThat(context).hasSingleBean(FileLoggerConfig.class);
                        assertThat(context.getBean(FileLoggerConfig.class).getLevel()).isEqualTo(Level.ERROR);
                    });
        }
    }

    @Nested
    @DisplayName("Properties 바인딩")
    class PropertiesBindingTests {

        @Test
        @DisplayName("fastlog.* 속성이 설정에 반영되어야 한다")
        void shouldBindProperties() {
            String file = dir.resolve("app.log").toString();

            contextRunner
                    .withPropertyValues(
                            "fastlog.file=" + file,
                            "fastlog.level=warn",
                            "fastlog.rotate-bytes=1048576",
                            "fastlog.rotate-cycle=daily",
                            "fastlog.buffer-period=5s",
                            "fastlog.discard-threshold=128")
                    .run(context -> {
                        FileLoggerConfig config = context.getBean(FileLoggerConfig.class);
                        assertThat(config.getFile()).isEqualTo(file);
                        assertThat(config.getLevel()).isEqualTo(Level.WARN);
                        assertThat(config.getRotateBytes()).isEqualTo(1048576L);
                        assertThat(config.getRotateCycle()).isEqualTo(Cycle.DAILY);
                        assertThat(config.getBufferPeriod()).isEqualTo(Duration.ofSeconds(5));
                        assertThat(config.getDiscardThreshold()).isEqualTo(128);
                    });
        }

        @Test
        @DisplayName("config-file이 지정되면 JSON 파일에서 설정을 읽는다")
        void shouldLoadJsonConfigFile() throws Exception {
            // given
            Path json = dir.resolve("fastlog.json");
            String file = dir.resolve("json.log").toString().replace("\\", "\\\\");
            Files.writeString(json, "{\"file\": \"" + file + "\", \"level\": \"error\", \"rotate_cycle\": \"hourly\"}");

            // when / then
            contextRunner
                    .withPropertyValues("fastlog.config-file=" + json, "fastlog.level=debug")
                    .run(context -> {
                        FileLoggerConfig config = context.getBean(FileLoggerConfig.class);
                        assertThat(config.getLevel()).isEqualTo(Level.ERROR);
                        assertThat(config.getRotateCycle()).isEqualTo(Cycle.HOURLY);
                    });
        }
    }

    @Nested
    @DisplayName("기본 로거 설치")
    class DefaultLoggerTests {

        @Test
        @DisplayName("컨텍스트 동안 기본 로거로 설치되고 종료 시 이전 로거로 복구된다")
        void shouldInstallAndRestoreDefaultLogger() throws Exception {
            // given
            FastLogger before = FastLog.current();
            Path file = dir.resolve("app.log");

            // when
            contextRunner
                    .withPropertyValues("fastlog.file=" + file)
                    .run(context -> {
                        assertThat(FastLog.current()).isSameAs(context.getBean(FileLogger.class));
                        FastLog.info("hello from %s", "spring");
                    });

            // then
            assertThat(FastLog.current()).isSameAs(before);
            List<String> lines = Files.readAllLines(file);
            assertThat(lines).hasSize(1);
            assertThat(lines.get(0))
                    .contains(" INFO FastLogAutoConfigurationTest.java:")
                    .endsWith(" - hello from spring");
        }

        @Test
        @DisplayName("install-default=false면 기본 로거를 바꾸지 않는다")
        void shouldNotInstallWhenDisabled() {
            FastLogger before = FastLog.current();

            contextRunner
                    .withPropertyValues("fastlog.install-default=false", "fastlog.file=" + dir.resolve("app.log"))
                    .run(context -> {
                        assertThat(context).hasSingleBean(FileLogger.class);
                        assertThat(FastLog.current()).isSameAs(before);
                    });
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomConfig {

        @Bean
        FileLoggerConfig customFileLoggerConfig() {
            return FileLoggerConfig.builder().level(Level.ERROR).build();
        }
    }
}
