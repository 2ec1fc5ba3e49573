package io.github.hongjungwan.fastlog.core.internal;

import io.github.hongjungwan.fastlog.api.config.FileLoggerConfig;

import java.io.Closeable;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;

/**
 * 로그 출력 대상. 파일(append 모드) 또는 표준 스트림.
 *
 * <p>표준 스트림은 닫지 않고 sync 하지 않는다.</p>
 */
public interface Destination extends Closeable {

    OutputStream stream();

    /** 디스크 동기화 */
    void sync() throws IOException;

    boolean isStandardStream();

    /**
     * stdout/stderr (대소문자 무시)는 표준 스트림, 그 외는 파일 경로로 열며 없으면 생성한다.
     *
     * @throws IOException 파일을 열 수 없음
     */
    static Destination open(String id) throws IOException {
        if (FileLoggerConfig.STDOUT.equalsIgnoreCase(id)) {
            return new StandardStream(System.out);
        }
        if (FileLoggerConfig.STDERR.equalsIgnoreCase(id)) {
            return new StandardStream(System.err);
        }
        return new FileDestination(new FileOutputStream(id, true));
    }

    final class FileDestination implements Destination {
        private final FileOutputStream out;

        FileDestination(FileOutputStream out) {
            this.out = out;
        }

        @Override
        public OutputStream stream() {
            return out;
        }

        @Override
        public void sync() throws IOException {
            out.getFD().sync();
        }

        @Override
        public boolean isStandardStream() {
            return false;
        }

        @Override
        public void close() throws IOException {
            out.close();
        }
    }

    final class StandardStream implements Destination {
        private final PrintStream out;

        StandardStream(PrintStream out) {
            this.out = out;
        }

        @Override
        public OutputStream stream() {
            return out;
        }

        @Override
        public void sync() {
            out.flush();
        }

        @Override
        public boolean isStandardStream() {
            return true;
        }

        @Override
        public void close() {
            out.flush();
        }
    }
}
