package io.github.hongjungwan.fastlog.core.internal;

import io.github.hongjungwan.fastlog.api.FastLog;
import io.github.hongjungwan.fastlog.api.Level;

import java.io.IOException;
import java.io.OutputStream;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Formatter;
import java.util.Locale;

/**
 * 재사용 가능한 로그 레코드. 포맷된 엔트리 전체를 담는 가변 바이트 버퍼.
 *
 * <p>형식: {@code yyyy-MM-dd HH:mm:ss LEVEL File.java:line - message\n[File.java:line|...\n]}</p>
 *
 * <p>달력 필드(월/요일/일/시/분)는 포맷 시점에 한 번만 기록된다. 비동기 큐 대기 후 기록되더라도
 * 로테이션 판단은 레코드 생성 시각 기준이다.</p>
 *
 * <p>스레드 안전하지 않음. 한 시점에 하나의 스레드만 소유한다.</p>
 */
public final class LogRecord {

    public static final int HEADER_LENGTH = 26;

    static final String UNKNOWN_FILE = "???";

    private static final byte[] DIGITS = {'0', '1', '2', '3', '4', '5', '6', '7', '8', '9'};
    private static final byte DATE_SEPARATOR = '-';
    private static final byte SPACE = ' ';
    private static final byte COLON = ':';
    private static final byte MINUS = '-';
    private static final byte NEWLINE = '\n';
    private static final byte STACK_SEPARATOR = '|';

    /** 호출 위치 탐색 시 건너뛰는 파이프라인 내부 클래스 */
    private static final String[] PIPELINE_CLASSES = {
            LogRecord.class.getName(),
            DefaultFileLogger.class.getName(),
            FastLog.class.getName()
    };

    /** 스택 출력 시 제외하는 JDK 런타임 패키지 */
    private static final String[] RUNTIME_PREFIXES = {"java.", "javax.", "jdk.", "sun.", "com.sun."};

    private static final StackWalker WALKER = StackWalker.getInstance();

    private byte[] buffer;
    private int length;
    private final byte[] header = new byte[HEADER_LENGTH];

    private final StringBuilder text = new StringBuilder(128);
    private final Formatter formatter = new Formatter(text, Locale.ROOT);

    private int month;
    private int weekday;
    private int day;
    private int hour;
    private int minute;

    public LogRecord(int capacity) {
        this.buffer = new byte[Math.max(0, capacity)];
    }

    /** 버퍼를 비운다. 용량과 달력 필드는 유지되며 다음 포맷에서 덮어쓴다. */
    void reset() {
        length = 0;
        text.setLength(0);
    }

    /**
     * 헤더 "yyyy-MM-dd HH:mm:ss LEVEL " (26 bytes)를 기록하고 달력 필드를 캡처한다.
     */
    public void header(Level level, LocalDateTime time) {
        int yr = time.getYear();
        int mn = time.getMonthValue();
        int dy = time.getDayOfMonth();
        int hr = time.getHour();
        int mi = time.getMinute();
        int ss = time.getSecond();

        this.month = mn;
        this.weekday = time.getDayOfWeek().getValue();
        this.day = dy;
        this.hour = hr;
        this.minute = mi;

        header[0] = DIGITS[yr / 1000 % 10];
        yr %= 1000;
        header[1] = DIGITS[yr / 100];
        yr %= 100;
        header[2] = DIGITS[yr / 10];
        header[3] = DIGITS[yr % 10];
        header[4] = DATE_SEPARATOR;
        header[5] = DIGITS[mn / 10];
        header[6] = DIGITS[mn % 10];
        header[7] = DATE_SEPARATOR;
        header[8] = DIGITS[dy / 10];
        header[9] = DIGITS[dy % 10];
        header[10] = SPACE;
        header[11] = DIGITS[hr / 10];
        header[12] = DIGITS[hr % 10];
        header[13] = COLON;
        header[14] = DIGITS[mi / 10];
        header[15] = DIGITS[mi % 10];
        header[16] = COLON;
        header[17] = DIGITS[ss / 10];
        header[18] = DIGITS[ss % 10];
        header[19] = SPACE;

        String label = level.label();
        for (int i = 0; i < 5; i++) {
            header[20 + i] = (byte) label.charAt(i);
        }
        header[25] = SPACE;

        append(header, 0, HEADER_LENGTH);
    }

    /**
     * 호출자 위치 "File.java:line - "를 기록한다.
     *
     * @param skip 파이프라인 내부 프레임 이후 추가로 건너뛸 프레임 수
     */
    public void location(int skip) {
        StackWalker.StackFrame frame = WALKER.walk(frames -> frames
                .dropWhile(f -> isPipelineFrame(f.getClassName()))
                .skip(Math.max(0, skip))
                .findFirst()
                .orElse(null));

        if (frame == null || frame.getFileName() == null || frame.getLineNumber() < 0) {
            appendAscii(UNKNOWN_FILE);
            append(COLON);
            appendInt(1);
        } else {
            appendUtf8(frame.getFileName());
            append(COLON);
            appendInt(frame.getLineNumber());
        }
        append(SPACE);
        append(MINUS);
        append(SPACE);
    }

    /** 메시지 본문 + 개행. {@link Formatter} 문법. */
    public void printf(String format, Object... args) {
        text.setLength(0);
        if (args == null || args.length == 0) {
            text.append(format);
        } else {
            formatter.format(format, args);
        }
        appendUtf8(text);
        append(NEWLINE);
    }

    /**
     * 호출자부터 바깥쪽으로 "File.java:line|" 형식의 스택을 기록한다. JDK 런타임 프레임은 제외.
     *
     * @param skip 앞쪽에서 추가로 건너뛸 프레임 수
     */
    public void printStack(int skip) {
        WALKER.forEach(new StackAppender(Math.max(0, skip)));
        append(NEWLINE);
    }

    /** 스택 순회 상태. 파이프라인 프레임 구간이 끝난 뒤부터 기록한다. */
    private final class StackAppender implements java.util.function.Consumer<StackWalker.StackFrame> {
        private boolean callerReached;
        private int remainingSkip;

        StackAppender(int skip) {
            this.remainingSkip = skip;
        }

        @Override
        public void accept(StackWalker.StackFrame frame) {
            String className = frame.getClassName();
            if (!callerReached) {
                if (isPipelineFrame(className)) {
                    return;
                }
                callerReached = true;
            }
            if (isRuntimeFrame(className)) {
                return;
            }
            if (remainingSkip > 0) {
                remainingSkip--;
                return;
            }
            String fileName = frame.getFileName();
            appendUtf8(fileName == null ? UNKNOWN_FILE : fileName);
            append(COLON);
            appendInt(Math.max(frame.getLineNumber(), 1));
            append(STACK_SEPARATOR);
        }
    }

    static boolean isPipelineFrame(String className) {
        for (String pipelineClass : PIPELINE_CLASSES) {
            if (className.equals(pipelineClass)
                    || (className.startsWith(pipelineClass) && className.charAt(pipelineClass.length()) == '$')) {
                return true;
            }
        }
        return false;
    }

    static boolean isRuntimeFrame(String className) {
        for (String prefix : RUNTIME_PREFIXES) {
            if (className.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    /** 버퍼 내용을 그대로 기록 */
    void writeTo(OutputStream out) throws IOException {
        out.write(buffer, 0, length);
    }

    void append(byte b) {
        ensureCapacity(length + 1);
        buffer[length++] = b;
    }

    void append(byte[] bytes, int offset, int len) {
        ensureCapacity(length + len);
        System.arraycopy(bytes, offset, buffer, length, len);
        length += len;
    }

    private void appendAscii(String s) {
        ensureCapacity(length + s.length());
        for (int i = 0; i < s.length(); i++) {
            buffer[length++] = (byte) s.charAt(i);
        }
    }

    /** 음수가 아닌 정수를 10진 ASCII로 기록 */
    private void appendInt(int value) {
        if (value < 10) {
            append(DIGITS[value]);
            return;
        }
        int digits = 0;
        for (int v = value; v > 0; v /= 10) {
            digits++;
        }
        ensureCapacity(length + digits);
        for (int i = length + digits - 1; i >= length; i--) {
            buffer[i] = DIGITS[value % 10];
            value /= 10;
        }
        length += digits;
    }

    /** 중간 String 없이 UTF-8로 인코딩. 짝이 없는 surrogate는 '?'로 대체. */
    private void appendUtf8(CharSequence s) {
        int n = s.length();
        for (int i = 0; i < n; i++) {
            char c = s.charAt(i);
            if (c < 0x80) {
                append((byte) c);
            } else if (c < 0x800) {
                ensureCapacity(length + 2);
                buffer[length++] = (byte) (0xC0 | (c >> 6));
                buffer[length++] = (byte) (0x80 | (c & 0x3F));
            } else if (Character.isHighSurrogate(c) && i + 1 < n && Character.isLowSurrogate(s.charAt(i + 1))) {
                int cp = Character.toCodePoint(c, s.charAt(++i));
                ensureCapacity(length + 4);
                buffer[length++] = (byte) (0xF0 | (cp >> 18));
                buffer[length++] = (byte) (0x80 | ((cp >> 12) & 0x3F));
                buffer[length++] = (byte) (0x80 | ((cp >> 6) & 0x3F));
                buffer[length++] = (byte) (0x80 | (cp & 0x3F));
            } else if (Character.isSurrogate(c)) {
                append((byte) '?');
            } else {
                ensureCapacity(length + 3);
                buffer[length++] = (byte) (0xE0 | (c >> 12));
                buffer[length++] = (byte) (0x80 | ((c >> 6) & 0x3F));
                buffer[length++] = (byte) (0x80 | (c & 0x3F));
            }
        }
    }

    private void ensureCapacity(int required) {
        if (required > buffer.length) {
            buffer = Arrays.copyOf(buffer, Math.max(required, Math.max(16, buffer.length * 2)));
        }
    }

    /** 포맷된 바이트 수 */
    public int length() {
        return length;
    }

    /** 현재 버퍼 용량. 풀 보존 판단 기준. */
    public int capacity() {
        return buffer.length;
    }

    /** 포맷된 내용의 사본 */
    public byte[] toByteArray() {
        return Arrays.copyOf(buffer, length);
    }

    public int getMonth() {
        return month;
    }

    /** ISO 요일 (월=1 ... 일=7) */
    public int getWeekday() {
        return weekday;
    }

    public int getDay() {
        return day;
    }

    public int getHour() {
        return hour;
    }

    public int getMinute() {
        return minute;
    }
}
