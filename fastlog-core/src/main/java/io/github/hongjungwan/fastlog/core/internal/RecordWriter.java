package io.github.hongjungwan.fastlog.core.internal;

/**
 * 직접 쓰기 경로. 플러시 데몬이 큐에서 꺼낸 레코드를 넘기는 대상.
 */
public interface RecordWriter {

    /** 동기 기록. 기록 후 레코드는 풀로 반환된다. */
    void writeDirect(LogRecord record);

    /** 버퍼 flush + 디스크 sync */
    void flush();
}
