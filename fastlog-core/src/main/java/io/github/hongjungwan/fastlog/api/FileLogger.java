package io.github.hongjungwan.fastlog.api;

/**
 * 파일/표준 스트림 출력 로거. 닫으면 플러시 데몬이 종료되고 파일이 닫힌다.
 */
public interface FileLogger extends FastLogger, AutoCloseable {

    /** 폐기 큐가 가득 차서 버려진 레코드 수 */
    long getDroppedRecords();

    @Override
    void close();
}
