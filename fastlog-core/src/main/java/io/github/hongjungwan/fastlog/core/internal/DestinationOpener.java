package io.github.hongjungwan.fastlog.core.internal;

import java.io.IOException;

/**
 * 출력 대상 열기. 최초 생성과 로테이션 후 재오픈에 사용된다.
 */
@FunctionalInterface
public interface DestinationOpener {

    DestinationOpener DEFAULT = Destination::open;

    Destination open(String id) throws IOException;
}
