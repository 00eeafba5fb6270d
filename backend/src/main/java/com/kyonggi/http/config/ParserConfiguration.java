package com.kyonggi.http.config;

/**
 * 바디 파서 설정
 * - maxMemoryBuffer: 메모리에 버퍼링할 요청 바디 최대 크기 (bytes)
 * - maxDiskBuffer: 디스크에 버퍼링할 요청 바디 최대 크기 (bytes)
 * - allowEmptyFiles: 빈 파일 업로드 허용 여부 (파일명/내용 둘 다 포함)
 */
public record ParserConfiguration(long maxMemoryBuffer, long maxDiskBuffer, boolean allowEmptyFiles) {

    public static final long DEFAULT_MAX_MEMORY_BUFFER = 102_400L;     // 100KB
    public static final long DEFAULT_MAX_DISK_BUFFER = 10_485_760L;    // 10MB

    public static ParserConfiguration defaults() {
        return new ParserConfiguration(DEFAULT_MAX_MEMORY_BUFFER, DEFAULT_MAX_DISK_BUFFER, false);
    }
}
