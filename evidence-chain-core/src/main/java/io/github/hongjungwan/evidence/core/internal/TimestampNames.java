package io.github.hongjungwan.evidence.core.internal;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * 파일 이름용 타임스탬프 (ISO-8601에서 ':'와 '.'를 '-'로 치환).
 */
final class TimestampNames {

    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH-mm-ss-SSS'Z'").withZone(ZoneOffset.UTC);

    private TimestampNames() {}

    static String of(Instant instant) {
        return FORMAT.format(instant);
    }
}
