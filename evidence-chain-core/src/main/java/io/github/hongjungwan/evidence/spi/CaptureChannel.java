package io.github.hongjungwan.evidence.spi;

import io.github.hongjungwan.evidence.api.domain.ScreenshotOptions;

/**
 * 원격 브라우저 캡처 채널 SPI. DevTools 프로토콜 등 요청/응답 전송을 감싸는 구현체용.
 */
public interface CaptureChannel {

    /** 채널 식별자 */
    String getName();

    /**
     * 현재 페이지 스크린샷.
     *
     * @return Base64 인코딩된 이미지 데이터
     * @throws CaptureException 응답 실패, 타임아웃
     */
    String captureScreenshot(ScreenshotOptions options);

    /**
     * 문서 검사 스크립트 실행.
     *
     * @param expression 원격에서 평가할 JavaScript 표현식
     * @return 검사 결과, 대상 요소가 없으면 null
     * @throws CaptureException 평가 실패
     */
    ElementInspection inspect(String expression);

    class CaptureException extends RuntimeException {
        public CaptureException(String message) {
            super(message);
        }

        public CaptureException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
