package io.github.hongjungwan.evidence.core.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hongjungwan.evidence.api.domain.AnchorTier;
import io.github.hongjungwan.evidence.api.domain.BoundingBox;
import io.github.hongjungwan.evidence.api.domain.DomAnchor;
import io.github.hongjungwan.evidence.spi.CaptureChannel;
import io.github.hongjungwan.evidence.spi.ElementInspection;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * 3계층 DOM 앵커 생성. 외부 검사 스크립트가 계산한 로케이터를 받아 우선 계층을 결정하는 순수 변환.
 *
 * <p>우선순위: 비어 있지 않은 CSS 셀렉터 &gt; XPath &gt; 텍스트.
 */
@Slf4j
public class AnchorBuilder {

    /** 저장 텍스트 최대 길이 (고정) */
    public static final int MAX_TEXT_LENGTH = 500;

    private static final ObjectMapper SCRIPT_MAPPER = new ObjectMapper();

    private static final String SELECTOR_PLACEHOLDER = "__SELECTOR__";

    private static final String EXTRACTION_SCRIPT = """
            (() => {
              const el = document.querySelector(__SELECTOR__);
              if (!el) return null;

              function getCssPath(element) {
                const parts = [];
                let current = element;
                while (current && current.nodeType === Node.ELEMENT_NODE) {
                  let selector = current.tagName.toLowerCase();
                  if (current.id) {
                    parts.unshift('#' + current.id);
                    break;
                  }
                  const parent = current.parentElement;
                  if (parent) {
                    const siblings = Array.from(parent.children).filter(c => c.tagName === current.tagName);
                    if (siblings.length > 1) {
                      selector += ':nth-child(' + (siblings.indexOf(current) + 1) + ')';
                    }
                  }
                  parts.unshift(selector);
                  current = parent;
                }
                return parts.join(' > ');
              }

              function getXPath(element) {
                const parts = [];
                let current = element;
                while (current && current.nodeType === Node.ELEMENT_NODE) {
                  let index = 1;
                  let sibling = current.previousElementSibling;
                  while (sibling) {
                    if (sibling.tagName === current.tagName) index++;
                    sibling = sibling.previousElementSibling;
                  }
                  parts.unshift(current.tagName.toLowerCase() + '[' + index + ']');
                  current = current.parentElement;
                }
                return '/' + parts.join('/');
              }

              const rect = el.getBoundingClientRect();
              return {
                cssSelector: getCssPath(el),
                xpath: getXPath(el),
                textContent: (el.textContent || '').trim().slice(0, 500),
                boundingBox: { x: rect.x, y: rect.y, width: rect.width, height: rect.height }
              };
            })()""";

    public DomAnchor build(String cssSelector, String xpath, String textContent) {
        return build(cssSelector, xpath, textContent, null);
    }

    public DomAnchor build(String cssSelector, String xpath, String textContent, BoundingBox boundingBox) {
        String css = nullToEmpty(cssSelector);
        String path = nullToEmpty(xpath);
        String text = truncate(nullToEmpty(textContent));
        AnchorTier tier = determinePrimaryTier(css, path);

        log.debug("DOM anchor built: primaryTier={}, hasSelector={}, hasXpath={}, textLength={}",
                tier.getValue(), !css.isEmpty(), !path.isEmpty(), text.length());

        return DomAnchor.builder()
                .cssSelector(css)
                .xpath(path)
                .textContent(text)
                .primaryTier(tier)
                .boundingBox(boundingBox)
                .build();
    }

    public DomAnchor buildFromInspection(ElementInspection inspection) {
        return build(inspection.cssSelector(), inspection.xpath(), inspection.textContent(),
                inspection.boundingBox());
    }

    /**
     * 원격 브라우저에서 요소를 검사해 앵커 생성.
     *
     * @return 요소가 없으면 empty
     * @throws CaptureChannel.CaptureException 채널 실패
     */
    public Optional<DomAnchor> locate(CaptureChannel channel, String cssSelector) {
        ElementInspection inspection = channel.inspect(extractionScript(cssSelector));
        if (inspection == null) {
            log.debug("No element matched selector: {}", cssSelector);
            return Optional.empty();
        }
        return Optional.of(buildFromInspection(inspection));
    }

    /** 셀렉터에 맞는 첫 요소의 css/xpath/text/boundingBox를 반환하는 JavaScript 표현식 */
    public String extractionScript(String cssSelector) {
        if (cssSelector == null || cssSelector.isBlank()) {
            throw new IllegalArgumentException("cssSelector must not be blank");
        }
        try {
            return EXTRACTION_SCRIPT.replace(SELECTOR_PLACEHOLDER, SCRIPT_MAPPER.writeValueAsString(cssSelector));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot quote selector: " + cssSelector, e);
        }
    }

    static AnchorTier determinePrimaryTier(String cssSelector, String xpath) {
        if (!cssSelector.isEmpty()) {
            return AnchorTier.CSS;
        }
        if (!xpath.isEmpty()) {
            return AnchorTier.XPATH;
        }
        return AnchorTier.TEXT_CONTENT;
    }

    private static String truncate(String text) {
        return text.length() > MAX_TEXT_LENGTH ? text.substring(0, MAX_TEXT_LENGTH) : text;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
