package io.github.hongjungwan.evidence.api.domain;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;

/**
 * 레코드 추가 요청. id, 추출 시각, 해시는 ChainStore가 부여.
 */
@Getter
@Builder(toBuilder = true)
public class AppendRequest {

    private final String sourceUrl;

    private final JsonNode extractedValue;

    @Singular
    private final List<DomAnchor> anchors;

    private final ScreenshotMeta screenshot;
}
