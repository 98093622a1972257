package io.github.hongjungwan.evidence.core.internal;

import java.util.regex.Pattern;

/**
 * 체인 ID 규칙. 저장 키 경로의 한 구간으로 쓰이므로 구분자, 상위 경로 불가.
 */
final class ChainIds {

    private static final Pattern CHAIN_ID_PATTERN = Pattern.compile("[A-Za-z0-9_-][A-Za-z0-9._-]*");

    private ChainIds() {
    }

    static String requireValid(String chainId) {
        if (chainId == null || !CHAIN_ID_PATTERN.matcher(chainId).matches()) {
            throw new IllegalArgumentException("Invalid chain id: " + chainId);
        }
        return chainId;
    }
}
