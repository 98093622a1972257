/**
 * Public API for the Evidence Chain SDK.
 *
 * <p>This package contains the types callers interact with directly:
 * the {@link io.github.hongjungwan.evidence.api.ChainStore} contract, the
 * domain model and the SDK configuration.</p>
 *
 * <h2>Main Entry Points:</h2>
 * <ul>
 *   <li>{@link io.github.hongjungwan.evidence.api.EvidenceChainSdk} - Component wiring for non-Spring callers</li>
 *   <li>{@link io.github.hongjungwan.evidence.api.ChainStore} - Create, append, verify, export, list</li>
 *   <li>{@link io.github.hongjungwan.evidence.api.config.EvidenceConfig} - SDK configuration</li>
 * </ul>
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * EvidenceChainSdk sdk = EvidenceChainSdk.create(EvidenceConfig.defaultConfig());
 * ChainStore chains = sdk.getChainStore();
 *
 * chains.create("run-42");
 * chains.append("run-42", AppendRequest.builder()
 *         .sourceUrl("https://example.com/product/7")
 *         .extractedValue(new ObjectMapper().valueToTree(Map.of("price", 1299)))
 *         .anchor(sdk.getAnchorBuilder().build("#price", "/html/body/div[1]/span[1]", "$12.99"))
 *         .build());
 *
 * VerificationResult result = chains.verify("run-42");
 * }</pre>
 *
 * @since 1.0.0
 */
package io.github.hongjungwan.evidence.api;
