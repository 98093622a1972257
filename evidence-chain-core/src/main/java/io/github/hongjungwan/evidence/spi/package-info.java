/**
 * Service Provider Interfaces (SPI) for the Evidence Chain SDK.
 *
 * <p>This package contains the contracts of the collaborators the SDK
 * depends on but does not own:</p>
 *
 * <ul>
 *   <li>{@link io.github.hongjungwan.evidence.spi.EvidenceStorage} - Atomic, per-key exclusive storage</li>
 *   <li>{@link io.github.hongjungwan.evidence.spi.CaptureChannel} - Remote browser screenshots and DOM inspection</li>
 * </ul>
 *
 * <p>A file-system storage ships in {@code core.internal}; capture channels are
 * provided by the application (for example a DevTools WebSocket client).</p>
 *
 * @since 1.0.0
 */
package io.github.hongjungwan.evidence.spi;
