package qkd.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * Listing view of a stored key. Carries no key material.
 */
public record KeySummary( String keyId, Instant createdAt, Instant expiresAt, int usageCount, int maxUsage, KeyState state, Map<String, String> metadata )
{
}
