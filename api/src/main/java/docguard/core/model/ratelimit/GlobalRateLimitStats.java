package docguard.core.model.ratelimit;

/**
 * Rate limit statistics across all clients.
 *
 * @param totalClients      clients with tracked state
 * @param totalRequests     accepted requests across all clients
 * @param clientsInCooldown clients currently cooling down
 */
public record GlobalRateLimitStats(int totalClients, long totalRequests, int clientsInCooldown) {}
