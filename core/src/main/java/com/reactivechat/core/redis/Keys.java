package com.reactivechat.core.redis;

/**
 * Redis keyspace for tokens, revocations, principals and conversations.
 * <p>
 * <b>Key design principles:</b>
 * <ul>
 *   <li>Namespace prefixes avoid collisions (rt:, revoked:, user:, conv:, msg:)</li>
 *   <li>Token and revocation keys carry a TTL no longer than the refresh token lifetime</li>
 *   <li>Hashes for structured records, sets for memberships, counters for sequences</li>
 * </ul>
 * </p>
 */
public final class Keys {
    private Keys() {
    }

    /**
     * Refresh token record: {@code rt:{tokenId}}
     * <p>
     * <b>Type:</b> Hash with fields {@code principalId}, {@code chainId}, {@code parentId},
     * {@code issuedAt}, {@code expiresAt} (epoch millis), {@code used} ("0"/"1").
     * <br>
     * <b>TTL:</b> expires with the token.
     * </p>
     *
     * @param tokenId refresh token id (JWT id)
     * @return Redis key
     */
    public static String refreshToken(String tokenId) {
        return "rt:" + tokenId;
    }

    /**
     * Revoked access token id: {@code revoked:token:{jti}} (String, TTL = access lifetime).
     */
    public static String revokedToken(String tokenId) {
        return "revoked:token:" + tokenId;
    }

    /**
     * Revoked token chain: {@code revoked:chain:{chainId}} (String, TTL = refresh lifetime).
     */
    public static String revokedChain(String chainId) {
        return "revoked:chain:" + chainId;
    }

    /**
     * Principal revocation cut-off: {@code revoked:principal:{principalId}}
     * <p>
     * <b>Content:</b> epoch millis; every token issued at or before it is revoked.
     * </p>
     */
    public static String revokedPrincipal(String principalId) {
        return "revoked:principal:" + principalId;
    }

    /**
     * Principal profile: {@code user:{principalId}} (Hash with {@code displayName}).
     */
    public static String user(String principalId) {
        return "user:" + principalId;
    }

    /**
     * Group memberships of a principal: {@code user:{principalId}:groups} (Set).
     */
    public static String userGroups(String principalId) {
        return "user:" + principalId + ":groups";
    }

    /**
     * Member ids of a conversation: {@code conv:{conversationId}:members} (Set).
     * A conversation exists iff this set exists.
     */
    public static String conversationMembers(String conversationId) {
        return "conv:" + conversationId + ":members";
    }

    /**
     * Sequence counter of a conversation: {@code conv:{conversationId}:seq} (INCR).
     */
    public static String conversationSequence(String conversationId) {
        return "conv:" + conversationId + ":seq";
    }

    /**
     * Unread message ids of one member: {@code conv:{conversationId}:unread:{principalId}} (Set).
     */
    public static String unread(String conversationId, String principalId) {
        return "conv:" + conversationId + ":unread:" + principalId;
    }

    /**
     * Message record: {@code msg:{messageId}} (Hash).
     */
    public static String message(String messageId) {
        return "msg:" + messageId;
    }

    /**
     * Readers of a message: {@code msg:{messageId}:reads} (Hash readerId -> epoch millis).
     */
    public static String messageReads(String messageId) {
        return "msg:" + messageId + ":reads";
    }

    /**
     * Global message id counter: {@code msg:ids} (INCR).
     */
    public static String messageIds() {
        return "msg:ids";
    }

}
