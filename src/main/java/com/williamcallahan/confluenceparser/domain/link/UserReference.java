package com.williamcallahan.confluenceparser.domain.link;

/**
 * Reference to a user, by account id or legacy user key.
 */
public record UserReference(String accountId, String localId, String userkey) implements ResourceReference {

    public static UserReference ofAccountId(String accountId) {
        return new UserReference(accountId, null, null);
    }

    @Override
    public LinkKind kind() {
        return LinkKind.USER;
    }

    @Override
    public String canonicalUri() {
        return accountId == null || accountId.isEmpty() ? null : "user://" + accountId;
    }
}
