package de.bsommerfeld.tutoria.db.store;

/**
 * What login needs from a user row: the id to load the account by, the
 * stored password hash and whether the account is enabled.
 */
public record StoredCredentials(long userId, String passwordHash, boolean active) {

    @Override
    public String toString() {
        return "StoredCredentials[userId=" + userId + ", active=" + active + "]";
    }
}
