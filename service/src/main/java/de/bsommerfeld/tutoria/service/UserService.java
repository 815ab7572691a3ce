package de.bsommerfeld.tutoria.service;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.tutoria.core.domain.EnrollmentStatus;
import de.bsommerfeld.tutoria.core.domain.Listing;
import de.bsommerfeld.tutoria.core.domain.NewUser;
import de.bsommerfeld.tutoria.core.domain.User;
import de.bsommerfeld.tutoria.core.domain.UserFilter;
import de.bsommerfeld.tutoria.core.domain.UserUpdate;
import de.bsommerfeld.tutoria.db.Database;
import de.bsommerfeld.tutoria.db.store.StoredCredentials;
import de.bsommerfeld.tutoria.db.store.UserStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Account management and login. Each method runs exactly one unit of work on
 * the database loop; password hashing happens before or after it on the
 * calling thread.
 */
@Singleton
public class UserService {

    private static final Logger LOG = LoggerFactory.getLogger(UserService.class);

    private final Database database;
    private final UserStore users;
    private final PasswordHasher hasher;

    @Inject
    public UserService(Database database, UserStore users, PasswordHasher hasher) {
        this.database = database;
        this.users = users;
        this.hasher = hasher;
    }

    public Optional<User> findOne(long id) {
        return database.call(c -> users.findById(c, id));
    }

    public Listing<User> findMany(UserFilter filter) {
        return new Listing<>(database.call(c -> users.findMany(c, filter)));
    }

    /**
     * @throws de.bsommerfeld.tutoria.db.DatabaseException with
     *                                                     {@code CONSTRAINT}
     *                                                     if the email is taken
     */
    public User create(NewUser user) {
        String hash = hasher.hash(user.password());
        User created = database.call(c -> users.insert(c, user, hash));
        LOG.info("Created user {} ({})", created.id(), created.role().code());
        return created;
    }

    public Optional<User> update(long id, UserUpdate update) {
        String hash = update.password() == null ? null : hasher.hash(update.password());
        return database.call(c -> users.update(c, id, update, hash));
    }

    public Optional<User> updateStatus(long id, boolean active) {
        Optional<User> updated = database.call(c -> users.updateStatus(c, id, active));
        updated.ifPresent(u -> LOG.info("User {} is now {}", id, active ? "active" : "inactive"));
        return updated;
    }

    /** Students of a session, optionally by enrollment status, ordered by name. */
    public Listing<User> findManyBySession(long sessionId, String search, EnrollmentStatus status) {
        return new Listing<>(database.call(c -> users.findBySession(c, sessionId, search, status)));
    }

    /**
     * Checks {@code password} against the stored hash. Disabled accounts
     * never authenticate. Issuing tokens is up to the caller.
     *
     * @return the account on success, empty on any mismatch
     */
    public Optional<User> authenticate(String email, String password) {
        if (email == null || password == null) {
            return Optional.empty();
        }
        Optional<StoredCredentials> credentials = database.call(c -> users.findCredentials(c, email.trim()));
        if (credentials.isEmpty() || !credentials.get().active()
                || !hasher.verify(password, credentials.get().passwordHash())) {
            LOG.debug("Rejected login for {}", email);
            return Optional.empty();
        }
        long userId = credentials.get().userId();
        return findOne(userId);
    }
}
