package tech.simplekanban.platform.user;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for User aggregates.
 */
public interface UserRepository {

    // Read operations
    Optional<User> findByIdOptional(String id);
    Optional<User> findByUsername(String username);
    Optional<User> findByEmail(String email);
    boolean existsByUsername(String username);
    boolean existsByEmail(String email);
    List<User> listAll();
    long countActiveAdmins();
    long countUsers();

    // Write operations

    /**
     * Serializes administrator bootstrap across instances until the current transaction ends.
     */
    void lockAdminBootstrap();

    void persist(User user);
    void update(User user);
}
