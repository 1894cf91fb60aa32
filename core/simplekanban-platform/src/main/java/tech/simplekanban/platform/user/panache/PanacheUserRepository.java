package tech.simplekanban.platform.user.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import tech.simplekanban.platform.user.User;
import tech.simplekanban.platform.user.UserRepository;
import tech.simplekanban.platform.user.entity.UserEntity;
import tech.simplekanban.platform.user.mapper.UserMapper;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

/**
 * Panache-based implementation of UserRepository.
 */
@ApplicationScoped
public class PanacheUserRepository implements UserRepository {

    private static final long ADMIN_BOOTSTRAP_LOCK_ID = lockId("simplekanban:admin-bootstrap");

    @Inject
    EntityManager em;

    @Override
    public Optional<User> findByIdOptional(String id) {
        return Optional.ofNullable(UserMapper.toDomain(em.find(UserEntity.class, id)));
    }

    @Override
    public Optional<User> findByUsername(String username) {
        return em.createQuery("FROM UserEntity WHERE username = :username", UserEntity.class)
            .setParameter("username", username)
            .getResultStream()
            .findFirst()
            .map(UserMapper::toDomain);
    }

    @Override
    public Optional<User> findByEmail(String email) {
        return em.createQuery("FROM UserEntity WHERE lower(email) = :email", UserEntity.class)
            .setParameter("email", email.toLowerCase())
            .getResultStream()
            .findFirst()
            .map(UserMapper::toDomain);
    }

    @Override
    public boolean existsByUsername(String username) {
        Long count = em.createQuery("SELECT COUNT(u) FROM UserEntity u WHERE u.username = :username", Long.class)
            .setParameter("username", username)
            .getSingleResult();
        return count > 0;
    }

    @Override
    public boolean existsByEmail(String email) {
        Long count = em.createQuery("SELECT COUNT(u) FROM UserEntity u WHERE lower(u.email) = :email", Long.class)
            .setParameter("email", email.toLowerCase())
            .getSingleResult();
        return count > 0;
    }

    @Override
    public List<User> listAll() {
        return em.createQuery("FROM UserEntity ORDER BY createdAt", UserEntity.class)
            .getResultList()
            .stream()
            .map(UserMapper::toDomain)
            .toList();
    }

    @Override
    public long countActiveAdmins() {
        return em.createQuery("SELECT COUNT(u) FROM UserEntity u WHERE u.admin = true AND u.active = true", Long.class)
            .getSingleResult();
    }

    @Override
    public long countUsers() {
        return em.createQuery("SELECT COUNT(u) FROM UserEntity u", Long.class).getSingleResult();
    }

    @Override
    public void lockAdminBootstrap() {
        // Transaction-scoped: released on commit or rollback
        em.createNativeQuery("SELECT 1 FROM pg_advisory_xact_lock(:lockId)")
            .setParameter("lockId", ADMIN_BOOTSTRAP_LOCK_ID)
            .getSingleResult();
    }

    @Override
    public void persist(User user) {
        em.persist(UserMapper.toEntity(user));
    }

    @Override
    public void update(User user) {
        UserEntity entity = em.find(UserEntity.class, user.id);
        if (entity != null) {
            UserMapper.updateEntity(entity, user);
        }
    }

    // FNV-1a 64-bit, stable across instances
    private static long lockId(String name) {
        long hash = 0xcbf29ce484222325L;
        for (byte b : name.getBytes(StandardCharsets.UTF_8)) {
            hash ^= b;
            hash *= 0x100000001b3L;
        }
        return hash;
    }
}
