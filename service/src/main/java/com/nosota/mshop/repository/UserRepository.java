package com.nosota.mshop.repository;

import com.nosota.mshop.api.model.UserRole;
import com.nosota.mshop.model.User;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, Long> {
    /**
     * Retrieves the {@link User} with the given ID and locks its row for update.
     * <p>
     * Used by every wallet mutation: concurrent deposits, withdrawals and purchases for the
     * same user wait for each other, so the balance check and the balance write see the
     * same value. Must be called inside a transaction, which should stay short.
     * </p>
     *
     * @param id The unique identifier (ID) of the user to be retrieved and locked.
     * @return The user, locked until the surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT u FROM User u WHERE u.id = :id")
    Optional<User> findByIdForUpdate(@Param("id") Long id);

    Optional<User> findByUsername(String username);

    /**
     * True if any account already uses the username or the email.
     */
    boolean existsByUsernameOrEmail(String username, String email);

    boolean existsByRole(UserRole role);

    long countByRole(UserRole role);

    List<User> findAllByOrderByIdAsc();
}
