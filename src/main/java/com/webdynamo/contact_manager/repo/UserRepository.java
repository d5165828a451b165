package com.webdynamo.contact_manager.repo;

import com.webdynamo.contact_manager.model.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    /**
     * Find a user by username
     * Used for login authentication
     *
     * @param username Login name
     * @return Optional containing user if found, empty otherwise
     */
    Optional<User> findByUsername(String username);

    /**
     * Check if a username is already taken
     * Used to prevent duplicate registrations
     *
     * @param username Username to check
     * @return true if username exists, false otherwise
     */
    boolean existsByUsername(String username);
}
