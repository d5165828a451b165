package com.webdynamo.contact_manager.repo;

import com.webdynamo.contact_manager.model.Contact;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ContactRepository extends JpaRepository<Contact, Long> {

    String SEARCH_FILTER = "WHERE c.username = :username " +
            "AND (:namePattern IS NULL " +
            "OR c.firstName LIKE :namePattern ESCAPE '!' " +
            "OR c.lastName LIKE :namePattern ESCAPE '!') " +
            "AND (:emailPattern IS NULL OR c.email LIKE :emailPattern ESCAPE '!') " +
            "AND (:phonePattern IS NULL OR c.phone LIKE :phonePattern ESCAPE '!')";

    /**
     * Ownership-scoped lookup. Returns empty both for unknown ids
     * and for contacts owned by someone else.
     */
    Optional<Contact> findByIdAndUsername(Long id, String username);

    /**
     * Search the owner's contacts. Each pattern is a LIKE pattern escaped with '!', or null to skip the filter.
     */
    @Query(value = "SELECT c FROM Contact c " + SEARCH_FILTER,
           countQuery = "SELECT COUNT(c) FROM Contact c " + SEARCH_FILTER)
    Page<Contact> search(
        @Param("username") String username,
        @Param("namePattern") String namePattern,
        @Param("emailPattern") String emailPattern,
        @Param("phonePattern") String phonePattern,
        Pageable pageable);

    /**
     * Number of contacts {@link #search} would match, for pages whose offset is past any possible row
     */
    @Query("SELECT COUNT(c) FROM Contact c " + SEARCH_FILTER)
    long countMatches(
        @Param("username") String username,
        @Param("namePattern") String namePattern,
        @Param("emailPattern") String emailPattern,
        @Param("phonePattern") String phonePattern);
}
