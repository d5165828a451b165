package com.webdynamo.contact_manager.repo;

import com.webdynamo.contact_manager.model.Address;
import com.webdynamo.contact_manager.model.Contact;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AddressRepository extends JpaRepository<Address, Long> {

    Optional<Address> findByIdAndContact(Long id, Contact contact);

    List<Address> findByContactOrderByIdAsc(Contact contact);

    @Modifying
    @Query("DELETE FROM Address a WHERE a.contact = :contact")
    int deleteByContact(@Param("contact") Contact contact);
}
