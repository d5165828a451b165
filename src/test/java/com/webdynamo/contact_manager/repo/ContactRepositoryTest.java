package com.webdynamo.contact_manager.repo;

import com.webdynamo.contact_manager.model.Address;
import com.webdynamo.contact_manager.model.Contact;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class ContactRepositoryTest {

    @Autowired
    private ContactRepository contactRepository;

    @Autowired
    private AddressRepository addressRepository;

    @Autowired
    private TestEntityManager entityManager;

    private Contact ownContact;
    private Contact foreignContact;

    @BeforeEach
    void setUp() {
        ownContact = entityManager.persist(new Contact(null, "Eko", "Kurniawan", "eko@gmail.com", "0811", "alice"));
        entityManager.persist(new Contact(null, "Budi", "Santoso", "budi@yahoo.com", "0822", "alice"));
        entityManager.persist(new Contact(null, "Joko", "Eko Putro", null, null, "alice"));
        foreignContact = entityManager.persist(new Contact(null, "Eko", "Other", "eko@gmail.com", "0811", "bob"));
        entityManager.flush();
    }

    @Test
    @DisplayName("findByIdAndUsername - Should not return another user's contact")
    void findByIdAndUsername_ShouldScopeToOwner() {
        assertThat(contactRepository.findByIdAndUsername(ownContact.getId(), "alice")).isPresent();
        assertThat(contactRepository.findByIdAndUsername(foreignContact.getId(), "alice")).isEmpty();
    }

    @Test
    @DisplayName("search - Name filter matches first or last name, scoped to owner")
    void search_ByName_ShouldMatchFirstOrLast() {
        Page<Contact> result = contactRepository.search("alice", "%Eko%", null, null,
                PageRequest.of(0, 10, Sort.by("id")));

        assertThat(result.getTotalElements()).isEqualTo(2);
        assertThat(result.getContent()).extracting(Contact::getUsername).containsOnly("alice");
        assertThat(result.getContent()).extracting(Contact::getFirstName).containsExactly("Eko", "Joko");
    }

    @Test
    @DisplayName("search - Filters are AND-combined and null filters are skipped")
    void search_CombinedFilters() {
        assertThat(contactRepository.search("alice", null, "%gmail%", "%081%", PageRequest.of(0, 10))
                .getTotalElements()).isEqualTo(1);
        assertThat(contactRepository.search("alice", null, null, null, PageRequest.of(0, 10))
                .getTotalElements()).isEqualTo(3);
        assertThat(contactRepository.search("alice", "%nobody%", null, null, PageRequest.of(0, 10))
                .getTotalElements()).isZero();
    }

    @Test
    @DisplayName("search - Page past the end still reports the total count")
    void search_PageOutOfRange_ShouldCountAll() {
        Page<Contact> result = contactRepository.search("alice", null, null, null, PageRequest.of(50, 2));

        assertThat(result.getContent()).isEmpty();
        assertThat(result.getTotalElements()).isEqualTo(3);
    }

    @Test
    @DisplayName("deleteByContact - Should only remove addresses of that contact")
    void deleteByContact_ShouldScopeToContact() {
        entityManager.persist(new Address(null, null, "Jakarta", null, "Indonesia", "10110", ownContact));
        entityManager.persist(new Address(null, null, "Bandung", null, "Indonesia", "40111", ownContact));
        entityManager.persist(new Address(null, null, "Surabaya", null, "Indonesia", "60111", foreignContact));
        entityManager.flush();

        int deleted = addressRepository.deleteByContact(ownContact);

        assertThat(deleted).isEqualTo(2);
        assertThat(addressRepository.findByContactOrderByIdAsc(foreignContact)).hasSize(1);
    }

    @Test
    @DisplayName("search - Escaped wildcards match only literally")
    void search_EscapedWildcards_ShouldMatchLiterally() {
        entityManager.persist(new Contact(null, "100%", "Under_Score", "u_s@mail.com", null, "alice"));
        entityManager.flush();

        assertThat(contactRepository.search("alice", "%!_%", null, null, PageRequest.of(0, 10))
                .getContent()).extracting(Contact::getFirstName).containsExactly("100%");
        assertThat(contactRepository.search("alice", "%!%%", null, null, PageRequest.of(0, 10))
                .getContent()).extracting(Contact::getFirstName).containsExactly("100%");
        assertThat(contactRepository.search("alice", null, "%e!_o%", null, PageRequest.of(0, 10))
                .getTotalElements()).isZero();
    }

    @Test
    @DisplayName("countMatches - Should agree with the search total")
    void countMatches_ShouldMatchSearchTotal() {
        assertThat(contactRepository.countMatches("alice", "%Eko%", null, null)).isEqualTo(2);
        assertThat(contactRepository.countMatches("alice", null, null, null)).isEqualTo(3);
        assertThat(contactRepository.countMatches("bob", null, "%gmail%", null)).isEqualTo(1);
    }
}
