package com.webdynamo.contact_manager.service;

import com.webdynamo.contact_manager.dto.PagingResponse;
import com.webdynamo.contact_manager.dto.WebResponse;
import com.webdynamo.contact_manager.dto.contact.ContactResponse;
import com.webdynamo.contact_manager.dto.contact.CreateContactRequest;
import com.webdynamo.contact_manager.dto.contact.SearchContactRequest;
import com.webdynamo.contact_manager.dto.contact.UpdateContactRequest;
import com.webdynamo.contact_manager.exception.ResourceNotFoundException;
import com.webdynamo.contact_manager.model.Contact;
import com.webdynamo.contact_manager.model.User;
import com.webdynamo.contact_manager.repo.AddressRepository;
import com.webdynamo.contact_manager.repo.ContactRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class ContactService {

    private final ContactRepository contactRepository;
    private final AddressRepository addressRepository;
    private final MetricsService metricsService;

    @Transactional
    public ContactResponse create(User user, CreateContactRequest request) {
        Contact contact = new Contact();
        contact.setFirstName(request.firstName());
        contact.setLastName(request.lastName());
        contact.setEmail(request.email());
        contact.setPhone(request.phone());
        contact.setUsername(user.getUsername());

        Contact saved = contactRepository.save(contact);
        metricsService.recordContactCreated();

        log.info("Created contact {} for user {}", saved.getId(), user.getUsername());
        return ContactResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public ContactResponse get(User user, Long contactId) {
        return ContactResponse.from(requireOwnedContact(user, contactId));
    }

    /**
     * Replace all fields of the contact; optional fields missing from the request become null
     */
    @Transactional
    public ContactResponse update(User user, Long contactId, UpdateContactRequest request) {
        Contact contact = requireOwnedContact(user, contactId);

        contact.setFirstName(request.firstName());
        contact.setLastName(request.lastName());
        contact.setEmail(request.email());
        contact.setPhone(request.phone());

        Contact saved = contactRepository.save(contact);
        log.info("Updated contact {} for user {}", contactId, user.getUsername());
        return ContactResponse.from(saved);
    }

    /**
     * Delete a contact together with its addresses
     */
    @Transactional
    public boolean remove(User user, Long contactId) {
        Contact contact = requireOwnedContact(user, contactId);

        int addresses = addressRepository.deleteByContact(contact);
        contactRepository.delete(contact);

        log.info("Deleted contact {} ({} addresses) for user {}", contactId, addresses, user.getUsername());
        return true;
    }

    /**
     * Search the caller's contacts.
     * total_page is computed from the full match count, so a page past the end
     * still reports the real number of pages.
     */
    @Transactional(readOnly = true)
    public WebResponse<List<ContactResponse>> search(User user, SearchContactRequest request) {
        int page = request.page();
        int size = request.size();
        String namePattern = likePattern(request.name());
        String emailPattern = likePattern(request.email());
        String phonePattern = likePattern(request.phone());

        // JPA takes an int first-result; an offset beyond that can only be an empty page
        long offset = (long) (page - 1) * size;
        if (offset > Integer.MAX_VALUE) {
            long total = contactRepository.countMatches(user.getUsername(), namePattern, emailPattern, phonePattern);
            log.debug("Page {} of size {} is past any row for user {}", page, size, user.getUsername());
            return WebResponse.of(List.of(), new PagingResponse(page, size, totalPages(total, size)));
        }

        Page<Contact> result = contactRepository.search(
                user.getUsername(),
                namePattern,
                emailPattern,
                phonePattern,
                PageRequest.of(page - 1, size, Sort.by("id"))
        );

        List<ContactResponse> data = result.getContent().stream()
                .map(ContactResponse::from)
                .toList();

        log.debug("Search for user {} matched {} contacts", user.getUsername(), result.getTotalElements());
        return WebResponse.of(data, new PagingResponse(page, size, totalPages(result.getTotalElements(), size)));
    }

    /**
     * Ownership-scoped lookup shared with the address endpoints.
     *
     * @throws ResourceNotFoundException if the contact does not exist or belongs to someone else
     */
    @Transactional(readOnly = true)
    public Contact requireOwnedContact(User user, Long contactId) {
        return contactRepository.findByIdAndUsername(contactId, user.getUsername())
                .orElseThrow(() -> new ResourceNotFoundException("Contact is not found"));
    }

    private static int totalPages(long total, int size) {
        return (int) ((total + size - 1) / size);
    }

    /**
     * Substring pattern for LIKE ... ESCAPE '!'. Wildcards typed by the user match literally.
     */
    static String likePattern(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String escaped = value
                .replace("!", "!!")
                .replace("%", "!%")
                .replace("_", "!_");
        return "%" + escaped + "%";
    }
}
