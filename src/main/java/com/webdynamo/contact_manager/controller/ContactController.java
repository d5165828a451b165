package com.webdynamo.contact_manager.controller;

import com.webdynamo.contact_manager.dto.WebResponse;
import com.webdynamo.contact_manager.dto.contact.ContactResponse;
import com.webdynamo.contact_manager.dto.contact.CreateContactRequest;
import com.webdynamo.contact_manager.dto.contact.SearchContactRequest;
import com.webdynamo.contact_manager.dto.contact.UpdateContactRequest;
import com.webdynamo.contact_manager.model.User;
import com.webdynamo.contact_manager.service.ContactService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/contacts")
@RequiredArgsConstructor
@Slf4j
public class ContactController {

    private final ContactService contactService;

    @PostMapping
    public ResponseEntity<WebResponse<ContactResponse>> create(
            @Valid @RequestBody CreateContactRequest request,
            @AuthenticationPrincipal User user
    ) {
        return ResponseEntity.ok(WebResponse.of(contactService.create(user, request)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<WebResponse<ContactResponse>> get(
            @PathVariable Long id,
            @AuthenticationPrincipal User user
    ) {
        log.info("Fetching contact {} for user {}", id, user.getUsername());
        return ResponseEntity.ok(WebResponse.of(contactService.get(user, id)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<WebResponse<ContactResponse>> update(
            @PathVariable Long id,
            @Valid @RequestBody UpdateContactRequest request,
            @AuthenticationPrincipal User user
    ) {
        return ResponseEntity.ok(WebResponse.of(contactService.update(user, id, request)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<WebResponse<Boolean>> remove(
            @PathVariable Long id,
            @AuthenticationPrincipal User user
    ) {
        return ResponseEntity.ok(WebResponse.of(contactService.remove(user, id)));
    }

    /**
     * Search contacts: ?name=&email=&phone=&page=&size=
     */
    @GetMapping
    public ResponseEntity<WebResponse<List<ContactResponse>>> search(
            @Valid @ModelAttribute SearchContactRequest request,
            @AuthenticationPrincipal User user
    ) {
        return ResponseEntity.ok(contactService.search(user, request));
    }
}
