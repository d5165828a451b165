package com.webdynamo.contact_manager.service;

import com.webdynamo.contact_manager.dto.address.AddressResponse;
import com.webdynamo.contact_manager.dto.address.CreateAddressRequest;
import com.webdynamo.contact_manager.dto.address.UpdateAddressRequest;
import com.webdynamo.contact_manager.exception.ResourceNotFoundException;
import com.webdynamo.contact_manager.model.Address;
import com.webdynamo.contact_manager.model.Contact;
import com.webdynamo.contact_manager.model.User;
import com.webdynamo.contact_manager.repo.AddressRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Addresses of a contact. Every operation first checks that the caller owns the contact.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AddressService {

    private final AddressRepository addressRepository;
    private final ContactService contactService;

    @Transactional
    public AddressResponse create(User user, Long contactId, CreateAddressRequest request) {
        Contact contact = contactService.requireOwnedContact(user, contactId);

        Address address = new Address();
        address.setStreet(request.street());
        address.setCity(request.city());
        address.setProvince(request.province());
        address.setCountry(request.country());
        address.setPostalCode(request.postalCode());
        address.setContact(contact);

        Address saved = addressRepository.save(address);
        log.info("Created address {} for contact {}", saved.getId(), contactId);
        return AddressResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public AddressResponse get(User user, Long contactId, Long addressId) {
        Contact contact = contactService.requireOwnedContact(user, contactId);
        return AddressResponse.from(requireAddress(contact, addressId));
    }

    @Transactional
    public AddressResponse update(User user, Long contactId, Long addressId, UpdateAddressRequest request) {
        Contact contact = contactService.requireOwnedContact(user, contactId);
        Address address = requireAddress(contact, addressId);

        address.setStreet(request.street());
        address.setCity(request.city());
        address.setProvince(request.province());
        address.setCountry(request.country());
        address.setPostalCode(request.postalCode());

        Address saved = addressRepository.save(address);
        log.info("Updated address {} of contact {}", addressId, contactId);
        return AddressResponse.from(saved);
    }

    @Transactional
    public boolean remove(User user, Long contactId, Long addressId) {
        Contact contact = contactService.requireOwnedContact(user, contactId);
        Address address = requireAddress(contact, addressId);

        addressRepository.delete(address);
        log.info("Deleted address {} of contact {}", addressId, contactId);
        return true;
    }

    @Transactional(readOnly = true)
    public List<AddressResponse> list(User user, Long contactId) {
        Contact contact = contactService.requireOwnedContact(user, contactId);
        return addressRepository.findByContactOrderByIdAsc(contact).stream()
                .map(AddressResponse::from)
                .toList();
    }

    private Address requireAddress(Contact contact, Long addressId) {
        return addressRepository.findByIdAndContact(addressId, contact)
                .orElseThrow(() -> new ResourceNotFoundException("Address is not found"));
    }
}
