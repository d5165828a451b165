package com.webdynamo.contact_manager.service;

import com.webdynamo.contact_manager.dto.address.AddressResponse;
import com.webdynamo.contact_manager.dto.address.CreateAddressRequest;
import com.webdynamo.contact_manager.dto.address.UpdateAddressRequest;
import com.webdynamo.contact_manager.exception.ResourceNotFoundException;
import com.webdynamo.contact_manager.model.Address;
import com.webdynamo.contact_manager.model.Contact;
import com.webdynamo.contact_manager.model.User;
import com.webdynamo.contact_manager.repo.AddressRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AddressServiceTest {

    @Mock
    private AddressRepository addressRepository;
    @Mock
    private ContactService contactService;

    @InjectMocks
    private AddressService addressService;

    private User testUser;
    private Contact testContact;
    private Address testAddress;

    @BeforeEach
    void setUp() {
        testUser = new User();
        testUser.setId(1L);
        testUser.setUsername("test");

        testContact = new Contact(10L, "Eko", null, null, null, "test");
        testAddress = new Address(5L, "Jalan Merdeka", "Jakarta", "DKI", "Indonesia", "10110", testContact);
    }

    @Test
    @DisplayName("create - Should attach the address to the owned contact")
    void create_ShouldSucceed() {
        when(contactService.requireOwnedContact(testUser, 10L)).thenReturn(testContact);
        when(addressRepository.save(any(Address.class))).thenAnswer(invocation -> {
            Address address = invocation.getArgument(0);
            address.setId(5L);
            return address;
        });

        AddressResponse response = addressService.create(testUser, 10L,
                new CreateAddressRequest(null, "Jakarta", null, "Indonesia", "10110"));

        assertThat(response.id()).isEqualTo(5L);
        assertThat(response.street()).isNull();
        assertThat(response.country()).isEqualTo("Indonesia");
        assertThat(response.postalCode()).isEqualTo("10110");
    }

    @Test
    @DisplayName("create - Contact not owned by caller stops before any save")
    void create_ForeignContact_ShouldBeNotFound() {
        when(contactService.requireOwnedContact(testUser, 10L))
                .thenThrow(new ResourceNotFoundException("Contact is not found"));

        assertThatThrownBy(() -> addressService.create(testUser, 10L,
                new CreateAddressRequest(null, null, null, "Indonesia", "10110")))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Contact is not found");

        verifyNoInteractions(addressRepository);
    }

    @Test
    @DisplayName("get - Address outside the contact is not found")
    void get_UnknownAddress_ShouldBeNotFound() {
        when(contactService.requireOwnedContact(testUser, 10L)).thenReturn(testContact);
        when(addressRepository.findByIdAndContact(77L, testContact)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> addressService.get(testUser, 10L, 77L))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Address is not found");
    }

    @Test
    @DisplayName("update - Should replace all address fields")
    void update_ShouldReplaceFields() {
        when(contactService.requireOwnedContact(testUser, 10L)).thenReturn(testContact);
        when(addressRepository.findByIdAndContact(5L, testContact)).thenReturn(Optional.of(testAddress));
        when(addressRepository.save(testAddress)).thenReturn(testAddress);

        AddressResponse response = addressService.update(testUser, 10L, 5L,
                new UpdateAddressRequest(null, "Bandung", "Jawa Barat", "Indonesia", "40111"));

        assertThat(response.street()).isNull();
        assertThat(response.city()).isEqualTo("Bandung");
        assertThat(response.postalCode()).isEqualTo("40111");
    }

    @Test
    @DisplayName("remove - Should delete the address")
    void remove_ShouldDelete() {
        when(contactService.requireOwnedContact(testUser, 10L)).thenReturn(testContact);
        when(addressRepository.findByIdAndContact(5L, testContact)).thenReturn(Optional.of(testAddress));

        assertThat(addressService.remove(testUser, 10L, 5L)).isTrue();
        verify(addressRepository).delete(testAddress);
    }

    @Test
    @DisplayName("list - Should map every address of the contact")
    void list_ShouldReturnAll() {
        when(contactService.requireOwnedContact(testUser, 10L)).thenReturn(testContact);
        when(addressRepository.findByContactOrderByIdAsc(testContact)).thenReturn(List.of(testAddress));

        List<AddressResponse> result = addressService.list(testUser, 10L);

        assertThat(result).extracting(AddressResponse::city).containsExactly("Jakarta");
    }
}
