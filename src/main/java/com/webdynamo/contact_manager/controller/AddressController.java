package com.webdynamo.contact_manager.controller;

import com.webdynamo.contact_manager.dto.WebResponse;
import com.webdynamo.contact_manager.dto.address.AddressResponse;
import com.webdynamo.contact_manager.dto.address.CreateAddressRequest;
import com.webdynamo.contact_manager.dto.address.UpdateAddressRequest;
import com.webdynamo.contact_manager.model.User;
import com.webdynamo.contact_manager.service.AddressService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/contacts/{contactId}/addresses")
@RequiredArgsConstructor
public class AddressController {

    private final AddressService addressService;

    @PostMapping
    public ResponseEntity<WebResponse<AddressResponse>> create(
            @PathVariable Long contactId,
            @Valid @RequestBody CreateAddressRequest request,
            @AuthenticationPrincipal User user
    ) {
        return ResponseEntity.ok(WebResponse.of(addressService.create(user, contactId, request)));
    }

    @GetMapping
    public ResponseEntity<WebResponse<List<AddressResponse>>> list(
            @PathVariable Long contactId,
            @AuthenticationPrincipal User user
    ) {
        return ResponseEntity.ok(WebResponse.of(addressService.list(user, contactId)));
    }

    @GetMapping("/{addressId}")
    public ResponseEntity<WebResponse<AddressResponse>> get(
            @PathVariable Long contactId,
            @PathVariable Long addressId,
            @AuthenticationPrincipal User user
    ) {
        return ResponseEntity.ok(WebResponse.of(addressService.get(user, contactId, addressId)));
    }

    @PutMapping("/{addressId}")
    public ResponseEntity<WebResponse<AddressResponse>> update(
            @PathVariable Long contactId,
            @PathVariable Long addressId,
            @Valid @RequestBody UpdateAddressRequest request,
            @AuthenticationPrincipal User user
    ) {
        return ResponseEntity.ok(WebResponse.of(addressService.update(user, contactId, addressId, request)));
    }

    @DeleteMapping("/{addressId}")
    public ResponseEntity<WebResponse<Boolean>> remove(
            @PathVariable Long contactId,
            @PathVariable Long addressId,
            @AuthenticationPrincipal User user
    ) {
        return ResponseEntity.ok(WebResponse.of(addressService.remove(user, contactId, addressId)));
    }
}
