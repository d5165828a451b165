package com.webdynamo.contact_manager.controller;

import com.webdynamo.contact_manager.dto.WebResponse;
import com.webdynamo.contact_manager.dto.user.LoginUserRequest;
import com.webdynamo.contact_manager.dto.user.RegisterUserRequest;
import com.webdynamo.contact_manager.dto.user.UpdateUserRequest;
import com.webdynamo.contact_manager.dto.user.UserResponse;
import com.webdynamo.contact_manager.model.User;
import com.webdynamo.contact_manager.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
@Slf4j
public class UserController {

    private final UserService userService;

    /**
     * Register a new account (public)
     */
    @PostMapping
    public ResponseEntity<WebResponse<UserResponse>> register(@Valid @RequestBody RegisterUserRequest request) {
        return ResponseEntity.ok(WebResponse.of(userService.register(request)));
    }

    /**
     * Log in and receive a token (public)
     */
    @PostMapping("/login")
    public ResponseEntity<WebResponse<UserResponse>> login(@Valid @RequestBody LoginUserRequest request) {
        return ResponseEntity.ok(WebResponse.of(userService.login(request)));
    }

    /**
     * Get current user profile
     */
    @GetMapping("/current")
    public ResponseEntity<WebResponse<UserResponse>> getCurrentUser(@AuthenticationPrincipal User user) {
        log.info("Fetching profile for user: {}", user.getUsername());
        return ResponseEntity.ok(WebResponse.of(userService.get(user)));
    }

    /**
     * Update name and/or password of the current user
     */
    @PatchMapping("/current")
    public ResponseEntity<WebResponse<UserResponse>> updateCurrentUser(
            @Valid @RequestBody UpdateUserRequest request,
            @AuthenticationPrincipal User user
    ) {
        return ResponseEntity.ok(WebResponse.of(userService.update(user, request)));
    }

    /**
     * Log out: revokes the token used for this request
     */
    @DeleteMapping("/current")
    public ResponseEntity<WebResponse<Boolean>> logout(
            @AuthenticationPrincipal User user,
            @RequestHeader(HttpHeaders.AUTHORIZATION) String token
    ) {
        return ResponseEntity.ok(WebResponse.of(userService.logout(user, token)));
    }
}
