package com.webdynamo.contact_manager.dto.contact;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * Query parameters of GET /api/contacts.
 * Filters are substring matches; null means "don't filter".
 */
public record SearchContactRequest(

        String name,

        String email,

        String phone,

        @Min(value = 1, message = "Page must be at least 1")
        Integer page,

        @Min(value = 1, message = "Size must be at least 1")
        @Max(value = 100, message = "Size must be at most 100")
        Integer size
) {
    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_SIZE = 10;

    public SearchContactRequest {
        if (page == null) {
            page = DEFAULT_PAGE;
        }
        if (size == null) {
            size = DEFAULT_SIZE;
        }
    }
}
