package com.webdynamo.contact_manager.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Success envelope: {@code {"data": ...}}, plus {@code "paging"} on list endpoints
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebResponse<T>(

        T data,

        PagingResponse paging
) {
    public static <T> WebResponse<T> of(T data) {
        return new WebResponse<>(data, null);
    }

    public static <T> WebResponse<T> of(T data, PagingResponse paging) {
        return new WebResponse<>(data, paging);
    }
}
