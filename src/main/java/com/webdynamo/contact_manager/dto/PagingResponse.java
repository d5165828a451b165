package com.webdynamo.contact_manager.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PagingResponse(

        @JsonProperty("current_page")
        int currentPage,

        int size,

        @JsonProperty("total_page")
        int totalPage
) {
}
