package com.micronote.backend.global.web;

import org.springframework.data.domain.Page;

public record PaginationResponse(int page, int limit, long total, int pages) {

    public static PaginationResponse from(Page<?> page) {
        return new PaginationResponse(
                page.getNumber() + 1,
                page.getSize(),
                page.getTotalElements(),
                page.getTotalPages()
        );
    }
}
