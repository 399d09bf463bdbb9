package com.codeops.lineage.dto.response;

import org.springframework.data.domain.Page;

import java.util.List;

/**
 * Paged result envelope. {@code page} is zero-based.
 */
public record PageResponse<T>(
        List<T> content,
        int page,
        int size,
        long totalElements,
        int totalPages,
        boolean isLast
) {

    /**
     * Converts a Spring Data page whose content is already mapped to DTOs.
     *
     * @param page the Spring page
     * @param <T>  the element type
     * @return the page response
     */
    public static <T> PageResponse<T> from(Page<T> page) {
        return new PageResponse<>(
                page.getContent(),
                page.getNumber(),
                page.getSize(),
                page.getTotalElements(),
                page.getTotalPages(),
                page.isLast()
        );
    }
}
