package com.ClinicCare.clinic_backend.service;

import com.ClinicCare.clinic_backend.exception.ValidationException;
import com.ClinicCare.clinic_backend.util.Constants;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

// 1-based page numbers in, Spring Data 0-based pages out
final class Paging {

    private Paging() {
    }

    static Pageable of(int page, int limit, Sort sort) {
        if (page < 1) {
            throw new ValidationException("Page must be 1 or greater");
        }
        if (limit < 1 || limit > Constants.MAX_PAGE_LIMIT) {
            throw new ValidationException("Limit must be between 1 and " + Constants.MAX_PAGE_LIMIT);
        }
        return PageRequest.of(page - 1, limit, sort);
    }
}
