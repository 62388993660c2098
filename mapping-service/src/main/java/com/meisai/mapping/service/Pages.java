package com.meisai.mapping.service;

import com.meisai.common.error.MeisaiException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;

/** 1-based paging of the listing endpoints. */
final class Pages {

    static final int DEFAULT_PAGE_SIZE = 50;
    static final int MAX_PAGE_SIZE = 1000;

    private Pages() {
    }

    static PageRequest of(Integer page, Integer pageSize, Sort sort) {
        int pageNumber = page == null ? 1 : page;
        int size = pageSize == null ? DEFAULT_PAGE_SIZE : pageSize;
        if (pageNumber < 1) {
            throw MeisaiException.validation("page", "page must be 1 or greater");
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw MeisaiException.validation("pageSize", "pageSize must be between 1 and " + MAX_PAGE_SIZE);
        }
        return PageRequest.of(pageNumber - 1, size, sort);
    }
}
