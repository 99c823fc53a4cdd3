package com.cidery.ledger.api.controller;

import org.springframework.data.domain.Page;

import java.util.HashMap;
import java.util.Map;

final class PageResponse {

    private PageResponse() {
    }

    static Map<String, Object> of(Page<?> page) {
        Map<String, Object> response = new HashMap<>();
        response.put("content", page.getContent());
        response.put("totalElements", page.getTotalElements());
        response.put("totalPages", page.getTotalPages());
        response.put("page", page.getNumber());
        response.put("size", page.getSize());
        return response;
    }
}
