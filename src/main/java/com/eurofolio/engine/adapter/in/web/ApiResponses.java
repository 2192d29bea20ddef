package com.eurofolio.engine.adapter.in.web;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.HashMap;
import java.util.Map;

/**
 * 오류 응답 본문: {"status": "error", "message": ...}
 */
final class ApiResponses {

    private ApiResponses() {
    }

    static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        Map<String, String> body = new HashMap<>();
        body.put("status", "error");
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
