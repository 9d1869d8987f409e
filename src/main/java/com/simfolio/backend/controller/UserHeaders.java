package com.simfolio.backend.controller;

/**
 * The authenticating gateway in front of this service forwards the caller's id in this header.
 */
final class UserHeaders {

    static final String USER_ID = "X-User-Id";

    private UserHeaders() {
    }
}
