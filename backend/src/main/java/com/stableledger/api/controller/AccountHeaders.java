package com.stableledger.api.controller;

/**
 * Header naming the account a request acts for. Authentication happens in front of this service.
 */
final class AccountHeaders {

    static final String ACCOUNT = "X-Account";

    private AccountHeaders() {
    }
}
