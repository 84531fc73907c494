package com.z254.horizon.client;

import com.z254.horizon.domain.exception.HorizonException;

/**
 * Exception raised when a collaborator authority returns an error.
 */
public class AuthorityClientException extends HorizonException {

    private final String authority;
    private final int statusCode;

    public AuthorityClientException(String authority, int statusCode, String message) {
        super(authority + " returned " + statusCode + ": " + message);
        this.authority = authority;
        this.statusCode = statusCode;
    }

    public String getAuthority() {
        return authority;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
