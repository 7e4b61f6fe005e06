package com.wpanther.cgaca.dto.ocsp;

/**
 * Overall status of a response, codes as in RFC 6960
 */
public enum OcspResponseStatus {
    SUCCESSFUL(0),
    MALFORMED_REQUEST(1);

    private final int code;

    OcspResponseStatus(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
