package com.phillippitts.voicegate.presentation.controller;

import com.phillippitts.voicegate.domain.ClientIdentity;
import com.phillippitts.voicegate.exception.InvalidIdentityException;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Derives the admission identity of a request.
 *
 * <p>Address: first {@code X-Forwarded-For} entry, else {@code X-Real-IP}, else the socket address.
 * The optional {@code X-Device-Fingerprint} header is appended when present.
 */
@Component
public class ClientIdentityResolver {

    static final String FORWARDED_FOR = "X-Forwarded-For";
    static final String REAL_IP = "X-Real-IP";
    static final String FINGERPRINT = "X-Device-Fingerprint";

    /** Longest textual IPv6 form. */
    private static final int MAX_ADDRESS_LENGTH = 45;
    private static final Pattern ADDRESS = Pattern.compile("[0-9A-Fa-f.:]+");
    private static final Pattern FINGERPRINT_VALUE = Pattern.compile("[A-Za-z0-9_-]{1,128}");

    /**
     * @throws InvalidIdentityException when no usable address is available or a header is malformed
     */
    public ClientIdentity resolve(HttpServletRequest request) {
        String address = firstNonBlank(firstForwarded(request.getHeader(FORWARDED_FOR)),
                request.getHeader(REAL_IP), request.getRemoteAddr());
        if (address == null || "unknown".equalsIgnoreCase(address)) {
            throw new InvalidIdentityException("client address unavailable");
        }
        if (address.length() > MAX_ADDRESS_LENGTH || !ADDRESS.matcher(address).matches()) {
            throw new InvalidIdentityException("malformed client address");
        }

        String fingerprint = request.getHeader(FINGERPRINT);
        if (fingerprint != null) {
            fingerprint = fingerprint.strip();
            if (!fingerprint.isEmpty() && !FINGERPRINT_VALUE.matcher(fingerprint).matches()) {
                throw new InvalidIdentityException("malformed device fingerprint");
            }
        }
        return new ClientIdentity(address, fingerprint);
    }

    private static String firstForwarded(String header) {
        if (header == null) {
            return null;
        }
        int comma = header.indexOf(',');
        return (comma < 0 ? header : header.substring(0, comma)).strip();
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) {
                return v.strip();
            }
        }
        return null;
    }
}
