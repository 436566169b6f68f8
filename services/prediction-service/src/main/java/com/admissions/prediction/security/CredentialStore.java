package com.admissions.prediction.security;

import com.admissions.prediction.config.CredentialProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * CredentialStore - Fixed username/password table used at login time.
 *
 * The table is built once from the {@code auth.users} configuration and is
 * immutable afterwards, so lookups need no synchronization. Duplicate
 * usernames are a configuration error and abort startup.
 *
 * Passwords are held and compared as configured (plain equality, constant
 * time). Hashing is not applied.
 */
@Slf4j
@Component
public class CredentialStore {

    private final Map<String, Credential> credentials;

    @Autowired
    public CredentialStore(CredentialProperties properties) {
        this(properties.getUsers().stream()
                .map(account -> new Credential(account.getUsername(), account.getPassword()))
                .toList());
    }

    public CredentialStore(Collection<Credential> accounts) {
        Map<String, Credential> table = new LinkedHashMap<>();
        for (Credential credential : accounts) {
            if (credential.getUsername() == null || credential.getUsername().isBlank()) {
                throw new IllegalStateException("Credential table contains a blank username");
            }
            if (table.putIfAbsent(credential.getUsername(), credential) != null) {
                throw new IllegalStateException("Duplicate username in credential table: " + credential.getUsername());
            }
        }
        this.credentials = Map.copyOf(table);
        log.info("Credential store loaded with {} account(s)", credentials.size());
    }

    /**
     * Check a username/password pair against the table.
     *
     * Both byte sequences are compared in full regardless of where they first
     * differ, so response time does not reveal how much of a password matched.
     *
     * @param username Account name from the login request, may be null
     * @param password Password from the login request, may be null
     * @return true only if the username exists and the password matches exactly
     */
    public boolean verify(String username, String password) {
        if (username == null || password == null) {
            return false;
        }
        Credential credential = credentials.get(username);
        if (credential == null) {
            return false;
        }
        return MessageDigest.isEqual(
                credential.getPassword().getBytes(StandardCharsets.UTF_8),
                password.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Check whether an account still exists. Used when authorizing a token so
     * that a subject dropped from the table loses access.
     *
     * @param username Subject claim of a verified token, may be null
     * @return true if the table holds an account with this exact name
     */
    public boolean contains(String username) {
        return username != null && credentials.containsKey(username);
    }
}
