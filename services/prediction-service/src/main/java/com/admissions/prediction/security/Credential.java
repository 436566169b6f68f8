package com.admissions.prediction.security;

import lombok.ToString;
import lombok.Value;

/**
 * One account in the fixed credential table.
 *
 * Built from {@code auth.users} at startup. The password is kept out of
 * {@code toString()} so the account can be logged safely.
 */
@Value
public class Credential {
    String username;

    @ToString.Exclude
    String password;
}
