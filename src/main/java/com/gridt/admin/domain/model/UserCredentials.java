package com.gridt.admin.domain.model;

import java.util.Objects;

/**
 * What registration needs to create a user. The password is plain text here and is
 * hashed by the registration service before it reaches storage.
 */
public record UserCredentials(String username, String email, String password) {

    public UserCredentials {
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(email, "email");
        Objects.requireNonNull(password, "password");
    }

    /**
     * Builds credentials from generated values, fitting username and email into their columns.
     * The email keeps its domain; only the local part is shortened.
     */
    public static UserCredentials fitted(String username, String email, String password) {
        return new UserCredentials(
            Text.truncate(username, User.USERNAME_MAX_LENGTH),
            fitEmail(email),
            password
        );
    }

    static String fitEmail(String email) {
        if (email.length() <= User.EMAIL_MAX_LENGTH) {
            return email;
        }
        int at = email.lastIndexOf('@');
        if (at <= 0) {
            return Text.truncate(email, User.EMAIL_MAX_LENGTH);
        }
        String domain = email.substring(at);
        int localBudget = User.EMAIL_MAX_LENGTH - domain.length();
        if (localBudget < 1) {
            return Text.truncate(email, User.EMAIL_MAX_LENGTH);
        }
        return Text.truncate(email.substring(0, at), localBudget) + domain;
    }

    @Override
    public String toString() {
        return "UserCredentials[username=" + username + ", email=" + email + "]";
    }
}
