package com.gridt.admin.application.service;

import com.gridt.admin.application.port.out.TextSource;
import com.gridt.admin.domain.model.MovementDraft;
import com.gridt.admin.domain.model.MovementInterval;
import com.gridt.admin.domain.model.User;
import com.gridt.admin.domain.model.UserCredentials;
import org.springframework.stereotype.Component;

import java.util.HexFormat;
import java.util.Random;

/**
 * Produces random, column-safe movements and users. Nothing is persisted here.
 */
@Component
public class FixtureGenerator {

    private static final MovementInterval[] INTERVALS = MovementInterval.values();
    private static final int EMAIL_SUFFIX_BYTES = 4;

    private final TextSource text;
    private final Random random;

    public FixtureGenerator(TextSource text, Random random) {
        this.text = text;
        this.random = random;
    }

    public MovementDraft generateMovement() {
        MovementInterval interval = INTERVALS[random.nextInt(INTERVALS.length)];
        return MovementDraft.of(
            text.sentence(),
            interval,
            text.paragraph(),
            text.paragraph(8)
        );
    }

    /**
     * Random credentials. The email local part carries the username plus a random hex suffix
     * so that generated addresses rarely collide on the unique email column.
     */
    public UserCredentials generateUserCredentials() {
        String username = sanitize(text.username());
        if (username.isEmpty()) {
            username = "user";
        }
        username = username.length() > User.USERNAME_MAX_LENGTH
            ? username.substring(0, User.USERNAME_MAX_LENGTH)
            : username;

        byte[] suffix = new byte[EMAIL_SUFFIX_BYTES];
        random.nextBytes(suffix);
        String email = username + "." + HexFormat.of().formatHex(suffix) + "@" + text.emailDomain();

        return UserCredentials.fitted(username, email, text.password());
    }

    private static String sanitize(String raw) {
        StringBuilder sb = new StringBuilder(raw.length());
        for (char c : raw.toCharArray()) {
            if (Character.isLetterOrDigit(c) || c == '.' || c == '_' || c == '-') {
                sb.append(Character.toLowerCase(c));
            }
        }
        return sb.toString();
    }
}
