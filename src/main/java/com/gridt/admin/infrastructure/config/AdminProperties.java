package com.gridt.admin.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "admin")
public class AdminProperties {

    private int chunkSize = 1000;
    private int deleteLimit = 100;
    private boolean randomDelete = true;
    private int passwordHashStrength = 10;
    private Fixtures fixtures = new Fixtures();

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    public int getDeleteLimit() {
        return deleteLimit;
    }

    public void setDeleteLimit(int deleteLimit) {
        this.deleteLimit = deleteLimit;
    }

    public boolean isRandomDelete() {
        return randomDelete;
    }

    public void setRandomDelete(boolean randomDelete) {
        this.randomDelete = randomDelete;
    }

    public int getPasswordHashStrength() {
        return passwordHashStrength;
    }

    public void setPasswordHashStrength(int passwordHashStrength) {
        this.passwordHashStrength = passwordHashStrength;
    }

    public Fixtures getFixtures() {
        return fixtures;
    }

    public void setFixtures(Fixtures fixtures) {
        this.fixtures = fixtures;
    }

    public static class Fixtures {
        private String locale = "en";
        private Long seed;

        public String getLocale() {
            return locale;
        }

        public void setLocale(String locale) {
            this.locale = locale;
        }

        /**
         * Fixed seed for reproducible fixtures and sampling; null seeds from the clock.
         */
        public Long getSeed() {
            return seed;
        }

        public void setSeed(Long seed) {
            this.seed = seed;
        }
    }
}
