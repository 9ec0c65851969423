package de.alive.inboxscan;

import de.alive.inboxscan.service.config.ScanConfiguration;

public record Configuration(
        String username,
        String password,
        String imapHost,
        int imapPort,
        ScanConfiguration scanConfig
) {

    public static final String DEFAULT_IMAP_HOST = "imap.gmail.com";
    public static final int DEFAULT_IMAP_PORT = 993;

    public Configuration(String username, String password, ScanConfiguration scanConfig) {
        this(username, password, DEFAULT_IMAP_HOST, DEFAULT_IMAP_PORT, scanConfig);
    }

    public Configuration {
        if (username == null || username.trim().isEmpty()) {
            throw new IllegalArgumentException("Username cannot be null or empty");
        }
        if (password == null || password.trim().isEmpty()) {
            throw new IllegalArgumentException("Password cannot be null or empty");
        }
        if (imapHost == null || imapHost.trim().isEmpty()) {
            throw new IllegalArgumentException("IMAP host cannot be null or empty");
        }
        if (imapPort <= 0 || imapPort > 65535) {
            throw new IllegalArgumentException("IMAP port out of range: " + imapPort);
        }
        if (scanConfig == null) {
            throw new IllegalArgumentException("Scan configuration cannot be null");
        }
    }

    @Override
    public String toString() {
        return String.format("Configuration{username=%s, imap=%s:%d}", username, imapHost, imapPort);
    }
}
