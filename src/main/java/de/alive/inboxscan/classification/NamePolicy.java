package de.alive.inboxscan.classification;

public enum NamePolicy {
    SUBSTRING,
    WHOLE_WORD
}
