package de.alive.inboxscan.domain;

import lombok.Getter;

@Getter
public enum CategoryTag {
    SOCIAL_MEDIA("Social Media"),
    SHOPPING("Shopping"),
    FINANCE("Finance"),
    CLOUD_SERVICES("Cloud Services"),
    SUBSCRIPTION_SERVICES("Subscription Services"),
    GAMING("Gaming"),
    PROFESSIONAL("Professional"),
    TRAVEL("Travel"),
    ACCOUNTS("Accounts");

    private final String displayName;

    CategoryTag(String displayName) {
        this.displayName = displayName;
    }
}
