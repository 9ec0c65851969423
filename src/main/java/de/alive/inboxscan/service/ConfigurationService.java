package de.alive.inboxscan.service;

import de.alive.inboxscan.Configuration;
import de.alive.inboxscan.classification.NamePolicy;
import de.alive.inboxscan.exception.ConfigurationException;
import de.alive.inboxscan.service.config.ScanConfiguration;
import de.alive.inboxscan.util.LogUtils;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

@Slf4j
public class ConfigurationService {

    static final String EMAIL_ENV = "EMAIL";
    static final String PASSWORD_ENV = "APP_PASSWORD";
    static final String IMAP_HOST_ENV = "IMAP_HOST";
    static final String IMAP_PORT_ENV = "IMAP_PORT";
    static final String SCAN_NAME_ENV = "SCAN_NAME";
    static final String NAME_POLICY_ENV = "NAME_POLICY";
    static final String LOOKBACK_MONTHS_ENV = "LOOKBACK_MONTHS";
    static final String UNSUBSCRIBE_DAYS_ENV = "UNSUBSCRIBE_LOOKBACK_DAYS";
    static final String OUTPUT_DIR_ENV = "OUTPUT_DIR";

    private final Function<String, String> environment;

    public ConfigurationService() {
        this(System::getenv);
    }

    public ConfigurationService(Function<String, String> environment) {
        this.environment = environment;
    }

    public Configuration loadConfiguration() {
        log.info("{} Loading configuration...", LogUtils.PROCESS_EMOJI);

        // Credentials
        String email = getRequiredEnvironmentVariable(EMAIL_ENV);
        String password = getRequiredEnvironmentVariable(PASSWORD_ENV);
        validateEmailFormat(email);
        validatePasswordSecurity(password);

        // Server, defaults to Gmail
        String host = getEnvironmentVariable(IMAP_HOST_ENV).orElse(Configuration.DEFAULT_IMAP_HOST);
        int port = getIntEnvironmentVariable(IMAP_PORT_ENV, Configuration.DEFAULT_IMAP_PORT);

        ScanConfiguration scanConfig = loadScanConfiguration();

        log.info("{} Configuration loaded for {} on {}:{}",
                LogUtils.SUCCESS_EMOJI, LogUtils.maskEmail(email), host, port);
        log.info("{} {}", LogUtils.PROCESS_EMOJI, scanConfig.getConfigurationSummary());

        try {
            return new Configuration(email, password, host, port, scanConfig);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), IMAP_HOST_ENV,
                    ConfigurationException.ConfigurationType.INVALID_VALUE, e);
        }
    }

    public ScanConfiguration loadScanConfiguration() {
        String name = getRequiredEnvironmentVariable(SCAN_NAME_ENV);
        Path outputDirectory = Path.of(getEnvironmentVariable(OUTPUT_DIR_ENV).orElse("."));

        ScanConfiguration config = ScanConfiguration.forProduction(name, outputDirectory).toBuilder()
                .namePolicy(getNamePolicy())
                .lookbackMonths(getIntEnvironmentVariable(LOOKBACK_MONTHS_ENV,
                        ScanConfiguration.DEFAULT_LOOKBACK_MONTHS))
                .unsubscribeLookbackDays(getIntEnvironmentVariable(UNSUBSCRIBE_DAYS_ENV,
                        ScanConfiguration.DEFAULT_UNSUBSCRIBE_LOOKBACK_DAYS))
                .build();

        // Validate configuration
        try {
            config.validate();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), SCAN_NAME_ENV,
                    ConfigurationException.ConfigurationType.INVALID_VALUE, e);
        }
        return config;
    }

    private NamePolicy getNamePolicy() {
        Optional<String> value = getEnvironmentVariable(NAME_POLICY_ENV);
        if (value.isEmpty()) {
            return NamePolicy.SUBSTRING;
        }
        try {
            return NamePolicy.valueOf(value.get().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(
                    String.format("Unknown name policy '%s'", value.get()),
                    NAME_POLICY_ENV,
                    ConfigurationException.ConfigurationType.INVALID_VALUE,
                    e
            );
        }
    }

    private int getIntEnvironmentVariable(String key, int defaultValue) {
        Optional<String> value = getEnvironmentVariable(key);
        if (value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.get().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                    String.format("Environment variable '%s' must be a number, got '%s'", key, value.get()),
                    key,
                    ConfigurationException.ConfigurationType.INVALID_VALUE,
                    e
            );
        }
    }

    private String getRequiredEnvironmentVariable(String key) {
        return getEnvironmentVariable(key)
                .orElseThrow(() -> new ConfigurationException(
                        String.format("Required environment variable '%s' is not set", key),
                        key,
                        ConfigurationException.ConfigurationType.MISSING_ENVIRONMENT_VARIABLE
                ));
    }

    private Optional<String> getEnvironmentVariable(String key) {
        String value = environment.apply(key);
        return Optional.ofNullable(value)
                .filter(v -> !v.trim().isEmpty());
    }

    private void validateEmailFormat(String email) {
        if (!email.contains("@") || !email.contains(".")) {
            throw new ConfigurationException(
                    String.format("Invalid email format: %s", LogUtils.maskEmail(email)),
                    EMAIL_ENV,
                    ConfigurationException.ConfigurationType.INVALID_VALUE
            );
        }
    }

    private void validatePasswordSecurity(String password) {
        if (password.length() < 16) {
            log.warn("{} App password seems short - ensure it's a valid app-specific password",
                    LogUtils.WARNING_EMOJI);
        }
    }
}
