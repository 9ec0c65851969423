package de.alive.inboxscan;

import de.alive.inboxscan.classification.UnsubscribeLinkExtractor;
import de.alive.inboxscan.domain.UnsubscribeSelection;
import de.alive.inboxscan.exception.ConfigurationException;
import de.alive.inboxscan.exception.InvalidSelectionException;
import de.alive.inboxscan.infrastructure.ImapMailboxSource;
import de.alive.inboxscan.infrastructure.MessageDecoder;
import de.alive.inboxscan.service.ConfigurationService;
import de.alive.inboxscan.service.config.ScanConfiguration;
import de.alive.inboxscan.unsubscribe.FileUnsubscribeOutcomeLog;
import de.alive.inboxscan.unsubscribe.SelectionReader;
import de.alive.inboxscan.unsubscribe.UnsubscribeExecutor;
import de.alive.inboxscan.unsubscribe.UnsubscribeTokenLocator;
import de.alive.inboxscan.util.LogUtils;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

@Slf4j
public class UnsubscribeApplication {

    static final String SELECTION_FILE_ENV = "SELECTION_FILE";

    public static void main(String[] args) {
        log.info("{} Starting unsubscribe run...", LogUtils.ROCKET_EMOJI);
        try {
            String selectionFile = System.getenv(SELECTION_FILE_ENV);
            if (selectionFile == null || selectionFile.isBlank()) {
                throw new ConfigurationException("Missing required environment variable: " + SELECTION_FILE_ENV,
                        SELECTION_FILE_ENV, ConfigurationException.ConfigurationType.MISSING_ENVIRONMENT_VARIABLE);
            }
            Configuration configuration = new ConfigurationService().loadConfiguration();
            run(configuration, Path.of(selectionFile));
        } catch (ConfigurationException e) {
            log.error("{} Invalid configuration ({}): {}", LogUtils.ERROR_EMOJI, e.getConfigKey(), e.getMessage());
            System.exit(1);
        } catch (InvalidSelectionException e) {
            log.error("{} Selection file rejected: {}", LogUtils.ERROR_EMOJI, e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            log.error("{} Unsubscribe run failed: {}", LogUtils.ERROR_EMOJI, e.getMessage(), e);
            System.exit(1);
        }
    }

    static void run(Configuration configuration, Path selectionFile) throws InvalidSelectionException {
        ScanConfiguration scanConfig = configuration.scanConfig();
        List<UnsubscribeSelection> selections = new SelectionReader().read(selectionFile);

        try (ImapMailboxSource mailbox = new ImapMailboxSource(configuration)) {
            UnsubscribeTokenLocator locator = new UnsubscribeTokenLocator(mailbox, new MessageDecoder(),
                    new UnsubscribeLinkExtractor(), LocalDate.now().minusDays(scanConfig.getUnsubscribeLookbackDays()));
            UnsubscribeExecutor executor = new UnsubscribeExecutor(locator,
                    new FileUnsubscribeOutcomeLog(scanConfig.getOutcomeLogFile()), scanConfig);

            Thread shutdownHook = new Thread(executor::cancel, "unsubscribe-cancel");
            Runtime.getRuntime().addShutdownHook(shutdownHook);
            try {
                executor.run(selections);
            } finally {
                try {
                    Runtime.getRuntime().removeShutdownHook(shutdownHook);
                } catch (IllegalStateException e) {
                    log.debug("JVM already shutting down");
                }
            }
        }
    }
}
