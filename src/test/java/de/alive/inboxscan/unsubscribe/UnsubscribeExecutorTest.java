package de.alive.inboxscan.unsubscribe;

import de.alive.inboxscan.domain.UnsubscribeInfo;
import de.alive.inboxscan.domain.UnsubscribeOutcome;
import de.alive.inboxscan.domain.UnsubscribeSelection;
import de.alive.inboxscan.domain.UnsubscribeState;
import de.alive.inboxscan.exception.MailConnectionException;
import de.alive.inboxscan.service.config.ScanConfiguration;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UnsubscribeExecutorTest {

    private static final Instant NOW = Instant.parse("2024-03-02T08:00:00Z");

    @Mock
    private UnsubscribeTokenLocator locator;

    @TempDir
    Path tempDir;

    private MockWebServer server;
    private ScanConfiguration config;
    private FileUnsubscribeOutcomeLog outcomeLog;
    private UnsubscribeExecutor executor;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();

        config = ScanConfiguration.forTesting("Jane", tempDir);
        outcomeLog = new FileUnsubscribeOutcomeLog(config.getOutcomeLogFile());
        executor = new UnsubscribeExecutor(locator, new UnsubscribeHttpClient(Duration.ofSeconds(2)), outcomeLog,
                config, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void execute_ServerRecoversOnThirdAttempt_Succeeds() throws Exception {
        // given
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(200));
        stubHttpToken("abc123");

        // when
        List<UnsubscribeOutcome> outcomes = executor.run(List.of(selected(1, "shopco.com", "abc123")));

        // then
        assertEquals(1, outcomes.size());
        UnsubscribeOutcome outcome = outcomes.get(0);
        assertEquals(UnsubscribeOutcome.Result.SUCCESS, outcome.result());
        assertEquals(3, outcome.attempts());
        assertEquals(NOW, outcome.attemptedAt());
        assertEquals(3, server.getRequestCount());
        assertEquals(Optional.of(UnsubscribeState.SUCCESS), executor.getState("shopco.com"));
        assertEquals(List.of("2024-03-02T08:00:00Z | shopco.com | abc123 | SUCCESS | HTTP 200 after 3 attempt(s)"),
                Files.readAllLines(config.getOutcomeLogFile(), StandardCharsets.UTF_8));
    }

    @Test
    void execute_ClientError_FailsWithoutRetry() throws Exception {
        // given
        server.enqueue(new MockResponse().setResponseCode(404));
        stubHttpToken("abc123");

        // when
        List<UnsubscribeOutcome> outcomes = executor.run(List.of(selected(1, "shopco.com", "abc123")));

        // then
        assertEquals(UnsubscribeOutcome.Result.FAILED, outcomes.get(0).result());
        assertEquals(1, outcomes.get(0).attempts());
        assertEquals(1, server.getRequestCount());
        assertTrue(outcomes.get(0).detail().contains("404"));
    }

    @Test
    void execute_ServerKeepsFailing_FailsAfterRetryBudget() throws Exception {
        // given
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse().setResponseCode(500));
        }
        stubHttpToken("abc123");

        // when
        List<UnsubscribeOutcome> outcomes = executor.run(List.of(selected(1, "shopco.com", "abc123")));

        // then
        assertEquals(UnsubscribeOutcome.Result.FAILED, outcomes.get(0).result());
        assertEquals(config.getMaxAttempts(), outcomes.get(0).attempts());
        assertEquals(config.getMaxAttempts(), server.getRequestCount());
        assertEquals(Optional.of(UnsubscribeState.FAILED), executor.getState("shopco.com"));
    }

    @Test
    void execute_RedirectResponse_CountsAsSuccessWithoutFollowing() throws Exception {
        // given
        server.enqueue(new MockResponse().setResponseCode(302).setHeader("Location", "https://elsewhere.example/"));
        stubHttpToken("abc123");

        // when
        List<UnsubscribeOutcome> outcomes = executor.run(List.of(selected(1, "shopco.com", "abc123")));

        // then
        assertEquals(UnsubscribeOutcome.Result.SUCCESS, outcomes.get(0).result());
        assertEquals(1, server.getRequestCount());
    }

    @Test
    void execute_RowsNotSelectedForBoth_AreSkippedWithoutOutcome() {
        // given
        List<UnsubscribeSelection> rows = List.of(
                new UnsubscribeSelection(1, "a.com", "https://a.com/u?t=1", "1", true, false),
                new UnsubscribeSelection(2, "b.com", "https://b.com/u?t=2", "2", false, true));

        // when / then
        StepVerifier.create(executor.execute(rows)).verifyComplete();
        verifyNoInteractions(locator);
        assertTrue(outcomeLog.entries().isEmpty());
        assertFalse(Files.exists(config.getOutcomeLogFile()));
        assertTrue(executor.getStates().isEmpty());
    }

    @Test
    void execute_TokenNotFound_RequiresManualAction() throws Exception {
        // given
        when(locator.locate("old.example", "stale")).thenReturn(Optional.empty());

        // when
        List<UnsubscribeOutcome> outcomes = executor.run(List.of(selected(1, "old.example", "stale")));

        // then
        assertEquals(UnsubscribeOutcome.Result.MANUAL_REQUIRED, outcomes.get(0).result());
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void execute_MailtoMechanism_RequiresManualAction() throws Exception {
        // given
        when(locator.locate("list.example", "m-1")).thenReturn(Optional.of(
                new UnsubscribeInfo("mailto:leave@list.example?subject=m-1", "m-1", UnsubscribeInfo.Mechanism.MAILTO)));

        // when
        List<UnsubscribeOutcome> outcomes = executor.run(List.of(selected(1, "list.example", "m-1")));

        // then
        assertEquals(UnsubscribeOutcome.Result.MANUAL_REQUIRED, outcomes.get(0).result());
        assertTrue(outcomes.get(0).detail().contains("mailto:leave@list.example"));
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void execute_MailboxFailureForOneRow_ContinuesWithNextRow() throws Exception {
        // given
        server.enqueue(new MockResponse().setResponseCode(200));
        when(locator.locate("first.example", "broken")).thenThrow(new MailConnectionException("timeout",
                MailConnectionException.ConnectionStage.MESSAGE_SEARCH));
        stubHttpToken("abc123");

        // when
        List<UnsubscribeOutcome> outcomes = executor.run(List.of(
                selected(1, "first.example", "broken"),
                selected(2, "shopco.com", "abc123")));

        // then
        assertEquals(2, outcomes.size());
        assertEquals(UnsubscribeOutcome.Result.FAILED, outcomes.get(0).result());
        assertEquals(UnsubscribeOutcome.Result.SUCCESS, outcomes.get(1).result());
    }

    @Test
    void execute_MailboxSessionLost_StopsRemainingRows() throws Exception {
        // given
        when(locator.locate("first.example", "broken")).thenThrow(new MailConnectionException("login rejected",
                MailConnectionException.ConnectionStage.AUTHENTICATION));

        // when
        List<UnsubscribeOutcome> outcomes = executor.run(List.of(
                selected(1, "first.example", "broken"),
                selected(2, "shopco.com", "abc123")));

        // then
        assertEquals(1, outcomes.size());
        assertEquals(UnsubscribeOutcome.Result.FAILED, outcomes.get(0).result());
        assertTrue(executor.isCancelled());
        verify(locator, never()).locate(anyString(), eq("abc123"));
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void execute_DomainAlreadyUnsubscribed_LaterRowsSkipped() throws Exception {
        // given
        server.enqueue(new MockResponse().setResponseCode(200));
        stubHttpToken("abc123");

        // when
        List<UnsubscribeOutcome> outcomes = executor.run(List.of(
                selected(1, "shopco.com", "abc123"),
                selected(2, "shopco.com", "other-token")));

        // then
        assertEquals(1, outcomes.size());
        verify(locator, never()).locate(anyString(), eq("other-token"));
    }

    @Test
    void cancel_StopsBeforeNextRowAndKeepsLoggedOutcomes() throws Exception {
        // given
        server.enqueue(new MockResponse().setResponseCode(200));
        stubHttpToken("abc123");
        List<UnsubscribeSelection> rows = List.of(
                selected(1, "shopco.com", "abc123"),
                selected(2, "news.example", "zzz"));

        // when
        List<UnsubscribeOutcome> outcomes = executor.execute(rows)
                .doOnNext(outcome -> executor.cancel())
                .collectList()
                .block();

        // then
        assertNotNull(outcomes);
        assertEquals(1, outcomes.size());
        assertTrue(executor.isCancelled());
        verify(locator, never()).locate(anyString(), eq("zzz"));
        assertEquals(1, Files.readAllLines(config.getOutcomeLogFile(), StandardCharsets.UTF_8).size());
        assertEquals(Optional.of(UnsubscribeState.PENDING), executor.getState("news.example"));
    }

    private void stubHttpToken(String token) throws MailConnectionException {
        String url = server.url("/unsub?t=" + token).toString();
        when(locator.locate("shopco.com", token))
                .thenReturn(Optional.of(new UnsubscribeInfo(url, token, UnsubscribeInfo.Mechanism.HTTP)));
    }

    private static UnsubscribeSelection selected(int row, String domain, String token) {
        return new UnsubscribeSelection(row, domain, "https://" + domain + "/unsub?t=" + token, token, true, true);
    }
}
