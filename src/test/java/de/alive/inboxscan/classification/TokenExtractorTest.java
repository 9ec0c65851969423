package de.alive.inboxscan.classification;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TokenExtractorTest {

    @Test
    void tokenFor_QueryParameter_ReturnsValue() {
        assertEquals("abc123", TokenExtractor.tokenFor("https://shopco.com/unsub?t=abc123"));
    }

    @Test
    void tokenFor_SeveralParameters_ReturnsLongestValue() {
        assertEquals("longervalue", TokenExtractor.tokenFor("https://x.com/unsubscribe?a=1&token=longervalue&b="));
    }

    @Test
    void tokenFor_TrackingParameters_AreIgnored() {
        assertEquals("1", TokenExtractor.tokenFor("https://a.example/u?id=1&utm_campaign=weekly_digest"));
        assertEquals("9f3k", TokenExtractor.tokenFor("https://a.example/u?UTM_SOURCE=newsletter_main&mc_cid=abcdef123&s=9f3k"));
    }

    @Test
    void tokenFor_OnlyTrackingParameters_FallsBackToPath() {
        assertEquals("user-77", TokenExtractor.tokenFor("https://a.example/unsubscribe/user-77?utm_medium=email"));
    }

    @Test
    void tokenFor_EncodedParameter_IsDecoded() {
        assertEquals("a b+c", TokenExtractor.tokenFor("https://x.com/unsubscribe?id=a%20b%2Bc"));
    }

    @Test
    void tokenFor_IdentifierInPath_ReturnsSegment() {
        assertEquals("AbCdEfGhIjKlMnOpQr", TokenExtractor.tokenFor("https://x.com/u/AbCdEfGhIjKlMnOpQr/unsubscribe"));
        assertEquals("42", TokenExtractor.tokenFor("https://x.com/unsubscribe/42/confirm.html"));
    }

    @Test
    void tokenFor_OnlyGenericSegments_ReturnsWholeUrl() {
        assertEquals("https://x.com/email/unsubscribe", TokenExtractor.tokenFor("https://x.com/email/unsubscribe"));
    }

    @Test
    void tokenFor_Mailto_UsesQueryOnly() {
        assertEquals("unsubscribe-123", TokenExtractor.tokenFor("mailto:leave@x.com?subject=unsubscribe-123"));
        assertEquals("mailto:leave@x.com", TokenExtractor.tokenFor("mailto:leave@x.com"));
    }

    @Test
    void tokenFor_UnparseableUrl_ReturnsTrimmedInput() {
        assertEquals("https://x.com/a b|c", TokenExtractor.tokenFor("  https://x.com/a b|c "));
    }
}
