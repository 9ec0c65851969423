package de.alive.inboxscan.infrastructure;

import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import javax.mail.internet.MimeUtility;
import javax.mail.internet.ParseException;
import java.io.ByteArrayOutputStream;
import java.io.UnsupportedEncodingException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Header and body text decoding that never fails: encoded words with unknown charsets and
 * bodies in unsupported charsets degrade to UTF-8 (when valid) or ISO-8859-1.
 */
@Slf4j
public final class TextDecoder {

    private static final Pattern ENCODED_WORD = Pattern.compile("=\\?([^?\\s]+)\\?([bBqQ])\\?([^?\\s]*)\\?=");
    private static final Pattern FOLDING = Pattern.compile("\\r?\\n[ \\t]+");

    private TextDecoder() {
    }

    // Decodes every RFC 2047 encoded word in a header value independently, keeping plain words as they are.
    @NotNull
    public static String decodeHeader(@Nullable String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }

        String unfolded = FOLDING.matcher(raw).replaceAll(" ");
        Matcher matcher = ENCODED_WORD.matcher(unfolded);
        StringBuilder decoded = new StringBuilder(unfolded.length());
        int last = 0;
        boolean previousWasEncoded = false;

        while (matcher.find()) {
            String between = unfolded.substring(last, matcher.start());
            // whitespace between two adjacent encoded words is not part of the text
            if (!(previousWasEncoded && between.isBlank())) {
                decoded.append(between);
            }
            decoded.append(decodeWord(matcher.group(), matcher.group(1), matcher.group(2), matcher.group(3)));
            previousWasEncoded = true;
            last = matcher.end();
        }
        decoded.append(unfolded.substring(last));
        return decoded.toString().trim();
    }

    // Decodes bytes in the declared charset, falling back to best-effort detection when it is missing or unknown.
    @NotNull
    public static String decodeBytes(byte[] bytes, @Nullable String charsetName) {
        Charset charset = lookupCharset(charsetName);
        if (charset != null) {
            return new String(bytes, charset);
        }
        return bestEffort(bytes);
    }

    @NotNull
    public static String bestEffort(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            return new String(bytes, StandardCharsets.ISO_8859_1);
        }
    }

    @Nullable
    static Charset lookupCharset(@Nullable String charsetName) {
        if (charsetName == null || charsetName.isBlank()) {
            return null;
        }
        String name = charsetName.trim();
        // RFC 2231 language suffix, e.g. utf-8*en
        int star = name.indexOf('*');
        if (star > 0) {
            name = name.substring(0, star);
        }
        try {
            return Charset.forName(MimeUtility.javaCharset(name));
        } catch (IllegalArgumentException e) {
            log.debug("Unknown charset '{}', using best-effort decoding", charsetName);
            return null;
        }
    }

    private static String decodeWord(String word, String charsetName, String encoding, String text) {
        try {
            return MimeUtility.decodeWord(word);
        } catch (UnsupportedEncodingException | ParseException e) {
            log.debug("Falling back to best-effort decoding for '{}': {}", word, e.getMessage());
        } catch (RuntimeException e) {
            log.debug("Malformed encoded word '{}': {}", word, e.getMessage());
        }

        byte[] bytes;
        try {
            bytes = "B".equalsIgnoreCase(encoding) ? Base64.getMimeDecoder().decode(text) : decodeQ(text);
        } catch (IllegalArgumentException e) {
            return word;
        }
        return decodeBytes(bytes, charsetName);
    }

    private static byte[] decodeQ(String text) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '_') {
                out.write(' ');
            } else if (c == '=' && isHex(text, i + 1) && isHex(text, i + 2)) {
                out.write(Integer.parseInt(text.substring(i + 1, i + 3), 16));
                i += 2;
            } else {
                out.write((byte) c);
            }
        }
        return out.toByteArray();
    }

    private static boolean isHex(String text, int index) {
        return index < text.length() && Character.digit(text.charAt(index), 16) >= 0;
    }
}
