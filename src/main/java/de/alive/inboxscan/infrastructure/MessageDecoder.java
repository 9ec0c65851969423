package de.alive.inboxscan.infrastructure;

import de.alive.inboxscan.domain.DecodeResult;
import de.alive.inboxscan.domain.NormalizedMessage;
import de.alive.inboxscan.domain.RawMessage;
import de.alive.inboxscan.util.LogUtils;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import javax.mail.MessagingException;
import javax.mail.Multipart;
import javax.mail.Part;
import javax.mail.Session;
import javax.mail.internet.AddressException;
import javax.mail.internet.ContentType;
import javax.mail.internet.InternetAddress;
import javax.mail.internet.MimeBodyPart;
import javax.mail.internet.MimeMessage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw RFC 822 bytes into a {@link NormalizedMessage}. Never throws for bad input; messages
 * whose header block cannot be read come back as {@link DecodeResult#failed(long, String)}.
 */
@Slf4j
public class MessageDecoder {

    private static final int MAX_CONTENT_LENGTH = 500_000;
    private static final int MAX_SUBJECT_LENGTH = 1000;
    private static final int MAX_SENDER_LENGTH = 500;
    private static final int MAX_MULTIPART_DEPTH = 10;

    private static final Pattern HEADER_FIELD = Pattern.compile("^[!-9;-~]+:");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern EMAIL_PATTERN = Pattern.compile("([a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,})");

    private final Session session;

    public MessageDecoder() {
        Properties props = new Properties();
        props.setProperty("mail.mime.allowutf8", "true");
        props.setProperty("mail.mime.address.strict", "false");
        props.setProperty("mail.mime.decodetext.strict", "false");
        props.setProperty("mail.mime.parameters.strict", "false");
        this.session = Session.getInstance(props);
    }

    @NotNull
    public DecodeResult decode(@NotNull RawMessage raw) {
        long uid = raw.uid();
        if (raw.size() == 0) {
            return DecodeResult.failed(uid, "Empty message");
        }

        try {
            MimeMessage mimeMessage = new MimeMessage(session, new ByteArrayInputStream(raw.rawBytes()));

            // Header block must contain at least one name: value line
            List<String> headerLines = headerLines(mimeMessage);
            if (headerLines.stream().noneMatch(line -> HEADER_FIELD.matcher(line).find())) {
                return DecodeResult.failed(uid, "No parseable header fields");
            }

            // Try the sender fields in order
            Sender sender = extractSender(mimeMessage);
            String senderAddress = truncate(sender.address(), MAX_SENDER_LENGTH);

            // Build the message with all fields length-limited
            NormalizedMessage message = NormalizedMessage.builder()
                    .messageId(resolveMessageId(mimeMessage, raw))
                    .uid(uid)
                    .arrivalDate(raw.arrivalDate())
                    .senderName(truncate(sender.name(), MAX_SENDER_LENGTH))
                    .senderAddress(senderAddress)
                    .senderDomain(domainOf(senderAddress))
                    .subject(truncate(TextDecoder.decodeHeader(mimeMessage.getHeader("Subject", null)), MAX_SUBJECT_LENGTH))
                    .bodyText(extractBody(mimeMessage, uid))
                    .rawHeaderBlock(String.join("\n", headerLines))
                    .listUnsubscribe(decodedHeader(mimeMessage, "List-Unsubscribe"))
                    .build();

            return DecodeResult.ok(message);

        } catch (MessagingException e) {
            log.warn("{} Failed to decode message {}: {}", LogUtils.ERROR_EMOJI, uid, e.getMessage());
            return DecodeResult.failed(uid, "Unparseable message: " + e.getMessage());
        } catch (RuntimeException e) {
            log.warn("{} Unexpected error decoding message {}: {}", LogUtils.ERROR_EMOJI, uid, e.toString());
            return DecodeResult.failed(uid, "Decoder error: " + e);
        }
    }

    // Lower-cased part after the last @, or the whole lower-cased value when there is none
    @NotNull
    public static String domainOf(String address) {
        if (address == null) {
            return "";
        }
        String value = address.trim().toLowerCase(Locale.ROOT);
        int at = value.lastIndexOf('@');
        return at >= 0 ? value.substring(at + 1) : value;
    }

    private List<String> headerLines(MimeMessage mimeMessage) throws MessagingException {
        List<String> lines = new ArrayList<>();
        Enumeration<String> headers = mimeMessage.getAllHeaderLines();
        while (headers.hasMoreElements()) {
            lines.add(headers.nextElement());
        }
        return lines;
    }

    private String resolveMessageId(MimeMessage mimeMessage, RawMessage raw) throws MessagingException {
        String header = mimeMessage.getHeader("Message-ID", null);
        if (header != null && !header.isBlank()) {
            return WHITESPACE.matcher(header).replaceAll("");
        }
        return String.format("uid-%d-%d", raw.uid(), raw.arrivalDate().getEpochSecond());
    }

    private String decodedHeader(MimeMessage mimeMessage, String name) throws MessagingException {
        String value = mimeMessage.getHeader(name, ", ");
        return value == null ? null : TextDecoder.decodeHeader(value);
    }

    private Sender extractSender(MimeMessage mimeMessage) throws MessagingException {
        String rawFrom = mimeMessage.getHeader("From", ",");
        if (rawFrom == null || rawFrom.isBlank()) {
            rawFrom = mimeMessage.getHeader("Sender", ",");
        }
        if (rawFrom == null || rawFrom.isBlank()) {
            return new Sender("", "");
        }

        try {
            InternetAddress[] addresses = InternetAddress.parseHeader(rawFrom, false);
            if (addresses.length > 0 && addresses[0].getAddress() != null && !addresses[0].getAddress().isBlank()) {
                InternetAddress first = addresses[0];
                String name = first.getPersonal() == null ? "" : TextDecoder.decodeHeader(first.getPersonal());
                return new Sender(stripQuotes(name), first.getAddress().trim().toLowerCase(Locale.ROOT));
            }
        } catch (AddressException e) {
            log.debug("Lenient address parsing failed for '{}': {}", rawFrom, e.getMessage());
        }

        String decoded = TextDecoder.decodeHeader(rawFrom);
        Matcher matcher = EMAIL_PATTERN.matcher(decoded);
        if (matcher.find()) {
            String name = decoded.substring(0, matcher.start()).replace("<", "").trim();
            return new Sender(stripQuotes(name), matcher.group(1).toLowerCase(Locale.ROOT));
        }
        return new Sender("", decoded.trim());
    }

    private String extractBody(MimeMessage mimeMessage, long uid) {
        try {
            Optional<String> text = findPart(mimeMessage, "text/plain", 0);
            if (text.isEmpty()) {
                text = findPart(mimeMessage, "text/html", 0).map(HtmlTextConverter::toText);
            }
            return truncate(text.orElse(""), MAX_CONTENT_LENGTH);
        } catch (MessagingException | IOException e) {
            log.debug("Body extraction failed for message {}, continuing with empty body: {}", uid, e.getMessage());
            return "";
        }
    }

    private Optional<String> findPart(Part part, String mimeType, int depth) throws MessagingException, IOException {
        if (depth > MAX_MULTIPART_DEPTH || isAttachment(part)) {
            return Optional.empty();
        }

        if (part.isMimeType("multipart/*")) {
            Object content = part.getContent();
            if (content instanceof Multipart multipart) {
                for (int i = 0; i < multipart.getCount(); i++) {
                    Optional<String> found = findPart(multipart.getBodyPart(i), mimeType, depth + 1);
                    if (found.isPresent() && !found.get().isBlank()) {
                        return found;
                    }
                }
            }
            return Optional.empty();
        }

        if (part.isMimeType(mimeType)) {
            return Optional.of(readText(part));
        }
        return Optional.empty();
    }

    private boolean isAttachment(Part part) {
        try {
            return Part.ATTACHMENT.equalsIgnoreCase(part.getDisposition());
        } catch (MessagingException e) {
            return false;
        }
    }

    private String readText(Part part) throws MessagingException, IOException {
        try {
            Object content = part.getContent();
            if (content instanceof String text) {
                return text;
            }
        } catch (IOException e) {
            log.debug("Declared charset unusable, decoding part best-effort: {}", e.getMessage());
        }
        return TextDecoder.decodeBytes(readBytes(part), charsetOf(part));
    }

    private byte[] readBytes(Part part) throws MessagingException, IOException {
        try (InputStream in = part.getInputStream()) {
            return in.readAllBytes();
        } catch (IOException e) {
            // broken transfer encoding, fall back to the undecoded bytes
            InputStream raw = part instanceof MimeBodyPart bodyPart ? bodyPart.getRawInputStream()
                    : part instanceof MimeMessage message ? message.getRawInputStream() : null;
            if (raw == null) {
                throw e;
            }
            try (raw) {
                return raw.readAllBytes();
            }
        }
    }

    private String charsetOf(Part part) {
        try {
            String contentType = part.getContentType();
            return contentType == null ? null : new ContentType(contentType).getParameter("charset");
        } catch (MessagingException e) {
            return null;
        }
    }

    private static String stripQuotes(String value) {
        String trimmed = value.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            return trimmed.substring(1, trimmed.length() - 1).trim();
        }
        return trimmed;
    }

    private static String truncate(String value, int maxLength) {
        if (value == null) {
            return "";
        }
        return value.length() > maxLength ? value.substring(0, maxLength) : value;
    }

    private record Sender(String name, String address) {
    }
}
