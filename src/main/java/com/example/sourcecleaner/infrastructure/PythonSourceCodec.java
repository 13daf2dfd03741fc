package com.example.sourcecleaner.infrastructure;

import com.example.sourcecleaner.application.SourceCodec;
import com.example.sourcecleaner.domain.DecodedSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * PEP 263 encoding detection. Sources that do not decode under their declared (or default
 * UTF-8) encoding are read as ISO-8859-1, which accepts any byte sequence.
 */
@Component
public class PythonSourceCodec implements SourceCodec {
    private static final Logger log = LogManager.getLogger(PythonSourceCodec.class);

    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
    private static final Pattern CODING_COOKIE =
            Pattern.compile("^[ \\t\\f]*#.*?coding[:=][ \\t]*([-\\w.]+)");
    private static final Pattern BLANK_OR_COMMENT = Pattern.compile("^[ \\t\\f]*(?:[#\\r\\n]|$)");
    private static final Charset FALLBACK = StandardCharsets.ISO_8859_1;

    @Override
    public DecodedSource decode(byte[] content) {
        boolean bom = startsWithBom(content);
        byte[] body = bom ? Arrays.copyOfRange(content, UTF8_BOM.length, content.length) : content;
        Optional<Charset> declared;
        try {
            declared = declaredCharset(body);
        } catch (UnsupportedCharsetException | IllegalCharsetNameException e) {
            log.debug("Unknown coding cookie, reading as {}", FALLBACK.name());
            return new DecodedSource(new String(content, FALLBACK), FALLBACK, false);
        }
        Charset charset = declared.orElse(StandardCharsets.UTF_8);
        if (bom && !charset.equals(StandardCharsets.UTF_8)) {
            return new DecodedSource(new String(content, FALLBACK), FALLBACK, false);
        }
        try {
            String text =
                    charset.newDecoder()
                            .onMalformedInput(CodingErrorAction.REPORT)
                            .onUnmappableCharacter(CodingErrorAction.REPORT)
                            .decode(ByteBuffer.wrap(body))
                            .toString();
            return new DecodedSource(text, charset, bom);
        } catch (CharacterCodingException e) {
            log.debug("Source does not decode as {}, reading as {}", charset.name(), FALLBACK.name());
            return new DecodedSource(new String(content, FALLBACK), FALLBACK, false);
        }
    }

    @Override
    public byte[] encode(DecodedSource original, String text) {
        byte[] encoded = text.getBytes(original.charset());
        if (!original.byteOrderMark()) {
            return encoded;
        }
        byte[] withBom = new byte[UTF8_BOM.length + encoded.length];
        System.arraycopy(UTF8_BOM, 0, withBom, 0, UTF8_BOM.length);
        System.arraycopy(encoded, 0, withBom, UTF8_BOM.length, encoded.length);
        return withBom;
    }

    /** The cookie may sit on the first line, or on the second when the first is blank or a comment. */
    Optional<Charset> declaredCharset(byte[] body) {
        String head = new String(body, 0, Math.min(body.length, 4096), FALLBACK);
        String[] lines = head.split("\\r?\\n|\\r", 3);
        for (int i = 0; i < Math.min(2, lines.length); i++) {
            Matcher cookie = CODING_COOKIE.matcher(lines[i]);
            if (cookie.find()) {
                return Optional.of(charsetFor(cookie.group(1)));
            }
            if (!BLANK_OR_COMMENT.matcher(lines[i]).lookingAt()) {
                break;
            }
        }
        return Optional.empty();
    }

    private static Charset charsetFor(String declared) {
        String name = declared.toLowerCase(Locale.ROOT).replace('_', '-');
        if (name.equals("utf-8") || name.startsWith("utf-8-")) {
            return StandardCharsets.UTF_8;
        }
        for (String latin1 : new String[] {"latin-1", "iso-8859-1", "iso-latin-1"}) {
            if (name.equals(latin1) || name.startsWith(latin1 + "-")) {
                return StandardCharsets.ISO_8859_1;
            }
        }
        return Charset.forName(name);
    }

    private static boolean startsWithBom(byte[] content) {
        return content.length >= UTF8_BOM.length
                && content[0] == UTF8_BOM[0]
                && content[1] == UTF8_BOM[1]
                && content[2] == UTF8_BOM[2];
    }
}
