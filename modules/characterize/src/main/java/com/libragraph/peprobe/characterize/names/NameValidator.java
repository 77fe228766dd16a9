package com.libragraph.peprobe.characterize.names;

import jakarta.enterprise.context.ApplicationScoped;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Cheap heuristic gate for names read out of import/export tables.
 *
 * <p>A token is accepted when it is non-empty, decodes as UTF-8, and every code point is
 * allowed by its {@link NameKind}. Names that fail usually point at a corrupt or
 * deliberately mangled table. This is not a grammar and not a security boundary.
 *
 * <p>No length limit is applied: DLL names routinely exceed 8.3.
 */
@ApplicationScoped
public class NameValidator {

    public boolean isValidSymbolName(byte[] token) {
        return isValid(NameKind.SYMBOL_NAME, token);
    }

    public boolean isValidShortFilename(byte[] token) {
        return isValid(NameKind.SHORT_FILENAME, token);
    }

    public boolean isValid(NameKind kind, byte[] token) {
        Objects.requireNonNull(kind, "kind cannot be null");
        if (token == null || token.length == 0) {
            return false;
        }

        CharBuffer chars;
        try {
            chars = newDecoder().decode(ByteBuffer.wrap(token));
        } catch (CharacterCodingException e) {
            // Malformed UTF-8 cannot be a well-formed name
            return false;
        }

        return chars.codePoints().allMatch(kind::accepts);
    }

    private static CharsetDecoder newDecoder() {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
    }
}
