package com.libragraph.peprobe.characterize.names;

import java.util.BitSet;

/**
 * Kinds of name tokens found in PE import/export tables, each with its own
 * punctuation allow-list on top of Unicode letters and numbers.
 */
public enum NameKind {

    /** Mangled or plain function names: {@code _ ? @ $ ( )}. */
    SYMBOL_NAME("_?@$()"),

    /**
     * FAT 8.3 short-filename characters, used to judge DLL names.
     * {@code /} is accepted as well, matching established PE tooling.
     */
    SHORT_FILENAME("!/$%&'()`-@^_{}~+,.;=[]");

    private final String punctuation;
    private final BitSet allowed;

    NameKind(String punctuation) {
        this.punctuation = punctuation;
        this.allowed = new BitSet(128);
        punctuation.chars().forEach(allowed::set);
    }

    /**
     * The accepted punctuation characters, in table order.
     */
    public String punctuation() {
        return punctuation;
    }

    /**
     * Whether a single code point is acceptable in a name of this kind.
     */
    public boolean accepts(int codePoint) {
        if (codePoint < 128 && allowed.get(codePoint)) {
            return true;
        }
        return Character.isLetter(codePoint) || isNumber(codePoint);
    }

    private static boolean isNumber(int codePoint) {
        int type = Character.getType(codePoint);
        return type == Character.DECIMAL_DIGIT_NUMBER
                || type == Character.LETTER_NUMBER
                || type == Character.OTHER_NUMBER;
    }
}
