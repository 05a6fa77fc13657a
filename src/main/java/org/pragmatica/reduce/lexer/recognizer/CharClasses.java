package org.pragmatica.reduce.lexer.recognizer;

/**
 * ASCII character class helpers shared by the recognizers.
 */
final class CharClasses {
    private CharClasses() {}

    static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static int letterRun(CharSequence input, int from) {
        int pos = from;
        while (pos < input.length() && isLetter(input.charAt(pos))) {
            pos++;
        }
        return pos - from;
    }

    static int digitRun(CharSequence input, int from) {
        int pos = from;
        while (pos < input.length() && isDigit(input.charAt(pos))) {
            pos++;
        }
        return pos - from;
    }
}
