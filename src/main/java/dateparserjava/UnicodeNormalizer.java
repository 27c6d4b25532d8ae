package dateparserjava;

import java.text.Normalizer;

/**
 * Unicode folding used by the normalized cache family: NFKD decomposition
 * followed by removal of all non-spacing marks ("miércoles" becomes "miercoles").
 */
public final class UnicodeNormalizer {
    private UnicodeNormalizer() {
    }

    /**
     * Folds the given string.
     *
     * @param input the string to fold
     * @return the decomposed string without combining marks
     */
    public static String normalize(String input) {
        if (input == null || input.isEmpty()) return input;

        String decomposed = Normalizer.normalize(input, Normalizer.Form.NFKD);
        StringBuilder sb = new StringBuilder(decomposed.length());
        for (int i = 0; i < decomposed.length(); ) {
            int cp = decomposed.codePointAt(i);
            if (Character.getType(cp) != Character.NON_SPACING_MARK) {
                sb.appendCodePoint(cp);
            }
            i += Character.charCount(cp);
        }
        return sb.toString();
    }
}
