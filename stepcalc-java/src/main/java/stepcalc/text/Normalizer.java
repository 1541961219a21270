package stepcalc.text;

import java.util.Map;

/**
 * Folds full-width forms and common math glyphs into the ASCII the lexer expects.
 * Total and idempotent.
 */
public final class Normalizer {
    private Normalizer() {}

    private static final Map<Character, Character> GLYPHS = Map.ofEntries(
            Map.entry('×', '*'),
            Map.entry('✕', '*'),
            Map.entry('✖', '*'),
            Map.entry('·', '*'),
            Map.entry('・', '*'),
            Map.entry('÷', '/'),
            Map.entry('／', '/'),
            Map.entry('−', '-'),
            Map.entry('–', '-'),
            Map.entry('—', '-'),
            Map.entry('％', '%'),
            Map.entry('＾', '^'),
            Map.entry('￥', '\\'),
            Map.entry('¥', '\\'), // NFKC folds the full-width yen into this one
            Map.entry('，', ',')
    );

    public static String normalize(String input) {
        if (input == null || input.isEmpty()) return "";

        String nfkc = java.text.Normalizer.normalize(input, java.text.Normalizer.Form.NFKC);
        StringBuilder sb = new StringBuilder(nfkc.length());
        for (int i = 0; i < nfkc.length(); i++) {
            char c = nfkc.charAt(i);
            sb.append(GLYPHS.getOrDefault(c, c));
        }
        return sb.toString();
    }
}
