package stepcalc.template;

import stepcalc.error.TemplateException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code {{ name }}} substitution applied to the raw expression before normalization.
 */
public final class Template {
    private Template() {}

    private static final Pattern DEFINITION = Pattern.compile("^([A-Za-z_]\\w*)\\s*=\\s*(.+)$");
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z_]\\w*)\\s*}}");

    /** Parses {@code name = value} lines; blank lines are skipped, later names win. */
    public static Map<String, String> parseVariables(String text) {
        Map<String, String> vars = new LinkedHashMap<>();
        if (text == null || text.isEmpty()) return vars;

        String[] lines = text.split("\\r?\\n");
        for (int i = 0; i < lines.length; i++) {
            String trimmed = lines[i].trim();
            if (trimmed.isEmpty()) continue;

            Matcher m = DEFINITION.matcher(trimmed);
            if (!m.matches()) {
                throw new TemplateException("variable definition on line " + (i + 1) + " must be name = value");
            }
            vars.put(m.group(1), m.group(2).trim());
        }
        return vars;
    }

    public static String apply(String source, Map<String, String> vars) {
        Matcher m = PLACEHOLDER.matcher(source);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String name = m.group(1);
            String value = vars.get(name);
            if (value == null) {
                throw new TemplateException("template variable \"" + name + "\" is not defined");
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(value));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
