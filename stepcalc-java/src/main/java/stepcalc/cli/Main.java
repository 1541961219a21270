package stepcalc.cli;

import stepcalc.api.CalcConfig;
import stepcalc.api.Calculation;
import stepcalc.api.Calculator;
import stepcalc.error.CalcException;
import stepcalc.error.Carets;
import stepcalc.error.SyntaxException;
import stepcalc.print.NumberFormatter;
import stepcalc.template.Template;
import stepcalc.terms.TermSummary;
import stepcalc.text.Normalizer;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class Main {

    static final int OK = 0;
    static final int CALC_ERROR = 1;
    static final int USAGE = 2;

    private static final String USAGE_TEXT = "Usage: stepcalc [--vars <file>] [--scale <n>] <expression...>";

    public static void main(String[] args) throws IOException {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) throws IOException {
        Path varsFile = null;
        CalcConfig config = CalcConfig.fromSystemProperties();
        List<String> words = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a.equals("--vars") || a.equals("--scale")) {
                if (i + 1 >= args.length) {
                    err.println("Missing value for " + a);
                    err.println(USAGE_TEXT);
                    return USAGE;
                }
                String v = args[++i];
                if (a.equals("--vars")) {
                    varsFile = Path.of(v);
                } else {
                    try {
                        config = config.withScale(Integer.parseInt(v));
                    } catch (IllegalArgumentException e) {
                        err.println("Bad scale: " + v);
                        return USAGE;
                    }
                }
            } else {
                words.add(a);
            }
        }

        if (words.isEmpty()) {
            err.println(USAGE_TEXT);
            return USAGE;
        }

        String expression = String.join(" ", words);
        Calculator calculator = new Calculator(config);

        Map<String, String> vars = Map.of();
        try {
            if (varsFile != null) vars = Template.parseVariables(Files.readString(varsFile));

            Calculation c = calculator.calculate(expression, vars);
            print(c, calculator.printer().numbers(), out);
            return OK;
        } catch (CalcException e) {
            err.println(e.kind() + ": " + e.getMessage());
            // syntax errors already carry their caret
            if (!(e instanceof SyntaxException) && e.range().length() > 0) {
                String source = Normalizer.normalize(Template.apply(expression, vars));
                err.println(Carets.render(source, e.range()));
            }
            return CALC_ERROR;
        }
    }

    private static void print(Calculation c, NumberFormatter numbers, PrintStream out) {
        out.println("Expression: " + c.source());

        out.println("Steps:");
        if (c.steps().isEmpty()) out.println("  (none)");
        for (int i = 0; i < c.steps().size(); i++) {
            out.println("  " + (i + 1) + ". " + c.steps().get(i));
        }

        out.println("Terms:");
        for (TermSummary t : c.terms()) {
            out.println("  " + t.index() + ". " + t.text() + " = " + numbers.format(t.value())
                    + "  (running total " + numbers.format(t.runningTotal()) + ")");
        }

        out.println("= " + c.formattedValue());
    }
}
