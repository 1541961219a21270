package stepcalc.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stepcalc.ast.Node;
import stepcalc.decimal.DecimalArithmetic;
import stepcalc.error.CalcException;
import stepcalc.eval.Evaluation;
import stepcalc.eval.Evaluator;
import stepcalc.eval.RawEvaluation;
import stepcalc.lexer.Lexer;
import stepcalc.lexer.Token;
import stepcalc.parser.Parser;
import stepcalc.print.Printer;
import stepcalc.template.Template;
import stepcalc.terms.RunningTotals;
import stepcalc.terms.TermSummary;
import stepcalc.text.Normalizer;

import java.util.List;
import java.util.Map;

/**
 * Entry point composing the pipeline: template, normalize, lex, parse, evaluate, terms.
 * Immutable and safe to share between threads.
 */
public final class Calculator {

    private static final Logger log = LoggerFactory.getLogger(Calculator.class);

    private final CalcConfig config;
    private final Printer printer;
    private final Evaluator evaluator;
    private final RunningTotals runningTotals;

    public Calculator() {
        this(CalcConfig.DEFAULT);
    }

    public Calculator(CalcConfig config) {
        DecimalArithmetic math = config.arithmetic();
        this.config = config;
        this.printer = new Printer(config.formatter());
        this.evaluator = new Evaluator(math, printer);
        this.runningTotals = new RunningTotals(evaluator, printer, math);
    }

    public CalcConfig config() {
        return config;
    }

    public Printer printer() {
        return printer;
    }

    /** Tokenizes {@code source} as is; callers normalize first if needed. */
    public List<Token> tokenize(String source) {
        return new Lexer(source).tokenize();
    }

    public Node parse(String source) {
        return new Parser(tokenize(source), source).parse();
    }

    public RawEvaluation evaluateRaw(Node ast) {
        return evaluator.evaluateRaw(ast);
    }

    public Evaluation evaluate(Node ast) {
        return evaluator.evaluate(ast);
    }

    public Calculation calculate(String input) {
        return calculate(input, Map.of());
    }

    public Calculation calculate(String input, Map<String, String> vars) {
        String source = Normalizer.normalize(Template.apply(input == null ? "" : input, vars));
        log.debug("Calculating '{}'", source);
        try {
            List<Token> tokens = tokenize(source);
            log.debug("Lexer: {} tokens", tokens.size());

            Node ast = new Parser(tokens, source).parse();
            Evaluation result = evaluator.evaluate(ast);
            log.debug("Evaluator: {} steps", result.steps().size());

            List<TermSummary> terms = runningTotals.summarize(ast);
            String formatted = printer.numbers().format(result.value());
            return new Calculation(source, ast, result.value(), formatted, result.steps(), terms);
        } catch (CalcException e) {
            log.debug("Calculation failed: {} at {}", e.kind(), e.range());
            throw e;
        }
    }
}
