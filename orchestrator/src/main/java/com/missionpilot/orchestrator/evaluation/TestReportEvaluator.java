package com.missionpilot.orchestrator.evaluation;

import com.missionpilot.orchestrator.model.Task;
import com.missionpilot.orchestrator.tool.Observation;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Judges command output that contains a test-runner summary.
 *
 * Recognised formats:
 * <pre>
 *   Maven Surefire:  Tests run: 12, Failures: 1, Errors: 0, Skipped: 2
 *   pytest:          ===== 10 passed, 2 failed in 0.31s =====
 *   JUnit console:   [ 12 tests successful ]  [ 1 tests failed ]
 * </pre>
 * Score is the pass ratio; the verdict is SUCCESS only when nothing failed.
 */
@Component
@Order(1)
public class TestReportEvaluator implements OutcomeEvaluator {

    private static final Pattern SUREFIRE = Pattern.compile(
            "Tests run: (\\d+), Failures: (\\d+), Errors: (\\d+)");
    private static final Pattern PYTEST_PASSED = Pattern.compile("(\\d+) passed");
    private static final Pattern PYTEST_FAILED = Pattern.compile("(\\d+) (?:failed|error)");
    private static final Pattern PYTEST_LINE   = Pattern.compile("=+ .*(?:passed|failed).* in [\\d.]+s");
    private static final Pattern JUNIT_OK      = Pattern.compile("\\[\\s*(\\d+) tests successful\\s*]");
    private static final Pattern JUNIT_FAILED  = Pattern.compile("\\[\\s*(\\d+) tests failed\\s*]");

    record Summary(int total, int failed) {
        double ratio() { return total == 0 ? 0.0 : (double) (total - failed) / total; }
    }

    @Override
    public String name() { return "test-report"; }

    @Override
    public boolean supports(String toolName, Observation observation) {
        return !observation.hasToolError() && parse(output(observation)).isPresent();
    }

    @Override
    public EvaluationResult evaluate(Task task, String action, Observation observation) {
        Summary s = parse(output(observation)).orElseThrow();
        boolean exitOk = observation.exitCode() == null || observation.exitCode() == 0;
        if (s.failed() == 0 && s.total() > 0 && exitOk) {
            return EvaluationResult.success(1.0, "All %d tests passed.".formatted(s.total()));
        }
        return EvaluationResult.failure(s.ratio(),
                "%d of %d tests failed; inspect the failing tests before changing more code."
                        .formatted(s.failed(), s.total()));
    }

    // ------------------------------------------------------------------
    // Parsing
    // ------------------------------------------------------------------

    static Optional<Summary> parse(String text) {
        Matcher m = SUREFIRE.matcher(text);
        int total = 0, failed = 0;
        boolean found = false;
        // Surefire prints one line per class then a total; the last match is the total
        while (m.find()) {
            total  = Integer.parseInt(m.group(1));
            failed = Integer.parseInt(m.group(2)) + Integer.parseInt(m.group(3));
            found  = true;
        }
        if (found) return Optional.of(new Summary(total, failed));

        Matcher line = PYTEST_LINE.matcher(text);
        if (line.find()) {
            String summary = line.group();
            int passed = firstInt(PYTEST_PASSED, summary);
            int bad    = firstInt(PYTEST_FAILED, summary);
            return Optional.of(new Summary(passed + bad, bad));
        }

        Matcher ok = JUNIT_OK.matcher(text);
        if (ok.find()) {
            int passed = Integer.parseInt(ok.group(1));
            int bad    = firstInt(JUNIT_FAILED, text);
            return Optional.of(new Summary(passed + bad, bad));
        }
        return Optional.empty();
    }

    private static int firstInt(Pattern p, String text) {
        Matcher m = p.matcher(text);
        return m.find() ? Integer.parseInt(m.group(1)) : 0;
    }

    private static String output(Observation o) {
        return (o.stdout() == null ? "" : o.stdout()) + "\n" + (o.stderr() == null ? "" : o.stderr());
    }
}
