package org.boc.interpret;

import org.boc.parsing.ast.StatementType;

/**
 * What the {@link Interpreter} did with one statement.
 */
public final class StatementOutcome {

    public enum Status {
        // the statement changed the belief store or the known values
        APPLIED,
        // nothing to do, e.g. a descriptive block or an unknown belief name
        SKIPPED,
        // the statement carried invalid values
        REJECTED
    }

    private final StatementType statementType;
    private final Status status;
    private final String detail;

    public StatementOutcome(StatementType statementType, Status status, String detail) {
        this.statementType = statementType;
        this.status = status;
        this.detail = detail;
    }

    public static StatementOutcome applied(StatementType type, String detail) {
        return new StatementOutcome(type, Status.APPLIED, detail);
    }

    public static StatementOutcome skipped(StatementType type, String detail) {
        return new StatementOutcome(type, Status.SKIPPED, detail);
    }

    public static StatementOutcome rejected(StatementType type, String detail) {
        return new StatementOutcome(type, Status.REJECTED, detail);
    }

    public StatementType getStatementType() {
        return statementType;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isApplied() {
        return status == Status.APPLIED;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return statementType.tag() + " " + status + ": " + detail;
    }
}
