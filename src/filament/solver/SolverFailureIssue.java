package filament.solver;

import filament.errors.Issue;
import filament.errors.IssueVisitor;

public class SolverFailureIssue extends Issue {
	private final String description;
	private final Throwable cause;

	public SolverFailureIssue(String description, Throwable cause) {
		this.description = description;
		this.cause = cause;
	}

	public String getDescription() {
		return description;
	}

	/**
	 * @return the exception raised by the solver session, or null when the solver answered UNKNOWN
	 */
	public Throwable getCause() {
		return cause;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
