package filament.errors;

public class IssueWithContext extends Issue {
	private final Context context;
	private final Issue issue;

	public IssueWithContext(Issue issue, Context context) {
		this.issue = issue;
		this.context = context;
	}

	public Issue getIssue() {
		return issue;
	}

	public Context getContext() {
		return context;
	}

	/**
	 * @return the issue with every layer of context stripped
	 */
	public Issue getInnermostIssue() {
		Issue inner = issue;
		while (inner instanceof IssueWithContext) {
			inner = ((IssueWithContext) inner).getIssue();
		}
		return inner;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
