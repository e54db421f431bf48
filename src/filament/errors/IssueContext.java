package filament.errors;

import java.util.Collection;

/**
 * Collects the issues reported by a pass. Nested contexts created by {@link #withContext(Context)} tag each issue
 * with what was being processed before handing it to their parent.
 */
public abstract class IssueContext {

	public abstract void error(Issue err);

	public abstract boolean hasErrors();

	public void errors(Collection<? extends Issue> errs) {
		for (Issue err : errs) {
			error(err);
		}
	}

	public IssueContext withContext(Context context) {
		return new Nested(this, context);
	}

	private static final class Nested extends IssueContext {
		private final IssueContext parent;
		private final Context context;

		Nested(IssueContext parent, Context context) {
			this.parent = parent;
			this.context = context;
		}

		@Override
		public void error(Issue err) {
			parent.error(err.withContext(context));
		}

		@Override
		public boolean hasErrors() {
			return parent.hasErrors();
		}
	}
}
