package filament.trans.passes.mono;

import filament.errors.Issue;
import filament.errors.IssueVisitor;

import java.util.List;

public class InstantiationCycleIssue extends Issue {
	private final List<SpecializationKey> cycle;
	private final int depthLimit;

	/**
	 * @param cycle the specializations on the stack, starting and ending with the repeated key
	 */
	public InstantiationCycleIssue(List<SpecializationKey> cycle) {
		this(cycle, 0);
	}

	/**
	 * @param chain every specialization on the stack from the entry down to the one that went past the limit
	 */
	public InstantiationCycleIssue(List<SpecializationKey> chain, int depthLimit) {
		this.cycle = chain;
		this.depthLimit = depthLimit;
	}

	public List<SpecializationKey> getCycle() {
		return cycle;
	}

	/**
	 * @return the nesting limit that was exceeded, or 0 if a key repeated
	 */
	public int getDepthLimit() {
		return depthLimit;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
