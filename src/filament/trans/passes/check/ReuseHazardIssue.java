package filament.trans.passes.check;

import filament.errors.Issue;
import filament.errors.IssueVisitor;
import filament.model.ast.FilInvocation;
import filament.model.expr.Interval;

import java.util.List;

public class ReuseHazardIssue extends Issue {
	private final String instance;
	private final FilInvocation first;
	private final FilInvocation second;
	private final List<Interval> firstWindow;
	private final List<Interval> secondWindow;

	public ReuseHazardIssue(String instance, FilInvocation first, FilInvocation second, List<Interval> firstWindow,
	                        List<Interval> secondWindow) {
		this.instance = instance;
		this.first = first;
		this.second = second;
		this.firstWindow = firstWindow;
		this.secondWindow = secondWindow;
	}

	public String getInstance() {
		return instance;
	}

	public FilInvocation getFirst() {
		return first;
	}

	public FilInvocation getSecond() {
		return second;
	}

	public List<Interval> getFirstWindow() {
		return firstWindow;
	}

	public List<Interval> getSecondWindow() {
		return secondWindow;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
