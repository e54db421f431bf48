package filament.trans.passes.check;

import filament.model.ast.FilInvocation;
import filament.model.expr.Atom;
import filament.model.expr.Interval;

import java.util.List;
import java.util.Map;

/**
 * Two invocations of one instance, whose active windows must not overlap: one must be over before the other
 * starts. Windows are half-open, so one may end exactly when the next starts.
 */
public final class ReuseCheck {
	private final String instance;
	private final FilInvocation first;
	private final FilInvocation second;
	private final List<Interval> firstWindow;
	private final List<Interval> secondWindow;

	public ReuseCheck(String instance, FilInvocation first, FilInvocation second, List<Interval> firstWindow,
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

	public boolean holds(Map<Atom, Long> valuation) {
		return before(firstWindow, secondWindow, valuation) || before(secondWindow, firstWindow, valuation);
	}

	private static boolean before(List<Interval> earlier, List<Interval> later, Map<Atom, Long> valuation) {
		for (Interval a : earlier) {
			long end = a.getEnd().getOffset().evaluate(valuation);
			for (Interval b : later) {
				if (end > b.getStart().getOffset().evaluate(valuation)) {
					return false;
				}
			}
		}
		return true;
	}

	public ReuseHazardIssue toIssue() {
		return new ReuseHazardIssue(instance, first, second, firstWindow, secondWindow);
	}
}
