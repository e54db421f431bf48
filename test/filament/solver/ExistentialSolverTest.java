package filament.solver;

import filament.errors.TopLevelIssueContext;
import filament.model.expr.Atom;
import filament.model.expr.Constraint;
import filament.model.expr.Expression;
import filament.trans.passes.check.UnderconstrainedExistentialIssue;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class ExistentialSolverTest {

	private static final Atom L = Atom.existential("L");
	private static final Expression l = Expression.of(L);
	private static final Constraint.Reason R = Constraint.Reason.EXISTENTIAL_DEFINITION;

	private TopLevelIssueContext ctx;

	@Before
	public void setUp() {
		ctx = new TopLevelIssueContext();
	}

	private Optional<Map<Atom, Long>> solve(List<Constraint> constraints) {
		return ExistentialSolver.perform(ctx, SolverFactory.builtin(), "Scale[3]", null,
				Collections.singletonList(L), constraints);
	}

	@Test
	public void testUniqueSolution() {
		Optional<Map<Atom, Long>> solved = solve(Collections.singletonList(
				Constraint.eq(l.times(3), Expression.constant(12), R, null)));
		assertThat(ctx.hasErrors(), is(false));
		assertThat(solved.get().get(L), is(4L));
	}

	@Test
	public void testSeveralSolutions() {
		Optional<Map<Atom, Long>> solved = solve(Arrays.asList(
				Constraint.ge(l, Expression.constant(2), R, null),
				Constraint.ge(Expression.constant(5), l, R, null)));
		assertThat(solved.isPresent(), is(false));
		assertThat(ctx.getIssues().get(0), instanceOf(UnderconstrainedExistentialIssue.class));
	}

	@Test
	public void testConflictingConstraints() {
		Constraint two = Constraint.eq(l, Expression.constant(2), R, null);
		Constraint bounded = Constraint.ge(Expression.constant(10), l, R, null);
		Constraint three = Constraint.eq(l, Expression.constant(3), R, null);
		Optional<Map<Atom, Long>> solved = solve(Arrays.asList(two, bounded, three));
		assertThat(solved.isPresent(), is(false));
		UnsatisfiableConstraintsIssue issue = (UnsatisfiableConstraintsIssue) ctx.getIssues().get(0);
		assertThat(issue.getClauses(), is(Arrays.asList(two, three)));
		assertThat(issue.getSubject(), is("Scale[3]"));
	}

	@Test
	public void testNothingToSolve() {
		Optional<Map<Atom, Long>> solved = ExistentialSolver.perform(ctx, SolverFactory.builtin(), "main[]", null,
				Collections.emptyList(), Collections.singletonList(
						Constraint.gt(Expression.constant(9), Expression.constant(4), R, null)));
		assertThat(solved.get().isEmpty(), is(true));

		ExistentialSolver.perform(ctx, SolverFactory.builtin(), "main[]", null, Collections.emptyList(),
				Collections.singletonList(Constraint.gt(Expression.constant(4), Expression.constant(9), R, null)));
		assertThat(ctx.getIssues().get(0), instanceOf(UnsatisfiableConstraintsIssue.class));
	}
}
