package filament.solver;

import filament.model.expr.Atom;
import filament.model.expr.Constraint;
import filament.model.expr.Expression;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class FourierMotzkinSessionTest {

	private static final Atom X = Atom.existential("x");
	private static final Atom Y = Atom.existential("y");
	private static final Expression x = Expression.of(X);
	private static final Expression y = Expression.of(Y);
	private static final Constraint.Reason R = Constraint.Reason.GUARD;

	private FourierMotzkinSession session;

	private static Expression c(long value) {
		return Expression.constant(value);
	}

	@Before
	public void setUp() {
		session = new FourierMotzkinSession();
		session.declare(X);
		session.declare(Y);
	}

	@Test
	public void testBoundedModel() {
		session.assume(Constraint.gt(x, c(2), R, null));
		session.assume(Constraint.gt(c(5), x, R, null));
		assertThat(session.check(), is(SatResult.SAT));
		long value = session.model(Collections.singletonList(X)).get(X);
		assertTrue(value == 3 || value == 4);
	}

	@Test
	public void testVariablesAreNatural() {
		session.assume(Constraint.gt(c(0), x, R, null));
		assertThat(session.check(), is(SatResult.UNSAT));
	}

	@Test
	public void testNoIntegerSolution() {
		session.assume(Constraint.eq(x.times(2), c(3), R, null));
		assertThat(session.check(), is(SatResult.UNSAT));
	}

	@Test
	public void testEliminationAcrossVariables() {
		session.assume(Constraint.ge(x.plus(y), c(10), R, null));
		session.assume(Constraint.ge(c(3), x, R, null));
		session.assume(Constraint.ge(c(6), y, R, null));
		assertThat(session.check(), is(SatResult.UNSAT));
	}

	@Test
	public void testEqualityModel() {
		session.assume(Constraint.eq(x.times(3), c(12), R, null));
		session.assume(Constraint.eq(y, x.plus(1), R, null));
		assertThat(session.check(), is(SatResult.SAT));
		Map<Atom, Long> model = session.model(Arrays.asList(X, Y));
		assertThat(model.get(X), is(4L));
		assertThat(model.get(Y), is(5L));
	}

	@Test
	public void testPushPop() {
		session.assume(Constraint.gt(x, c(5), R, null));
		session.push();
		session.assume(Constraint.ge(c(3), x, R, null));
		assertThat(session.check(), is(SatResult.UNSAT));
		session.pop();
		assertThat(session.check(), is(SatResult.SAT));
	}

	@Test
	public void testDisjunction() {
		session.assume(Constraint.ge(x, c(1), R, null));
		session.assume(Constraint.ge(c(20), x, R, null));
		session.push();
		session.assumeAny(Arrays.asList(Constraint.gt(x, c(10), R, null), Constraint.ge(c(0), x, R, null)));
		assertThat(session.check(), is(SatResult.SAT));
		assertTrue(session.model(Collections.singletonList(X)).get(X) > 10);
		session.pop();
		session.assumeAny(Arrays.asList(Constraint.gt(x, c(30), R, null), Constraint.ge(c(0), x, R, null)));
		assertThat(session.check(), is(SatResult.UNSAT));
	}

	@Test
	public void testEmptyDisjunction() {
		session.assumeAny(Collections.emptyList());
		assertThat(session.check(), is(SatResult.UNSAT));
	}

	@Test
	public void testProductLowerBound() {
		session.assume(Constraint.ge(x, c(2), R, null));
		session.assume(Constraint.ge(y, c(3), R, null));
		session.assume(Constraint.ge(c(5), x.times(y), R, null));
		assertThat(session.check(), is(SatResult.UNSAT));
	}

	@Test
	public void testProductModelMustAgreeWithFactors() {
		// x*x = 2 has no natural solution, but the product column alone can be 2
		session.assume(Constraint.eq(x.times(x), c(2), R, null));
		assertThat(session.check(), is(SatResult.UNKNOWN));
	}

	@Test
	public void testConsistentProductModel() {
		session.assume(Constraint.eq(x.times(x), c(4), R, null));
		session.assume(Constraint.eq(x, c(2), R, null));
		assertThat(session.check(), is(SatResult.SAT));
		assertThat(session.model(Collections.singletonList(X)).get(X), is(2L));
	}

	@Test(expected = IllegalStateException.class)
	public void testModelWithoutCheck() {
		session.model(Collections.singletonList(X));
	}

	@Test(expected = IllegalStateException.class)
	public void testUnbalancedPop() {
		session.pop();
	}
}
