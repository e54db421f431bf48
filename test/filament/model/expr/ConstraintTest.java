package filament.model.expr;

import org.junit.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class ConstraintTest {

	private static final Atom W = Atom.parameter("W");
	private static final Expression w = Expression.of(W);

	@Test
	public void testNegation() {
		Constraint eq = Constraint.eq(w, Expression.constant(8), Constraint.Reason.WIDTH_MATCH, null);
		List<Constraint> negated = eq.negation();
		assertThat(negated.size(), is(2));
		assertThat(negated.get(0).render(), is("W > 8"));
		assertThat(negated.get(1).render(), is("8 > W"));

		Constraint gt = Constraint.gt(w, Expression.ZERO, Constraint.Reason.GUARD, null);
		assertThat(gt.negation().get(0).render(), is("0 >= W"));
	}

	@Test
	public void testTriviallyTrue() {
		Constraint ge = Constraint.ge(w.plus(1), w, Constraint.Reason.INTERVAL_WELL_FORMED, null);
		assertThat(ge.isGround(), is(true));
		assertThat(ge.isTriviallyTrue(), is(true));
		Constraint gt = Constraint.gt(w, w, Constraint.Reason.GUARD, null);
		assertThat(gt.isTriviallyTrue(), is(false));
		assertThat(Constraint.gt(w, Expression.ZERO, Constraint.Reason.GUARD, null).isTriviallyTrue(), is(false));
	}

	@Test
	public void testEvaluate() {
		Map<Atom, Long> valuation = new HashMap<>();
		valuation.put(W, 8L);
		assertThat(Constraint.ge(w, Expression.constant(8), Constraint.Reason.GUARD, null).evaluate(valuation),
				is(true));
		assertThat(Constraint.gt(w, Expression.constant(8), Constraint.Reason.GUARD, null).evaluate(valuation),
				is(false));
	}

	@Test
	public void testReasonIsNotPartOfEquality() {
		Constraint a = Constraint.eq(w, Expression.ONE, Constraint.Reason.GUARD, null);
		Constraint b = a.withReason(Constraint.Reason.WIDTH_MATCH, null);
		assertThat(a, is(b));
		assertThat(b.getReason(), is(Constraint.Reason.WIDTH_MATCH));
	}
}
