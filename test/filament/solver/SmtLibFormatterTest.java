package filament.solver;

import filament.model.expr.Atom;
import filament.model.expr.Constraint;
import filament.model.expr.Expression;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class SmtLibFormatterTest {

	private static final Atom W = Atom.parameter("W");
	private static final Atom L = Atom.instanceExistential("m2", "L");

	@Test
	public void testSymbolsAreQuoted() {
		assertThat(SmtLibFormatter.symbol(L), is("|m2.L|"));
	}

	@Test
	public void testNegativeNumbers() {
		assertThat(SmtLibFormatter.number(-3), is("(- 3)"));
		assertThat(SmtLibFormatter.number(7), is("7"));
	}

	@Test
	public void testExpressions() {
		Expression e = Expression.of(W).times(2).plus(Expression.of(L)).minus(Expression.ONE);
		assertThat(SmtLibFormatter.expression(e), is("(+ (* 2 |W|) |m2.L| (- 1))"));
		assertThat(SmtLibFormatter.expression(Expression.of(W).times(Expression.of(W))), is("(* |W| |W|)"));
		assertThat(SmtLibFormatter.expression(Expression.ZERO), is("0"));
	}

	@Test
	public void testConstraints() {
		Constraint c = Constraint.ge(Expression.of(W), Expression.constant(4), Constraint.Reason.GUARD, null);
		assertThat(SmtLibFormatter.constraint(c), is("(>= |W| 4)"));
		Constraint d = Constraint.eq(Expression.of(W), Expression.ONE, Constraint.Reason.GUARD, null);
		assertThat(SmtLibFormatter.disjunction(Arrays.asList(c, d)), is("(or (>= |W| 4) (= |W| 1))"));
		assertThat(SmtLibFormatter.disjunction(Collections.emptyList()), is("false"));
	}

	@Test
	public void testDeclarationsAreNatural() {
		assertThat(SmtLibFormatter.declare(W),
				is(Arrays.asList("(declare-const |W| Int)", "(assert (>= |W| 0))")));
		assertThat(SmtLibFormatter.getValue(Arrays.asList(W, L)), is("(get-value (|W| |m2.L|))"));
	}
}
