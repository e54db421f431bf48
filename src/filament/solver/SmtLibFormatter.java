package filament.solver;

import filament.model.expr.Atom;
import filament.model.expr.Constraint;
import filament.model.expr.Expression;
import filament.model.expr.Monomial;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Renders atoms and constraints as SMT-LIB 2 commands in the integer theory.
 */
public final class SmtLibFormatter {
	private SmtLibFormatter() {}

	public static String symbol(Atom atom) {
		return "|" + atom.render() + "|";
	}

	public static String number(long value) {
		return value < 0 ? "(- " + Math.negateExact(value) + ")" : Long.toString(value);
	}

	public static String expression(Expression expression) {
		List<String> terms = new ArrayList<>();
		for (Map.Entry<Monomial, Long> term : expression.getTerms().entrySet()) {
			Monomial monomial = term.getKey();
			long coefficient = term.getValue();
			if (monomial.isConstant()) {
				terms.add(number(coefficient));
				continue;
			}
			List<String> factors = new ArrayList<>();
			if (coefficient != 1) {
				factors.add(number(coefficient));
			}
			for (Atom factor : monomial.getFactors()) {
				factors.add(symbol(factor));
			}
			terms.add(factors.size() == 1 ? factors.get(0) : "(* " + String.join(" ", factors) + ")");
		}
		if (terms.isEmpty()) {
			return "0";
		}
		if (terms.size() == 1) {
			return terms.get(0);
		}
		return "(+ " + String.join(" ", terms) + ")";
	}

	public static String constraint(Constraint constraint) {
		return "(" + constraint.getComparison().getSymbol() + " " + expression(constraint.getLhs()) + " " +
				expression(constraint.getRhs()) + ")";
	}

	public static String disjunction(List<Constraint> alternatives) {
		if (alternatives.isEmpty()) {
			return "false";
		}
		if (alternatives.size() == 1) {
			return constraint(alternatives.get(0));
		}
		List<String> rendered = new ArrayList<>();
		for (Constraint c : alternatives) {
			rendered.add(constraint(c));
		}
		return "(or " + String.join(" ", rendered) + ")";
	}

	public static List<String> declare(Atom atom) {
		List<String> commands = new ArrayList<>();
		commands.add("(declare-const " + symbol(atom) + " Int)");
		commands.add("(assert (>= " + symbol(atom) + " 0))");
		return commands;
	}

	public static String assertion(String formula) {
		return "(assert " + formula + ")";
	}

	public static String getValue(Collection<Atom> atoms) {
		List<String> symbols = new ArrayList<>();
		for (Atom atom : atoms) {
			symbols.add(symbol(atom));
		}
		return "(get-value (" + String.join(" ", symbols) + "))";
	}
}
