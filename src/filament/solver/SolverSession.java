package filament.solver;

import filament.model.expr.Atom;
import filament.model.expr.Constraint;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * One incremental conversation with a decision procedure for constraints over naturals. Every declared variable
 * ranges over the naturals; products of variables are allowed, but a session may treat them as opaque.
 *
 * Sessions are single-threaded and independent of each other.
 */
public interface SolverSession extends AutoCloseable {

	/**
	 * Declares a natural-valued variable. Declarations are not scoped by {@link #push()}.
	 */
	void declare(Atom variable);

	void assume(Constraint constraint);

	/**
	 * Assumes that at least one of the alternatives holds.
	 */
	void assumeAny(List<Constraint> alternatives);

	void push();

	void pop();

	SatResult check();

	/**
	 * @return a value for each variable from the last satisfiable {@link #check()}
	 */
	Map<Atom, Long> model(Collection<Atom> variables);

	@Override
	void close();
}
