package filament.solver;

import java.nio.file.Path;
import java.util.Arrays;

/**
 * Opens solver sessions. Implementations must be safe to call from several checking workers at once.
 */
public interface SolverFactory {

	SolverSession open();

	static SolverFactory builtin() {
		return FourierMotzkinSession::new;
	}

	/**
	 * @param name builtin, z3 or cvc5
	 * @param replayFile where to record every SMT-LIB command sent, or null
	 */
	static SolverFactory create(String name, Path replayFile) {
		switch (name) {
			case "builtin":
				return builtin();
			case "z3":
				return new SmtLibSolverFactory(Arrays.asList("z3", "-smt2", "-in"), replayFile);
			case "cvc5":
				return new SmtLibSolverFactory(Arrays.asList("cvc5", "--incremental", "--force-logic=ALL"), replayFile);
			default:
				throw new IllegalArgumentException("unknown solver " + name + "; expected builtin, z3 or cvc5");
		}
	}
}
