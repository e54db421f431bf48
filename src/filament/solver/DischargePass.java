package filament.solver;

import filament.errors.IssueContext;
import filament.model.expr.Atom;
import filament.model.expr.Constraint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Proves universally quantified obligations: each must hold for every natural value of the atoms it mentions,
 * given the facts. All obligations are first refuted together in one query; only when that fails is each one
 * queried on its own to find the culprits.
 */
public final class DischargePass {
	private static final Logger logger = Logger.getLogger(DischargePass.class.getName());

	private DischargePass() {}

	public static void perform(IssueContext ctx, SolverFactory factory, List<Constraint> facts,
	                           List<Obligation> obligations, boolean showModels) {
		List<Obligation> pending = new ArrayList<>();
		for (Obligation obligation : obligations) {
			Obligation simplified = obligation.simplified();
			if (simplified.getClauses().isEmpty()) {
				continue;
			}
			if (simplified.isGround()) {
				for (Constraint clause : simplified.getClauses()) {
					if (!clause.evaluate(Collections.emptyMap())) {
						ctx.error(simplified.failure(null));
						break;
					}
				}
				continue;
			}
			pending.add(simplified);
		}
		if (pending.isEmpty()) {
			return;
		}

		SortedSet<Atom> atoms = new TreeSet<>();
		for (Constraint fact : facts) {
			atoms.addAll(fact.getAtoms());
		}
		List<Constraint> everyNegation = new ArrayList<>();
		for (Obligation obligation : pending) {
			atoms.addAll(obligation.getAtoms());
			everyNegation.addAll(obligation.negation());
		}

		try (SolverSession session = factory.open()) {
			for (Atom atom : atoms) {
				session.declare(atom);
			}
			for (Constraint fact : facts) {
				session.assume(fact);
			}
			session.push();
			session.assumeAny(everyNegation);
			SatResult batch = timedCheck(session, pending.size() + " obligation(s)");
			session.pop();
			if (batch == SatResult.UNSAT) {
				return;
			}
			for (Obligation obligation : pending) {
				session.push();
				session.assumeAny(obligation.negation());
				SatResult result = timedCheck(session, obligation.getClauses().toString());
				if (result != SatResult.UNSAT) {
					Map<Atom, Long> counterexample = null;
					if (showModels && result == SatResult.SAT) {
						counterexample = session.model(obligation.getAtoms());
					}
					ctx.error(obligation.failure(counterexample));
				}
				session.pop();
			}
		} catch (SolverException e) {
			ctx.error(new SolverFailureIssue(e.getMessage(), e));
		}
	}

	/**
	 * Looks for values of the atoms that satisfy the facts but violate some constraint of goal.
	 *
	 * @return UNSAT when the facts imply every constraint of goal, SAT when they provably do not
	 */
	public static SatResult refute(SolverFactory factory, List<Constraint> facts, List<Constraint> goal) {
		Obligation obligation = new Obligation(goal, cex -> null).simplified();
		if (obligation.getClauses().isEmpty()) {
			return SatResult.UNSAT;
		}
		if (obligation.isGround()) {
			for (Constraint clause : obligation.getClauses()) {
				if (!clause.evaluate(Collections.emptyMap())) {
					return SatResult.SAT;
				}
			}
			return SatResult.UNSAT;
		}
		SortedSet<Atom> atoms = new TreeSet<>(obligation.getAtoms());
		for (Constraint fact : facts) {
			atoms.addAll(fact.getAtoms());
		}
		try (SolverSession session = factory.open()) {
			for (Atom atom : atoms) {
				session.declare(atom);
			}
			for (Constraint fact : facts) {
				session.assume(fact);
			}
			session.assumeAny(obligation.negation());
			return timedCheck(session, goal.toString());
		}
	}

	static SatResult timedCheck(SolverSession session, String what) {
		long start = System.nanoTime();
		SatResult result = session.check();
		long millis = (System.nanoTime() - start) / 1_000_000;
		logger.fine(() -> "solver answered " + result + " in " + millis + "ms for " + what);
		return result;
	}
}
