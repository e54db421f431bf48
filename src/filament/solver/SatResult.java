package filament.solver;

public enum SatResult {
	SAT,
	UNSAT,
	UNKNOWN,
}
