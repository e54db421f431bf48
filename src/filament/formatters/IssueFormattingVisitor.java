package filament.formatters;

import filament.errors.IssueVisitor;
import filament.errors.IssueWithContext;
import filament.model.expr.Atom;
import filament.model.expr.Constraint;
import filament.model.expr.Interval;
import filament.solver.SolverFailureIssue;
import filament.solver.UnsatisfiableConstraintsIssue;
import filament.trans.passes.check.*;
import filament.trans.passes.load.CyclicImportIssue;
import filament.trans.passes.load.IOErrorIssue;
import filament.trans.passes.load.ModuleNotFoundIssue;
import filament.trans.passes.mono.InstantiationCycleIssue;
import filament.trans.passes.mono.SpecializationKey;
import filament.trans.passes.parse.ParseIssue;
import filament.trans.passes.parse.option.OptionParserIssue;
import filament.trans.passes.scope.DuplicateDefinitionIssue;
import filament.trans.passes.scope.UnboundIdentifierIssue;
import filament.util.SourceLocatable;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private final IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void writeLocation(SourceLocatable where) throws IOException {
		if (where == null) {
			return;
		}
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			where.getLocation().writePretty(out);
		}
	}

	private void writeCounterexample(Map<Atom, Long> counterexample) throws IOException {
		if (counterexample == null || counterexample.isEmpty()) {
			return;
		}
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			out.write("counterexample (unmentioned parameters are 0): ");
			out.write(counterexample.entrySet().stream()
					.map(e -> e.getKey().render() + " = " + e.getValue())
					.collect(Collectors.joining(", ")));
		}
	}

	private static String renderWindow(List<Interval> window) {
		return window.stream().map(Interval::render).collect(Collectors.joining(" + "));
	}

	@Override
	public Void visit(IssueWithContext issueWithContext) throws IOException {
		issueWithContext.getContext().accept(new ContextFormattingVisitor(out));
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			issueWithContext.getIssue().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(OptionParserIssue optionParserIssue) throws IOException {
		out.write("unable to parse options: ");
		out.write(optionParserIssue.getDescription());
		return null;
	}

	@Override
	public Void visit(ParseIssue parseIssue) throws IOException {
		out.write("parse error: ");
		out.write(parseIssue.getError().getMessage());
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			parseIssue.getError().getLocation().writePretty(out);
		}
		return null;
	}

	@Override
	public Void visit(IOErrorIssue ioErrorIssue) throws IOException {
		out.write("IO error reading ");
		out.write(String.valueOf(ioErrorIssue.getPath()));
		out.write(": ");
		out.write(ioErrorIssue.getError().toString());
		return null;
	}

	@Override
	public Void visit(ModuleNotFoundIssue moduleNotFoundIssue) throws IOException {
		out.write("could not find imported file \"");
		out.write(moduleNotFoundIssue.getImport().getPath());
		out.write("\"; searched ");
		out.write(moduleNotFoundIssue.getSearched().stream().map(Path::toString).collect(Collectors.joining(", ")));
		writeLocation(moduleNotFoundIssue.getImport());
		return null;
	}

	@Override
	public Void visit(CyclicImportIssue cyclicImportIssue) throws IOException {
		out.write("cyclic import: ");
		out.write(cyclicImportIssue.getChain().stream().map(Path::toString).collect(Collectors.joining(" -> ")));
		writeLocation(cyclicImportIssue.getImport());
		return null;
	}

	@Override
	public Void visit(UnboundIdentifierIssue unboundIdentifierIssue) throws IOException {
		out.write("unbound identifier ");
		out.write(unboundIdentifierIssue.getName());
		out.write(" in ");
		out.write(unboundIdentifierIssue.getUsage());
		writeLocation(unboundIdentifierIssue.getReference());
		return null;
	}

	@Override
	public Void visit(DuplicateDefinitionIssue duplicateDefinitionIssue) throws IOException {
		out.write("duplicate definition of ");
		out.write(duplicateDefinitionIssue.getName());
		writeLocation(duplicateDefinitionIssue.getSecond());
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			out.write("first defined ");
			duplicateDefinitionIssue.getFirst().getLocation().writePretty(out);
		}
		return null;
	}

	@Override
	public Void visit(MalformedIntervalIssue malformedIntervalIssue) throws IOException {
		out.write("malformed interval: ");
		out.write(malformedIntervalIssue.getDescription());
		writeLocation(malformedIntervalIssue.getWhere());
		writeCounterexample(malformedIntervalIssue.getCounterexample());
		return null;
	}

	@Override
	public Void visit(IntervalMismatchIssue intervalMismatchIssue) throws IOException {
		out.write("interval mismatch for ");
		out.write(intervalMismatchIssue.getPort());
		out.write(": required ");
		out.write(intervalMismatchIssue.getRequired().render());
		out.write(", supplied ");
		out.write(intervalMismatchIssue.getSupplied().render());
		writeLocation(intervalMismatchIssue.getWhere());
		writeCounterexample(intervalMismatchIssue.getCounterexample());
		return null;
	}

	@Override
	public Void visit(BitwidthMismatchIssue bitwidthMismatchIssue) throws IOException {
		out.write("bit-width mismatch for ");
		out.write(bitwidthMismatchIssue.getPort());
		out.write(": required ");
		out.write(bitwidthMismatchIssue.getRequired().render());
		out.write(", supplied ");
		out.write(bitwidthMismatchIssue.getSupplied().render());
		writeLocation(bitwidthMismatchIssue.getWhere());
		writeCounterexample(bitwidthMismatchIssue.getCounterexample());
		return null;
	}

	@Override
	public Void visit(GuardViolatedIssue guardViolatedIssue) throws IOException {
		out.write("guard of ");
		out.write(guardViolatedIssue.getTarget());
		out.write(" may not hold: ");
		out.write(guardViolatedIssue.getGuard().render());
		writeLocation(guardViolatedIssue.getWhere());
		writeCounterexample(guardViolatedIssue.getCounterexample());
		return null;
	}

	@Override
	public Void visit(ReuseHazardIssue reuseHazardIssue) throws IOException {
		out.write("instance ");
		out.write(reuseHazardIssue.getInstance());
		out.write(" is reused by ");
		out.write(reuseHazardIssue.getFirst().getName().getId());
		out.write(" and ");
		out.write(reuseHazardIssue.getSecond().getName().getId());
		out.write(" while still busy: ");
		out.write(renderWindow(reuseHazardIssue.getFirstWindow()));
		out.write(" may overlap ");
		out.write(renderWindow(reuseHazardIssue.getSecondWindow()));
		writeLocation(reuseHazardIssue.getSecond());
		return null;
	}

	@Override
	public Void visit(ArgumentCountMismatchIssue argumentCountMismatchIssue) throws IOException {
		out.write(argumentCountMismatchIssue.getTarget());
		out.write(" expects ");
		out.write(Integer.toString(argumentCountMismatchIssue.getExpected()));
		out.write(" argument(s), got ");
		out.write(Integer.toString(argumentCountMismatchIssue.getActual()));
		writeLocation(argumentCountMismatchIssue.getWhere());
		return null;
	}

	@Override
	public Void visit(InvalidPortReferenceIssue invalidPortReferenceIssue) throws IOException {
		out.write("invalid reference to port ");
		out.write(invalidPortReferenceIssue.getPort());
		out.write(": ");
		out.write(invalidPortReferenceIssue.getDescription());
		writeLocation(invalidPortReferenceIssue.getReference());
		return null;
	}

	@Override
	public Void visit(UnboundOutputIssue unboundOutputIssue) throws IOException {
		out.write("output ");
		out.write(unboundOutputIssue.getPort().getName().getId());
		if (unboundOutputIssue.getBindings() == 0) {
			out.write(" is never bound");
		} else {
			out.write(" is bound ");
			out.write(Integer.toString(unboundOutputIssue.getBindings()));
			out.write(" times");
		}
		writeLocation(unboundOutputIssue.getPort());
		return null;
	}

	@Override
	public Void visit(InterfaceTimingIssue interfaceTimingIssue) throws IOException {
		out.write("interface port ");
		out.write(interfaceTimingIssue.getPort().getName().getId());
		out.write(": ");
		out.write(interfaceTimingIssue.getDescription());
		writeLocation(interfaceTimingIssue.getPort());
		return null;
	}

	@Override
	public Void visit(UnderconstrainedExistentialIssue underconstrainedExistentialIssue) throws IOException {
		out.write("existential ");
		out.write(underconstrainedExistentialIssue.getExistential());
		out.write(" is under-constrained: ");
		out.write(underconstrainedExistentialIssue.getDescription());
		writeLocation(underconstrainedExistentialIssue.getWhere());
		return null;
	}

	@Override
	public Void visit(UnsatisfiableConstraintsIssue unsatisfiableConstraintsIssue) throws IOException {
		out.write("unsatisfiable constraints for ");
		out.write(unsatisfiableConstraintsIssue.getSubject());
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (Constraint clause : unsatisfiableConstraintsIssue.getClauses()) {
				out.newLine();
				out.write(clause.render());
				out.write(" (");
				out.write(clause.getReason().getDescription());
				out.write(")");
				if (clause.getOrigin() != null) {
					try (IndentingWriter.Indent ignored2 = out.indent()) {
						out.newLine();
						clause.getOrigin().getLocation().writePretty(out);
					}
				}
			}
		}
		writeCounterexample(unsatisfiableConstraintsIssue.getCounterexample());
		return null;
	}

	@Override
	public Void visit(SolverFailureIssue solverFailureIssue) throws IOException {
		out.write("constraint solver failure: ");
		out.write(solverFailureIssue.getDescription());
		Throwable cause = solverFailureIssue.getCause();
		if (cause != null && cause.getMessage() != null && !cause.getMessage().equals(solverFailureIssue.getDescription())) {
			try (IndentingWriter.Indent ignored = out.indent()) {
				out.newLine();
				out.write("caused by: ");
				out.write(cause.getMessage());
			}
		}
		return null;
	}

	@Override
	public Void visit(InstantiationCycleIssue instantiationCycleIssue) throws IOException {
		List<SpecializationKey> chain = instantiationCycleIssue.getCycle();
		if (instantiationCycleIssue.getDepthLimit() == 0) {
			out.write("instantiation cycle: ");
			out.write(chain.stream().map(SpecializationKey::render).collect(Collectors.joining(" -> ")));
			return null;
		}
		out.write("instantiation does not terminate, more than ");
		out.write(Integer.toString(instantiationCycleIssue.getDepthLimit()));
		out.write(" nested specializations: ");
		if (chain.size() <= 6) {
			out.write(chain.stream().map(SpecializationKey::render).collect(Collectors.joining(" -> ")));
		} else {
			out.write(chain.subList(0, 3).stream().map(SpecializationKey::render).collect(Collectors.joining(" -> ")));
			out.write(" -> ... -> ");
			out.write(chain.subList(chain.size() - 2, chain.size()).stream()
					.map(SpecializationKey::render).collect(Collectors.joining(" -> ")));
		}
		return null;
	}
}
