package filament.errors;

import filament.solver.SolverFailureIssue;
import filament.solver.UnsatisfiableConstraintsIssue;
import filament.trans.passes.check.*;
import filament.trans.passes.load.CyclicImportIssue;
import filament.trans.passes.load.IOErrorIssue;
import filament.trans.passes.load.ModuleNotFoundIssue;
import filament.trans.passes.mono.InstantiationCycleIssue;
import filament.trans.passes.parse.ParseIssue;
import filament.trans.passes.parse.option.OptionParserIssue;
import filament.trans.passes.scope.DuplicateDefinitionIssue;
import filament.trans.passes.scope.UnboundIdentifierIssue;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(IssueWithContext issueWithContext) throws E;
	public abstract T visit(OptionParserIssue optionParserIssue) throws E;
	public abstract T visit(ParseIssue parseIssue) throws E;
	public abstract T visit(IOErrorIssue ioErrorIssue) throws E;
	public abstract T visit(ModuleNotFoundIssue moduleNotFoundIssue) throws E;
	public abstract T visit(CyclicImportIssue cyclicImportIssue) throws E;
	public abstract T visit(UnboundIdentifierIssue unboundIdentifierIssue) throws E;
	public abstract T visit(DuplicateDefinitionIssue duplicateDefinitionIssue) throws E;
	public abstract T visit(MalformedIntervalIssue malformedIntervalIssue) throws E;
	public abstract T visit(IntervalMismatchIssue intervalMismatchIssue) throws E;
	public abstract T visit(BitwidthMismatchIssue bitwidthMismatchIssue) throws E;
	public abstract T visit(GuardViolatedIssue guardViolatedIssue) throws E;
	public abstract T visit(ReuseHazardIssue reuseHazardIssue) throws E;
	public abstract T visit(ArgumentCountMismatchIssue argumentCountMismatchIssue) throws E;
	public abstract T visit(InvalidPortReferenceIssue invalidPortReferenceIssue) throws E;
	public abstract T visit(UnboundOutputIssue unboundOutputIssue) throws E;
	public abstract T visit(InterfaceTimingIssue interfaceTimingIssue) throws E;
	public abstract T visit(UnderconstrainedExistentialIssue underconstrainedExistentialIssue) throws E;
	public abstract T visit(UnsatisfiableConstraintsIssue unsatisfiableConstraintsIssue) throws E;
	public abstract T visit(SolverFailureIssue solverFailureIssue) throws E;
	public abstract T visit(InstantiationCycleIssue instantiationCycleIssue) throws E;
}
