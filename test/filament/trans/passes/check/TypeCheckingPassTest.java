package filament.trans.passes.check;

import filament.CompilationTestingUtils;
import filament.errors.TopLevelIssueContext;
import filament.model.expr.Atom;
import filament.model.expr.Expression;
import filament.model.ast.FilUnit;
import filament.solver.SolverFactory;
import filament.trans.intermediate.CheckedProgram;
import filament.trans.intermediate.DefinitionRegistry;
import filament.trans.passes.parse.FilParsingPass;
import filament.trans.passes.scope.ScopingPass;
import org.junit.Before;
import org.junit.Test;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class TypeCheckingPassTest {

	private static final String SHIFT = "extern comp Shift[W, N]<G: 1>(go: interface[G], in: [G, G+1] W) -> " +
			"(out: [G, G+1] W) where N < W;\n";
	private static final String LOOSE = "comp Loose<G: 1>(go: interface[G]) -> () with {\n" +
			"    exists L where L > 0;\n" +
			"} {\n" +
			"}\n";
	private static final String BAD_MAIN = "comp main<G: 1>(go: interface[G], a: [G, G+1] 8) -> (out: [G, G+1] 8) {\n" +
			"    s := new Shift[8, 9];\n" +
			"    x := s<G>(a);\n" +
			"    out = x.out;\n" +
			"}\n";

	private TopLevelIssueContext ctx;

	@Before
	public void setUp() {
		ctx = new TopLevelIssueContext();
	}

	private DefinitionRegistry registry(TopLevelIssueContext ctx, String source) {
		FilUnit unit = FilParsingPass.perform(ctx, Paths.get("inline.fil"), source);
		DefinitionRegistry registry = ScopingPass.perform(ctx, Collections.singletonList(unit));
		assertThat(ctx.hasErrors(), is(false));
		return registry;
	}

	@Test
	public void testWorkedExample() {
		CheckedProgram program = CompilationTestingUtils.check(ctx, "worked_example.fil");
		assertThat(ctx.format(), ctx.hasErrors(), is(false));
		assertThat(new ArrayList<>(program.getComponents().keySet()), is(Arrays.asList("Mul", "main")));

		CheckedComponent mul = program.findComponent("Mul").get();
		Atom m = Atom.parameter("M");
		assertThat(mul.getResolved().get(Atom.existential("L")), is(Expression.of(m).times(Expression.of(m))));

		CheckedComponent main = program.findComponent("main").get();
		assertThat(main.getDeferred().isEmpty(), is(true));
		Expression latency = Expression.of(Atom.instanceExistential("m2", "L"))
				.plus(Expression.of(Atom.instanceExistential("m3", "L")).times(2));
		assertThat(main.getResolved().get(Atom.existential("L")), is(latency));
		assertThat(main.getInvocations().size(), is(3));
		// m3 is reused back to back; the second use starts exactly when the first is done
		assertThat(main.getDeferredReuse().isEmpty(), is(true));
	}

	@Test
	public void testLiteralGuardViolation() {
		CompilationTestingUtils.check(ctx, "guard_violation.fil");
		List<GuardViolatedIssue> issues = CompilationTestingUtils.issuesOf(ctx, GuardViolatedIssue.class);
		assertThat(ctx.getIssues().size(), is(1));
		assertThat(issues.get(0).getTarget(), is("Shift[8, 9]"));

		String rendered = ctx.getIssues().get(0).render();
		assertThat(rendered, rendered.startsWith("while checking component main"), is(true));
		assertThat(rendered, rendered.contains("guard of Shift[8, 9] may not hold"), is(true));
	}

	@Test
	public void testSymbolicGuards() {
		CompilationTestingUtils.check(ctx, "symbolic_guard.fil");
		assertThat(ctx.getIssues().size(), is(1));
		GuardViolatedIssue issue = CompilationTestingUtils.issuesOf(ctx, GuardViolatedIssue.class).get(0);
		assertThat(issue.getTarget(), is("Shift[W+1, 4]"));
		assertThat(issue.getCounterexample(), is(notNullValue()));
		long w = issue.getCounterexample().get(Atom.parameter("W"));
		assertTrue(w <= 3);
	}

	@Test
	public void testReuseHazard() {
		CompilationTestingUtils.check(ctx, "reuse_hazard.fil");
		List<ReuseHazardIssue> issues = CompilationTestingUtils.issuesOf(ctx, ReuseHazardIssue.class);
		assertThat(ctx.getIssues().size(), is(1));
		assertThat(issues.get(0).getInstance(), is("m"));
		assertThat(issues.get(0).getFirst().getName().getId(), is("x"));
		assertThat(issues.get(0).getSecond().getName().getId(), is("y"));
	}

	@Test
	public void testNonlinearReuseLeftForSpecialization() {
		CheckedProgram program = CompilationTestingUtils.check(ctx, "pipe_safe.fil");
		assertThat(ctx.format(), ctx.hasErrors(), is(false));
		List<ReuseCheck> deferred = program.findComponent("Pipe").get().getDeferredReuse();
		assertThat(deferred.size(), is(1));
		assertThat(deferred.get(0).getInstance(), is("s"));
		assertThat(deferred.get(0).getFirst().getName().getId(), is("x"));
		assertThat(deferred.get(0).getSecond().getName().getId(), is("y"));
	}

	@Test
	public void testIntervalAndWidthMismatch() {
		CompilationTestingUtils.check(ctx, "interval_mismatch.fil");
		assertThat(ctx.getIssues().size(), is(2));
		IntervalMismatchIssue interval = CompilationTestingUtils.issuesOf(ctx, IntervalMismatchIssue.class).get(0);
		assertThat(interval.getPort(), is("x.in"));
		assertThat(interval.getRequired().render(), is("[G+1, G+2]"));
		assertThat(interval.getSupplied().render(), is("[G, G+1]"));
		BitwidthMismatchIssue width = CompilationTestingUtils.issuesOf(ctx, BitwidthMismatchIssue.class).get(0);
		assertThat(width.getPort(), is("y.in"));
		assertThat(width.getRequired(), is(Expression.constant(32)));
		assertThat(width.getSupplied(), is(Expression.constant(16)));
	}

	@Test
	public void testUnderconstrainedExistential() {
		CompilationTestingUtils.check(ctx, "underconstrained.fil");
		List<UnderconstrainedExistentialIssue> issues =
				CompilationTestingUtils.issuesOf(ctx, UnderconstrainedExistentialIssue.class);
		assertThat(ctx.getIssues().size(), is(1));
		assertThat(issues.get(0).getExistential(), is("L"));
	}

	@Test
	public void testExistentialPinnedByGuards() {
		CheckedProgram program = CompilationTestingUtils.checkSource(ctx,
				"comp main<G: 1>(go: interface[G]) -> () with {\n" +
				"    exists L where L >= 3, L <= 3;\n" +
				"} {\n" +
				"}\n");
		assertThat(ctx.format(), ctx.hasErrors(), is(false));
		CheckedComponent main = program.findComponent("main").get();
		assertThat(main.getResolved().get(Atom.existential("L")), is(Expression.constant(3)));
		assertThat(main.getDeferred().isEmpty(), is(true));
	}

	@Test
	public void testExistentialBoundedByParametersIsLeftForSpecialization() {
		CheckedProgram program = CompilationTestingUtils.checkSource(ctx,
				"extern comp Pin[W]<G: 1>(go: interface[G]) -> () with { exists L where L >= W, W >= L; };\n");
		assertThat(ctx.format(), ctx.hasErrors(), is(false));
		assertThat(program.findComponent("Pin").get().getDeferred(),
				is(Collections.singletonList(Atom.existential("L"))));
	}

	@Test
	public void testUnconstrainedExistential() {
		CompilationTestingUtils.checkSource(ctx,
				"extern comp Free<G: 1>(go: interface[G]) -> () with { exists L; };\n");
		List<UnderconstrainedExistentialIssue> issues =
				CompilationTestingUtils.issuesOf(ctx, UnderconstrainedExistentialIssue.class);
		assertThat(ctx.getIssues().size(), is(1));
		assertThat(issues.get(0).getDescription(), is("no definition is given and nothing constrains it"));
	}

	@Test
	public void testExistentialLeftForSpecialization() {
		CheckedProgram program = CompilationTestingUtils.check(ctx, "deferred_existential.fil");
		assertThat(ctx.format(), ctx.hasErrors(), is(false));
		CheckedComponent scale = program.findComponent("Scale").get();
		assertThat(scale.getDeferred(), is(Collections.singletonList(Atom.existential("L"))));
		assertThat(scale.getConcreteConstraints().isEmpty(), is(false));
		assertThat(program.findComponent("main").get().getDeferred().isEmpty(), is(true));
	}

	@Test
	public void testSelfReferentialDefinition() {
		CompilationTestingUtils.checkSource(ctx,
				"extern comp E<G: L>(go: interface[G]) -> () with { exists L = K+1; exists K = L; };\n");
		List<UnderconstrainedExistentialIssue> issues =
				CompilationTestingUtils.issuesOf(ctx, UnderconstrainedExistentialIssue.class);
		assertThat(issues.isEmpty(), is(false));
		assertThat(issues.get(0).getDescription(), is("its definition refers to itself"));
	}

	@Test
	public void testUnboundOutput() {
		CompilationTestingUtils.checkSource(ctx,
				"comp main<G: 1>(go: interface[G], a: [G, G+1] 8) -> (out: [G, G+1] 8) {\n" +
				"}\n");
		assertThat(CompilationTestingUtils.issuesOf(ctx, UnboundOutputIssue.class).size(), is(1));
	}

	@Test
	public void testInterfacePortIsNotData() {
		CompilationTestingUtils.checkSource(ctx, SHIFT +
				"comp main<G: 1>(go: interface[G]) -> (out: [G, G+1] 1) {\n" +
				"    s := new Shift[1, 0];\n" +
				"    x := s<G>(go);\n" +
				"    out = x.out;\n" +
				"}\n");
		assertThat(CompilationTestingUtils.issuesOf(ctx, InvalidPortReferenceIssue.class).size(), is(1));
	}

	@Test
	public void testParallelCheckingReportsTheSameIssues() {
		String source = SHIFT + LOOSE + BAD_MAIN +
				"comp Other<G: 1>(go: interface[G], a: [G, G+1] 16) -> (o: [G, G+1] 16) {\n" +
				"    s := new Shift[16, 20];\n" +
				"    x := s<G>(a);\n" +
				"    o = x.out;\n" +
				"}\n";
		TopLevelIssueContext sequential = new TopLevelIssueContext();
		TypeCheckingPass.perform(sequential, registry(sequential, source), SolverFactory.builtin(), 1, false, true);
		TopLevelIssueContext parallel = new TopLevelIssueContext();
		TypeCheckingPass.perform(parallel, registry(parallel, source), SolverFactory.builtin(), 4, false, true);

		assertThat(sequential.getIssues().size(), is(3));
		assertThat(parallel.format(), is(sequential.format()));
	}

	@Test
	public void testFailFast() {
		String source = SHIFT + LOOSE + BAD_MAIN;
		TopLevelIssueContext all = new TopLevelIssueContext();
		TypeCheckingPass.perform(all, registry(all, source), SolverFactory.builtin(), 2, false, true);
		assertThat(all.getIssues().size(), is(2));

		TopLevelIssueContext first = new TopLevelIssueContext();
		CheckedProgram program = TypeCheckingPass.perform(first, registry(first, source), SolverFactory.builtin(), 2,
				true, true);
		// Loose fails before main's level is reached
		assertThat(first.getIssues().size(), is(1));
		assertThat(CompilationTestingUtils.issuesOf(first, UnderconstrainedExistentialIssue.class).size(), is(1));
		assertThat(program.findComponent("Shift").isPresent(), is(true));
		assertThat(program.findComponent("main").isPresent(), is(false));
	}
}
