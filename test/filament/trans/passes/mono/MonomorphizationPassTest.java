package filament.trans.passes.mono;

import filament.CompilationTestingUtils;
import filament.errors.TopLevelIssueContext;
import filament.solver.SolverFactory;
import filament.trans.intermediate.CheckedProgram;
import filament.trans.passes.check.ArgumentCountMismatchIssue;
import filament.trans.passes.check.GuardViolatedIssue;
import filament.trans.passes.check.ReuseHazardIssue;
import filament.trans.passes.scope.UnboundIdentifierIssue;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.junit.Assert.assertThat;

public class MonomorphizationPassTest {

	private TopLevelIssueContext ctx;
	private CompilationSession session;

	@Before
	public void setUp() {
		ctx = new TopLevelIssueContext();
		session = new CompilationSession();
	}

	private CheckedProgram check(String fixture) {
		CheckedProgram program = CompilationTestingUtils.check(ctx, fixture);
		assertThat(ctx.format(), ctx.hasErrors(), is(false));
		return program;
	}

	private Optional<MonomorphizedProgram> specialize(CheckedProgram program, String main, Long... arguments) {
		return MonomorphizationPass.perform(ctx, program, session, SolverFactory.builtin(), main,
				Arrays.asList(arguments));
	}

	private static List<String> names(MonomorphizedProgram program) {
		List<String> names = new ArrayList<>();
		for (MonoComponent component : program.getComponents().values()) {
			names.add(component.getName());
		}
		return names;
	}

	private static List<Long> times(MonoComponent component) {
		List<Long> times = new ArrayList<>();
		for (MonoInvocation invocation : component.getInvocations()) {
			times.add(invocation.getTime());
		}
		return times;
	}

	@Test
	public void testWorkedExample() {
		MonomorphizedProgram program = specialize(check("worked_example.fil"), "main").get();
		assertThat(ctx.format(), ctx.hasErrors(), is(false));
		assertThat(names(program), is(Arrays.asList("Mul_32_2", "Mul_32_3", "main")));

		MonoComponent main = program.getEntryComponent();
		assertThat(main.getDelay(), is(22L));
		assertThat(main.getExistentials().get("L"), is(22L));
		assertThat(times(main), is(Arrays.asList(0L, 4L, 13L)));
		assertThat(main.getInvocations().get(1).getInstance(), is("m3"));
		assertThat(main.getInvocations().get(2).getInstance(), is("m3"));
		assertThat(main.getInvocations().get(2).getArguments().get(0).render(), is("y.out"));

		MonoComponent out = program.getComponents().get(new SpecializationKey("Mul", Arrays.asList(32L, 3L)));
		assertThat(out.isExtern(), is(true));
		assertThat(out.getExistentials().get("L"), is(9L));
		MonoPort product = out.getOutputs().get(0);
		assertThat(product.getStart(), is(9L));
		assertThat(product.getEnd(), is(10L));
		assertThat(product.getWidth(), is(32L));

		MonoPort output = main.getOutputs().get(0);
		assertThat(output.getStart(), is(22L));
		assertThat(main.getBindings().get(0).getSource().render(), is("z.out"));
	}

	@Test
	public void testLatencyIndependentOfDeclarationOrder() {
		MonomorphizedProgram program = specialize(check("reversed_order.fil"), "main").get();
		MonoComponent main = program.getEntryComponent();
		assertThat(main.getExistentials().get("L"), is(13L));
		assertThat(times(main), is(Arrays.asList(0L, 9L)));
		assertThat(names(program), is(Arrays.asList("Mul_32_3", "Mul_32_2", "main")));
	}

	@Test
	public void testExistentialSolvedAfterSpecialization() {
		MonomorphizedProgram program = specialize(check("deferred_existential.fil"), "main").get();
		assertThat(ctx.format(), ctx.hasErrors(), is(false));
		MonoComponent scale = program.getComponents().get(new SpecializationKey("Scale",
				Collections.singletonList(3L)));
		assertThat(scale.getExistentials().get("L"), is(3L));
		assertThat(scale.getDelay(), is(9L));
		assertThat(program.getEntryComponent().getExistentials().get("L"), is(9L));
	}

	@Test
	public void testSpecializationsAreShared() {
		CheckedProgram checked = check("worked_example.fil");
		SpecializationKey key = new SpecializationKey("Mul", Arrays.asList(32L, 3L));
		MonoComponent first = MonomorphizationPass.specialize(ctx, checked, session, SolverFactory.builtin(), key,
				null).get();
		MonomorphizedProgram program = specialize(checked, "main").get();
		assertThat(program.getComponents().get(key), is(sameInstance(first)));
		assertThat(session.size(), is(3));

		// a second walk over the same session reuses every specialization
		MonomorphizedProgram again = specialize(checked, "main").get();
		assertThat(again.getEntryComponent(), is(sameInstance(program.getEntryComponent())));
		assertThat(session.size(), is(3));
	}

	@Test
	public void testEntryWithArguments() {
		MonomorphizedProgram program = specialize(check("worked_example.fil"), "Mul", 16L, 5L).get();
		MonoComponent mul = program.getEntryComponent();
		assertThat(mul.getName(), is("Mul_16_5"));
		assertThat(mul.getDelay(), is(25L));
		assertThat(mul.getInterfacePort().get().getName(), is("go"));
		assertThat(mul.getPorts().size(), is(4));
	}

	@Test
	public void testEntryGuardViolated() {
		Optional<MonomorphizedProgram> program = specialize(check("worked_example.fil"), "Mul", 32L, 0L);
		assertThat(program.isPresent(), is(false));
		assertThat(CompilationTestingUtils.issuesOf(ctx, GuardViolatedIssue.class).size(), is(1));
	}

	@Test
	public void testEntryArgumentCount() {
		Optional<MonomorphizedProgram> program = specialize(check("worked_example.fil"), "Mul", 32L);
		assertThat(program.isPresent(), is(false));
		assertThat(CompilationTestingUtils.issuesOf(ctx, ArgumentCountMismatchIssue.class).size(), is(1));
	}

	@Test
	public void testMissingEntry() {
		Optional<MonomorphizedProgram> program = specialize(check("worked_example.fil"), "top");
		assertThat(program.isPresent(), is(false));
		UnboundIdentifierIssue issue = CompilationTestingUtils.issuesOf(ctx, UnboundIdentifierIssue.class).get(0);
		assertThat(issue.getName(), is("top"));
	}

	@Test
	public void testInstantiationCycle() {
		Optional<MonomorphizedProgram> program = specialize(check("instantiation_cycle.fil"), "main");
		assertThat(program.isPresent(), is(false));
		List<InstantiationCycleIssue> cycles = CompilationTestingUtils.issuesOf(ctx, InstantiationCycleIssue.class);
		assertThat(cycles.size(), is(1));
		SpecializationKey loop = new SpecializationKey("Loop", Collections.singletonList(1L));
		assertThat(cycles.get(0).getCycle(), is(Arrays.asList(loop, loop)));
		assertThat(session.lookup(loop).isPresent(), is(false));
	}

	@Test
	public void testGrowingInstantiationIsBounded() {
		CheckedProgram program = check("growing_instantiation.fil");
		Optional<MonomorphizedProgram> mono = MonomorphizationPass.perform(ctx, program, session,
				SolverFactory.builtin(), "main", Collections.emptyList(), 4);
		assertThat(mono.isPresent(), is(false));
		List<InstantiationCycleIssue> issues = CompilationTestingUtils.issuesOf(ctx, InstantiationCycleIssue.class);
		assertThat(ctx.getIssues().size(), is(1));
		assertThat(issues.get(0).getDepthLimit(), is(4));
		List<SpecializationKey> chain = issues.get(0).getCycle();
		assertThat(chain.size(), is(6));
		assertThat(chain.get(0), is(new SpecializationKey("main", Collections.emptyList())));
		assertThat(chain.get(5), is(new SpecializationKey("Loop", Collections.singletonList(5L))));
		assertThat(ctx.getIssues().get(0).render().contains("more than 4 nested specializations"), is(true));
	}

	@Test
	public void testGrowingInstantiationWithDefaultLimit() {
		Optional<MonomorphizedProgram> mono = specialize(check("growing_instantiation.fil"), "main");
		assertThat(mono.isPresent(), is(false));
		InstantiationCycleIssue issue = CompilationTestingUtils.issuesOf(ctx, InstantiationCycleIssue.class).get(0);
		assertThat(issue.getDepthLimit(), is(MonomorphizationPass.DEFAULT_MAX_DEPTH));
		assertThat(issue.getCycle().size(), is(MonomorphizationPass.DEFAULT_MAX_DEPTH + 2));
	}

	@Test
	public void testDeferredReuseHoldsForConcreteWidth() {
		MonomorphizedProgram program = specialize(check("pipe_safe.fil"), "main").get();
		assertThat(ctx.format(), ctx.hasErrors(), is(false));
		assertThat(names(program), is(Arrays.asList("Sq_2", "Pipe_2", "main")));
		MonoComponent pipe = program.getComponents().get(new SpecializationKey("Pipe", Collections.singletonList(2L)));
		assertThat(times(pipe), is(Arrays.asList(0L, 5L)));
	}

	@Test
	public void testDeferredReuseFailsForConcreteWidth() {
		Optional<MonomorphizedProgram> program = specialize(check("pipe_hazard.fil"), "main");
		assertThat(program.isPresent(), is(false));
		assertThat(ctx.getIssues().size(), is(1));
		ReuseHazardIssue issue = CompilationTestingUtils.issuesOf(ctx, ReuseHazardIssue.class).get(0);
		assertThat(issue.getInstance(), is("s"));
		assertThat(issue.getFirst().getName().getId(), is("x"));
		assertThat(issue.getSecond().getName().getId(), is("y"));
		assertThat(session.lookup(new SpecializationKey("Pipe", Collections.singletonList(3L))).isPresent(), is(false));
	}
}
