package filament.trans.passes.scope;

import filament.CompilationTestingUtils;
import filament.errors.TopLevelIssueContext;
import filament.model.ast.FilUnit;
import filament.trans.intermediate.DefinitionRegistry;
import filament.trans.passes.parse.FilParsingPass;
import org.junit.Before;
import org.junit.Test;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class ScopingPassTest {

	private static final String REG =
			"extern comp Reg[W]<G: 1>(go: interface[G], in: [G, G+1] W) -> (out: [G+1, G+2] W);\n";

	private TopLevelIssueContext ctx;

	@Before
	public void setUp() {
		ctx = new TopLevelIssueContext();
	}

	private DefinitionRegistry scope(String source) {
		FilUnit unit = FilParsingPass.perform(ctx, Paths.get("inline.fil"), source);
		assertThat(ctx.hasErrors(), is(false));
		return ScopingPass.perform(ctx, Collections.singletonList(unit));
	}

	private List<String> unboundNames() {
		List<String> names = new ArrayList<>();
		for (UnboundIdentifierIssue issue : CompilationTestingUtils.issuesOf(ctx, UnboundIdentifierIssue.class)) {
			names.add(issue.getName());
		}
		return names;
	}

	@Test
	public void testWorkedExampleResolves() {
		DefinitionRegistry registry = ScopingPass.perform(ctx, CompilationTestingUtils.load(ctx,
				"worked_example.fil"));
		assertThat(ctx.hasErrors(), is(false));
		assertThat(registry.getInstantiations("main"), is(Collections.singleton("Mul")));
		assertThat(registry.getTopologicalOrder(), is(Arrays.asList("Mul", "main")));
	}

	@Test
	public void testUnboundNames() {
		scope(REG +
				"comp main<G: 1>(go: interface[G], a: [G, G+1] 32) -> (o: [G+1, G+2] 32) {\n" +
				"  r := new Reg[X];\n" +
				"  f := new Fifo;\n" +
				"  x := q<G>(a);\n" +
				"  y := r<G>(b);\n" +
				"  o = y.data;\n" +
				"}\n");
		assertThat(unboundNames(), is(Arrays.asList("X", "Fifo", "q", "b", "y.data")));
	}

	@Test
	public void testInstanceExistentialsOnlyInBodies() {
		scope(REG +
				"comp main<G: r.L>(go: interface[G]) -> () {\n" +
				"  r := new Reg[1];\n" +
				"  x := r<G+r.M>(1);\n" +
				"}\n");
		assertThat(unboundNames(), is(Arrays.asList("r.L", "r.M")));
	}

	@Test
	public void testGuardsSeeOnlyParameters() {
		scope("extern comp E[N]<G: 1>(go: interface[G]) -> () with { exists L; } where L > N;\n");
		assertThat(unboundNames(), is(Collections.singletonList("L")));
	}

	@Test
	public void testDuplicateComponent() {
		scope(REG + REG);
		List<DuplicateDefinitionIssue> duplicates =
				CompilationTestingUtils.issuesOf(ctx, DuplicateDefinitionIssue.class);
		assertThat(duplicates.size(), is(1));
		assertThat(duplicates.get(0).getName(), is("Reg"));
	}

	@Test
	public void testBodyNamesShadowingParameters() {
		scope(REG +
				"comp main[W]<G: 1>(go: interface[G]) -> () {\n" +
				"  W := new Reg[W];\n" +
				"}\n");
		List<DuplicateDefinitionIssue> duplicates =
				CompilationTestingUtils.issuesOf(ctx, DuplicateDefinitionIssue.class);
		assertThat(duplicates.size(), is(1));
		assertThat(duplicates.get(0).getName(), is("W"));
	}
}
