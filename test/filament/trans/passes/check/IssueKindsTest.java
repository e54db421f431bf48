package filament.trans.passes.check;

import filament.CompilationTestingUtils;
import filament.errors.Issue;
import filament.errors.TopLevelIssueContext;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;

import java.util.Arrays;
import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

@RunWith(Parameterized.class)
public class IssueKindsTest {

	@Parameterized.Parameters(name = "{0}")
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{
					"two interface ports",
					"extern comp Two<G: 1>(go: interface[G], again: interface[G]) -> ();",
					InterfaceTimingIssue.class, 1,
				},
				{
					"interface output",
					"extern comp Out<G: 1>(go: interface[G]) -> (done: interface[G]);",
					InterfaceTimingIssue.class, 1,
				},
				{
					"late interface",
					"extern comp Late<G: 1>(go: interface[G+1]) -> ();",
					InterfaceTimingIssue.class, 1,
				},
				{
					"empty interval",
					"extern comp Empty<G: 1>(go: interface[G], in: [G+1, G+1] 8) -> ();",
					MalformedIntervalIssue.class, 1,
				},
				{
					"backwards interval",
					"extern comp Back<G: 1>(go: interface[G]) -> (out: [G+2, G] 8);",
					MalformedIntervalIssue.class, 1,
				},
				{
					"too many arguments",
					"extern comp Reg[W]<G: 1>(go: interface[G], in: [G, G+1] W) -> (out: [G+1, G+2] W);\n" +
							"comp main<G: 1>(go: interface[G], a: [G, G+1] 8) -> () {\n" +
							"    r := new Reg[8, 9];\n" +
							"}\n",
					ArgumentCountMismatchIssue.class, 1,
				},
		});
	}

	private final String source;
	private final Class<? extends Issue> kind;
	private final int count;

	public IssueKindsTest(String name, String source, Class<? extends Issue> kind, int count) {
		this.source = source;
		this.kind = kind;
		this.count = count;
	}

	@Test
	public void test() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		CompilationTestingUtils.checkSource(ctx, source);
		assertThat(ctx.format(), ctx.getIssues().size(), is(count));
		assertThat(ctx.format(), CompilationTestingUtils.issuesOf(ctx, kind).size(), is(count));
	}
}
