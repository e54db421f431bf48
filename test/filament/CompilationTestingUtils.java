package filament;

import filament.errors.Issue;
import filament.errors.IssueWithContext;
import filament.errors.TopLevelIssueContext;
import filament.model.ast.FilUnit;
import filament.solver.SolverFactory;
import filament.solver.SolverSession;
import filament.trans.intermediate.CheckedProgram;
import filament.trans.intermediate.DefinitionRegistry;
import filament.trans.passes.check.TypeCheckingPass;
import filament.trans.passes.load.LoadingPass;
import filament.trans.passes.load.ModuleLoader;
import filament.trans.passes.parse.FilParsingPass;
import filament.trans.passes.scope.ScopingPass;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

public class CompilationTestingUtils {
	private CompilationTestingUtils() {}

	/**
	 * Opens built-in sessions and counts them.
	 */
	public static class CountingSolverFactory implements SolverFactory {
		private final AtomicInteger opened = new AtomicInteger();

		@Override
		public SolverSession open() {
			opened.incrementAndGet();
			return SolverFactory.builtin().open();
		}

		public int getOpened() {
			return opened.get();
		}
	}

	public static Path fixture(String name) {
		return Paths.get("test", "fil", name);
	}

	public static List<FilUnit> load(TopLevelIssueContext ctx, String fixture) {
		return LoadingPass.perform(ctx, new ModuleLoader(Collections.emptyList()), fixture(fixture));
	}

	public static CheckedProgram check(TopLevelIssueContext ctx, String fixture, SolverFactory solver) {
		return check(ctx, load(ctx, fixture), solver);
	}

	public static CheckedProgram check(TopLevelIssueContext ctx, String fixture) {
		return check(ctx, fixture, SolverFactory.builtin());
	}

	public static CheckedProgram checkSource(TopLevelIssueContext ctx, String source, SolverFactory solver) {
		FilUnit unit = FilParsingPass.perform(ctx, Paths.get("inline.fil"), source);
		List<FilUnit> units = new ArrayList<>();
		if (unit != null) {
			units.add(unit);
		}
		return check(ctx, units, solver);
	}

	public static CheckedProgram checkSource(TopLevelIssueContext ctx, String source) {
		return checkSource(ctx, source, SolverFactory.builtin());
	}

	private static CheckedProgram check(TopLevelIssueContext ctx, List<FilUnit> units, SolverFactory solver) {
		if (ctx.hasErrors()) {
			return null;
		}
		DefinitionRegistry registry = ScopingPass.perform(ctx, units);
		if (ctx.hasErrors()) {
			return null;
		}
		return TypeCheckingPass.perform(ctx, registry, solver, 1, false, true);
	}

	public static Issue unwrap(Issue issue) {
		if (issue instanceof IssueWithContext) {
			return ((IssueWithContext) issue).getInnermostIssue();
		}
		return issue;
	}

	public static <T extends Issue> List<T> issuesOf(TopLevelIssueContext ctx, Class<T> kind) {
		List<T> result = new ArrayList<>();
		for (Issue issue : ctx.getIssues()) {
			Issue inner = unwrap(issue);
			if (kind.isInstance(inner)) {
				result.add(kind.cast(inner));
			}
		}
		return result;
	}
}
