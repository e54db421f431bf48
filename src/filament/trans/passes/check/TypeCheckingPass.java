package filament.trans.passes.check;

import filament.InternalCompilerError;
import filament.errors.Issue;
import filament.errors.IssueContext;
import filament.errors.TopLevelIssueContext;
import filament.model.ast.FilComponent;
import filament.model.component.Signature;
import filament.solver.SolverFactory;
import filament.trans.intermediate.CheckedProgram;
import filament.trans.intermediate.DefinitionRegistry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Logger;

/**
 * Checks every component of a program. Signatures are built first; components are then checked level by level
 * of the instantiation graph, callees first, each component of a level in its own worker with its own solver
 * sessions. Issues are merged back in component order, so the report does not depend on scheduling.
 */
public class TypeCheckingPass {
	private static final Logger logger = Logger.getLogger(TypeCheckingPass.class.getName());

	private TypeCheckingPass() {}

	private static final class Result {
		final Optional<CheckedComponent> checked;
		final List<Issue> issues;

		Result(Optional<CheckedComponent> checked, List<Issue> issues) {
			this.checked = checked;
			this.issues = issues;
		}
	}

	public static CheckedProgram perform(IssueContext ctx, DefinitionRegistry registry, SolverFactory solver,
	                                     int jobs, boolean failFast, boolean showModels) {
		Map<String, Signature> signatures = new LinkedHashMap<>();
		for (FilComponent component : registry.getComponents()) {
			SignatureBuilder.perform(ctx.withContext(new WhileCheckingComponent(component)), component)
					.ifPresent(signature -> signatures.put(signature.getName(), signature));
			if (failFast && ctx.hasErrors()) {
				return new CheckedProgram(registry, new LinkedHashMap<>());
			}
		}

		Map<String, CheckedComponent> checked = new ConcurrentHashMap<>();
		ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, jobs));
		try {
			for (List<String> level : registry.getLevels()) {
				Map<String, Future<Result>> futures = new LinkedHashMap<>();
				for (String name : level) {
					Signature signature = signatures.get(name);
					if (signature == null) {
						continue;
					}
					futures.put(name, executor.submit(() -> check(signature, signatures, solver, showModels)));
				}
				boolean failed = false;
				for (Map.Entry<String, Future<Result>> e : futures.entrySet()) {
					Result result = await(e.getValue());
					ctx.errors(result.issues);
					if (result.checked.isPresent()) {
						checked.putIfAbsent(e.getKey(), result.checked.get());
					} else {
						failed = true;
					}
				}
				if (failed && failFast) {
					logger.fine("stopping after the first level with a failing component");
					break;
				}
			}
		} finally {
			executor.shutdownNow();
		}

		Map<String, CheckedComponent> ordered = new LinkedHashMap<>();
		for (String name : registry.getTopologicalOrder()) {
			if (checked.containsKey(name)) {
				ordered.put(name, checked.get(name));
			}
		}
		return new CheckedProgram(registry, ordered);
	}

	private static Result check(Signature signature, Map<String, Signature> signatures, SolverFactory solver,
	                            boolean showModels) {
		TopLevelIssueContext local = new TopLevelIssueContext();
		long start = System.nanoTime();
		Optional<CheckedComponent> checked = ComponentChecker.perform(
				local.withContext(new WhileCheckingComponent(signature.getNode())),
				signature, signatures, solver, showModels);
		logger.fine(() -> "checked " + signature.getName() + " in " + (System.nanoTime() - start) / 1000000 + "ms");
		return new Result(checked, local.getIssues());
	}

	private static Result await(Future<Result> future) {
		try {
			return future.get();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new InternalCompilerError("interrupted while type checking", e);
		} catch (ExecutionException e) {
			throw new InternalCompilerError("type checking failed unexpectedly", e.getCause());
		}
	}
}
