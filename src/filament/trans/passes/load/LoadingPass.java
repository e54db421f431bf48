package filament.trans.passes.load;

import filament.errors.IssueContext;
import filament.model.ast.FilImport;
import filament.model.ast.FilUnit;
import filament.trans.passes.parse.FilParsingPass;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Parses the entry file and every file it transitively imports. Each file is loaded once, no matter how many
 * files import it; an import chain leading back to a file still being loaded is reported as a cycle.
 */
public class LoadingPass {
	private static final Logger logger = Logger.getLogger(LoadingPass.class.getName());

	private LoadingPass() {}

	/**
	 * @return the parsed files, every file after the files it imports
	 */
	public static List<FilUnit> perform(IssueContext ctx, ModuleLoader loader, Path entry) {
		List<FilUnit> units = new ArrayList<>();
		load(ctx, loader, entry.toAbsolutePath().normalize(), new LinkedHashSet<>(), new HashSet<>(), units);
		return units;
	}

	private static void load(IssueContext ctx, ModuleLoader loader, Path file, LinkedHashSet<Path> loading,
	                         Set<Path> visited, List<FilUnit> units) {
		visited.add(file);
		String contents;
		try {
			contents = loader.read(file);
		} catch (IOException e) {
			ctx.error(new IOErrorIssue(file, e));
			return;
		}
		logger.fine("loading " + file);
		FilUnit unit = FilParsingPass.perform(ctx, file, contents);
		if (unit == null) {
			return;
		}

		loading.add(file);
		for (FilImport fileImport : unit.getImports()) {
			Optional<Path> resolved = loader.resolve(file, fileImport.getPath());
			if (!resolved.isPresent()) {
				ctx.error(new ModuleNotFoundIssue(fileImport, loader.candidates(file, fileImport.getPath())));
				continue;
			}
			Path target = resolved.get();
			if (loading.contains(target)) {
				List<Path> chain = new ArrayList<>();
				boolean inCycle = false;
				for (Path p : loading) {
					inCycle |= p.equals(target);
					if (inCycle) {
						chain.add(p);
					}
				}
				chain.add(target);
				ctx.error(new CyclicImportIssue(fileImport, chain));
				continue;
			}
			if (visited.contains(target)) {
				continue;
			}
			load(ctx.withContext(new WhileLoadingImport(fileImport)), loader, target, loading, visited, units);
		}
		loading.remove(file);
		units.add(unit);
	}
}
