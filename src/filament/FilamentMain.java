package filament;

import filament.errors.TopLevelIssueContext;
import filament.model.ast.FilUnit;
import filament.solver.SolverException;
import filament.solver.SolverFactory;
import filament.trans.FilamentTransException;
import filament.trans.intermediate.CheckedProgram;
import filament.trans.intermediate.DefinitionRegistry;
import filament.trans.passes.check.TypeCheckingPass;
import filament.trans.passes.emit.JsonEmitPass;
import filament.trans.passes.emit.SourceEmitPass;
import filament.trans.passes.load.LoadingPass;
import filament.trans.passes.load.ModuleLoader;
import filament.trans.passes.mono.CompilationSession;
import filament.trans.passes.mono.MonomorphizationPass;
import filament.trans.passes.mono.MonomorphizedProgram;
import filament.trans.passes.parse.option.OptionParsingPass;
import filament.trans.passes.scope.ScopingPass;
import org.apache.commons.io.FileUtils;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

public class FilamentMain {
	public static final int EXIT_OK = 0;
	public static final int EXIT_FAILURE = 1;
	public static final int EXIT_BAD_OPTIONS = 2;

	private final String[] cmdArgs;
	private static Logger logger;

	public FilamentMain(String[] args) {
		cmdArgs = args;
		// parent of every pass logger
		logger = Logger.getLogger("filament");
	}

	public static void main(String[] args) {
		int status = new FilamentMain(args).run();
		if (status == EXIT_OK) {
			logger.info("Finished");
		} else {
			logger.info("Terminated with errors");
		}
		System.exit(status);
	}

	// Top-level workhorse method.
	public int run() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();

		// Check options, set up logging.
		FilamentOptions opts = OptionParsingPass.perform(ctx, logger, cmdArgs);
		if (ctx.hasErrors()) {
			System.err.println(ctx.format());
			opts.printHelp();
			return EXIT_BAD_OPTIONS;
		}
		if (opts.version) {
			System.out.println("Filament version " + FilamentOptions.VERSION);
			return EXIT_OK;
		}
		if (opts.help) {
			opts.printHelp();
			return EXIT_OK;
		}

		Path replayFile = opts.solverReplayFile == null ? null : Paths.get(opts.solverReplayFile);
		SolverFactory solver;
		try {
			solver = SolverFactory.create(opts.solver, replayFile);
		} catch (SolverException e) {
			logger.severe(e.getMessage());
			return EXIT_FAILURE;
		}
		try {
			CheckedProgram program = check(ctx, opts, solver);
			if (opts.check) {
				return EXIT_OK;
			}
			MonomorphizedProgram mono = monomorphize(ctx, opts, program, solver);
			emit(opts, mono);
		} catch (FilamentTransException e) {
			logger.severe("found issues");
			System.err.println(e.getMsg());
			return EXIT_FAILURE;
		} catch (IOException e) {
			logger.severe("could not write output: " + e.getMessage());
			return EXIT_FAILURE;
		} finally {
			if (solver instanceof Closeable) {
				try {
					((Closeable) solver).close();
				} catch (IOException e) {
					logger.warning("could not close the solver replay file: " + e.getMessage());
				}
			}
		}
		return EXIT_OK;
	}

	private CheckedProgram check(TopLevelIssueContext ctx, FilamentOptions opts, SolverFactory solver)
			throws FilamentTransException {
		List<Path> libraryPaths = new ArrayList<>();
		for (String dir : opts.libraryPaths) {
			libraryPaths.add(Paths.get(dir));
		}

		logger.info("Loading " + opts.inputFilePath);
		List<FilUnit> units = LoadingPass.perform(ctx, new ModuleLoader(libraryPaths), Paths.get(opts.inputFilePath));
		checkErrors(ctx);

		logger.info("Resolving names");
		DefinitionRegistry registry = ScopingPass.perform(ctx, units);
		checkErrors(ctx);

		logger.info("Type checking " + registry.getComponents().size() + " component(s) with " + opts.jobs +
				" worker(s)");
		CheckedProgram program = TypeCheckingPass.perform(ctx, registry, solver, opts.jobs, opts.failFast,
				opts.showModels);
		checkErrors(ctx);
		return program;
	}

	private MonomorphizedProgram monomorphize(TopLevelIssueContext ctx, FilamentOptions opts, CheckedProgram program,
	                                          SolverFactory solver) throws FilamentTransException {
		logger.info("Monomorphizing from " + opts.main);
		CompilationSession session = new CompilationSession();
		Optional<MonomorphizedProgram> mono = MonomorphizationPass.perform(
				ctx, program, session, solver, opts.main, opts.entryArguments, opts.maxDepth);
		checkErrors(ctx);
		logger.info("Produced " + mono.get().getComponents().size() + " specialization(s)");
		return mono.get();
	}

	private void emit(FilamentOptions opts, MonomorphizedProgram mono) throws IOException {
		String text = opts.emitSource
				? SourceEmitPass.perform(mono)
				: JsonEmitPass.perform(mono).toString(2) + System.lineSeparator();
		if (opts.output == null) {
			System.out.print(text);
		} else {
			logger.info("Writing output to \"" + opts.output + "\"");
			FileUtils.writeStringToFile(new File(opts.output), text, StandardCharsets.UTF_8);
		}
	}

	private static void checkErrors(TopLevelIssueContext ctx) throws FilamentTransException {
		if (ctx.hasErrors()) {
			throw new FilamentTransException(ctx.format());
		}
	}
}
