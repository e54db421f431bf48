package filament;

import filament.trans.passes.mono.MonomorphizationPass;
import org.apache.commons.io.FileUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.plumelib.options.Option;
import org.plumelib.options.Options;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class FilamentOptions {
	public static final String VERSION = "0.3.0";

	@Option(value = "Print the version and exit")
	public boolean version = false;

	@Option(value = "-h Print usage information", aliases = {"-help"})
	public boolean help = false;

	@Option(value = "-q Reduce printing during execution", aliases = {"-quiet"})
	public boolean logLvlQuiet = false;

	/**
	 * Be verbose, print solver traffic and timings. Sets the log level to FINE.
	 */
	@Option(value = "-v Print detailed information during execution", aliases = {"-verbose"})
	public boolean logLvlVerbose = false;

	@Option(value = "-c Type-check only, do not monomorphize or emit")
	public boolean check = false;

	@Option(value = "Include solver models in diagnostics and trace output")
	public boolean showModels = false;

	@Option(value = "-m The entry component")
	public String main = null;

	@Option(value = "Comma-separated literal arguments of the entry component")
	public String args = null;

	@Option(value = "-o Write the output to this file instead of stdout")
	public String output = null;

	@Option(value = "Emit the concrete source instead of JSON")
	public boolean emitSource = false;

	@Option(value = "-L Extra import search directories, separated by ':'")
	public List<String> library = new ArrayList<>();

	@Option(value = "The solver to use: builtin, z3 or cvc5")
	public String solver = null;

	@Option(value = "Record every SMT-LIB command sent to the solver in this file")
	public String solverReplayFile = null;

	@Option(value = "-j Number of parallel type-checking workers")
	public int jobs = 0;

	@Option(value = "Stop at the first failing component")
	public boolean failFast = false;

	@Option(value = "Maximum nesting of specializations below the entry component")
	public int maxDepth = MonomorphizationPass.DEFAULT_MAX_DEPTH;

	@Option(value = "Path to a JSON configuration file supplying defaults for the other options")
	public String config = null;

	public String inputFilePath;

	// values after the configuration file and the defaults are applied
	public List<String> libraryPaths = new ArrayList<>();
	public List<Long> entryArguments = new ArrayList<>();

	private final Options plumeOptions;
	private final String[] cmdArgs;
	private String[] remainingArgs;

	public FilamentOptions(String[] args) {
		plumeOptions = new Options("filament [options] file.fil", this);
		cmdArgs = args;
	}

	public void printHelp() {
		plumeOptions.printUsage();
	}

	/**
	 * @return true if the run should stop here because only the version or usage was requested
	 */
	public boolean isInformational() {
		return version || help;
	}

	public void parse() throws FilamentOptionException {
		try {
			// the (boolean, String[]) overload prints usage and exits the JVM on errors
			remainingArgs = plumeOptions.parse(cmdArgs);
		} catch (Options.ArgException e) {
			throw new FilamentOptionException(e.getMessage());
		}
		if (isInformational()) {
			return;
		}
		if (remainingArgs.length != 1) {
			throw new FilamentOptionException("expected exactly one source file, found " + remainingArgs.length);
		}
		inputFilePath = remainingArgs[0];

		for (String entry : library) {
			for (String dir : entry.split(":")) {
				if (!dir.isEmpty()) {
					libraryPaths.add(dir);
				}
			}
		}
		if (config != null) {
			applyConfig(config, readConfig(config));
		}
		if (main == null) {
			main = "main";
		}
		if (solver == null) {
			solver = "builtin";
		}
		if (!Arrays.asList("builtin", "z3", "cvc5").contains(solver)) {
			throw new FilamentOptionException("unknown solver " + solver + "; expected builtin, z3 or cvc5");
		}
		if (maxDepth <= 0) {
			throw new FilamentOptionException("--max-depth must be positive, found " + maxDepth);
		}
		if (jobs <= 0) {
			jobs = Runtime.getRuntime().availableProcessors();
		}
		if (args != null && !args.trim().isEmpty()) {
			for (String arg : args.split(",")) {
				try {
					long value = Long.parseLong(arg.trim());
					if (value < 0) {
						throw new FilamentOptionException("entry arguments must be naturals, found " + value);
					}
					entryArguments.add(value);
				} catch (NumberFormatException e) {
					throw new FilamentOptionException("entry arguments must be literals, found \"" + arg.trim() + "\"");
				}
			}
		}
	}

	private static JSONObject readConfig(String path) throws FilamentOptionException {
		String s;
		try {
			s = FileUtils.readFileToString(new File(path), StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw new FilamentOptionException("Error reading configuration file: " + ex.getMessage());
		}
		try {
			return new JSONObject(s);
		} catch (JSONException e) {
			throw new FilamentOptionException(path + ": parsing error: " + e.getMessage());
		}
	}

	// command line options take precedence over the configuration file
	private void applyConfig(String path, JSONObject config) throws FilamentOptionException {
		try {
			if (solver == null && config.has("solver")) {
				solver = config.getString("solver");
			}
			if (main == null && config.has("main")) {
				main = config.getString("main");
			}
			if (!showModels && config.has("show_models")) {
				showModels = config.getBoolean("show_models");
			}
			if (jobs <= 0 && config.has("jobs")) {
				jobs = config.getInt("jobs");
			}
			if (config.has("library_paths")) {
				JSONArray paths = config.getJSONArray("library_paths");
				for (int i = 0; i < paths.length(); i++) {
					libraryPaths.add(paths.getString(i));
				}
			}
		} catch (JSONException e) {
			throw new FilamentOptionException(path + ": " + e.getMessage());
		}
	}
}
