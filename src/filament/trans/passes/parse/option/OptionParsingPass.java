package filament.trans.passes.parse.option;

import filament.FilamentOptionException;
import filament.FilamentOptions;
import filament.errors.IssueContext;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

public class OptionParsingPass {
	private OptionParsingPass() {}

	public static FilamentOptions perform(IssueContext ctx, Logger logger, String[] args) {
		FilamentOptions opts = new FilamentOptions(args);
		try {
			opts.parse();
		} catch (FilamentOptionException e) {
			ctx.error(new OptionParserIssue(e.getMsg()));
		}
		// set the logger's log level based on command line arguments
		Level level;
		if (opts.logLvlQuiet) {
			level = Level.WARNING;
		} else if (opts.logLvlVerbose) {
			level = Level.FINE;
		} else {
			level = Level.INFO;
		}
		logger.setLevel(level);
		for (Handler handler : Logger.getLogger("").getHandlers()) {
			handler.setLevel(level);
		}
		return opts;
	}
}
