package filament.solver;

import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Starts one external SMT-LIB 2 solver process per session. When a replay file is given, every command any
 * session sends is appended to it, so a failing run can be reproduced by piping the file into the solver.
 */
public class SmtLibSolverFactory implements SolverFactory, Closeable {
	private final List<String> command;
	private final Writer replay;

	public SmtLibSolverFactory(List<String> command, Path replayFile) {
		this.command = new ArrayList<>(command);
		if (replayFile == null) {
			this.replay = null;
		} else {
			try {
				this.replay = Files.newBufferedWriter(replayFile, StandardCharsets.UTF_8);
			} catch (IOException e) {
				throw new SolverException("could not open solver replay file " + replayFile, e);
			}
		}
	}

	public List<String> getCommand() {
		return command;
	}

	@Override
	public SolverSession open() {
		return new SmtLibSession(command, this::record);
	}

	private void record(String line) {
		if (replay == null) {
			return;
		}
		synchronized (replay) {
			try {
				replay.write(line);
				replay.write('\n');
			} catch (IOException e) {
				throw new SolverException("could not write solver replay file", e);
			}
		}
	}

	@Override
	public void close() throws IOException {
		if (replay != null) {
			synchronized (replay) {
				replay.close();
			}
		}
	}
}
