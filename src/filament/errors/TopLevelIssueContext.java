package filament.errors;

import filament.Unreachable;
import filament.formatters.IndentingWriter;
import filament.formatters.IssueFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
 * The root issue collector. Safe to share between checking workers.
 */
public class TopLevelIssueContext extends IssueContext {

	private final List<Issue> errors = new ArrayList<>();

	@Override
	public synchronized void error(Issue err) {
		errors.add(err);
	}

	@Override
	public synchronized boolean hasErrors() {
		return !errors.isEmpty();
	}

	public synchronized List<Issue> getIssues() {
		return new ArrayList<>(errors);
	}

	public synchronized void format(IndentingWriter out) throws IOException {
		out.write("Detected ");
		out.write(Integer.toString(errors.size()));
		out.write(" issue(s):");
		for (Issue e : errors) {
			out.newLine();
			e.accept(new IssueFormattingVisitor(out));
		}
	}

	public String format() {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			format(out);
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}
}
