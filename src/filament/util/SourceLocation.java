package filament.util;

import filament.Unreachable;
import filament.formatters.IndentingWriter;
import org.apache.commons.io.FileUtils;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Objects;

public class SourceLocation implements Comparable<SourceLocation> {
	private final Path file;
	private final int startOffset;
	private final int endOffset;
	private final int startLine;
	private final int endLine;
	private final int startColumn;
	private final int endColumn;

	public SourceLocation(Path file, int startOffset, int endOffset, int startLine, int endLine, int startColumn,
	                      int endColumn) {
		this.file = file;
		this.startOffset = startOffset;
		this.endOffset = endOffset;
		this.startLine = startLine;
		this.endLine = endLine;
		this.startColumn = startColumn;
		this.endColumn = endColumn;
	}

	public String prettyString() {
		StringWriter sw = new StringWriter();
		writePretty(new IndentingWriter(sw));
		return sw.getBuffer().toString();
	}

	/**
	 * Writes "at line:column in file F", followed by the offending source line and a caret marker
	 * when the file can still be read.
	 */
	public void writePretty(IndentingWriter out) {
		try {
			if (isUnknown()) {
				out.write("at unknown source location");
				return;
			}
			out.write("at ");
			if (startLine != endLine) {
				out.write((startLine + 1) + ":" + (startColumn + 1) + "-" + (endLine + 1) + ":" + endColumn);
			} else if (startColumn != endColumn) {
				out.write((startLine + 1) + ":" + (startColumn + 1) + "-" + endColumn);
			} else {
				out.write((startLine + 1) + ":" + (startColumn + 1));
			}
			out.write(" in file " + file);
			if (!file.toFile().isFile()) {
				return;
			}
			String contents = FileUtils.readFileToString(file.toFile(), StandardCharsets.UTF_8);
			if (startOffset > contents.length()) {
				return;
			}
			int lineStart = startOffset == 0 ? 0 : contents.lastIndexOf('\n', startOffset - 1) + 1;
			int lineEnd = contents.indexOf('\n', startOffset);
			if (lineEnd == -1) {
				lineEnd = contents.length();
			}
			out.newLine();
			out.append(contents, lineStart, lineEnd);
			out.newLine();
			for (int pos = lineStart; pos < startOffset; pos++) {
				out.append(' ');
			}
			int effectiveEnd = startOffset == endOffset ? endOffset + 1 : endOffset;
			for (int pos = startOffset; pos < lineEnd && pos < effectiveEnd; pos++) {
				out.append('^');
			}
			if (startOffset == contents.length()) {
				out.append("^ EOF");
			}
		} catch (IOException e) {
			throw new Unreachable(e);
		}
	}

	public static SourceLocation unknown() {
		return new SourceLocation(null, -1, -1, -1, -1, -1, -1);
	}

	public boolean isUnknown() {
		return file == null;
	}

	public SourceLocation combine(SourceLocation other) {
		if (isUnknown()) {
			return other;
		} else if (other.isUnknown()) {
			return this;
		}
		if (!file.equals(other.getFile())) {
			throw new IllegalArgumentException(
					"tried to combine source locations from two different files: " + file + ", " + other.getFile());
		}
		SourceLocation first = compareTo(other) <= 0 ? this : other;
		SourceLocation last = endOffset >= other.endOffset ? this : other;
		return new SourceLocation(file,
				first.startOffset, last.endOffset,
				first.startLine, last.endLine,
				first.startColumn, last.endColumn);
	}

	public Path getFile() {
		return file;
	}

	public int getStartOffset() {
		return startOffset;
	}

	public int getEndOffset() {
		return endOffset;
	}

	public int getStartLine() {
		return startLine;
	}

	public int getEndLine() {
		return endLine;
	}

	public int getStartColumn() {
		return startColumn;
	}

	public int getEndColumn() {
		return endColumn;
	}

	@Override
	public int hashCode() {
		return Objects.hash(file, startOffset, endOffset, startLine, endLine, startColumn, endColumn);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		SourceLocation other = (SourceLocation) obj;
		return startOffset == other.startOffset && endOffset == other.endOffset && startLine == other.startLine &&
				endLine == other.endLine && startColumn == other.startColumn && endColumn == other.endColumn &&
				Objects.equals(file, other.file);
	}

	@Override
	public String toString() {
		if (isUnknown()) {
			return "SourceLocation [UNKNOWN]";
		}
		return "SourceLocation [file=" + file + ", line=" + (startLine + 1) + ", column=" + (startColumn + 1) + "]";
	}

	@Override
	public int compareTo(SourceLocation o) {
		if (isUnknown() && o.isUnknown()) {
			return 0;
		}
		if (isUnknown()) {
			return -1;
		}
		if (o.isUnknown()) {
			return 1;
		}
		int comparedFile = file.compareTo(o.file);
		if (comparedFile != 0) {
			return comparedFile;
		}
		int comparedStart = Integer.compare(startOffset, o.startOffset);
		if (comparedStart != 0) {
			return comparedStart;
		}
		return Integer.compare(endOffset, o.endOffset);
	}

}
