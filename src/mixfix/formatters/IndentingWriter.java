package mixfix.formatters;

import java.io.IOException;
import java.io.Writer;

/**
 * A writer that indents every line after a line break by the currently open indentation, and keeps track of the
 * column it is writing at so that boxes can indent relative to where they started.
 */
public class IndentingWriter extends Writer {

	private final Writer out;
	private final int defaultIndent;
	private int indent = 0;
	private boolean atLineStart = false;
	private int horizontalPosition = 0;

	public static class Indent implements AutoCloseable {

		private final IndentingWriter writer;
		private final int spaces;

		public Indent(IndentingWriter writer, int spaces) {
			this.writer = writer;
			this.spaces = spaces;
		}

		@Override
		public void close() {
			writer.unindent(spaces);
		}

	}

	public IndentingWriter(Writer out) {
		this(out, 4);
	}

	public IndentingWriter(Writer out, int defaultIndent) {
		this.out = out;
		this.defaultIndent = defaultIndent;
	}

	public Indent indent(int spaces) {
		indent += spaces;
		return new Indent(this, spaces);
	}

	public Indent indent() {
		return indent(defaultIndent);
	}

	/**
	 * Indents any following lines such that they start at the current column plus {@code extra}.
	 *
	 * @return an AutoCloseable that reverses the indent when closed
	 */
	public Indent indentFromHere(int extra) {
		return indent(Math.max(horizontalPosition + extra - indent, 0));
	}

	/**
	 * @return the 0-based position along the current line of text being written
	 */
	public int getHorizontalPosition() {
		return horizontalPosition;
	}

	public void unindent(int spaces) {
		if(spaces > indent) {
			throw new IllegalStateException("can't unindent below 0");
		}
		indent -= spaces;
	}

	public void newLine() throws IOException {
		write("\n");
	}

	@Override
	public void close() throws IOException {
		out.close();
	}

	@Override
	public void flush() throws IOException {
		out.flush();
	}

	@Override
	public void write(char[] chars, int offset, int len) throws IOException {
		for(int i = offset; i < offset + len; ++i) {
			char c = chars[i];
			if(atLineStart && c != '\n') {
				for(int j = 0; j < indent; ++j) {
					out.write(' ');
				}
				horizontalPosition = indent;
				atLineStart = false;
			}
			out.write(c);
			if(c == '\n') {
				atLineStart = true;
				horizontalPosition = 0;
			} else {
				horizontalPosition++;
			}
		}
	}

}
