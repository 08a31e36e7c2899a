package mixfix.formatters;

import java.io.IOException;
import java.util.List;

public class FormattingTools {
	private FormattingTools() {}

	public interface WriteElement<T> {
		void write(T element) throws IOException;
	}

	public static <T> void writeSeparated(IndentingWriter out, String separator, List<T> elements,
	                                      WriteElement<T> writeElement) throws IOException {
		boolean first = true;
		for(T element : elements) {
			if(first) {
				first = false;
			} else {
				out.write(separator);
			}
			writeElement.write(element);
		}
	}

	public static <T> void writeCommaSeparated(IndentingWriter out, List<T> elements,
	                                           WriteElement<T> writeElement) throws IOException {
		writeSeparated(out, ", ", elements, writeElement);
	}
}
