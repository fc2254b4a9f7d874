package com.davfx.csvexport.csv;

import java.io.Closeable;
import java.io.Flushable;
import java.io.IOException;

/**
 * Line-by-line CSV destination. Nothing is written before the previous call returns.
 */
public interface CsvWriter extends Flushable {
	/**
	 * Cells appended to a line are formatted with {@link CsvCell#format(Object, char)}. Closing the
	 * line ends it.
	 */
	public interface Line extends AutoCloseable, Closeable {
		Line append(Object value) throws IOException;
	}

	Line line() throws IOException;
	
	// Already formatted line, written as is
	CsvWriter write(String line) throws IOException;
}
