package com.davfx.csvexport.csv;

import java.io.Closeable;
import java.io.IOException;

public interface AutoCloseableCsvWriter extends CsvWriter, AutoCloseable, Closeable {
	@Override
	void close() throws IOException;
}
