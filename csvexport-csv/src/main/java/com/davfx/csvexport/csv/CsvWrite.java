package com.davfx.csvexport.csv;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

public final class CsvWrite {
	
	private static final Logger LOGGER = LoggerFactory.getLogger(CsvWrite.class);

	private CsvFormat format = new CsvFormat();
	private CsvEncoding encoding = CsvEncoding.DEFAULT;
	private boolean preamble = true;
	
	public CsvWrite() {
	}
	
	public CsvWrite withFormat(CsvFormat format) {
		this.format = Preconditions.checkNotNull(format);
		return this;
	}
	public CsvWrite withEncoding(CsvEncoding encoding) {
		this.encoding = Preconditions.checkNotNull(encoding);
		return this;
	}
	/**
	 * Whether the encoding byte order mark is written when the destination is opened (default).
	 */
	public CsvWrite withPreamble(boolean preamble) {
		this.preamble = preamble;
		return this;
	}

	/**
	 * The stream is not closed unless {@link MayAutoCloseCsvWriter#autoClose()} is used.
	 */
	public MayAutoCloseCsvWriter to(OutputStream out) throws IOException {
		return to(out, preamble);
	}
	
	private MayAutoCloseCsvWriter to(final OutputStream out, boolean withPreamble) throws IOException {
		if (withPreamble) {
			out.write(encoding.preamble());
		}
		final CsvWriter csvWriter = new CsvWriterImpl(encoding, format, out);
		return new MayAutoCloseCsvWriter() {
			@Override
			public Line line() throws IOException {
				return csvWriter.line();
			}
			@Override
			public CsvWriter write(String line) throws IOException {
				csvWriter.write(line);
				return this;
			}

			@Override
			public void flush() throws IOException {
				csvWriter.flush();
			}
			
			@Override
			public AutoCloseableCsvWriter autoClose() {
				return new AutoCloseableCsvWriter() {
					
					@Override
					public Line line() throws IOException {
						return csvWriter.line();
					}
					@Override
					public CsvWriter write(String line) throws IOException {
						csvWriter.write(line);
						return this;
					}
					
					@Override
					public void flush() throws IOException {
						csvWriter.flush();
					}
					
					@Override
					public void close() throws IOException {
						try {
							csvWriter.flush();
						} finally {
							out.close();
						}
					}
				};
			}
		};
	}
	
	public AutoCloseableCsvWriter to(File file) throws IOException {
		LOGGER.trace("Writing to {} ({})", file, encoding);
		return open(new FileOutputStream(file), preamble);
	}
	
	// The byte order mark is only written at the beginning of the file
	public AutoCloseableCsvWriter append(File file) throws IOException {
		boolean empty = !file.exists() || (file.length() == 0L);
		LOGGER.trace("Appending to {} ({})", file, encoding);
		return open(new FileOutputStream(file, true), preamble && empty);
	}
	
	private AutoCloseableCsvWriter open(OutputStream out, boolean withPreamble) throws IOException {
		try {
			return to(out, withPreamble).autoClose();
		} catch (IOException ioe) {
			out.close();
			throw ioe;
		}
	}
	
	private static final class CsvWriterImpl implements CsvWriter {
		private final class InnerLine implements Line {
			private boolean beginning = true;
			private boolean closed = false;
			
			public InnerLine() {
			}

			@Override
			public Line append(Object value) throws IOException {
				Preconditions.checkState(!closed, "Line already closed");
				if (beginning) {
					beginning = false;
				} else {
					writer.write(delimiter);
				}
				writer.write(CsvCell.format(value, delimiter));
				return this;
			}
			
			@Override
			public void close() throws IOException {
				if (closed) {
					return;
				}
				closed = true;
				writer.write(lineSeparator);
			}
		}

		private final char delimiter;
		private final String lineSeparator;
		private final Writer writer;
		
		public CsvWriterImpl(CsvEncoding encoding, CsvFormat format, OutputStream out) {
			delimiter = format.delimiter();
			lineSeparator = format.lineSeparator();
			writer = new OutputStreamWriter(out, encoding.charset());
		}

		@Override
		public Line line() throws IOException {
			return new InnerLine();
		}
		
		@Override
		public CsvWriter write(String line) throws IOException {
			writer.write(line);
			writer.write(lineSeparator);
			return this;
		}
		
		@Override
		public void flush() throws IOException {
			writer.flush();
		}
	}
}
