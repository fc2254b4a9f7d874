package com.davfx.csvexport.csv;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.primitives.Bytes;

/**
 * Table of rows built incrementally, exported as CSV. Columns do not have to be declared: they are
 * added the first time a cell is set, in that order, whatever the row.
 * <pre>
 * CsvExport csv = new CsvExport();
 * 
 * csv.row();
 * csv.set("Region", "New York, USA");
 * csv.set("Sales", 100000);
 * csv.set("Date Opened", LocalDate.of(2003, 12, 31));
 * 
 * csv.row();
 * csv.set("Region", "Sydney \"in\" Australia");
 * csv.set("Sales", 50000);
 * csv.set("Date Opened", LocalDateTime.of(2005, 1, 1, 9, 30, 0));
 * 
 * String text = csv.export();
 * csv.export(new File("somefile.csv"));
 * byte[] data = csv.toBytes();
 * </pre>
 * A row that does not set a column gets an empty cell. Exporting does not modify the table.
 * <p>
 * Not thread-safe: the table must not be modified while it is exported.
 */
public final class CsvExport {
	
	private static final Logger LOGGER = LoggerFactory.getLogger(CsvExport.class);
	
	private static final FieldExtractor<Object> BEAN_FIELD_EXTRACTOR = new BeanFieldExtractor();
	
	private final List<String> columns = new ArrayList<>();
	private final Set<String> knownColumns = new HashSet<>();
	private final List<Map<String, Object>> rows = new ArrayList<>();
	private Map<String, Object> currentRow = null;
	
	public CsvExport() {
	}
	
	/**
	 * Must be called before setting the cells of a row.
	 */
	public CsvExport row() {
		currentRow = new HashMap<>();
		rows.add(currentRow);
		return this;
	}
	
	public CsvExport set(String column, Object value) {
		Preconditions.checkNotNull(column);
		if (currentRow == null) {
			throw new IllegalStateException("row() must be called before set()");
		}
		if (knownColumns.add(column)) {
			columns.add(column);
		}
		currentRow.put(column, value);
		return this;
	}
	
	/**
	 * Adds a row per record, with a cell per extracted field.
	 */
	public <T> CsvExport add(Iterable<? extends T> records, FieldExtractor<? super T> extractor) {
		Preconditions.checkNotNull(extractor);
		for (T record : records) {
			Map<String, Object> fields = extractor.extract(record);
			row();
			for (Map.Entry<String, Object> e : fields.entrySet()) {
				set(e.getKey(), e.getValue());
			}
		}
		return this;
	}
	
	/**
	 * Adds a row per record, with a cell per readable bean property.
	 */
	public CsvExport add(Iterable<?> records) {
		return add(records, BEAN_FIELD_EXTRACTOR);
	}
	
	public List<String> columns() {
		return Collections.unmodifiableList(columns);
	}
	
	public int size() {
		return rows.size();
	}
	
	/**
	 * Lazily computed lines, without line separator.
	 */
	public Iterable<String> lines(CsvFormat format) {
		return CsvLines.of(columns, rows, Preconditions.checkNotNull(format));
	}
	
	public String export() {
		return export(new CsvFormat());
	}
	
	public String export(CsvFormat format) {
		LOGGER.debug("Exporting {} rows, {} columns ({})", rows.size(), columns.size(), format);
		StringBuilder b = new StringBuilder();
		for (String line : lines(format)) {
			b.append(line).append(format.lineSeparator());
		}
		return b.toString();
	}
	
	/**
	 * Writes the byte order mark, then the lines one by one. The stream is flushed, not closed.
	 */
	public void export(OutputStream out, CsvEncoding encoding, CsvFormat format) throws IOException {
		LOGGER.debug("Exporting {} rows, {} columns to stream ({}, {})", rows.size(), columns.size(), encoding, format);
		CsvWriter csv = new CsvWrite().withEncoding(encoding).withFormat(format).to(out);
		write(csv, format);
		csv.flush();
	}
	
	public void export(File file) throws IOException {
		export(file, CsvEncoding.DEFAULT);
	}
	
	public void export(File file, CsvEncoding encoding) throws IOException {
		export(file, encoding, new CsvFormat());
	}
	
	/**
	 * Creates or overwrites the file. It may be partially written if an error occurs.
	 */
	public void export(File file, CsvEncoding encoding, CsvFormat format) throws IOException {
		LOGGER.debug("Exporting {} rows, {} columns to {} ({}, {})", rows.size(), columns.size(), file, encoding, format);
		try (AutoCloseableCsvWriter csv = new CsvWrite().withEncoding(encoding).withFormat(format).to(file)) {
			write(csv, format);
		}
	}
	
	private void write(CsvWriter csv, CsvFormat format) throws IOException {
		for (String line : lines(format)) {
			csv.write(line);
		}
	}
	
	public byte[] toBytes() {
		return toBytes(CsvEncoding.DEFAULT);
	}
	
	public byte[] toBytes(CsvEncoding encoding) {
		return toBytes(encoding, new CsvFormat());
	}
	
	/**
	 * Byte order mark followed by the encoded text.
	 */
	public byte[] toBytes(CsvEncoding encoding, CsvFormat format) {
		Preconditions.checkNotNull(encoding);
		return Bytes.concat(encoding.preamble(), encoding.encode(export(format)));
	}
}
