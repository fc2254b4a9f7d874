package com.davfx.csvexport.csv;

import com.davfx.csvexport.csv.dependencies.Dependencies;
import com.davfx.csvexport.util.ConfigUtils;
import com.google.common.base.Preconditions;
import com.typesafe.config.Config;

/**
 * Formatting options of one export. Immutable: every {@code with...} method returns a new instance.
 * <p>
 * Defaults come from the {@code com.davfx.csvexport.csv} configuration (comma delimiter, header line,
 * no {@code sep=} hint, raw header, CRLF line separator).
 */
public final class CsvFormat {
	
	private static final Config CONFIG = ConfigUtils.load(new Dependencies(), CsvFormat.class);
	private static final char DEFAULT_DELIMITER = ConfigUtils.getChar(CONFIG, "delimiter");
	private static final boolean DEFAULT_HEADER = CONFIG.getBoolean("header");
	private static final boolean DEFAULT_SEPARATOR_HINT = CONFIG.getBoolean("separatorHint");
	private static final boolean DEFAULT_ESCAPE_HEADER = CONFIG.getBoolean("escapeHeader");
	private static final String DEFAULT_LINE_SEPARATOR = CONFIG.getString("lineSeparator");

	private final char delimiter;
	private final boolean header;
	private final boolean separatorHint;
	private final boolean escapeHeader;
	private final String lineSeparator;
	
	public CsvFormat() {
		this(checkDelimiter(DEFAULT_DELIMITER), DEFAULT_HEADER, DEFAULT_SEPARATOR_HINT, DEFAULT_ESCAPE_HEADER, checkLineSeparator(DEFAULT_LINE_SEPARATOR));
	}
	
	private CsvFormat(char delimiter, boolean header, boolean separatorHint, boolean escapeHeader, String lineSeparator) {
		this.delimiter = delimiter;
		this.header = header;
		this.separatorHint = separatorHint;
		this.escapeHeader = escapeHeader;
		this.lineSeparator = lineSeparator;
	}
	
	private static char checkDelimiter(char delimiter) {
		Preconditions.checkArgument((delimiter != CsvCell.QUOTE) && (delimiter != '\n') && (delimiter != '\r'), "Invalid delimiter: %s", delimiter);
		return delimiter;
	}
	private static String checkLineSeparator(String lineSeparator) {
		Preconditions.checkArgument(!lineSeparator.isEmpty(), "Line separator cannot be empty");
		return lineSeparator;
	}
	
	public CsvFormat withDelimiter(char delimiter) {
		return new CsvFormat(checkDelimiter(delimiter), header, separatorHint, escapeHeader, lineSeparator);
	}
	public CsvFormat withHeader(boolean header) {
		return new CsvFormat(delimiter, header, separatorHint, escapeHeader, lineSeparator);
	}
	/**
	 * Adds a first {@code sep=<delimiter>} line, read by Excel to override the locale list separator.
	 */
	public CsvFormat withSeparatorHint(boolean separatorHint) {
		return new CsvFormat(delimiter, header, separatorHint, escapeHeader, lineSeparator);
	}
	/**
	 * Quotes header names the same way as data cells. Off by default: column names are written as is.
	 */
	public CsvFormat withEscapedHeader(boolean escapeHeader) {
		return new CsvFormat(delimiter, header, separatorHint, escapeHeader, lineSeparator);
	}
	public CsvFormat withLineSeparator(String lineSeparator) {
		return new CsvFormat(delimiter, header, separatorHint, escapeHeader, checkLineSeparator(Preconditions.checkNotNull(lineSeparator)));
	}
	
	public char delimiter() {
		return delimiter;
	}
	public boolean header() {
		return header;
	}
	public boolean separatorHint() {
		return separatorHint;
	}
	public boolean escapeHeader() {
		return escapeHeader;
	}
	public String lineSeparator() {
		return lineSeparator;
	}
	
	@Override
	public String toString() {
		return "CsvFormat(delimiter='" + delimiter + "', header=" + header + ", separatorHint=" + separatorHint + ", escapeHeader=" + escapeHeader + ")";
	}
}
