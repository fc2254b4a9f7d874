package com.davfx.csvexport.csv;

import java.nio.charset.Charset;

import com.davfx.csvexport.csv.dependencies.Dependencies;
import com.davfx.csvexport.util.ConfigUtils;
import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;
import com.typesafe.config.Config;

/**
 * A charset together with the byte order mark written before the encoded text, so that spreadsheet
 * tools detect the encoding.
 */
public final class CsvEncoding {
	
	private static final Config CONFIG = ConfigUtils.load(new Dependencies(), CsvEncoding.class);

	private static final byte[] NO_PREAMBLE = new byte[] {};
	private static final byte[] UTF_8_PREAMBLE = new byte[] { (byte) 0xEF, (byte) 0xBB, (byte) 0xBF };
	private static final byte[] UTF_16BE_PREAMBLE = new byte[] { (byte) 0xFE, (byte) 0xFF };
	private static final byte[] UTF_16LE_PREAMBLE = new byte[] { (byte) 0xFF, (byte) 0xFE };
	private static final byte[] UTF_32BE_PREAMBLE = new byte[] { 0x00, 0x00, (byte) 0xFE, (byte) 0xFF };
	private static final byte[] UTF_32LE_PREAMBLE = new byte[] { (byte) 0xFF, (byte) 0xFE, 0x00, 0x00 };

	public static final CsvEncoding UTF_8 = new CsvEncoding(Charsets.UTF_8, UTF_8_PREAMBLE);
	public static final CsvEncoding UTF_8_WITHOUT_BOM = new CsvEncoding(Charsets.UTF_8, NO_PREAMBLE);
	public static final CsvEncoding UTF_16BE = new CsvEncoding(Charsets.UTF_16BE, UTF_16BE_PREAMBLE);
	public static final CsvEncoding UTF_16LE = new CsvEncoding(Charsets.UTF_16LE, UTF_16LE_PREAMBLE);
	public static final CsvEncoding ISO_8859_1 = new CsvEncoding(Charsets.ISO_8859_1, NO_PREAMBLE);
	public static final CsvEncoding US_ASCII = new CsvEncoding(Charsets.US_ASCII, NO_PREAMBLE);

	public static final CsvEncoding DEFAULT;
	static {
		CsvEncoding e = of(CONFIG.getString("charset"));
		DEFAULT = CONFIG.getBoolean("bom") ? e : e.withoutPreamble();
	}

	private final Charset charset;
	private final byte[] preamble;
	
	private CsvEncoding(Charset charset, byte[] preamble) {
		this.charset = charset;
		this.preamble = preamble;
	}
	
	/**
	 * Unicode charsets get their byte order mark, other charsets none. Java {@code UTF-16} and
	 * {@code UTF-32} are big endian: they are encoded as {@code UTF-16BE} and {@code UTF-32BE} so that the
	 * mark is not written twice.
	 */
	public static CsvEncoding of(Charset charset) {
		Preconditions.checkNotNull(charset);
		switch (charset.name()) {
		case "UTF-8":
			return UTF_8;
		case "UTF-16":
		case "UTF-16BE":
			return UTF_16BE;
		case "UTF-16LE":
			return UTF_16LE;
		case "UTF-32":
		case "UTF-32BE":
			return new CsvEncoding(Charset.forName("UTF-32BE"), UTF_32BE_PREAMBLE);
		case "UTF-32LE":
			return new CsvEncoding(charset, UTF_32LE_PREAMBLE);
		default:
			return new CsvEncoding(charset, NO_PREAMBLE);
		}
	}

	// Fails with UnsupportedCharsetException or IllegalCharsetNameException
	public static CsvEncoding of(String charsetName) {
		return of(Charset.forName(charsetName));
	}
	
	public CsvEncoding withoutPreamble() {
		return new CsvEncoding(charset, NO_PREAMBLE);
	}
	
	public Charset charset() {
		return charset;
	}
	
	public byte[] preamble() {
		return preamble.clone();
	}
	
	public byte[] encode(String text) {
		return text.getBytes(charset);
	}
	
	@Override
	public String toString() {
		return charset.name() + ((preamble.length == 0) ? "" : " (with BOM)");
	}
}
