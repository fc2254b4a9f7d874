package com.davfx.csvexport.csv;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Calendar;
import java.util.Date;

import com.davfx.csvexport.csv.dependencies.Dependencies;
import com.davfx.csvexport.util.ConfigUtils;
import com.typesafe.config.Config;

/**
 * Converts a value to its CSV cell representation.
 * <ul>
 * <li>{@code null}, a {@link Nullable} holding null or an empty optional gives an empty cell;</li>
 * <li>dates are written {@code yyyy-MM-dd}, with {@code HH:mm:ss} appended unless the time is midnight
 * ({@link Date} and {@link Instant} in the default time zone);</li>
 * <li>{@code double}, {@code float} and {@link BigDecimal} are written in plain decimal notation, without
 * exponent or trailing zeros ({@code 1.0E7} gives {@code 10000000}, {@code 100000.0} gives {@code 100000}),
 * NaN and infinities as {@link String#valueOf(Object)} does;</li>
 * <li>anything else is written with {@link String#valueOf(Object)}.</li>
 * </ul>
 * A value containing the delimiter, a double quote, CR or LF is surrounded with double quotes, inner
 * double quotes being doubled: {@code "Dangerous Dan" McGrew} gives {@code """Dangerous Dan"" McGrew"}.
 * <p>
 * Cells longer than {@link #CROP_LENGTH} are cropped (Excel limit), keeping the closing quote.
 */
public final class CsvCell {
	
	private static final Config CONFIG = ConfigUtils.load(new Dependencies(), CsvCell.class);
	public static final int CROP_LENGTH = ConfigUtils.getPositiveInt(CONFIG, "cell.crop");
	public static final int MAX_LENGTH = ConfigUtils.getPositiveInt(CONFIG, "cell.max");

	static final char QUOTE = '"';
	private static final String QUOTE_AS_STRING = String.valueOf(QUOTE);
	private static final String DOUBLE_QUOTE = QUOTE_AS_STRING + QUOTE_AS_STRING;

	private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd");
	private static final DateTimeFormatter DATE_TIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

	/**
	 * A value that can hold null, like a SQL nullable type.
	 */
	public interface Nullable {
		boolean isNull();
	}
	
	private CsvCell() {
	}
	
	public static String format(Object value, char delimiter) {
		String s = toString(value);
		if (needsQuotes(s, delimiter)) {
			s = QUOTE + s.replace(QUOTE_AS_STRING, DOUBLE_QUOTE) + QUOTE;
		}
		return crop(s, CROP_LENGTH, MAX_LENGTH);
	}
	
	private static boolean needsQuotes(String s, char delimiter) {
		return (s.indexOf(delimiter) >= 0) || (s.indexOf(QUOTE) >= 0) || (s.indexOf('\n') >= 0) || (s.indexOf('\r') >= 0);
	}
	
	// The max length wins over the closing quote kept by cropping
	static String crop(String s, int cropLength, int maxLength) {
		if (s.length() > cropLength) {
			if (s.charAt(s.length() - 1) == QUOTE) {
				s = s.substring(0, cropLength) + QUOTE;
			} else {
				s = s.substring(0, cropLength);
			}
		}
		if (s.length() > maxLength) {
			s = s.substring(0, maxLength);
		}
		return s;
	}
	
	private static String toString(Object value) {
		if (value == null) {
			return "";
		}
		if ((value instanceof Nullable) && ((Nullable) value).isNull()) {
			return "";
		}
		if (value instanceof java.util.Optional) {
			java.util.Optional<?> o = (java.util.Optional<?>) value;
			return o.isPresent() ? toString(o.get()) : "";
		}
		if (value instanceof com.google.common.base.Optional) {
			com.google.common.base.Optional<?> o = (com.google.common.base.Optional<?>) value;
			return o.isPresent() ? toString(o.get()) : "";
		}
		LocalDateTime dateTime = toLocalDateTime(value);
		if (dateTime != null) {
			if (dateTime.toLocalTime().equals(LocalTime.MIDNIGHT)) {
				return DATE_FORMATTER.format(dateTime);
			}
			return DATE_TIME_FORMATTER.format(dateTime);
		}
		if (value instanceof BigDecimal) {
			return ((BigDecimal) value).toPlainString();
		}
		if ((value instanceof Double) || (value instanceof Float)) {
			return toPlainString((Number) value);
		}
		return String.valueOf(value);
	}
	
	// No exponent, no trailing zeros: 1.0E7 gives 10000000, 2.50 gives 2.5
	private static String toPlainString(Number value) {
		double d = value.doubleValue();
		if (Double.isNaN(d) || Double.isInfinite(d)) {
			return String.valueOf(value);
		}
		BigDecimal b = (value instanceof Float) ? new BigDecimal(value.toString()) : BigDecimal.valueOf(d);
		if (b.signum() == 0) {
			return "0";
		}
		return b.stripTrailingZeros().toPlainString();
	}
	
	// Returns null if the value is not a date
	private static LocalDateTime toLocalDateTime(Object value) {
		if (value instanceof LocalDateTime) {
			return (LocalDateTime) value;
		}
		if (value instanceof LocalDate) {
			return ((LocalDate) value).atStartOfDay();
		}
		if (value instanceof ZonedDateTime) {
			return ((ZonedDateTime) value).toLocalDateTime();
		}
		if (value instanceof OffsetDateTime) {
			return ((OffsetDateTime) value).toLocalDateTime();
		}
		if (value instanceof Calendar) {
			Calendar c = (Calendar) value;
			return LocalDateTime.ofInstant(c.toInstant(), c.getTimeZone().toZoneId());
		}
		if (value instanceof Instant) {
			return LocalDateTime.ofInstant((Instant) value, ZoneId.systemDefault());
		}
		if (value instanceof Date) {
			// java.sql.Date does not support toInstant()
			return LocalDateTime.ofInstant(Instant.ofEpochMilli(((Date) value).getTime()), ZoneId.systemDefault());
		}
		return null;
	}
}
