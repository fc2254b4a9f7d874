package com.davfx.csvexport.csv;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.google.common.base.Function;
import com.google.common.base.Joiner;
import com.google.common.collect.Iterables;

/**
 * Lines of a table: the {@code sep=} hint, the header, then one line per row. Nothing is computed
 * before the corresponding line is requested, and rows are only read (a missing cell is empty).
 */
final class CsvLines {
	
	private static final String SEPARATOR_HINT = "sep=";

	private CsvLines() {
	}
	
	static Iterable<String> of(final List<String> columns, Iterable<? extends Map<String, ?>> rows, CsvFormat format) {
		final char delimiter = format.delimiter();
		final Joiner joiner = Joiner.on(delimiter);
		final boolean escapeHeader = format.escapeHeader();
		
		final Function<Object, String> cell = new Function<Object, String>() {
			@Override
			public String apply(Object value) {
				return CsvCell.format(value, delimiter);
			}
		};
		
		List<Iterable<String>> lines = new ArrayList<>();
		
		if (format.separatorHint()) {
			lines.add(Collections.singletonList(SEPARATOR_HINT + delimiter));
		}

		if (format.header()) {
			lines.add(Iterables.transform(Collections.singletonList(columns), new Function<List<String>, String>() {
				@Override
				public String apply(List<String> names) {
					if (escapeHeader) {
						return joiner.join(Iterables.transform(names, cell));
					}
					return joiner.join(names);
				}
			}));
		}
		
		lines.add(Iterables.transform(rows, new Function<Map<String, ?>, String>() {
			@Override
			public String apply(final Map<String, ?> row) {
				return joiner.join(Iterables.transform(columns, new Function<String, String>() {
					@Override
					public String apply(String column) {
						return cell.apply(row.get(column));
					}
				}));
			}
		}));
		
		return Iterables.concat(lines);
	}
}
