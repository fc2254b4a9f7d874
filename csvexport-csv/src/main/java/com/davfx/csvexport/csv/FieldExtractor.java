package com.davfx.csvexport.csv;

import java.util.Map;

/**
 * Gives the named values of a record. The iteration order of the returned map is the order in which
 * cells are set, so implementations should return a {@link java.util.LinkedHashMap}.
 */
public interface FieldExtractor<T> {
	Map<String, Object> extract(T record);
}
