package com.davfx.csvexport.csv;

public final class CsvException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public CsvException(String message) {
		super(message);
	}

	public CsvException(String message, Throwable cause) {
		super(message, cause);
	}
}
