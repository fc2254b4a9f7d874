package com.davfx.csvexport.csv;

public interface MayAutoCloseCsvWriter extends CsvWriter {
	AutoCloseableCsvWriter autoClose();
}
