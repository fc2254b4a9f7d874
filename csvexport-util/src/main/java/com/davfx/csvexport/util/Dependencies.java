package com.davfx.csvexport.util;

/**
 * Implemented by each module in a class named {@code Dependencies}, located in the module's
 * {@code <package>.dependencies} package. The package name (minus {@code .dependencies}) names the
 * {@code .conf} resource holding the module defaults.
 */
public interface Dependencies {
	Dependencies[] dependencies();
}
