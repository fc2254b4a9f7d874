package com.davfx.csvexport.util.dependencies;

public final class Dependencies implements com.davfx.csvexport.util.Dependencies {
	@Override
	public com.davfx.csvexport.util.Dependencies[] dependencies() {
		return new com.davfx.csvexport.util.Dependencies[] {};
	}
}
