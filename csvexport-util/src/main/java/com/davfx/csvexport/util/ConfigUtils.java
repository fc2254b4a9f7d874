package com.davfx.csvexport.util;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.util.LinkedList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Charsets;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigOriginFactory;

public final class ConfigUtils {
	
	private static final Logger LOGGER = LoggerFactory.getLogger(ConfigUtils.class);
	
	private static final String EXTENSION = ".conf";
	private static final String INCLUDE = "include ";
	private static final String DEPENDENCIES_SUFFIX = ".dependencies";
	private static final String APPLICATION_RESOURCE = "configure";
	
	private ConfigUtils() {
	}
	
	public static char getChar(Config c, String key) {
		String s = c.getString(key);
		if (s.length() != 1) {
			throw new ConfigException.BadValue(c.origin(), key, "Invalid value: " + s + ". Char value must be a string with only one character.");
		}
		return s.charAt(0);
	}
	
	public static int getPositiveInt(Config c, String key) {
		int i = c.getInt(key);
		if (i <= 0) {
			throw new ConfigException.BadValue(c.origin(), key, "Invalid value: " + i + ". Must be strictly positive.");
		}
		return i;
	}
	
	//
	
	private static InputStream getResource(Dependencies dependencies, String resource) {
		InputStream i = dependencies.getClass().getClassLoader().getResourceAsStream(resource + EXTENSION);
		if (i != null) {
			return i;
		}
		for (Dependencies d : dependencies.dependencies()) {
			i = getResource(d, resource);
			if (i != null) {
				return i;
			}
		}
		return null;
	}

	// A file in the working directory takes precedence over the classpath resource
	private static String loadConfig(Dependencies dependencies, String resource, boolean required) throws IOException {
		File f = new File(new File("."), resource + EXTENSION);
		InputStream i;
		if (f.exists()) {
			LOGGER.trace("Config file found: {}", f.getAbsolutePath());
			i = new FileInputStream(f);
		} else {
			i = getResource(dependencies, resource);
			if (i == null) {
				if (required) {
					LOGGER.warn("Config file not found: {}", resource);
					throw new IOException("Config file not found: " + resource);
				}
				return "";
			}
		}
		try (BufferedReader r = new BufferedReader(new InputStreamReader(i, Charsets.UTF_8))) {
			StringBuilder b = new StringBuilder();
			while (true) {
				String line = r.readLine();
				if (line == null) {
					return b.toString();
				}
				String l = line.trim();
				if (l.startsWith(INCLUDE)) {
					b.append(loadConfig(dependencies, l.substring(INCLUDE.length()).trim(), true));
				} else {
					b.append(line);
				}
				b.append('\n');
			}
		}
	}

	public static final class Overrides {
		private final List<String> overrides = new LinkedList<>();
		public Overrides() {
		}
		
		public Overrides add(String config) {
			overrides.add(config);
			return this;
		}
		public Overrides add(String key, String value) {
			overrides.add(key + " = \"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"");
			return this;
		}
	}

	private static void gatherDependencies(Dependencies dependencies, List<Dependencies> l) {
		for (Dependencies d : dependencies.dependencies()) {
			gatherDependencies(d, l);
		}
		for (Dependencies d : l) {
			if (d.getClass() == dependencies.getClass()) {
				return;
			}
		}
		l.add(dependencies);
	}
	
	private static String packageOf(Dependencies d) {
		String packageName = d.getClass().getPackage().getName();
		if (!packageName.endsWith(DEPENDENCIES_SUFFIX)) {
			throw new IllegalArgumentException("Must end with '" + DEPENDENCIES_SUFFIX + "': " + packageName);
		}
		return packageName.substring(0, packageName.length() - DEPENDENCIES_SUFFIX.length());
	}

	/**
	 * Concatenates, in order: the {@code .conf} of every module reachable from {@code dependencies}
	 * (dependencies first), the optional {@code resource}, the application {@code configure.conf} if
	 * any, and finally the given overrides. Later definitions win.
	 */
	public static synchronized Config load(Dependencies dependencies, String resource, Overrides overrides) {
		StringBuilder c = new StringBuilder();

		List<Dependencies> l = new LinkedList<>();
		gatherDependencies(dependencies, l);
		for (Dependencies d : l) {
			String packageName = packageOf(d);
			LOGGER.trace("Dependency conf: {}", packageName);
			try {
				c.append(loadConfig(d, packageName, true));
			} catch (IOException e) {
				throw new ConfigException.IO(ConfigOriginFactory.newSimple(packageName + EXTENSION), "Could not load package config: " + packageName, e);
			}
		}
		
		if (resource != null) {
			try {
				c.append(loadConfig(dependencies, resource, true));
			} catch (IOException e) {
				throw new ConfigException.IO(ConfigOriginFactory.newSimple(resource + EXTENSION), "Could not load config: " + resource, e);
			}
		}

		try {
			c.append('\n');
			c.append(loadConfig(dependencies, APPLICATION_RESOURCE, false));
		} catch (IOException e) {
			throw new ConfigException.IO(ConfigOriginFactory.newSimple(APPLICATION_RESOURCE + EXTENSION), "Could not load application config", e);
		}

		for (String o : overrides.overrides) {
			c.append('\n');
			c.append(o);
		}

		String conf = c.toString();
		LOGGER.trace("Config: \n{}\n", conf);
		return ConfigFactory.parseString(conf).resolve();
	}

	public static Config load(Dependencies dependencies, String resource) {
		return load(dependencies, resource, new Overrides());
	}

	// Module defaults, scoped to the package of the given class
	public static Config load(Dependencies dependencies, Class<?> clazz) {
		return load(dependencies, null, new Overrides()).getConfig(clazz.getPackage().getName());
	}
}
