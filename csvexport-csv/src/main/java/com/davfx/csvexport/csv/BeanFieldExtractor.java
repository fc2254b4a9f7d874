package com.davfx.csvexport.csv;

import java.beans.BeanInfo;
import java.beans.IntrospectionException;
import java.beans.Introspector;
import java.beans.PropertyDescriptor;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;

/**
 * Extracts the readable fields of a record:
 * <ul>
 * <li>for a Java {@code record}, its components, in declaration order;</li>
 * <li>otherwise the JavaBean properties ({@code getX()}, {@code isX()}) in the order given by
 * {@link Introspector} (alphabetical), followed by the public instance fields not already named.</li>
 * </ul>
 * Properties declared by {@link Object} are ignored. A class without any readable field is rejected.
 */
public final class BeanFieldExtractor implements FieldExtractor<Object> {

	private static final Logger LOGGER = LoggerFactory.getLogger(BeanFieldExtractor.class);

	private static interface Property {
		String name();
		Object read(Object record) throws IllegalAccessException, InvocationTargetException;
	}

	private static final class MethodProperty implements Property {
		private final String name;
		private final Method method;
		public MethodProperty(String name, Method method) {
			this.name = name;
			this.method = method;
		}
		@Override
		public String name() {
			return name;
		}
		@Override
		public Object read(Object record) throws IllegalAccessException, InvocationTargetException {
			return method.invoke(record);
		}
	}

	private static final class FieldProperty implements Property {
		private final Field field;
		public FieldProperty(Field field) {
			this.field = field;
		}
		@Override
		public String name() {
			return field.getName();
		}
		@Override
		public Object read(Object record) throws IllegalAccessException {
			return field.get(record);
		}
	}

	// Weak keys so that cached classes can still be unloaded
	private final LoadingCache<Class<?>, List<Property>> properties = CacheBuilder.newBuilder().weakKeys().build(new CacheLoader<Class<?>, List<Property>>() {
		@Override
		public List<Property> load(Class<?> clazz) throws IntrospectionException {
			List<Property> l = new ArrayList<>();
			if (clazz.isRecord()) {
				for (RecordComponent c : clazz.getRecordComponents()) {
					l.add(new MethodProperty(c.getName(), c.getAccessor()));
				}
			} else {
				Set<String> names = new HashSet<>();
				BeanInfo info = Introspector.getBeanInfo(clazz, Object.class);
				for (PropertyDescriptor d : info.getPropertyDescriptors()) {
					if (d.getReadMethod() != null) {
						l.add(new MethodProperty(d.getName(), d.getReadMethod()));
						names.add(d.getName());
					}
				}
				for (Field f : clazz.getFields()) {
					if (!Modifier.isStatic(f.getModifiers()) && names.add(f.getName())) {
						l.add(new FieldProperty(f));
					}
				}
			}
			LOGGER.trace("Readable fields of {}: {}", clazz.getName(), l.size());
			return l;
		}
	});

	public BeanFieldExtractor() {
	}

	@Override
	public Map<String, Object> extract(Object record) {
		Preconditions.checkNotNull(record);
		Class<?> clazz = record.getClass();
		List<Property> l;
		try {
			l = properties.get(clazz);
		} catch (ExecutionException ee) {
			throw new CsvException("Could not introspect: " + clazz.getName(), ee.getCause());
		}
		if (l.isEmpty()) {
			throw new CsvException("No readable field: " + clazz.getName());
		}

		Map<String, Object> values = new LinkedHashMap<>();
		for (Property p : l) {
			try {
				values.put(p.name(), p.read(record));
			} catch (IllegalAccessException iae) {
				throw new CsvException("Field not readable: " + clazz.getName() + "." + p.name(), iae);
			} catch (InvocationTargetException ite) {
				throw new CsvException("Could not read field: " + clazz.getName() + "." + p.name(), ite.getCause());
			}
		}
		return values;
	}
}
