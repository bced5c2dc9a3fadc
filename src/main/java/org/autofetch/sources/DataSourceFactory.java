package org.autofetch.sources;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.Map;

/**
 * Instantiates {@link DataSource} implementations from their {@link DataSourceSpec}.
 */
public final class DataSourceFactory {

    private DataSourceFactory() {}

    /**
     * Resolves the implementation class without initializing it, so no source code
     * (static initializers included) runs in the calling process.
     *
     * @throws IllegalArgumentException if the class is missing, cannot be linked or is not a DataSource
     */
    public static Class<? extends DataSource> resolve(String type) {
        Class<?> cls;
        try {
            cls = Class.forName(type, false, DataSourceFactory.class.getClassLoader());
        } catch (ClassNotFoundException e) {
            throw new IllegalArgumentException("Unknown data source class: " + type, e);
        } catch (LinkageError e) {
            throw new IllegalArgumentException("Cannot load data source class " + type + ": " + e, e);
        }
        if (!DataSource.class.isAssignableFrom(cls)) {
            throw new IllegalArgumentException(type + " does not implement " + DataSource.class.getName());
        }
        return cls.asSubclass(DataSource.class);
    }

    public static DataSource create(DataSourceSpec spec) {
        Class<? extends DataSource> cls = resolve(spec.type());
        try {
            try {
                Constructor<? extends DataSource> withProperties = cls.getConstructor(Map.class);
                return withProperties.newInstance(spec.properties());
            } catch (NoSuchMethodException e) {
                return cls.getConstructor().newInstance();
            }
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException(spec.type() + " has no public (Map) or no-arg constructor", e);
        } catch (InvocationTargetException e) {
            throw new IllegalArgumentException("Failed to construct " + spec.type() + ": "
                    + e.getCause().getMessage(), e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException("Failed to construct " + spec.type() + ": " + e.getMessage(), e);
        } catch (ExceptionInInitializerError e) {
            throw new IllegalArgumentException("Failed to initialize " + spec.type() + ": " + e.getCause(), e);
        } catch (LinkageError e) {
            throw new IllegalArgumentException("Failed to initialize " + spec.type() + ": " + e, e);
        }
    }
}
