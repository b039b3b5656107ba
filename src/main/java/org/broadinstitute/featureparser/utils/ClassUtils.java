package org.broadinstitute.featureparser.utils;

import org.broadinstitute.featureparser.exceptions.UserException;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;

/**
 * Utilities for dealing with reflection.
 */
public final class ClassUtils {
    private ClassUtils(){}

    /**
     * Returns true iff we can make instances of this class.
     * Note that this will return false if the class does not have any public constructors.
     */
    public static boolean canMakeInstances(final Class<?> clazz) {
        return clazz != null &&
                !clazz.isPrimitive()  &&
                !clazz.isSynthetic()  &&
                !clazz.isInterface()  &&
                !clazz.isLocalClass() &&
                !Modifier.isPrivate(clazz.getModifiers()) &&
                !Modifier.isAbstract(clazz.getModifiers()) &&
                clazz.getConstructors().length != 0;
    }

    /**
     * Resolves a fully qualified class name and checks that it is a concrete subclass of {@code targetClass}.
     *
     * @throws UserException.BadInput if the class cannot be found, is not a subclass of {@code targetClass},
     *         or cannot be instantiated
     */
    public static <T> Class<? extends T> forName(final String className, final Class<T> targetClass) {
        Utils.nonEmpty(className, "class name");
        Utils.nonNull(targetClass, "target class");
        final Class<?> found;
        try {
            found = Class.forName(className);
        } catch (final ClassNotFoundException e) {
            throw new UserException.BadInput("Class " + className + " could not be found on the classpath", e);
        }
        if (!targetClass.isAssignableFrom(found)) {
            throw new UserException.BadInput("Class " + className + " is not a subclass of " + targetClass.getName());
        }
        if (!canMakeInstances(found)) {
            throw new UserException.BadInput("Class " + className + " cannot be instantiated, it needs a public no-arg constructor");
        }
        return found.asSubclass(targetClass);
    }

    /**
     * Creates an instance of the given class through its public no-arg constructor.
     *
     * @throws IllegalArgumentException if the class has no usable public no-arg constructor
     */
    public static <T> T makeInstanceOf(final Class<T> clazz) {
        Utils.nonNull(clazz, "class");
        try {
            return clazz.getConstructor().newInstance();
        } catch (final NoSuchMethodException | InstantiationException | IllegalAccessException | InvocationTargetException e) {
            throw new IllegalArgumentException("Problem making an instance of " + clazz + " Do check that the class has a public non-arg constructor", e);
        }
    }
}
