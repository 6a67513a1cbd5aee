package org.verifythat.util;

import org.verifythat.MethodResolutionException;

import java.lang.reflect.Constructor;
import java.lang.reflect.Executable;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Member lookup by name and argument types across a class, its superclasses and its interfaces,
 * private members included.
 */
public final class ReflectionUtils {

    private ReflectionUtils() {}

    public static Method findMethod(Class<?> type, String name, boolean isStatic, List<Class<?>> argumentTypes) {
        List<Method> applicable = new ArrayList<>();
        for (Method method : allMethods(type)) {
            if (method.getName().equals(name)
                    && !method.isBridge()
                    && Modifier.isStatic(method.getModifiers()) == isStatic
                    && isApplicable(method, argumentTypes)) {
                applicable.add(method);
            }
        }
        Method method = mostSpecific(applicable);
        if (method == null) {
            throw new MethodResolutionException(type.getName(), name, argumentTypes.size());
        }
        return accessibleMethod(method);
    }

    public static Method findAnnotatedMethod(Class<?> type, Class<? extends java.lang.annotation.Annotation> annotation,
                                             List<Class<?>> argumentTypes) {
        List<Method> applicable = new ArrayList<>();
        for (Method method : allMethods(type)) {
            if (method.isAnnotationPresent(annotation) && isApplicable(method, argumentTypes)) {
                applicable.add(method);
            }
        }
        Method method = mostSpecific(applicable);
        return method == null ? null : accessibleMethod(method);
    }

    public static <T> Constructor<T> findConstructor(Class<T> type, List<Class<?>> argumentTypes) {
        List<Constructor<?>> applicable = new ArrayList<>();
        for (Constructor<?> constructor : type.getDeclaredConstructors()) {
            if (isApplicable(constructor, argumentTypes)) {
                applicable.add(constructor);
            }
        }
        @SuppressWarnings("unchecked")
        Constructor<T> constructor = (Constructor<T>) mostSpecific(applicable);
        if (constructor == null) {
            throw new MethodResolutionException(type.getName(), "<init>", argumentTypes.size());
        }
        return constructor;
    }

    /**
     * @return the field, or {@code null} when no class in the hierarchy declares it
     */
    public static Field findField(Class<?> type, String name) {
        for (Class<?> current = type; current != null; current = current.getSuperclass()) {
            for (Field field : current.getDeclaredFields()) {
                if (field.getName().equals(name)) {
                    return field;
                }
            }
        }
        return null;
    }

    /**
     * Finds the getter of a property: {@code getName()}, {@code isName()} or an accessor named
     * after the property itself, as records declare them.
     */
    public static Method findGetter(Class<?> type, String property, boolean isStatic) {
        String capitalized = capitalize(property);
        for (String candidate : List.of("get" + capitalized, "is" + capitalized, property)) {
            for (Method method : allMethods(type)) {
                if (method.getName().equals(candidate)
                        && method.getParameterCount() == 0
                        && method.getReturnType() != void.class
                        && Modifier.isStatic(method.getModifiers()) == isStatic) {
                    return accessibleMethod(method);
                }
            }
        }
        throw new MethodResolutionException(type.getName(), "get" + capitalized, 0);
    }

    /**
     * @return the setter, or {@code null} when there is none
     */
    public static Method findSetter(Class<?> type, String property) {
        String name = "set" + capitalize(property);
        for (Method method : allMethods(type)) {
            if (method.getName().equals(name)
                    && method.getParameterCount() == 1
                    && !Modifier.isStatic(method.getModifiers())) {
                return accessibleMethod(method);
            }
        }
        return null;
    }

    /**
     * The property name a getter or setter exposes: {@code getIntProperty} is {@code intProperty},
     * {@code getURL} stays {@code URL}, and any other method keeps its own name.
     */
    public static String propertyName(Method method) {
        String name = method.getName();
        for (String prefix : List.of("get", "set", "is")) {
            if (name.length() > prefix.length()
                    && name.startsWith(prefix)
                    && Character.isUpperCase(name.charAt(prefix.length()))) {
                return decapitalize(name.substring(prefix.length()));
            }
        }
        return name;
    }

    /**
     * Replaces a method declared by a class this library cannot reach, such as the hidden
     * implementation behind {@code List.of}, with the same-signature declaration from a public
     * interface or superclass. Methods with no such declaration come back unchanged.
     */
    public static Method accessibleMethod(Method method) {
        if (isReachable(method.getDeclaringClass(), method.getModifiers())) {
            return method;
        }
        Method declaration = publicDeclaration(method.getDeclaringClass(), method.getName(), method.getParameterTypes());
        return declaration == null ? method : declaration;
    }

    public static boolean isApplicable(Executable executable, List<Class<?>> argumentTypes) {
        Class<?>[] parameterTypes = executable.getParameterTypes();
        if (parameterTypes.length != argumentTypes.size()) {
            return false;
        }
        for (int i = 0; i < parameterTypes.length; i++) {
            if (!TypeUtils.isAssignable(parameterTypes[i], argumentTypes.get(i))) {
                return false;
            }
        }
        return true;
    }

    private static <E extends Executable> E mostSpecific(List<E> applicable) {
        if (applicable.isEmpty()) {
            return null;
        }
        for (E candidate : applicable) {
            boolean mostSpecific = true;
            for (E other : applicable) {
                if (other != candidate && !isApplicable(other, List.of(candidate.getParameterTypes()))) {
                    mostSpecific = false;
                    break;
                }
            }
            if (mostSpecific) {
                return candidate;
            }
        }
        return applicable.get(0);
    }

    private static Method publicDeclaration(Class<?> type, String name, Class<?>[] parameterTypes) {
        for (Class<?> current = type; current != null; current = current.getSuperclass()) {
            if (current != type) {
                Method method = declaredPublicMethod(current, name, parameterTypes);
                if (method != null) {
                    return method;
                }
            }
            Method method = interfaceDeclaration(current.getInterfaces(), name, parameterTypes);
            if (method != null) {
                return method;
            }
        }
        return null;
    }

    private static Method interfaceDeclaration(Class<?>[] interfaces, String name, Class<?>[] parameterTypes) {
        for (Class<?> candidate : interfaces) {
            Method method = declaredPublicMethod(candidate, name, parameterTypes);
            if (method == null) {
                method = interfaceDeclaration(candidate.getInterfaces(), name, parameterTypes);
            }
            if (method != null) {
                return method;
            }
        }
        return null;
    }

    private static Method declaredPublicMethod(Class<?> type, String name, Class<?>[] parameterTypes) {
        try {
            Method method = type.getDeclaredMethod(name, parameterTypes);
            return isReachable(type, method.getModifiers()) && Modifier.isPublic(method.getModifiers()) ? method : null;
        } catch (NoSuchMethodException e) {
            return null;
        }
    }

    /**
     * A member is reachable when it is public in a public class of an exported package, or when its
     * package is open to this library, as the unnamed module is.
     */
    private static boolean isReachable(Class<?> type, int modifiers) {
        Module module = type.getModule();
        Module self = ReflectionUtils.class.getModule();
        if (module.isOpen(type.getPackageName(), self)) {
            return true;
        }
        if (!Modifier.isPublic(modifiers) || !module.isExported(type.getPackageName(), self)) {
            return false;
        }
        for (Class<?> current = type; current != null; current = current.getDeclaringClass()) {
            if (!Modifier.isPublic(current.getModifiers())) {
                return false;
            }
        }
        return true;
    }

    private static Set<Method> allMethods(Class<?> type) {
        Set<Method> methods = new LinkedHashSet<>();
        for (Class<?> current = type; current != null; current = current.getSuperclass()) {
            for (Method method : current.getDeclaredMethods()) {
                methods.add(method);
            }
        }
        // public methods inherited from interfaces, and Object's methods for interface types
        for (Method method : type.getMethods()) {
            methods.add(method);
        }
        if (type.isInterface()) {
            for (Method method : Object.class.getMethods()) {
                methods.add(method);
            }
        }
        return methods;
    }

    private static String capitalize(String name) {
        if (name.isEmpty()) {
            return name;
        }
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    private static String decapitalize(String name) {
        if (name.length() > 1 && Character.isUpperCase(name.charAt(0)) && Character.isUpperCase(name.charAt(1))) {
            return name;
        }
        return Character.toLowerCase(name.charAt(0)) + name.substring(1);
    }
}
