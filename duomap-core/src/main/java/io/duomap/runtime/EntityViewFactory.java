package io.duomap.runtime;

import net.bytebuddy.ByteBuddy;
import net.bytebuddy.description.modifier.FieldManifestation;
import net.bytebuddy.description.modifier.TypeManifestation;
import net.bytebuddy.description.modifier.Visibility;
import net.bytebuddy.dynamic.DynamicType;
import net.bytebuddy.implementation.FieldAccessor;
import net.bytebuddy.implementation.Implementation;
import net.bytebuddy.implementation.MethodCall;
import net.bytebuddy.implementation.MethodDelegation;
import net.bytebuddy.implementation.bind.annotation.AllArguments;
import net.bytebuddy.implementation.bind.annotation.FieldValue;
import net.bytebuddy.implementation.bind.annotation.Origin;
import net.bytebuddy.implementation.bind.annotation.RuntimeType;
import net.bytebuddy.matcher.ElementMatchers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Generates typed interface views over {@link EntityInstance}s with ByteBuddy.
 * <p>
 * A view interface declares JavaBean-style accessors:
 * <pre>
 * public interface BookView {
 *     Long getId();
 *     String getTitle();
 *     AuthorView getAuthor();
 *     void setAuthor(AuthorView author);
 * }
 * </pre>
 * {@code getX()}/{@code isX()} delegate to {@link EntityInstance#get(String)} and
 * {@code setX(v)} to {@link EntityInstance#set(String, Object)}, so relationship
 * getters go through the lazy reference of the field. Property {@code authorId}
 * maps to field {@code authorId} when the entity has one, otherwise to
 * {@code author_id}. Related instances returned for a view-typed getter are
 * wrapped in that view; views passed to setters are unwrapped. Getters must
 * return reference types, since an unset field reads as {@code null}.
 * <p>
 * One class is generated per view interface and cached.
 */
public final class EntityViewFactory {

    private static final Logger LOG = LoggerFactory.getLogger(EntityViewFactory.class);
    private static final String INSTANCE_FIELD = "instance";

    private final ConcurrentHashMap<Class<?>, GeneratedView> views = new ConcurrentHashMap<>();

    /**
     * Create a view over an instance.
     *
     * @throws IllegalArgumentException if the type is not an interface, declares
     *                                  a non-accessor method, or names a property
     *                                  the instance's entity does not have
     */
    public <V> V create(Class<V> viewInterface, EntityInstance instance) {
        var generated = views.computeIfAbsent(viewInterface, this::generate);
        for (var property : generated.properties().values()) {
            if (resolveField(instance, property) == null) {
                throw new IllegalArgumentException("View " + viewInterface.getSimpleName() + " declares property '"
                        + property + "' but entity " + instance.entityName() + " has no such field");
            }
        }
        try {
            return viewInterface.cast(generated.constructor().newInstance(instance, this));
        } catch (InstantiationException | IllegalAccessException | InvocationTargetException e) {
            throw new IllegalStateException("Failed to instantiate view " + viewInterface.getName(), e);
        }
    }

    int generatedCount() {
        return views.size();
    }

    private GeneratedView generate(Class<?> viewInterface) {
        if (!viewInterface.isInterface()) {
            throw new IllegalArgumentException("Views must be interfaces: " + viewInterface.getName());
        }
        var properties = new LinkedHashMap<String, String>();
        for (Method method : viewInterface.getMethods()) {
            if (!Modifier.isAbstract(method.getModifiers()) || method.getDeclaringClass() == EntityView.class) {
                continue;
            }
            var returnType = method.getReturnType();
            if (method.getParameterCount() == 0 && returnType.isPrimitive() && returnType != void.class) {
                throw new IllegalArgumentException("View method " + viewInterface.getSimpleName() + "."
                        + method.getName() + " returns primitive " + returnType.getName() + "; use the boxed type");
            }
            properties.put(method.getName(), propertyName(method));
        }

        String className = viewInterface.getName() + "$DuomapView";
        DynamicType.Builder<?> builder = new ByteBuddy()
                .subclass(Object.class)
                .implement(viewInterface, EntityView.class)
                .name(className)
                .modifiers(Visibility.PUBLIC, TypeManifestation.FINAL)
                .defineField(INSTANCE_FIELD, EntityInstance.class, Visibility.PRIVATE, FieldManifestation.FINAL)
                .defineField("factory", EntityViewFactory.class, Visibility.PRIVATE, FieldManifestation.FINAL);

        Implementation.Composable ctorCall;
        try {
            ctorCall = MethodCall.invoke(Object.class.getConstructor());
        } catch (NoSuchMethodException e) {
            throw new IllegalStateException("Failed to resolve Object constructor", e);
        }
        ctorCall = ctorCall.andThen(FieldAccessor.ofField(INSTANCE_FIELD).setsArgumentAt(0))
                .andThen(FieldAccessor.ofField("factory").setsArgumentAt(1));
        builder = builder.defineConstructor(Visibility.PUBLIC)
                .withParameters(EntityInstance.class, EntityViewFactory.class)
                .intercept(ctorCall);

        builder = builder.method(ElementMatchers.isAbstract()
                        .and(ElementMatchers.not(ElementMatchers.isDeclaredBy(EntityView.class))))
                .intercept(MethodDelegation.to(AccessorInterceptor.class));
        builder = builder.method(ElementMatchers.named("entityInstance").and(ElementMatchers.takesArguments(0)))
                .intercept(FieldAccessor.ofField(INSTANCE_FIELD));
        builder = builder.method(ElementMatchers.named("toString").and(ElementMatchers.takesArguments(0)))
                .intercept(MethodDelegation.to(ToStringInterceptor.class));

        Class<?> implClass = builder.make()
                .load(viewInterface.getClassLoader())
                .getLoaded();
        try {
            Constructor<?> constructor = implClass.getConstructor(EntityInstance.class, EntityViewFactory.class);
            LOG.debug("Generated view {} with properties {}", className, properties.values());
            return new GeneratedView(constructor, properties);
        } catch (NoSuchMethodException e) {
            throw new IllegalStateException("Generated view has no constructor: " + className, e);
        }
    }

    static String propertyName(Method method) {
        var name = method.getName();
        int parameters = method.getParameterCount();
        boolean returnsVoid = method.getReturnType() == void.class;
        if (name.startsWith("get") && name.length() > 3 && parameters == 0 && !returnsVoid) {
            return decapitalize(name.substring(3));
        }
        if (name.startsWith("is") && name.length() > 2 && parameters == 0
                && method.getReturnType() == Boolean.class) {
            return decapitalize(name.substring(2));
        }
        if (name.startsWith("set") && name.length() > 3 && parameters == 1) {
            return decapitalize(name.substring(3));
        }
        throw new IllegalArgumentException("Unsupported view method " + method.getDeclaringClass().getSimpleName()
                + "." + name + ": only getX(), isX() and setX(value) are allowed");
    }

    static String resolveField(EntityInstance instance, String property) {
        if (instance.hasField(property)) {
            return property;
        }
        var snake = toSnakeCase(property);
        return instance.hasField(snake) ? snake : null;
    }

    Object toViewValue(Object value, Class<?> returnType) {
        if (value instanceof EntityInstance related && returnType.isInterface()
                && returnType != Object.class && !returnType.isInstance(value)) {
            return create(returnType, related);
        }
        return value;
    }

    static Object fromViewValue(Object value) {
        if (value instanceof EntityView view) {
            return view.entityInstance();
        }
        if (value instanceof List<?> list) {
            var unwrapped = new ArrayList<Object>(list.size());
            for (Object element : list) {
                unwrapped.add(fromViewValue(element));
            }
            return unwrapped;
        }
        return value;
    }

    private static String decapitalize(String name) {
        if (name.length() > 1 && Character.isUpperCase(name.charAt(1)) && Character.isUpperCase(name.charAt(0))) {
            return name;
        }
        return Character.toLowerCase(name.charAt(0)) + name.substring(1);
    }

    private static String toSnakeCase(String property) {
        var result = new StringBuilder(property.length() + 4);
        for (int i = 0; i < property.length(); i++) {
            char c = property.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0) {
                    result.append('_');
                }
                result.append(Character.toLowerCase(c));
            } else {
                result.append(c);
            }
        }
        return result.toString().toLowerCase(Locale.ROOT);
    }

    private record GeneratedView(Constructor<?> constructor, Map<String, String> properties) {
    }

    public static class AccessorInterceptor {

        @RuntimeType
        public static Object intercept(@Origin Method method,
                @AllArguments Object[] args,
                @FieldValue(INSTANCE_FIELD) EntityInstance instance,
                @FieldValue("factory") EntityViewFactory factory) {
            var field = resolveField(instance, propertyName(method));
            if (args.length == 1) {
                instance.set(field, fromViewValue(args[0]));
                return null;
            }
            return factory.toViewValue(instance.get(field), method.getReturnType());
        }
    }

    public static class ToStringInterceptor {

        public static String intercept(@FieldValue(INSTANCE_FIELD) EntityInstance instance) {
            return instance.toString();
        }
    }
}
