package com.ivamare.caseguard.pipeline.impl;

import com.ivamare.caseguard.exception.InterceptorAlreadyRegisteredException;
import com.ivamare.caseguard.model.ExecutionContext;
import com.ivamare.caseguard.model.PendingRecord;
import com.ivamare.caseguard.pipeline.CreateInterceptor;
import com.ivamare.caseguard.pipeline.InterceptorRegistry;
import com.ivamare.caseguard.pipeline.PreCreate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.config.BeanPostProcessor;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default implementation of InterceptorRegistry.
 *
 * <p>Implements BeanPostProcessor to discover and register interceptors
 * from Spring beans with @PreCreate methods. An interceptor name may be
 * registered only once per entity.
 */
public class DefaultInterceptorRegistry implements InterceptorRegistry, BeanPostProcessor {

    private static final Logger log = LoggerFactory.getLogger(DefaultInterceptorRegistry.class);

    private static final Comparator<Registration> EXECUTION_ORDER =
        Comparator.comparingInt((Registration r) -> r.key().order()).thenComparingLong(Registration::sequence);

    private final Map<String, List<Registration>> registrations = new ConcurrentHashMap<>();
    private long nextSequence;

    @Override
    public void register(String entityName, CreateInterceptor interceptor, int order) {
        register(entityName, interceptor.getClass().getName(), interceptor, order);
    }

    private synchronized void register(String entityName, String name, CreateInterceptor interceptor, int order) {
        List<Registration> current = registrations.getOrDefault(entityName, List.of());
        if (current.stream().anyMatch(r -> r.key().name().equals(name))) {
            throw new InterceptorAlreadyRegisteredException(entityName, name);
        }

        List<Registration> updated = new ArrayList<>(current);
        updated.add(new Registration(new InterceptorKey(entityName, name, order), interceptor, nextSequence++));
        updated.sort(EXECUTION_ORDER);
        registrations.put(entityName, List.copyOf(updated));

        log.debug("Registered interceptor {} for {} (order={})", name, entityName, order);
    }

    @Override
    public List<CreateInterceptor> interceptorsFor(String entityName) {
        return registrations.getOrDefault(entityName, List.of()).stream()
            .map(Registration::interceptor)
            .toList();
    }

    @Override
    public boolean hasInterceptors(String entityName) {
        return !registrations.getOrDefault(entityName, List.of()).isEmpty();
    }

    @Override
    public List<InterceptorKey> registeredInterceptors() {
        return registrations.values().stream()
            .flatMap(List::stream)
            .map(Registration::key)
            .toList();
    }

    @Override
    public synchronized void clear() {
        registrations.clear();
    }

    @Override
    public List<InterceptorKey> registerBean(Object bean) {
        List<InterceptorKey> registered = new ArrayList<>();

        for (Method method : bean.getClass().getMethods()) {
            PreCreate annotation = method.getAnnotation(PreCreate.class);
            if (annotation == null) {
                continue;
            }

            validateInterceptorMethod(method);

            String entityName = annotation.entity();
            String name = bean.getClass().getSimpleName() + "." + method.getName();

            CreateInterceptor interceptor = (target, context) -> invoke(method, bean, target, context);

            register(entityName, name, interceptor, annotation.order());
            registered.add(new InterceptorKey(entityName, name, annotation.order()));

            log.info("Discovered interceptor {}() for {}", name, entityName);
        }

        return registered;
    }

    /**
     * BeanPostProcessor callback - scans beans for @PreCreate methods.
     */
    @Override
    public Object postProcessAfterInitialization(Object bean, String beanName) {
        boolean hasInterceptors = Arrays.stream(bean.getClass().getMethods())
            .anyMatch(m -> m.isAnnotationPresent(PreCreate.class));

        if (hasInterceptors) {
            registerBean(bean);
        }

        return bean;
    }

    private static void invoke(Method method, Object bean, PendingRecord target, ExecutionContext context) {
        try {
            method.invoke(bean, target, context);
        } catch (InvocationTargetException e) {
            // Rethrow what the interceptor threw, not the reflection wrapper
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Interceptor " + method.getName() + " failed", cause);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Interceptor " + method.getName() + " is not accessible", e);
        }
    }

    private void validateInterceptorMethod(Method method) {
        Class<?>[] params = method.getParameterTypes();
        if (params.length != 2 ||
            !params[0].equals(PendingRecord.class) ||
            !params[1].equals(ExecutionContext.class)) {

            throw new IllegalArgumentException(
                "Interceptor method " + method.getName() + " must have signature: " +
                "void methodName(PendingRecord target, ExecutionContext context)"
            );
        }
    }

    private record Registration(InterceptorKey key, CreateInterceptor interceptor, long sequence) {}
}
