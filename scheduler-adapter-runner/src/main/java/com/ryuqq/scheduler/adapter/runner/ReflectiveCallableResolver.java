package com.ryuqq.scheduler.adapter.runner;

import com.ryuqq.scheduler.core.exception.CallableResolutionException;
import com.ryuqq.scheduler.core.executor.CallableResolver;
import com.ryuqq.scheduler.core.executor.JobContext;
import com.ryuqq.scheduler.core.executor.TaskFunction;
import com.ryuqq.scheduler.core.model.CallableRef;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 클래스 이름으로 함수를 찾는 Resolver.
 *
 * <p><strong>지원 형식:</strong></p>
 * <ul>
 *   <li>{@code com.example.Jobs::cleanup}: public static 메서드.
 *       파라미터는 없거나 {@link JobContext} 하나</li>
 *   <li>{@code com.example.CleanupTask}: public 기본 생성자가 있는 {@link TaskFunction} 구현체</li>
 * </ul>
 *
 * <p>참조 문자열만 저장되므로 다른 프로세스의 워커도 같은 클래스가 클래스패스에 있으면 실행할 수 있습니다.
 * 해석 결과는 캐시됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ReflectiveCallableResolver implements CallableResolver {

    private static final String METHOD_SEPARATOR = "::";

    private final ClassLoader classLoader;
    private final Map<CallableRef, TaskFunction> cache = new ConcurrentHashMap<>();

    public ReflectiveCallableResolver() {
        this(ReflectiveCallableResolver.class.getClassLoader());
    }

    public ReflectiveCallableResolver(ClassLoader classLoader) {
        if (classLoader == null) {
            throw new IllegalArgumentException("classLoader cannot be null");
        }
        this.classLoader = classLoader;
    }

    /**
     * static 메서드 참조 생성.
     *
     * @param type 메서드를 가진 클래스
     * @param methodName 메서드 이름
     * @return 참조
     */
    public static CallableRef refFor(Class<?> type, String methodName) {
        return CallableRef.of(type.getName() + METHOD_SEPARATOR + methodName);
    }

    /**
     * TaskFunction 구현 클래스 참조 생성.
     *
     * @param type TaskFunction 구현 클래스
     * @return 참조
     */
    public static CallableRef refFor(Class<? extends TaskFunction> type) {
        return CallableRef.of(type.getName());
    }

    @Override
    public TaskFunction resolve(CallableRef ref) {
        TaskFunction cached = cache.get(ref);
        if (cached != null) {
            return cached;
        }
        TaskFunction resolved = doResolve(ref.getValue());
        cache.putIfAbsent(ref, resolved);
        return resolved;
    }

    private TaskFunction doResolve(String value) {
        int separator = value.indexOf(METHOD_SEPARATOR);
        if (separator < 0) {
            return instantiate(loadClass(value), value);
        }
        Class<?> type = loadClass(value.substring(0, separator));
        String methodName = value.substring(separator + METHOD_SEPARATOR.length());
        if (methodName.isBlank()) {
            throw new CallableResolutionException("Missing method name in " + value);
        }
        return staticMethod(type, methodName, value);
    }

    private Class<?> loadClass(String className) {
        try {
            return Class.forName(className, true, classLoader);
        } catch (ClassNotFoundException | LinkageError e) {
            throw new CallableResolutionException("Cannot load class " + className, e);
        }
    }

    private static TaskFunction instantiate(Class<?> type, String ref) {
        if (!TaskFunction.class.isAssignableFrom(type)) {
            throw new CallableResolutionException(ref + " does not implement " + TaskFunction.class.getName());
        }
        try {
            Constructor<?> constructor = type.getConstructor();
            return (TaskFunction) constructor.newInstance();
        } catch (NoSuchMethodException e) {
            throw new CallableResolutionException(ref + " has no public no-arg constructor", e);
        } catch (ReflectiveOperationException e) {
            throw new CallableResolutionException("Cannot instantiate " + ref, e);
        }
    }

    private static TaskFunction staticMethod(Class<?> type, String methodName, String ref) {
        Method withContext = findMethod(type, methodName, JobContext.class);
        Method method = withContext != null ? withContext : findMethod(type, methodName);
        if (method == null || !Modifier.isStatic(method.getModifiers())) {
            throw new CallableResolutionException(
                "No public static method " + methodName + "() or " + methodName + "(JobContext) in " + type.getName()
            );
        }
        boolean passContext = method == withContext;
        return context -> invoke(method, passContext ? new Object[]{context} : new Object[0], ref);
    }

    private static Method findMethod(Class<?> type, String name, Class<?>... parameterTypes) {
        try {
            return type.getMethod(name, parameterTypes);
        } catch (NoSuchMethodException e) {
            return null;
        }
    }

    private static Object invoke(Method method, Object[] args, String ref) throws Exception {
        try {
            return method.invoke(null, args);
        } catch (InvocationTargetException e) {
            // 함수가 던진 예외를 그대로 Job 실패로 기록
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        } catch (IllegalAccessException e) {
            throw new CallableResolutionException("Cannot invoke " + ref, e);
        }
    }
}
