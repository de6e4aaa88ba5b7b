package com.ryuqq.scheduler.adapter.runner;

import com.ryuqq.scheduler.core.exception.CallableResolutionException;
import com.ryuqq.scheduler.core.executor.CallableResolver;
import com.ryuqq.scheduler.core.executor.TaskFunction;
import com.ryuqq.scheduler.core.model.CallableRef;
import com.ryuqq.scheduler.core.model.TaskId;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 프로세스 내에서 등록한 함수를 참조 이름으로 찾는 Resolver.
 *
 * <p>{@code Scheduler.configureTask}로 등록한 람다는 직렬화할 수 없으므로
 * {@code "registry:<taskId>"} 참조로 저장하고 여기서 다시 찾습니다.
 * 같은 Task를 등록한 인스턴스의 워커만 해당 Job을 실행할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RegistryCallableResolver implements CallableResolver {

    static final String PREFIX = "registry:";

    private final Map<CallableRef, TaskFunction> functions = new ConcurrentHashMap<>();

    /**
     * Task용 참조 생성.
     *
     * @param taskId Task 식별자
     * @return 레지스트리 참조
     */
    public static CallableRef refFor(TaskId taskId) {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        return CallableRef.of(PREFIX + taskId.getValue());
    }

    /**
     * 함수 등록 (같은 참조가 있으면 교체).
     *
     * @param ref 참조
     * @param function 함수
     */
    public void register(CallableRef ref, TaskFunction function) {
        if (ref == null) {
            throw new IllegalArgumentException("ref cannot be null");
        }
        if (function == null) {
            throw new IllegalArgumentException("function cannot be null");
        }
        functions.put(ref, function);
    }

    public boolean contains(CallableRef ref) {
        return functions.containsKey(ref);
    }

    @Override
    public TaskFunction resolve(CallableRef ref) {
        TaskFunction function = functions.get(ref);
        if (function == null) {
            throw new CallableResolutionException("No function registered for " + ref.getValue());
        }
        return function;
    }
}
